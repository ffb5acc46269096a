package com.shardql.config;

import com.shardql.engine.BoundedTaskRunner;
import com.shardql.engine.DatasetKeyNormalizer;
import com.shardql.engine.FetchDispatcher;
import com.shardql.engine.SchemaDiscoverer;
import com.shardql.query.QueryBuilder;
import com.shardql.query.QueryExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@Configuration
public class EngineConfiguration {

    /**
     * Worker pool shared by every request. Each call still enforces its own concurrency bound.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService fetchWorkers(ShardqlProperties properties) {
        int size = properties.getWorkerPoolSize();
        return new ThreadPoolExecutor(size, size, 60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(), new CustomizableThreadFactory("shardql-worker-"));
    }

    @Bean
    public BoundedTaskRunner boundedTaskRunner(ExecutorService fetchWorkers) {
        return new BoundedTaskRunner(fetchWorkers);
    }

    @Bean
    public QueryBuilder queryBuilder(ShardqlProperties properties) {
        ShardqlProperties.Warehouse warehouse = properties.getWarehouse();
        return new QueryBuilder(warehouse.getCatalog(), warehouse.getIdentifierQuote().charAt(0));
    }

    @Bean
    public DatasetKeyNormalizer datasetKeyNormalizer(ShardqlProperties properties) {
        DatasetKeyNormalizer normalizer = new DatasetKeyNormalizer(properties.getDatasetKeyPrefix(), properties.getDatasetKeySuffix());
        normalizer.requireDistinct(properties.getDatasets());
        return normalizer;
    }

    @Bean
    public SchemaDiscoverer schemaDiscoverer(QueryExecutor queryExecutor, QueryBuilder queryBuilder,
                                             BoundedTaskRunner boundedTaskRunner, ShardqlProperties properties) {
        return new SchemaDiscoverer(queryExecutor, queryBuilder, boundedTaskRunner, properties.getDiscovery().getConcurrency());
    }

    @Bean
    public FetchDispatcher fetchDispatcher(QueryExecutor queryExecutor, QueryBuilder queryBuilder,
                                           BoundedTaskRunner boundedTaskRunner, ShardqlProperties properties) {
        return new FetchDispatcher(queryExecutor, queryBuilder, boundedTaskRunner, properties.getQueryTimeoutSeconds());
    }
}
