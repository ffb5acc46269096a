package com.shardql.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.shardql.query.JdbcQueryExecutor;
import com.shardql.query.QueryExecutor;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * The warehouse connection pool and the query executor built on it. The pool is created once
 * and handed to the executor explicitly; nothing else opens warehouse connections.
 */
@Slf4j
@Configuration
public class WarehouseConfiguration {

    @Bean(destroyMethod = "close")
    public HikariDataSource warehouseDataSource(ShardqlProperties properties) {
        HikariDataSource ds = new HikariDataSource(buildHikariConfig(properties.getWarehouse()));
        log.info("Warehouse pool created: url={}, maximum_pool_size={}",
                maskUrl(properties.getWarehouse().getJdbcUrl()), properties.getWarehouse().getMaximumPoolSize());
        return ds;
    }

    @Bean
    public Cache<String, List<Map<String, Object>>> queryResultCache(ShardqlProperties properties) {
        ShardqlProperties.CacheSettings settings = properties.getCache();
        // Weighed by row count: one entry may hold up to a full row limit.
        return Caffeine.newBuilder()
                .maximumWeight(settings.getMaximumRows())
                .weigher((String sql, List<Map<String, Object>> rows) -> Math.max(1, rows.size()))
                .expireAfterWrite(Duration.ofSeconds(settings.getExpireAfterWriteSeconds()))
                .build();
    }

    @Bean
    public QueryExecutor queryExecutor(
            HikariDataSource warehouseDataSource,
            Cache<String, List<Map<String, Object>>> queryResultCache,
            ShardqlProperties properties
    ) {
        return new JdbcQueryExecutor(warehouseDataSource, queryResultCache, properties.getWarehouse().isReadOnly());
    }

    static HikariConfig buildHikariConfig(ShardqlProperties.Warehouse warehouse) {
        if (warehouse.getJdbcUrl() == null || warehouse.getJdbcUrl().isBlank()) {
            throw new IllegalStateException("shardql.warehouse.jdbc-url is required");
        }
        HikariConfig config = new HikariConfig();
        config.setExceptionOverrideClassName(WarehouseSqlExceptionOverride.class.getName());
        config.setJdbcUrl(warehouse.getJdbcUrl());
        config.setUsername(warehouse.getUsername());
        config.setPassword(warehouse.getPassword());
        if (warehouse.getJdbcUrl().startsWith("jdbc:postgresql:")) {
            config.addDataSourceProperty("ApplicationName", "shardql");
        }
        config.setConnectionTimeout(warehouse.getConnectionTimeoutMs());
        config.setMaximumPoolSize(warehouse.getMaximumPoolSize());
        config.setMinimumIdle(1);
        config.setPoolName("shardql-warehouse");
        // Start even if the warehouse is unreachable; failures surface per query.
        config.setInitializationFailTimeout(-1);
        return config;
    }

    static String maskUrl(String url) {
        if (url == null) {
            return null;
        }
        return url.replaceAll(":[^@:/]+@", ":****@").replaceAll("(?i)(password=)[^&;]*", "$1****");
    }
}
