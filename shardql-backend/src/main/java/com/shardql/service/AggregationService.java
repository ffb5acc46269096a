package com.shardql.service;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shardql.api.ApiEnvelope;
import com.shardql.api.InvalidRequestException;
import com.shardql.api.TotalFailureException;
import com.shardql.config.ShardqlProperties;
import com.shardql.emit.StreamingAggregateWriter;
import com.shardql.engine.DatasetKeyNormalizer;
import com.shardql.engine.FetchDispatcher;
import com.shardql.engine.ResultAggregator;
import com.shardql.engine.SchemaDiscoverer;
import com.shardql.model.AggregateLayout;
import com.shardql.model.AggregationPlan;
import com.shardql.model.DiscoveryResult;
import com.shardql.model.FetchUnit;
import com.shardql.model.GroupBy;
import com.shardql.query.QueryBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Plans and runs aggregation requests: discovery, fetch unit creation, bounded dispatch, and
 * emission of the merged result either buffered or streamed.
 */
@Slf4j
@Service
public class AggregationService {
    public static final String MISSING_TABLE_NAME = "Missing table_name parameter";
    public static final String INVALID_TABLE_NAME = "Invalid table_name parameter";
    public static final String NO_TABLES_FOUND = "No tables found in datasets.";
    public static final String ALL_FETCHES_FAILED = "All table fetches failed.";

    private static final TypeReference<LinkedHashMap<String, Object>> FIELDS = new TypeReference<>() {
    };

    private final ShardqlProperties properties;
    private final SchemaDiscoverer schemaDiscoverer;
    private final FetchDispatcher fetchDispatcher;
    private final DatasetKeyNormalizer normalizer;
    private final ObjectMapper objectMapper;

    public AggregationService(
            ShardqlProperties properties,
            SchemaDiscoverer schemaDiscoverer,
            FetchDispatcher fetchDispatcher,
            DatasetKeyNormalizer normalizer,
            ObjectMapper objectMapper
    ) {
        this.properties = properties;
        this.schemaDiscoverer = schemaDiscoverer;
        this.fetchDispatcher = fetchDispatcher;
        this.normalizer = normalizer;
        this.objectMapper = objectMapper;
    }

    /**
     * Lists the distinct table names across all configured datasets.
     *
     * @return success envelope with {@code tables}, and {@code errors} when some datasets failed
     * @throws TotalFailureException when every dataset failed or none has a table
     */
    public ApiEnvelope listTables() {
        DiscoveryResult discovery = schemaDiscoverer.discover(properties.getDatasets());
        if (discovery.getTables().isEmpty()) {
            throw new TotalFailureException(NO_TABLES_FOUND, discovery.getErrors());
        }
        return ApiEnvelope.builder()
                .status(ApiEnvelope.SUCCESS)
                .tables(discovery.tableNames())
                .errors(discovery.hasErrors() ? discovery.getErrors() : null)
                .build();
    }

    /**
     * Discovers every (dataset, table) pair and plans one fetch per pair.
     *
     * @throws TotalFailureException when discovery finds no table at all
     */
    public AggregationPlan planAllTables() {
        ShardqlProperties.EndpointSettings settings = properties.getEndpoints().getAllTables();
        DiscoveryResult discovery = schemaDiscoverer.discover(properties.getDatasets());
        if (discovery.getTables().isEmpty()) {
            throw new TotalFailureException(NO_TABLES_FOUND, discovery.getErrors());
        }

        List<FetchUnit> units = discovery.getTables().stream()
                .map(ref -> FetchUnit.of(ref, settings.getRowLimit(), settings.isUseQueryCache()))
                .toList();
        return AggregationPlan.builder()
                .units(units)
                .groupBy(settings.getGroupBy())
                .layout(AggregateLayout.NESTED)
                .concurrency(settings.getConcurrency())
                .emission(settings.getEmission())
                .discoveryErrors(discovery.hasErrors() ? discovery.getErrors() : null)
                .build();
    }

    /**
     * Plans one fetch of {@code tableName} per configured dataset. The table is not looked up
     * first; a dataset without it reports a failed unit.
     *
     * @throws InvalidRequestException when the name is missing or not a valid identifier
     */
    public AggregationPlan planTable(String tableName) {
        if (tableName == null || tableName.isBlank()) {
            throw new InvalidRequestException(MISSING_TABLE_NAME);
        }
        String table = tableName.trim();
        if (!QueryBuilder.isValidIdentifier(table)) {
            throw new InvalidRequestException(INVALID_TABLE_NAME);
        }

        ShardqlProperties.EndpointSettings settings = properties.getEndpoints().getSingleTable();
        List<FetchUnit> units = new LinkedHashSet<>(properties.getDatasets()).stream()
                .map(dataset -> FetchUnit.builder()
                        .dataset(dataset)
                        .table(table)
                        .rowLimit(settings.getRowLimit())
                        .useCache(settings.isUseQueryCache())
                        .build())
                .toList();
        GroupBy groupBy = settings.getGroupBy();
        return AggregationPlan.builder()
                .units(units)
                .groupBy(groupBy)
                // One table: dataset-major collapses to dataset -> rows.
                .layout(groupBy == GroupBy.BY_DATASET ? AggregateLayout.FLAT : AggregateLayout.NESTED)
                .concurrency(settings.getConcurrency())
                .emission(settings.getEmission())
                .table(table)
                .build();
    }

    /**
     * Runs a plan and returns the whole aggregate at once.
     */
    public ApiEnvelope execute(AggregationPlan plan) {
        long start = System.currentTimeMillis();
        ResultAggregator aggregator = ResultAggregator.forUnits(plan.getUnits(), plan.getGroupBy(), plan.getLayout(), normalizer);
        fetchDispatcher.dispatch(plan.getUnits(), plan.getConcurrency(), aggregator::accept);
        Map<String, Object> data = aggregator.toMap();

        log.info("Aggregation finished: units={}, succeeded={}, failed={}, duration_ms={}",
                plan.getUnits().size(), aggregator.getSuccessCount(), aggregator.getFailureCount(),
                System.currentTimeMillis() - start);
        ApiEnvelope envelope = trailer(plan, aggregator.allFailed());
        envelope.setTable(plan.getTable());
        envelope.setData(data);
        return envelope;
    }

    /**
     * Runs a plan, writing each unit's result to {@code out} as soon as it completes.
     *
     * @throws IOException if writing to {@code out} fails; fetches already in flight still finish
     */
    public void stream(AggregationPlan plan, OutputStream out) throws IOException {
        long start = System.currentTimeMillis();
        try (JsonGenerator generator = objectMapper.createGenerator(out)) {
            generator.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
            StreamingAggregateWriter writer = new StreamingAggregateWriter(
                    generator, plan.getUnits(), plan.getGroupBy(), plan.getLayout(), normalizer);

            writer.begin(toFields(ApiEnvelope.builder().table(plan.getTable()).build()));
            fetchDispatcher.dispatch(plan.getUnits(), plan.getConcurrency(), result -> {
                try {
                    writer.accept(result);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
            writer.endData();
            writer.finish(toFields(trailer(plan, writer.allFailed())));

            log.info("Streamed aggregation finished: units={}, succeeded={}, failed={}, duration_ms={}",
                    plan.getUnits().size(), writer.getSuccessCount(), writer.getFailureCount(),
                    System.currentTimeMillis() - start);
        } catch (UncheckedIOException e) {
            log.warn("Streaming aborted: {}", e.getCause().getMessage());
            throw e.getCause();
        }
    }

    /**
     * Envelope fields known only once every unit has reported.
     */
    private ApiEnvelope trailer(AggregationPlan plan, boolean allFailed) {
        return ApiEnvelope.builder()
                .status(allFailed ? ApiEnvelope.ERROR : ApiEnvelope.SUCCESS)
                .message(allFailed ? ALL_FETCHES_FAILED : null)
                .discoveryErrors(plan.getDiscoveryErrors())
                .build();
    }

    private Map<String, Object> toFields(ApiEnvelope envelope) {
        return objectMapper.convertValue(envelope, FIELDS);
    }
}
