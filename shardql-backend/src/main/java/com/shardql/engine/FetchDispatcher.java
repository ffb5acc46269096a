package com.shardql.engine;

import com.shardql.model.FetchOutcome;
import com.shardql.model.FetchResult;
import com.shardql.model.FetchUnit;
import com.shardql.query.QueryBuilder;
import com.shardql.query.QueryExecutor;
import com.shardql.query.QueryRequest;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Fetches the rows of many (dataset, table) units with bounded concurrency.
 */
@Slf4j
public class FetchDispatcher {
    private final QueryExecutor queryExecutor;
    private final QueryBuilder queryBuilder;
    private final BoundedTaskRunner runner;
    private final int queryTimeoutSeconds;

    public FetchDispatcher(QueryExecutor queryExecutor, QueryBuilder queryBuilder, BoundedTaskRunner runner, int queryTimeoutSeconds) {
        this.queryExecutor = queryExecutor;
        this.queryBuilder = queryBuilder;
        this.runner = runner;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    /**
     * Fetches every unit and hands each result to {@code sink} on the calling thread, in
     * completion order. Returns once every unit has been delivered exactly once.
     *
     * @param units units to fetch
     * @param concurrency maximum fetches of this call in flight
     * @param sink receiver of results
     */
    public void dispatch(List<FetchUnit> units, int concurrency, Consumer<FetchResult> sink) {
        log.info("Dispatching {} fetch unit(s) with concurrency={}", units.size(), concurrency);
        runner.<FetchUnit, FetchResult>run(units, concurrency, this::fetch, (unit, result, error) -> {
            if (result != null) {
                sink.accept(result);
                return;
            }
            log.warn("Fetch did not complete: unit={}, reason={}", unit.describe(), FetchOutcome.describe(error));
            sink.accept(new FetchResult(unit, FetchOutcome.failure(error), 0));
        });
    }

    /**
     * Runs one unit's query. Never throws: any failure becomes a failed outcome.
     */
    FetchResult fetch(FetchUnit unit) {
        long start = System.currentTimeMillis();
        try {
            log.debug("Fetching data from {}", unit.describe());
            QueryRequest request = QueryRequest.builder()
                    .sql(queryBuilder.selectAll(unit.getDataset(), unit.getTable(), unit.getRowLimit()))
                    .maxRows(unit.getRowLimit())
                    .useCache(unit.isUseCache())
                    .timeoutSeconds(queryTimeoutSeconds)
                    .build();
            List<Map<String, Object>> rows = queryExecutor.query(request);
            long elapsed = System.currentTimeMillis() - start;
            log.debug("Retrieved {} rows from {} in {} ms", rows.size(), unit.describe(), elapsed);
            return new FetchResult(unit, FetchOutcome.success(rows), elapsed);
        } catch (Exception e) {
            long elapsed = System.currentTimeMillis() - start;
            log.warn("Error fetching {}: {}", unit.describe(), e.getMessage());
            return new FetchResult(unit, FetchOutcome.failure(e), elapsed);
        }
    }
}
