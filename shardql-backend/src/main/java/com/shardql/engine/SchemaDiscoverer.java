package com.shardql.engine;

import com.shardql.model.DiscoveryResult;
import com.shardql.model.FetchOutcome;
import com.shardql.model.TableRef;
import com.shardql.query.QueryBuilder;
import com.shardql.query.QueryExecutor;
import com.shardql.query.QueryRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lists the tables of every dataset with one metadata query each.
 *
 * <p>A failing dataset is recorded in the error map and does not stop discovery of the others.
 */
public class SchemaDiscoverer {
    private static final Logger log = LoggerFactory.getLogger(SchemaDiscoverer.class);
    private static final String TABLE_NAME_COLUMN = "table_name";

    private final QueryExecutor queryExecutor;
    private final QueryBuilder queryBuilder;
    private final BoundedTaskRunner runner;
    private final int concurrency;

    public SchemaDiscoverer(QueryExecutor queryExecutor, QueryBuilder queryBuilder, BoundedTaskRunner runner, int concurrency) {
        this.queryExecutor = queryExecutor;
        this.queryBuilder = queryBuilder;
        this.runner = runner;
        this.concurrency = concurrency;
    }

    /**
     * Discovers tables in the given datasets.
     *
     * @param datasets dataset ids, in the order results should be reported
     * @return discovered (dataset, table) pairs and per-dataset errors
     */
    public DiscoveryResult discover(List<String> datasets) {
        List<String> distinct = new ArrayList<>(new LinkedHashSet<>(datasets));
        Map<String, List<String>> tablesByDataset = new HashMap<>();
        Map<String, String> failures = new HashMap<>();

        runner.<String, List<String>>run(distinct, concurrency, this::listTables, (dataset, tables, error) -> {
            if (error != null) {
                String reason = FetchOutcome.describe(error);
                log.warn("Table discovery failed: dataset={}, reason={}", dataset, reason);
                failures.put(dataset, reason);
            } else {
                tablesByDataset.put(dataset, tables);
            }
        });

        Set<TableRef> tables = new LinkedHashSet<>();
        Map<String, String> errors = new LinkedHashMap<>();
        for (String dataset : distinct) {
            if (failures.containsKey(dataset)) {
                errors.put(dataset, failures.get(dataset));
                continue;
            }
            for (String table : tablesByDataset.getOrDefault(dataset, List.of())) {
                tables.add(new TableRef(dataset, table));
            }
        }

        DiscoveryResult result = new DiscoveryResult(tables, errors, distinct.size());
        if (result.isTotalFailure()) {
            log.warn("Table discovery failed in all {} dataset(s)", distinct.size());
        } else {
            log.info("Discovered {} table(s) across {} dataset(s), {} dataset error(s)", tables.size(), distinct.size(), errors.size());
        }
        return result;
    }

    private List<String> listTables(String dataset) throws Exception {
        List<Map<String, Object>> rows = queryExecutor.query(QueryRequest.of(queryBuilder.listTables(dataset)));
        List<String> tables = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Object name = tableName(row);
            if (name == null) {
                log.warn("Metadata row without {} column: dataset={}, row={}", TABLE_NAME_COLUMN, dataset, row);
                continue;
            }
            tables.add(String.valueOf(name));
        }
        return tables;
    }

    private static Object tableName(Map<String, Object> row) {
        for (Map.Entry<String, Object> e : row.entrySet()) {
            if (TABLE_NAME_COLUMN.equalsIgnoreCase(e.getKey())) {
                return e.getValue();
            }
        }
        return null;
    }
}
