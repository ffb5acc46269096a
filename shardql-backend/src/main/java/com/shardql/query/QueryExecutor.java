package com.shardql.query;

import java.util.List;
import java.util.Map;

/**
 * Runs a query against the warehouse and returns its rows.
 *
 * <p>Implementations must be safe to share across worker threads. Row order is preserved as
 * returned by the warehouse.
 */
public interface QueryExecutor {

    /**
     * Executes a query.
     *
     * @param request query text and execution hints
     * @return rows as column name to JSON-safe value maps
     * @throws QueryExecutionException if the query cannot be executed
     */
    List<Map<String, Object>> query(QueryRequest request) throws QueryExecutionException;
}
