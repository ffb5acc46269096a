package com.shardql.query;

import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link QueryExecutor} over a pooled JDBC {@link DataSource}.
 *
 * <p>The data source is owned by the application context and shared by every worker. Each call
 * borrows its own connection, so concurrent queries never share a statement.
 */
@Slf4j
public class JdbcQueryExecutor implements QueryExecutor {
    private final DataSource dataSource;
    private final Cache<String, List<Map<String, Object>>> resultCache;
    private final boolean readOnly;

    /**
     * @param dataSource pooled data source
     * @param resultCache cache for requests carrying the cache hint, may be null to disable
     * @param readOnly whether borrowed connections are switched to read-only
     */
    public JdbcQueryExecutor(DataSource dataSource, Cache<String, List<Map<String, Object>>> resultCache, boolean readOnly) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.resultCache = resultCache;
        this.readOnly = readOnly;
    }

    @Override
    public List<Map<String, Object>> query(QueryRequest request) throws QueryExecutionException {
        if (request == null || request.getSql() == null || request.getSql().isBlank()) {
            throw new QueryExecutionException("sql is blank");
        }

        String cacheKey = request.isUseCache() && resultCache != null ? cacheKey(request) : null;
        if (cacheKey != null) {
            List<Map<String, Object>> cached = resultCache.getIfPresent(cacheKey);
            if (cached != null) {
                log.debug("Query cache hit: sql={}", request.getSql());
                return cached;
            }
        }

        List<Map<String, Object>> rows = execute(request);
        if (cacheKey != null) {
            resultCache.put(cacheKey, rows);
        }
        return rows;
    }

    private List<Map<String, Object>> execute(QueryRequest request) throws QueryExecutionException {
        long start = System.currentTimeMillis();
        try (Connection conn = dataSource.getConnection()) {
            if (readOnly) {
                conn.setReadOnly(true);
            }
            try (Statement stmt = conn.createStatement()) {
                if (request.getMaxRows() > 0) {
                    stmt.setMaxRows(request.getMaxRows());
                }
                if (request.getTimeoutSeconds() > 0) {
                    stmt.setQueryTimeout(request.getTimeoutSeconds());
                }
                try (ResultSet rs = stmt.executeQuery(request.getSql())) {
                    List<Map<String, Object>> rows = readRows(rs, request.getMaxRows());
                    log.debug("Query returned {} rows in {} ms", rows.size(), System.currentTimeMillis() - start);
                    return Collections.unmodifiableList(rows);
                }
            }
        } catch (SQLException e) {
            throw new QueryExecutionException(describe(e), e);
        }
    }

    private static List<Map<String, Object>> readRows(ResultSet rs, int maxRows) throws SQLException {
        ResultSetMetaData metaData = rs.getMetaData();
        int columnCount = metaData.getColumnCount();
        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                row.put(metaData.getColumnLabel(i), RowValues.read(rs, i));
            }
            rows.add(row);
            // Some drivers ignore setMaxRows.
            if (maxRows > 0 && rows.size() >= maxRows) {
                break;
            }
        }
        return rows;
    }

    private static String cacheKey(QueryRequest request) {
        return request.getMaxRows() + "|" + request.getSql();
    }

    private static String describe(SQLException e) {
        String message = e.getMessage() != null && !e.getMessage().isBlank() ? e.getMessage() : e.getClass().getSimpleName();
        if (e.getSQLState() != null) {
            return message + " (SQLState " + e.getSQLState() + ")";
        }
        return message;
    }
}
