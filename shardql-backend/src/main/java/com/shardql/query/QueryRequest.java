package com.shardql.query;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class QueryRequest {
    String sql;
    /** Hard cap on returned rows, 0 for none. */
    int maxRows;
    /** Identical requests may be answered from an earlier result. */
    boolean useCache;
    /** Warehouse-side timeout, 0 for none. */
    int timeoutSeconds;

    public static QueryRequest of(String sql) {
        return QueryRequest.builder().sql(sql).build();
    }
}
