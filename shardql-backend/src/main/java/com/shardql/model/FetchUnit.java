package com.shardql.model;

import lombok.Builder;
import lombok.Value;

/**
 * One (dataset, table) pair to be fetched with exactly one query.
 */
@Value
@Builder
public class FetchUnit {
    String dataset;
    String table;
    int rowLimit;
    boolean useCache;

    public static FetchUnit of(TableRef ref, int rowLimit, boolean useCache) {
        return FetchUnit.builder()
                .dataset(ref.getDataset())
                .table(ref.getTable())
                .rowLimit(rowLimit)
                .useCache(useCache)
                .build();
    }

    public String describe() {
        return dataset + "." + table;
    }
}
