package com.shardql.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Everything needed to run one aggregation request once discovery and validation are done.
 */
@Value
@Builder
public class AggregationPlan {
    List<FetchUnit> units;
    GroupBy groupBy;
    AggregateLayout layout;
    int concurrency;
    EmissionMode emission;
    /** Requested table for single-table requests, null otherwise. */
    String table;
    /** Datasets whose discovery failed, null when none did. */
    Map<String, String> discoveryErrors;
}
