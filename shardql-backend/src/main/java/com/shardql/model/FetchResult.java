package com.shardql.model;

import lombok.Value;

@Value
public class FetchResult {
    FetchUnit unit;
    FetchOutcome outcome;
    long durationMs;
}
