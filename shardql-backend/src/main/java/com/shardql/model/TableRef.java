package com.shardql.model;

import lombok.Value;

/**
 * A table discovered in one dataset.
 */
@Value
public class TableRef {
    String dataset;
    String table;
}
