package com.shardql.model;

public enum EmissionMode {
    BUFFERED,
    STREAMING
}
