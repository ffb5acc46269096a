package com.shardql.query;

/**
 * Thrown when a dataset or table name cannot be safely placed into query text.
 */
public class InvalidIdentifierException extends IllegalArgumentException {

    public InvalidIdentifierException(String message) {
        super(message);
    }
}
