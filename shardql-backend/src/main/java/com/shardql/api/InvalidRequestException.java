package com.shardql.api;

/**
 * A required request input is missing or unusable. Raised before any warehouse work starts.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
