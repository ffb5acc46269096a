package com.shardql.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Nothing usable could be produced for a request, e.g. no dataset yielded any table.
 */
public class TotalFailureException extends RuntimeException {
    private final Map<String, String> errors;

    /**
     * @param message human-readable summary
     * @param errors per-dataset reasons, may be empty
     */
    public TotalFailureException(String message, Map<String, String> errors) {
        super(message);
        this.errors = errors != null ? Collections.unmodifiableMap(new LinkedHashMap<>(errors)) : Map.of();
    }

    public Map<String, String> getErrors() {
        return errors;
    }
}
