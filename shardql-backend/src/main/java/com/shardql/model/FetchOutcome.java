package com.shardql.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of a single fetch: either the rows returned by the executor or the reason it failed.
 */
public final class FetchOutcome {
    public static final String ERROR_FIELD = "error";

    private final List<Map<String, Object>> rows;
    private final String reason;

    private FetchOutcome(List<Map<String, Object>> rows, String reason) {
        this.rows = rows;
        this.reason = reason;
    }

    public static FetchOutcome success(List<Map<String, Object>> rows) {
        return new FetchOutcome(Collections.unmodifiableList(Objects.requireNonNull(rows, "rows")), null);
    }

    public static FetchOutcome failure(String reason) {
        return new FetchOutcome(null, reason == null || reason.isBlank() ? "unknown error" : reason);
    }

    public static FetchOutcome failure(Throwable error) {
        return failure(describe(error));
    }

    /**
     * Human-readable reason for a failure: the first non-blank message along the cause chain,
     * or the exception type when none has a message.
     */
    public static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t.getMessage() != null && !t.getMessage().isBlank()) {
                return t.getMessage();
            }
        }
        return error.getClass().getSimpleName();
    }

    public boolean isSuccess() {
        return rows != null;
    }

    public List<Map<String, Object>> getRows() {
        if (rows == null) {
            throw new IllegalStateException("failed outcome has no rows");
        }
        return rows;
    }

    public String getReason() {
        return reason;
    }

    /**
     * Value placed at this outcome's position in a response: the row list, or an
     * {@code {"error": reason}} marker.
     */
    public Object toLeafValue() {
        if (isSuccess()) {
            return rows;
        }
        Map<String, Object> marker = new LinkedHashMap<>();
        marker.put(ERROR_FIELD, reason);
        return marker;
    }

    @Override
    public String toString() {
        return isSuccess() ? "Success{rows=" + rows.size() + "}" : "Failure{reason=" + reason + "}";
    }
}
