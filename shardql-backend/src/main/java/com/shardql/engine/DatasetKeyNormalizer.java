package com.shardql.engine;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Shortens dataset identifiers for presentation, e.g. {@code keywords_ranking_data_sheet3} to
 * {@code 3} when the prefix {@code keywords_ranking_data_sheet} is configured.
 *
 * <p>Applied to aggregate keys only. An identifier that would become empty is kept as is.
 */
public class DatasetKeyNormalizer {
    public static final DatasetKeyNormalizer IDENTITY = new DatasetKeyNormalizer(null, null);

    private final String prefix;
    private final String suffix;

    public DatasetKeyNormalizer(String prefix, String suffix) {
        this.prefix = prefix != null ? prefix : "";
        this.suffix = suffix != null ? suffix : "";
    }

    public String normalize(String dataset) {
        if (dataset == null) {
            return null;
        }
        String key = dataset;
        if (!prefix.isEmpty() && key.startsWith(prefix)) {
            key = key.substring(prefix.length());
        }
        if (!suffix.isEmpty() && key.endsWith(suffix)) {
            key = key.substring(0, key.length() - suffix.length());
        }
        return key.isEmpty() ? dataset : key;
    }

    /**
     * Fails if two datasets would be presented under the same key.
     *
     * @throws IllegalStateException on a collision
     */
    public void requireDistinct(Collection<String> datasets) {
        Map<String, String> seen = new HashMap<>();
        for (String dataset : datasets) {
            String previous = seen.putIfAbsent(normalize(dataset), dataset);
            if (previous != null && !previous.equals(dataset)) {
                throw new IllegalStateException("Datasets " + previous + " and " + dataset
                        + " both normalize to key '" + normalize(dataset) + "'");
            }
        }
    }
}
