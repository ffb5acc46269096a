package com.shardql.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tables found across datasets, plus the datasets whose metadata query failed.
 */
public class DiscoveryResult {
    private final Set<TableRef> tables;
    private final Map<String, String> errors;
    private final int datasetCount;

    public DiscoveryResult(Set<TableRef> tables, Map<String, String> errors, int datasetCount) {
        this.tables = Collections.unmodifiableSet(new LinkedHashSet<>(tables));
        this.errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
        this.datasetCount = datasetCount;
    }

    public Set<TableRef> getTables() {
        return tables;
    }

    public Map<String, String> getErrors() {
        return errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * True when every dataset's metadata query failed.
     */
    public boolean isTotalFailure() {
        return datasetCount > 0 && errors.size() == datasetCount;
    }

    /**
     * Table names with dataset origin dropped, in first-seen order.
     */
    public List<String> tableNames() {
        Set<String> names = new LinkedHashSet<>();
        for (TableRef ref : tables) {
            names.add(ref.getTable());
        }
        return List.copyOf(names);
    }
}
