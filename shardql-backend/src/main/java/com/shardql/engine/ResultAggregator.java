package com.shardql.engine;

import com.shardql.model.AggregateLayout;
import com.shardql.model.FetchOutcome;
import com.shardql.model.FetchResult;
import com.shardql.model.FetchUnit;
import com.shardql.model.GroupBy;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Folds fetch results into one nested map keyed by unit origin.
 *
 * <p>The aggregate is shaped up front from the submitted units, in submission order, so the
 * arrival order of results never affects its layout. Each unit owns exactly one leaf: its row
 * list on success, or an {@code {"error": reason}} marker on failure. All methods are
 * synchronized; results may be folded from any thread.
 */
public class ResultAggregator {
    public static final String MISSING_OUTCOME = "No outcome was reported for this table";

    private final GroupBy groupBy;
    private final AggregateLayout layout;
    private final DatasetKeyNormalizer normalizer;
    /** Leaves by outer key, FLAT layout only. */
    private final Map<String, Object> leaves = new LinkedHashMap<>();
    /** Inner maps by outer key, NESTED layout only. */
    private final Map<String, Map<String, Object>> groups = new LinkedHashMap<>();
    private final Set<FetchUnit> pending = new LinkedHashSet<>();
    private int successCount;
    private int failureCount;

    private ResultAggregator(List<FetchUnit> units, GroupBy groupBy, AggregateLayout layout, DatasetKeyNormalizer normalizer) {
        this.groupBy = Objects.requireNonNull(groupBy, "groupBy");
        this.layout = Objects.requireNonNull(layout, "layout");
        this.normalizer = normalizer != null ? normalizer : DatasetKeyNormalizer.IDENTITY;

        Set<List<String>> slots = new HashSet<>();
        for (FetchUnit unit : units) {
            if (!pending.add(unit)) {
                throw new IllegalArgumentException("Duplicate fetch unit: " + unit.describe());
            }
            if (!slots.add(slotOf(unit))) {
                throw new IllegalArgumentException("Fetch unit " + unit.describe() + " collides with another unit at " + slotOf(unit));
            }
            place(unit, null);
        }
    }

    /**
     * Creates an aggregator expecting exactly the given units.
     *
     * @throws IllegalArgumentException if a unit repeats or two units map to the same leaf
     */
    public static ResultAggregator forUnits(List<FetchUnit> units, GroupBy groupBy, AggregateLayout layout, DatasetKeyNormalizer normalizer) {
        return new ResultAggregator(units, groupBy, layout, normalizer);
    }

    /**
     * Folds one result into the aggregate.
     *
     * @throws IllegalStateException if the unit was not expected or already folded
     */
    public synchronized void accept(FetchResult result) {
        FetchUnit unit = result.getUnit();
        if (!pending.remove(unit)) {
            throw new IllegalStateException("Unexpected or repeated result for " + unit.describe());
        }
        FetchOutcome outcome = result.getOutcome();
        if (outcome.isSuccess()) {
            successCount++;
        } else {
            failureCount++;
        }
        place(unit, outcome.toLeafValue());
    }

    /**
     * Returns a copy of the aggregate. Units that never reported are marked as failed first, so
     * the result always has one leaf per submitted unit.
     */
    public synchronized Map<String, Object> toMap() {
        for (FetchUnit unit : new ArrayList<>(pending)) {
            accept(new FetchResult(unit, FetchOutcome.failure(MISSING_OUTCOME), 0));
        }
        if (layout == AggregateLayout.FLAT) {
            return new LinkedHashMap<>(leaves);
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, Object>> e : groups.entrySet()) {
            copy.put(e.getKey(), new LinkedHashMap<>(e.getValue()));
        }
        return copy;
    }

    public synchronized boolean isComplete() {
        return pending.isEmpty();
    }

    public synchronized int getSuccessCount() {
        return successCount;
    }

    public synchronized int getFailureCount() {
        return failureCount;
    }

    /**
     * True when at least one unit was expected and none succeeded.
     */
    public synchronized boolean allFailed() {
        return successCount == 0 && (failureCount > 0 || !pending.isEmpty());
    }

    private List<String> slotOf(FetchUnit unit) {
        String outer = groupBy.outerKey(unit, normalizer);
        return layout == AggregateLayout.FLAT ? List.of(outer) : List.of(outer, groupBy.innerKey(unit, normalizer));
    }

    private void place(FetchUnit unit, Object leaf) {
        String outer = groupBy.outerKey(unit, normalizer);
        if (layout == AggregateLayout.FLAT) {
            leaves.put(outer, leaf);
            return;
        }
        groups.computeIfAbsent(outer, k -> new LinkedHashMap<>()).put(groupBy.innerKey(unit, normalizer), leaf);
    }
}
