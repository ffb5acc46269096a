package com.shardql.emit;

import com.fasterxml.jackson.core.JsonGenerator;
import com.shardql.engine.DatasetKeyNormalizer;
import com.shardql.engine.ResultAggregator;
import com.shardql.model.AggregateLayout;
import com.shardql.model.FetchOutcome;
import com.shardql.model.FetchResult;
import com.shardql.model.FetchUnit;
import com.shardql.model.GroupBy;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes an aggregate envelope incrementally as fetch results arrive.
 *
 * <p>Output is {@code {<header fields>, "data": {...}, <trailer fields>}}. Every leaf is
 * flushed as soon as its unit completes. In the nested layout a group (one outer key) must be
 * written contiguously, so only one group is open at a time: results for other groups are held
 * until the open group has all its units, then the next group with held results is opened and
 * drained. Bytes already written are never revisited; a failed unit writes its error marker in
 * place of its rows.
 *
 * <p>Not thread-safe. Feed it from the single thread collecting dispatcher results.
 */
public class StreamingAggregateWriter {

    private enum State {
        NEW, DATA, TRAILER, CLOSED
    }

    private final JsonGenerator generator;
    private final GroupBy groupBy;
    private final AggregateLayout layout;
    private final DatasetKeyNormalizer normalizer;

    private final Set<FetchUnit> pending = new LinkedHashSet<>();
    private final Map<String, Integer> remainingByGroup = new LinkedHashMap<>();
    private final Map<String, List<FetchResult>> held = new LinkedHashMap<>();
    private String openGroup;
    private State state = State.NEW;
    private int successCount;
    private int failureCount;

    public StreamingAggregateWriter(JsonGenerator generator, List<FetchUnit> units, GroupBy groupBy,
                                    AggregateLayout layout, DatasetKeyNormalizer normalizer) {
        this.generator = generator;
        this.groupBy = groupBy;
        this.layout = layout;
        this.normalizer = normalizer != null ? normalizer : DatasetKeyNormalizer.IDENTITY;
        // Same shape rules as the buffered fold: rejects repeated units and leaf collisions.
        ResultAggregator.forUnits(units, groupBy, layout, this.normalizer);
        for (FetchUnit unit : units) {
            pending.add(unit);
            remainingByGroup.merge(groupBy.outerKey(unit, this.normalizer), 1, Integer::sum);
        }
    }

    /**
     * Writes the opening of the envelope, the header fields and the start of {@code data}.
     */
    public void begin(Map<String, Object> header) throws IOException {
        requireState(State.NEW);
        generator.writeStartObject();
        writeFields(header);
        generator.writeFieldName("data");
        generator.writeStartObject();
        generator.flush();
        state = State.DATA;
    }

    /**
     * Writes or holds one result.
     *
     * @throws IllegalStateException if the unit was not expected or already written
     */
    public void accept(FetchResult result) throws IOException {
        requireState(State.DATA);
        FetchUnit unit = result.getUnit();
        if (!pending.remove(unit)) {
            throw new IllegalStateException("Unexpected or repeated result for " + unit.describe());
        }
        if (result.getOutcome().isSuccess()) {
            successCount++;
        } else {
            failureCount++;
        }

        if (layout == AggregateLayout.FLAT) {
            writeLeaf(groupBy.outerKey(unit, normalizer), result.getOutcome());
            generator.flush();
            return;
        }

        String group = groupBy.outerKey(unit, normalizer);
        if (openGroup == null) {
            openGroup(group);
        }
        if (group.equals(openGroup)) {
            writeNestedLeaf(result);
            drainHeld();
        } else {
            held.computeIfAbsent(group, k -> new ArrayList<>()).add(result);
        }
        generator.flush();
    }

    /**
     * Closes {@code data}. Units that never reported are written as failures first.
     */
    public void endData() throws IOException {
        requireState(State.DATA);
        for (FetchUnit unit : new ArrayList<>(pending)) {
            accept(new FetchResult(unit, FetchOutcome.failure(ResultAggregator.MISSING_OUTCOME), 0));
        }
        generator.writeEndObject();
        state = State.TRAILER;
    }

    /**
     * Writes the trailer fields and closes the envelope.
     */
    public void finish(Map<String, Object> trailer) throws IOException {
        requireState(State.TRAILER);
        writeFields(trailer);
        generator.writeEndObject();
        generator.flush();
        state = State.CLOSED;
    }

    public boolean allFailed() {
        return successCount == 0 && (failureCount > 0 || !pending.isEmpty());
    }

    public int getSuccessCount() {
        return successCount;
    }

    public int getFailureCount() {
        return failureCount;
    }

    private void openGroup(String group) throws IOException {
        generator.writeFieldName(group);
        generator.writeStartObject();
        openGroup = group;
    }

    private void writeNestedLeaf(FetchResult result) throws IOException {
        writeLeaf(groupBy.innerKey(result.getUnit(), normalizer), result.getOutcome());
        int left = remainingByGroup.merge(openGroup, -1, Integer::sum);
        if (left == 0) {
            generator.writeEndObject();
            openGroup = null;
        }
    }

    private void drainHeld() throws IOException {
        while (openGroup == null && !held.isEmpty()) {
            String next = held.keySet().iterator().next();
            List<FetchResult> results = held.remove(next);
            openGroup(next);
            for (FetchResult result : results) {
                writeNestedLeaf(result);
            }
        }
    }

    private void writeLeaf(String key, FetchOutcome outcome) throws IOException {
        generator.writeFieldName(key);
        generator.writeObject(outcome.toLeafValue());
    }

    private void writeFields(Map<String, Object> fields) throws IOException {
        if (fields == null) {
            return;
        }
        for (Map.Entry<String, Object> e : fields.entrySet()) {
            if (e.getValue() != null) {
                generator.writeObjectField(e.getKey(), e.getValue());
            }
        }
    }

    private void requireState(State expected) {
        if (state != expected) {
            throw new IllegalStateException("Writer is " + state + ", expected " + expected);
        }
    }
}
