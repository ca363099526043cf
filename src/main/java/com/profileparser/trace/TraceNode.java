package com.profileparser.trace;

import com.profileparser.model.OperationRecord;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Position in a trace addressed by a dotted path such as {@code 1.2.3}.
 *
 * The number of segments gives the nesting depth and the last segment the
 * order among siblings. A node may exist before its record has been seen,
 * because children are logged before their parents.
 */
public class TraceNode {

    private final List<String> path;
    // Keyed by last path segment, kept in the order children were first seen
    private final Map<String, TraceNode> children = new LinkedHashMap<>();
    private OperationRecord record;

    private Long inclusiveTimeMs;
    private Long exclusiveTimeMs;
    private List<String> stack;

    TraceNode(List<String> path, OperationRecord record) {
        this.path = List.copyOf(path);
        this.record = record;
    }

    static List<String> splitPath(String pathId) {
        return Arrays.asList(pathId.split("\\."));
    }

    /**
     * Place a record at the node identified by {@code pathId}, creating any
     * missing nodes between this one and the target.
     */
    void insert(String pathId, OperationRecord operation) {
        List<String> parts = splitPath(pathId);

        if (parts.equals(path)) {
            record = operation;
        } else if (parts.size() > path.size() && parts.subList(0, path.size()).equals(path)) {
            TraceNode next = child(parts.get(path.size()));
            if (parts.size() == path.size() + 1) {
                next.record = operation;
            } else {
                next.insert(pathId, operation);
            }
        } else {
            throw new IllegalArgumentException(
                    "Span " + pathId + " does not belong under span " + getPathId());
        }
    }

    private TraceNode child(String segment) {
        return children.computeIfAbsent(segment, id -> {
            List<String> childPath = new ArrayList<>(path);
            childPath.add(id);
            return new TraceNode(childPath, null);
        });
    }

    /**
     * Post-order pass computing times, the operation stack and the record's
     * trace state. Children need their inclusive time before the parent can
     * subtract it.
     */
    void finish(String traceId, List<String> parentStack, OperationRecord parent) {
        if (record == null) {
            throw new IllegalStateException("No PROFILE line was logged for span " + getPathId());
        }

        List<String> ownStack = new ArrayList<>(parentStack);
        ownStack.add(record.getName());
        stack = Collections.unmodifiableList(ownStack);

        long childTime = 0;
        for (TraceNode child : children.values()) {
            child.finish(traceId, stack, record);
            childTime += child.inclusiveTimeMs;
        }

        // Truncates, like the integer conversion of the original profiler output
        inclusiveTimeMs = (long) (record.getDurationSeconds() * 1000);
        exclusiveTimeMs = Math.max(0L, inclusiveTimeMs - childTime);

        record.finish(traceId, parent == null ? null : parent.getSpanId());
    }

    void forEachDepthFirst(Consumer<TraceNode> action) {
        action.accept(this);
        for (TraceNode child : children.values()) {
            child.forEachDepthFirst(action);
        }
    }

    public String getPathId() {
        return String.join(".", path);
    }

    public List<String> getPath() {
        return path;
    }

    /**
     * Nesting depth, 1 for the root
     */
    public int getDepth() {
        return path.size();
    }

    public OperationRecord getRecord() {
        return record;
    }

    public Collection<TraceNode> getChildren() {
        return Collections.unmodifiableCollection(children.values());
    }

    public TraceNode getChild(String segment) {
        return children.get(segment);
    }

    public long getInclusiveTimeMs() {
        requireFinished();
        return inclusiveTimeMs;
    }

    public long getExclusiveTimeMs() {
        requireFinished();
        return exclusiveTimeMs;
    }

    /**
     * Names of every operation from the root down to this one
     */
    public List<String> getStack() {
        requireFinished();
        return stack;
    }

    public boolean isFinished() {
        return inclusiveTimeMs != null;
    }

    private void requireFinished() {
        if (inclusiveTimeMs == null) {
            throw new IllegalStateException("Span " + getPathId() + " has not been finalized");
        }
    }

    @Override
    public String toString() {
        return "TraceNode{" + getPathId() + ", " + (record == null ? "<pending>" : record.getName()) + "}";
    }
}
