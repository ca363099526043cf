package com.profileparser.trace;

import com.profileparser.model.OperationRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * All spans logged for one profiled request, organized by their paths.
 *
 * Iteration is depth first: the root, then each child subtree in the order
 * the children were first seen.
 * @author kiransahoo
 */
public class Trace implements Iterable<TraceNode> {

    private final String traceId;
    private final TraceNode root;
    private boolean finished;

    public Trace(OperationRecord root) {
        this(root, UUID.randomUUID().toString());
    }

    public Trace(OperationRecord root, String traceId) {
        this.traceId = traceId;
        this.root = new TraceNode(TraceNode.splitPath(root.getSpanId()), root);
    }

    public void add(OperationRecord record) {
        if (finished) {
            throw new IllegalStateException("Trace " + traceId + " is finalized, cannot add span " + record.getSpanId());
        }
        root.insert(record.getSpanId(), record);
    }

    /**
     * Compute inclusive and exclusive times and stamp trace id and parent
     * references onto every record. May be called once, after the last
     * {@link #add}; a second call fails.
     */
    public void finish() {
        if (finished) {
            throw new IllegalStateException("Trace " + traceId + " has already been finalized");
        }
        root.finish(traceId, Collections.emptyList(), null);
        finished = true;
    }

    public boolean isFinished() {
        return finished;
    }

    public String getTraceId() {
        return traceId;
    }

    public TraceNode getRoot() {
        return root;
    }

    public long getInclusiveTimeMs() {
        return root.getInclusiveTimeMs();
    }

    public long getExclusiveTimeMs() {
        return root.getExclusiveTimeMs();
    }

    public List<TraceNode> getNodes() {
        List<TraceNode> nodes = new ArrayList<>();
        root.forEachDepthFirst(nodes::add);
        return nodes;
    }

    public Stream<TraceNode> stream() {
        return getNodes().stream();
    }

    @Override
    public Iterator<TraceNode> iterator() {
        return Collections.unmodifiableList(getNodes()).iterator();
    }
}
