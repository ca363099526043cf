package com.profileparser.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One operation measured by the Puppet profiler.
 *
 * Profiling lines are written after the operation completes, so the log
 * timestamp is the finish time. Trace id, parent reference and start time are
 * filled in once, when the trace holding the record is finalized.
 * @author kiransahoo
 */
@Getter
@ToString(of = {"spanId", "kind", "name", "durationSeconds"})
public class OperationRecord {

    public static final String ROOT_SPAN_ID = "1";
    public static final String RESOURCE_TYPE_TAG = "puppet.resource_type";
    public static final String RESOURCE_TITLE_TAG = "puppet.resource_title";

    private final String spanId;
    private final OperationKind kind;
    private final String name;
    private final double durationSeconds;
    private final OffsetDateTime finishTime;
    private final Map<String, String> tags;

    private String traceId;
    private OffsetDateTime startTime;
    private final List<SpanReference> references = new ArrayList<>();
    private boolean finished;

    @Builder
    public OperationRecord(String spanId, OperationKind kind, String name,
                           double durationSeconds, OffsetDateTime finishTime,
                           Map<String, String> tags) {
        this.spanId = spanId;
        this.kind = kind != null ? kind : OperationKind.OTHER;
        this.name = name;
        this.durationSeconds = durationSeconds;
        this.finishTime = finishTime;
        this.tags = tags == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
    }

    public boolean isRoot() {
        return ROOT_SPAN_ID.equals(spanId);
    }

    public String getResourceType() {
        return tags.get(RESOURCE_TYPE_TAG);
    }

    /**
     * Name used when aggregating time. Resources other than classes are
     * grouped under their type so that e.g. all File resources add up.
     */
    public String getAggregateName() {
        String resourceType = getResourceType();
        if (resourceType == null || "Class".equals(resourceType)) {
            return name;
        }
        return resourceType;
    }

    public List<SpanReference> getReferences() {
        return Collections.unmodifiableList(references);
    }

    public Optional<String> getParentSpanId() {
        return references.stream()
                .filter(r -> SpanReference.CHILD_OF.equals(r.getType()))
                .map(SpanReference::getSpanId)
                .findFirst();
    }

    /**
     * Copy trace state onto the record. Called by {@code Trace#finish()} only.
     *
     * @param parentSpanId path of the enclosing span, {@code null} for the root
     */
    public void finish(String traceId, String parentSpanId) {
        if (finished) {
            throw new IllegalStateException("Span " + spanId + " has already been finished");
        }
        this.traceId = traceId;
        if (parentSpanId != null) {
            references.add(SpanReference.childOf(parentSpanId));
        }
        if (finishTime != null) {
            startTime = finishTime.minusNanos((long) (durationSeconds * 1_000_000_000L));
        }
        finished = true;
    }
}
