package com.profileparser.trace;

import com.profileparser.model.OperationRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Collects the records logged by one server thread until the root span of
 * the profile shows up. Puppet logs the root last, so every record seen
 * before it belongs to the same profile.
 */
@Slf4j
public class ThreadTraceAssembler {

    private final String threadId;
    private final List<OperationRecord> pending = new ArrayList<>();

    public ThreadTraceAssembler(String threadId) {
        this.threadId = threadId;
    }

    /**
     * @return the finalized trace when {@code record} is a root span,
     *         otherwise empty while the profile is still open
     */
    public Optional<Trace> submit(OperationRecord record) {
        if (!record.isRoot()) {
            pending.add(record);
            return Optional.empty();
        }

        Trace trace = new Trace(record);
        for (OperationRecord child : pending) {
            trace.add(child);
        }
        pending.clear();

        trace.finish();
        if (log.isDebugEnabled()) {
            log.debug("Thread {} completed trace {} ({} ms)",
                    threadId, trace.getTraceId(), trace.getInclusiveTimeMs());
        }
        return Optional.of(trace);
    }

    public String getThreadId() {
        return threadId;
    }

    public List<OperationRecord> getPending() {
        return Collections.unmodifiableList(pending);
    }
}
