package com.profileparser.trace;

import com.profileparser.model.OperationRecord;
import com.profileparser.parser.LogLine;
import com.profileparser.parser.LogLineParser;
import com.profileparser.parser.ProfileMessageClassifier;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Rebuilds traces from PROFILE lines fed to it one at a time, in log order.
 *
 * Lines of concurrent requests interleave in the log, so records are routed
 * to one {@link ThreadTraceAssembler} per server thread. An instance is
 * meant to consume one ordered stream and is not thread safe.
 * @author kiransahoo
 */
@Slf4j
public class LogTraceReconstructor {

    private final LogLineParser lineParser;
    private final ProfileMessageClassifier classifier;

    private final Map<String, ThreadTraceAssembler> assemblers = new HashMap<>();
    private final List<Trace> traces = new ArrayList<>();

    public LogTraceReconstructor(LogLineParser lineParser, ProfileMessageClassifier classifier) {
        this.lineParser = lineParser;
        this.classifier = classifier;
    }

    /**
     * Parse one log line. Lines that cannot be parsed are logged and skipped.
     *
     * @return the trace completed by this line, if any
     */
    public Optional<Trace> process(String line) {
        Optional<LogLine> parsed = lineParser.parse(line);
        if (parsed.isEmpty()) {
            log.warn("Could not parse log line: {}", line.strip());
            return Optional.empty();
        }

        LogLine logLine = parsed.get();
        Optional<OperationRecord> record = classifier.classify(logLine.getMessage(), logLine.getMetadata());
        if (record.isEmpty()) {
            log.warn("Could not parse PROFILE message: {}", logLine.getMessage());
            return Optional.empty();
        }

        String threadId = logLine.getMetadata().getThreadId();
        Optional<Trace> trace = assemblers
                .computeIfAbsent(threadId, ThreadTraceAssembler::new)
                .submit(record.get());

        trace.ifPresent(traces::add);
        return trace;
    }

    /**
     * Completed traces in the order their root spans were logged
     */
    public List<Trace> getTraces() {
        return Collections.unmodifiableList(traces);
    }

    /**
     * Records still waiting for a root span. These are never turned into
     * traces, e.g. when the log was rotated in the middle of a request.
     */
    public int getPendingRecordCount() {
        return assemblers.values().stream()
                .mapToInt(a -> a.getPending().size())
                .sum();
    }

    public int getThreadCount() {
        return assemblers.size();
    }
}
