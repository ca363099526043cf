package com.profileparser.service.summary;

import com.profileparser.model.OperationKind;
import com.profileparser.model.OperationRecord;
import com.profileparser.model.OperationSummary;
import com.profileparser.trace.Trace;
import com.profileparser.trace.TraceNode;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Adds up exclusive time per kind of operation across all traces
 * @author kiransahoo
 */
@Service
public class OperationSummaryService {

    /**
     * One summary per {@link OperationKind}, in declaration order, including
     * kinds with no spans. Items are sorted by time, largest first.
     */
    public List<OperationSummary> summarize(List<Trace> traces) {
        Map<OperationKind, List<TraceNode>> byKind = new EnumMap<>(OperationKind.class);
        for (OperationKind kind : OperationKind.values()) {
            byKind.put(kind, new ArrayList<>());
        }
        traces.stream()
                .flatMap(Trace::stream)
                .forEach(node -> byKind.get(node.getRecord().getKind()).add(node));

        List<OperationSummary> summaries = new ArrayList<>();
        byKind.forEach((kind, nodes) -> summaries.add(summarize(kind, nodes)));
        return summaries;
    }

    private OperationSummary summarize(OperationKind kind, List<TraceNode> nodes) {
        long total = 0;
        // Resources other than classes are aggregated under their type
        Map<String, Long> itemized = new LinkedHashMap<>();
        for (TraceNode node : nodes) {
            OperationRecord record = node.getRecord();
            total += node.getExclusiveTimeMs();
            itemized.merge(record.getAggregateName(), node.getExclusiveTimeMs(), Long::sum);
        }

        List<OperationSummary.Item> items = itemized.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()))
                .map(e -> OperationSummary.Item.builder()
                        .source(e.getKey())
                        .timeMs(e.getValue())
                        .build())
                .collect(Collectors.toList());

        return OperationSummary.builder()
                .kind(kind)
                .totalTimeMs(total)
                .items(items)
                .build();
    }
}
