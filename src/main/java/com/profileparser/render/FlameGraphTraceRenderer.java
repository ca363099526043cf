package com.profileparser.render;

import com.profileparser.model.OutputFormat;
import com.profileparser.trace.Trace;
import com.profileparser.trace.TraceNode;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Folded stack lines ({@code a;b;c 42}) for Brendan Gregg's flamegraph.pl,
 * weighted by exclusive time in milliseconds.
 */
public class FlameGraphTraceRenderer implements TraceRenderer {

    @Override
    public void render(List<Trace> traces, Writer output) throws IOException {
        for (Trace trace : traces) {
            for (TraceNode node : trace) {
                long time = node.getExclusiveTimeMs();
                if (time == 0) {
                    continue;
                }
                output.write(label(node) + " " + time + "\n");
            }
        }
        output.flush();
    }

    static String label(TraceNode node) {
        List<String> stack = new ArrayList<>(node.getStack());
        stack.set(stack.size() - 1, node.getRecord().getAggregateName());

        // flamegraph.pl splits frames on ';'
        return stack.stream()
                .map(frame -> frame.replace(";", ""))
                .collect(Collectors.joining(";"));
    }

    @Override
    public OutputFormat getFormat() {
        return OutputFormat.FLAMEGRAPH;
    }
}
