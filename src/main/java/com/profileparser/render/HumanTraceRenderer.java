package com.profileparser.render;

import com.profileparser.model.OperationSummary;
import com.profileparser.model.OutputFormat;
import com.profileparser.service.summary.OperationSummaryService;
import com.profileparser.trace.Trace;
import com.profileparser.trace.TraceNode;

import java.io.PrintWriter;
import java.io.Writer;
import java.util.List;

/**
 * Indented listing of every trace followed by tables of the most
 * expensive operations, sorted by exclusive time.
 * @author kiransahoo
 */
public class HumanTraceRenderer implements TraceRenderer {

    static final String ELLIPSIS = "…";

    private final OperationSummaryService summaryService;
    private final boolean color;
    private final int columnWidth;

    public HumanTraceRenderer(OperationSummaryService summaryService, boolean color, int columnWidth) {
        this.summaryService = summaryService;
        this.color = color;
        this.columnWidth = columnWidth;
    }

    @Override
    public void render(List<Trace> traces, Writer output) {
        PrintWriter out = new PrintWriter(output);

        for (Trace trace : traces) {
            for (TraceNode node : trace) {
                String indent = " ".repeat(node.getDepth());
                String id = AnsiColor.GREEN.apply(node.getRecord().getSpanId(), color);
                String time = AnsiColor.YELLOW.apply("(" + node.getInclusiveTimeMs() + " ms)", color);
                out.print(indent + id + " " + node.getRecord().getName() + " " + time + "\n");
            }
            out.print("\n\n");
        }

        for (OperationSummary summary : summaryService.summarize(traces)) {
            printSummary(out, summary);
        }
        out.flush();
    }

    private void printSummary(PrintWriter out, OperationSummary summary) {
        out.print("\n--- " + summary.getKind().getSummaryTitle() + " ---\n");
        out.print("Total time: " + summary.getTotalTimeMs() + " ms\n");
        out.print("Itemized:\n");

        String row = "%-" + columnWidth + "s | %s\n";
        out.printf("%-" + columnWidth + "s | %-19s\n", "Source", "Time");
        out.print("-".repeat(columnWidth) + "-+-" + "-".repeat(19) + "\n");
        for (OperationSummary.Item item : summary.getItems()) {
            if (item.getTimeMs() == 0) {
                continue;
            }
            out.printf(row, truncate(item.getSource(), columnWidth), item.getTimeMs() + " ms");
        }
    }

    static String truncate(String text, int width) {
        if (text.length() <= width) {
            return text;
        }
        return text.substring(0, width - 1) + ELLIPSIS;
    }

    @Override
    public OutputFormat getFormat() {
        return OutputFormat.HUMAN;
    }
}
