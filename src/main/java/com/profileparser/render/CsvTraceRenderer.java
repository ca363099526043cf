package com.profileparser.render;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.profileparser.model.OperationRecord;
import com.profileparser.model.OutputFormat;
import com.profileparser.trace.Trace;
import com.profileparser.trace.TraceNode;
import lombok.Value;

import java.io.IOException;
import java.io.Writer;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One CSV row per span, preceded by a header row
 */
public class CsvTraceRenderer implements TraceRenderer {

    // The profiler prints seconds with 4 digits of precision
    static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSXXX");

    private final CsvMapper mapper = CsvMapper.builder()
            .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
            // quote only values holding separators, quotes or line breaks
            .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
            .build();
    private final CsvSchema schema = mapper.schemaFor(Row.class).withHeader();

    @Override
    public void render(List<Trace> traces, Writer output) throws IOException {
        List<Row> rows = traces.stream()
                .flatMap(Trace::stream)
                .map(CsvTraceRenderer::toRow)
                .collect(Collectors.toList());

        // No header without data
        if (rows.isEmpty()) {
            return;
        }

        try (SequenceWriter writer = mapper.writer(schema).writeValues(output)) {
            writer.writeAll(rows);
        }
        output.flush();
    }

    private static Row toRow(TraceNode node) {
        OperationRecord record = node.getRecord();
        String timestamp = record.getStartTime() == null ? "" : TIMESTAMP_FORMAT.format(record.getStartTime());
        return new Row(timestamp,
                record.getTraceId(),
                record.getSpanId(),
                record.getName(),
                node.getExclusiveTimeMs(),
                node.getInclusiveTimeMs());
    }

    @Override
    public OutputFormat getFormat() {
        return OutputFormat.CSV;
    }

    @Value
    @JsonPropertyOrder({"timestamp", "trace_id", "span_id", "name", "exclusive_time_ms", "inclusive_time_ms"})
    static class Row {
        @JsonProperty("timestamp")
        String timestamp;
        @JsonProperty("trace_id")
        String traceId;
        @JsonProperty("span_id")
        String spanId;
        @JsonProperty("name")
        String name;
        @JsonProperty("exclusive_time_ms")
        long exclusiveTimeMs;
        @JsonProperty("inclusive_time_ms")
        long inclusiveTimeMs;
    }
}
