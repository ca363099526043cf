package com.profileparser.render;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.profileparser.model.OperationRecord;
import com.profileparser.model.OutputFormat;
import com.profileparser.parser.ProfileMessageClassifier;
import com.profileparser.trace.Trace;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Writes spans as a JSON array accepted by the Zipkin v2 API
 * ({@code POST /api/v2/spans}). Spans that took less than a millisecond
 * are left out.
 */
public class ZipkinTraceRenderer implements TraceRenderer {

    private final ObjectMapper objectMapper;
    private final String serviceName;

    public ZipkinTraceRenderer(ObjectMapper objectMapper, String serviceName) {
        this.objectMapper = objectMapper;
        this.serviceName = serviceName;
    }

    @Override
    public void render(List<Trace> traces, Writer output) throws IOException {
        List<ZipkinSpan> spans = traces.stream()
                .flatMap(Trace::stream)
                .filter(node -> node.getInclusiveTimeMs() > 0)
                .map(node -> toZipkinSpan(node.getRecord()))
                .collect(Collectors.toList());

        output.write(objectMapper.writeValueAsString(spans));
        output.flush();
    }

    ZipkinSpan toZipkinSpan(OperationRecord record) {
        Map<String, String> tags = new LinkedHashMap<>(record.getTags());
        // Carried by "kind" instead
        tags.remove(ProfileMessageClassifier.SPAN_KIND_TAG);

        return ZipkinSpan.builder()
                // Zipkin accepts 32 hex characters, a UUID without dashes
                .traceId(record.getTraceId().replace("-", ""))
                .id(hexId(record.getSpanId()))
                .parentId(record.getParentSpanId().map(ZipkinTraceRenderer::hexId).orElse(null))
                .name(record.getName())
                .kind("SERVER")
                .timestamp(record.getStartTime() == null ? null : toMicros(record.getStartTime().toInstant()))
                .duration((long) (record.getDurationSeconds() * 1_000_000))
                .localEndpoint(ZipkinSpan.Endpoint.builder().serviceName(serviceName).build())
                .tags(tags.isEmpty() ? null : tags)
                .build();
    }

    /**
     * Span ids must be exactly 16 hex characters; paths are hashed to get there.
     */
    static String hexId(String spanId) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(spanId.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private static long toMicros(Instant instant) {
        return instant.getEpochSecond() * 1_000_000L + instant.getNano() / 1_000;
    }

    @Override
    public OutputFormat getFormat() {
        return OutputFormat.ZIPKIN;
    }
}
