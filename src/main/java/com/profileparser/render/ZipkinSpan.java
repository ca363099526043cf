package com.profileparser.render;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Span in the Zipkin v2 {@code ListOfSpans} JSON format.
 * Timestamps and durations are in microseconds.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"traceId", "id", "parentId", "name", "kind", "timestamp", "duration", "localEndpoint", "tags"})
public class ZipkinSpan {
    private String traceId;
    private String id;
    private String parentId;
    private String name;
    private String kind;
    private Long timestamp;
    private Long duration;
    private Endpoint localEndpoint;
    private Map<String, String> tags;

    @Data
    @Builder
    public static class Endpoint {
        private String serviceName;
    }
}
