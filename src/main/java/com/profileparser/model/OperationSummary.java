package com.profileparser.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Exclusive time spent on one kind of operation, itemized by source
 */
@Data
@Builder
public class OperationSummary {
    private OperationKind kind;
    private long totalTimeMs;
    private List<Item> items;

    @Data
    @Builder
    public static class Item {
        private String source;
        private long timeMs;
    }
}
