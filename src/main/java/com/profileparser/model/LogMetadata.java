package com.profileparser.model;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;

/**
 * Fields taken from the logback layout that wraps a PROFILE message
 */
@Value
@Builder
public class LogMetadata {
    OffsetDateTime timestamp;
    String logLevel;
    String threadId;
    String javaClass;
    String requestId;
}
