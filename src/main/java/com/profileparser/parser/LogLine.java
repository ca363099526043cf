package com.profileparser.parser;

import com.profileparser.model.LogMetadata;
import lombok.Value;

@Value
public class LogLine {
    LogMetadata metadata;
    String message;
}
