package com.profileparser.model;

import java.util.Locale;

public enum OutputFormat {
    HUMAN,
    CSV,
    FLAMEGRAPH,
    ZIPKIN;

    public static OutputFormat fromString(String value) {
        if (value != null) {
            for (OutputFormat format : values()) {
                if (format.name().toLowerCase(Locale.ROOT).equals(value)) {
                    return format;
                }
            }
        }
        throw new IllegalArgumentException(
                value + " is not a supported output format. See --help for details.");
    }

    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
