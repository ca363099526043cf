package com.profileparser.parser;

/**
 * A log line had the expected shape but its content could not be interpreted
 */
public class ProfileParseException extends RuntimeException {

    public ProfileParseException(String message) {
        super(message);
    }

    public ProfileParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
