package com.profileparser.render;

/**
 * ANSI escape codes used by the human readable output
 */
public enum AnsiColor {
    RED(31),
    GREEN(32),
    YELLOW(33);

    private final int code;

    AnsiColor(int code) {
        this.code = code;
    }

    public String apply(String text, boolean enabled) {
        if (!enabled) {
            return text;
        }
        return "\033[" + code + "m" + text + "\033[0m";
    }
}
