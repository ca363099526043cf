package com.profileparser.cli;

import com.profileparser.model.OutputFormat;
import lombok.Getter;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Options given on the command line. Anything that is not an option is a log file.
 */
@Getter
public class CliOptions {

    static final String USAGE = "Usage: puppet-profile-parser [options] puppetserver.log [...]";

    static final String HELP = USAGE + "\n"
            + "    -f, --format FORMAT              Output format to use. One of:\n"
            + "                                         human (default)\n"
            + "                                         csv\n"
            + "                                         flamegraph\n"
            + "                                         zipkin\n"
            + "        --[no-]color                 Colorize output.\n"
            + "                                     Defaults to true if run from an interactive POSIX shell.\n"
            + "    -h, --help                       Show help\n"
            + "        --debug                      Enable backtraces from errors.\n"
            + "        --version                    Show version\n";

    private OutputFormat format;
    private Boolean color;
    private boolean help;
    private boolean version;
    private boolean debug;
    private final List<Path> logFiles = new ArrayList<>();

    /**
     * @throws IllegalArgumentException for unknown options, a missing format
     *         or a format that is not supported
     */
    public static CliOptions parse(String... args) {
        CliOptions options = new CliOptions();
        boolean optionsEnded = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];

            if (optionsEnded || !arg.startsWith("-") || arg.equals("-")) {
                options.logFiles.add(Path.of(arg));
                continue;
            }

            if (arg.startsWith("--format=")) {
                options.format = OutputFormat.fromString(arg.substring("--format=".length()));
                continue;
            }
            if (arg.startsWith("-f") && arg.length() > 2) {
                options.format = OutputFormat.fromString(arg.substring(2));
                continue;
            }

            switch (arg) {
                case "--" -> optionsEnded = true;
                case "-f", "--format" -> {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("missing argument: " + arg);
                    }
                    options.format = OutputFormat.fromString(args[++i]);
                }
                case "--color" -> options.color = Boolean.TRUE;
                case "--no-color" -> options.color = Boolean.FALSE;
                case "-h", "--help" -> options.help = true;
                case "--version" -> options.version = true;
                case "--debug" -> options.debug = true;
                default -> throw new IllegalArgumentException("invalid option: " + arg);
            }
        }
        return options;
    }

    public List<Path> getLogFiles() {
        return Collections.unmodifiableList(logFiles);
    }
}
