package com.profileparser.cli;

import com.profileparser.config.ProfileParserProperties;
import com.profileparser.factory.TraceRendererFactory;
import com.profileparser.model.OutputFormat;
import com.profileparser.render.TraceRenderer;
import com.profileparser.service.ProfileLogService;
import com.profileparser.trace.Trace;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/**
 * Command line entry point: parse the given log files and write the traces
 * to stdout in the requested format.
 * @author kiransahoo
 */
@Slf4j
@Component
public class ProfileParserCli implements CommandLineRunner, ExitCodeGenerator {

    private final ProfileLogService logService;
    private final TraceRendererFactory rendererFactory;
    private final ProfileParserProperties properties;
    private final PrintStream out;
    private final PrintStream err;

    private int exitCode;

    @Autowired
    public ProfileParserCli(ProfileLogService logService, TraceRendererFactory rendererFactory,
                            ProfileParserProperties properties) {
        this(logService, rendererFactory, properties, System.out, System.err);
    }

    ProfileParserCli(ProfileLogService logService, TraceRendererFactory rendererFactory,
                     ProfileParserProperties properties, PrintStream out, PrintStream err) {
        this.logService = logService;
        this.rendererFactory = rendererFactory;
        this.properties = properties;
        this.out = out;
        this.err = err;
    }

    @Override
    public void run(String... args) {
        exitCode = execute(args);
    }

    /**
     * @return the process exit code
     */
    public int execute(String... args) {
        CliOptions options = null;
        try {
            options = CliOptions.parse(args);

            if (options.isHelp()) {
                out.print(CliOptions.HELP);
                return 0;
            }
            if (options.isVersion()) {
                out.println(properties.getVersion());
                return 0;
            }
            if (options.getLogFiles().isEmpty()) {
                err.print(CliOptions.HELP);
                return 1;
            }

            OutputFormat format = options.getFormat() != null
                    ? options.getFormat()
                    : OutputFormat.fromString(properties.getDefaultFormat());
            TraceRenderer renderer = rendererFactory.getRenderer(format, resolveColor(options));

            List<Trace> traces = logService.parseFiles(options.getLogFiles());
            log.debug("Rendering {} traces", traces.size());

            Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
            renderer.render(traces, writer);
            writer.flush();
            return 0;
        } catch (Exception e) {
            err.println("ERROR " + e.getClass().getSimpleName() + ": " + e.getMessage());
            if (options != null && options.isDebug()) {
                e.printStackTrace(err);
            }
            return 1;
        }
    }

    private boolean resolveColor(CliOptions options) {
        if (options.getColor() != null) {
            return options.getColor();
        }
        if (properties.getColor() != null) {
            return properties.getColor();
        }
        return System.console() != null && !isWindows();
    }

    private static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
