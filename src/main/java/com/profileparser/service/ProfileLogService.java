package com.profileparser.service;

import com.profileparser.config.ProfileParserProperties;
import com.profileparser.parser.LogLineParser;
import com.profileparser.parser.ProfileMessageClassifier;
import com.profileparser.trace.LogTraceReconstructor;
import com.profileparser.trace.Trace;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.zip.GZIPInputStream;

/**
 * Reads Puppet Server log files and returns the traces found in them
 * @author kiransahoo
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProfileLogService {

    private final ProfileParserProperties properties;

    public LogTraceReconstructor newReconstructor() {
        return new LogTraceReconstructor(
                new LogLineParser(properties.resolveZoneId()),
                new ProfileMessageClassifier(properties.getServerUrl(), properties.getServiceName()));
    }

    /**
     * Parse all files in order into one set of traces. Profiles still open at
     * the end of one file continue in the next.
     */
    public List<Trace> parseFiles(List<Path> files) throws IOException {
        LogTraceReconstructor reconstructor = newReconstructor();
        for (Path file : files) {
            parseFile(file, reconstructor);
        }

        if (log.isDebugEnabled()) {
            log.debug("Parsed {} traces from {} threads, {} records left without a root span",
                    reconstructor.getTraces().size(), reconstructor.getThreadCount(),
                    reconstructor.getPendingRecordCount());
        }
        return reconstructor.getTraces();
    }

    /**
     * Files ending in {@code .gz} are decompressed while reading.
     */
    public void parseFile(Path file, LogTraceReconstructor reconstructor) throws IOException {
        log.debug("Reading {}", file);
        InputStream input = Files.newInputStream(file);
        if (file.getFileName().toString().endsWith(".gz")) {
            try {
                input = new GZIPInputStream(input);
            } catch (IOException e) {
                input.close();
                throw e;
            }
        }
        parse(input, reconstructor);
    }

    /**
     * Feed every PROFILE line of {@code input} to the reconstructor. The stream is closed.
     */
    public void parse(InputStream input, LogTraceReconstructor reconstructor) throws IOException {
        String tag = properties.getProfileTag();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.contains(tag)) {
                    reconstructor.process(line);
                }
            }
        }
    }
}
