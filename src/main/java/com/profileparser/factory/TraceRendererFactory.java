package com.profileparser.factory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.profileparser.config.ProfileParserProperties;
import com.profileparser.model.OutputFormat;
import com.profileparser.render.CsvTraceRenderer;
import com.profileparser.render.FlameGraphTraceRenderer;
import com.profileparser.render.HumanTraceRenderer;
import com.profileparser.render.TraceRenderer;
import com.profileparser.render.ZipkinTraceRenderer;
import com.profileparser.service.summary.OperationSummaryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class TraceRendererFactory {

    private final ObjectMapper objectMapper;
    private final OperationSummaryService summaryService;
    private final ProfileParserProperties properties;

    /**
     * @param color whether the human readable output may use ANSI colors
     */
    public TraceRenderer getRenderer(OutputFormat format, boolean color) {
        TraceRenderer renderer = switch (format) {
            case CSV -> new CsvTraceRenderer();
            case FLAMEGRAPH -> new FlameGraphTraceRenderer();
            case ZIPKIN -> new ZipkinTraceRenderer(objectMapper, properties.getServiceName());
            case HUMAN -> new HumanTraceRenderer(summaryService, color, properties.getSummaryColumnWidth());
        };
        log.debug("Rendering {} output", renderer.getFormat().getName());
        return renderer;
    }
}
