package com.profileparser.render;

import com.profileparser.model.OutputFormat;
import com.profileparser.trace.Trace;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Writes finalized traces in one output format.
 * Implementations flush but never close the writer.
 */
public interface TraceRenderer {

    /**
     * @param traces finalized traces, in completion order
     */
    void render(List<Trace> traces, Writer output) throws IOException;

    OutputFormat getFormat();
}
