package org.ecaflow.runner;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.ecaflow.analysis.AnalysisReport;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;

/**
 * Serializes an {@link AnalysisReport} as JSON.
 *
 * Output is UTF-8 with non-ASCII characters (the {@code →} in labels) written
 * as-is, pretty-printed unless compact output is requested.
 */
public class ReportWriter {

    private final ObjectMapper mapper;

    public ReportWriter(boolean compact) {
        this.mapper = new ObjectMapper();
        mapper.configure(SerializationFeature.INDENT_OUTPUT, !compact);
        mapper.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
    }

    public String toJson(AnalysisReport report) throws IOException {
        return mapper.writeValueAsString(report);
    }

    /**
     * Write the report followed by a newline; the stream is flushed, not closed.
     */
    public void write(AnalysisReport report, OutputStream out) throws IOException {
        Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
        writer.write(toJson(report));
        writer.write(System.lineSeparator());
        writer.flush();
    }

    public void write(AnalysisReport report, Path file) throws IOException {
        try (OutputStream out = Files.newOutputStream(file)) {
            write(report, out);
        }
    }
}
