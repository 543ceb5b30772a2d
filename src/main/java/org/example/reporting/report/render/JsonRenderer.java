package org.example.reporting.report.render;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.example.reporting.config.OutputFormat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One pretty-printed {@code <base>-<section>.json} array per section.
 */
public class JsonRenderer implements ReportRenderer {

    private final ObjectWriter writer;

    public JsonRenderer(ObjectMapper objectMapper) {
        this.writer = objectMapper.writerWithDefaultPrettyPrinter();
    }

    @Override
    public OutputFormat format() {
        return OutputFormat.JSON;
    }

    @Override
    public List<Path> render(Map<String, List<Map<String, Object>>> sections, RenderContext context) throws IOException {
        List<Path> written = new ArrayList<>();
        for (Map.Entry<String, List<Map<String, Object>>> section : sections.entrySet()) {
            Path file = context.resolve(context.baseName() + "-" + section.getKey() + ".json");
            Files.writeString(file, writer.writeValueAsString(section.getValue()), StandardCharsets.UTF_8);
            written.add(file);
        }
        return written;
    }
}
