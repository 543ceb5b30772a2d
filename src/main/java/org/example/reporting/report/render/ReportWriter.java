package org.example.reporting.report.render;

import lombok.extern.slf4j.Slf4j;
import org.example.reporting.config.OutputFormat;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Creates the output directory once and runs the renderer of every requested format.
 */
@Slf4j
public class ReportWriter {

    private final Map<OutputFormat, ReportRenderer> renderers = new EnumMap<>(OutputFormat.class);

    public ReportWriter(List<ReportRenderer> renderers) {
        renderers.forEach(renderer -> this.renderers.put(renderer.format(), renderer));
    }

    public List<Path> write(Map<String, List<Map<String, Object>>> sections, List<OutputFormat> formats,
                            RenderContext context) {
        List<Path> written = new ArrayList<>();
        try {
            Files.createDirectories(context.directory());
            for (OutputFormat format : formats) {
                ReportRenderer renderer = renderers.get(format);
                if (renderer == null) {
                    log.warn("No renderer registered for format {}", format.id());
                    continue;
                }
                List<Path> files = renderer.render(sections, context);
                log.debug("{} output: {}", format.id(), files);
                written.addAll(files);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write report to " + context.directory(), e);
        }
        return written;
    }
}
