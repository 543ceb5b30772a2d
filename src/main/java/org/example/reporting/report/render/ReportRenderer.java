package org.example.reporting.report.render;

import org.example.reporting.config.OutputFormat;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Serialises the final sections. {@code sections} is ordered; every renderer keeps that order
 * for files, sheets and tables as well as for the rows inside them.
 */
public interface ReportRenderer {

    OutputFormat format();

    /**
     * @return the files written
     */
    List<Path> render(Map<String, List<Map<String, Object>>> sections, RenderContext context) throws IOException;

    /** Column names of a section: the keys of its first row. */
    static List<String> headers(List<Map<String, Object>> rows) {
        return rows.isEmpty() ? List.of() : List.copyOf(rows.get(0).keySet());
    }
}
