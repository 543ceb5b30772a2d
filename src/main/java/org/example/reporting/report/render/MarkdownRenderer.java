package org.example.reporting.report.render;

import org.example.reporting.config.OutputFormat;
import org.example.reporting.report.model.Rows;
import org.example.reporting.report.model.Section;
import org.example.reporting.utils.Timestamps;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * All sections as Markdown tables in a single {@code <base>.md}.
 */
public class MarkdownRenderer implements ReportRenderer {

    static final String NO_ROWS = "_No rows_";

    @Override
    public OutputFormat format() {
        return OutputFormat.MD;
    }

    @Override
    public List<Path> render(Map<String, List<Map<String, Object>>> sections, RenderContext context) throws IOException {
        Path file = context.resolve(context.baseName() + ".md");
        Files.writeString(file, toDocument(sections, context), StandardCharsets.UTF_8);
        return List.of(file);
    }

    String toDocument(Map<String, List<Map<String, Object>>> sections, RenderContext context) {
        List<String> lines = new ArrayList<>();
        lines.add("# BrowserStack Report");
        lines.add("");
        lines.add("Generated at: " + Timestamps.format(context.generatedAt()));
        lines.add("");
        sections.forEach((sectionId, rows) -> {
            lines.add("## " + Section.labelFor(sectionId));
            lines.add("");
            lines.add(toTable(rows, context.markdownMaxRows()));
            lines.add("");
        });
        return String.join("\n", lines);
    }

    public String toTable(List<Map<String, Object>> rows, int maxRows) {
        if (rows.isEmpty()) {
            return NO_ROWS;
        }
        List<String> headers = ReportRenderer.headers(rows);
        List<Map<String, Object>> visible = maxRows > 0 && rows.size() > maxRows ? rows.subList(0, maxRows) : rows;

        StringBuilder table = new StringBuilder();
        table.append("| ").append(String.join(" | ", headers)).append(" |\n");
        table.append("| ").append(headers.stream().map(h -> "---").collect(Collectors.joining(" | "))).append(" |");
        for (Map<String, Object> row : visible) {
            table.append("\n| ")
                    .append(headers.stream().map(h -> cell(row.get(h))).collect(Collectors.joining(" | ")))
                    .append(" |");
        }
        if (visible.size() < rows.size()) {
            table.append("\n\n_Showing ").append(maxRows).append(" of ").append(rows.size())
                    .append(" rows. See CSV/XLSX for full data._");
        }
        return table.toString();
    }

    static String cell(Object value) {
        return Rows.text(value)
                .replaceAll("\\r?\\n", " <br> ")
                .replace("|", "\\|");
    }
}
