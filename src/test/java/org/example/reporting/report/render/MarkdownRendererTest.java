package org.example.reporting.report.render;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MarkdownRendererTest {

    private final MarkdownRenderer renderer = new MarkdownRenderer();

    private static Map<String, Object> row(String name, Object status) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("name", name);
        row.put("status", status);
        return row;
    }

    @Test
    void toTable_EscapesPipesAndLineBreaks() {
        String table = renderer.toTable(List.of(row("a|b", "line1\r\nline2")), 0);

        assertEquals("| name | status |\n| --- | --- |\n| a\\|b | line1 <br> line2 |", table);
    }

    @Test
    void toTable_TruncatesAndPointsToFullData() {
        List<Map<String, Object>> rows = List.of(row("one", 1), row("two", 2), row("three", 3));

        String table = renderer.toTable(rows, 2);

        assertTrue(table.contains("| two | 2 |"));
        assertFalse(table.contains("three"));
        assertTrue(table.endsWith("\n\n_Showing 2 of 3 rows. See CSV/XLSX for full data._"));
    }

    @Test
    void toTable_Empty_IsPlaceholder() {
        assertEquals("_No rows_", renderer.toTable(List.of(), 10));
    }

    @Test
    void render_SingleDocumentWithSectionLabels(@TempDir Path dir) throws Exception {
        Map<String, List<Map<String, Object>>> sections = new LinkedHashMap<>();
        sections.put("overview", List.of(row("total_tests", 4)));
        sections.put("sessions", List.of());
        RenderContext context = new RenderContext(dir, "weekly", 0, Instant.parse("2026-10-18T12:00:00Z"));

        List<Path> files = renderer.render(sections, context);

        assertEquals(List.of(dir.resolve("weekly.md")), files);
        assertEquals(String.join("\n",
                "# BrowserStack Report",
                "",
                "Generated at: 2026-10-18T12:00:00.000Z",
                "",
                "## Overview",
                "",
                "| name | status |",
                "| --- | --- |",
                "| total_tests | 4 |",
                "",
                "## App Automate Sessions",
                "",
                "_No rows_",
                ""), Files.readString(files.get(0)));
    }
}
