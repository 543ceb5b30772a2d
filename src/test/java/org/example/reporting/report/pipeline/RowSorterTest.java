package org.example.reporting.report.pipeline;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RowSorterTest {

    private final RowSorter sorter = new RowSorter();

    @Test
    void sort_NewestFirst_MissingTimestampsLast() {
        Map<String, Object> older = Map.of("build_name", "older", "finished_at", "2026-10-01T00:00:00Z");
        Map<String, Object> newer = Map.of("build_name", "newer", "finished_at", "2026-10-10T00:00:00Z");
        Map<String, Object> undated = Map.of("build_name", "undated");

        List<Map<String, Object>> sorted = sorter.sort(List.of(undated, older, newer), SectionProfile.BUILDS);

        assertEquals(List.of(newer, older, undated), sorted);
    }

    @Test
    void sort_UsesLatestOfAllSortFields() {
        Map<String, Object> restarted = Map.of("id", 1,
                "session_created_at", "2026-10-01T00:00:00Z", "session_finished_at", "2026-10-12T00:00:00Z");
        Map<String, Object> created = Map.of("id", 2, "session_created_at", "2026-10-11T00:00:00Z");

        assertEquals(List.of(restarted, created), sorter.sort(List.of(created, restarted), SectionProfile.SESSIONS));
    }

    @Test
    void sort_EqualKeys_KeepFetchOrder() {
        Map<String, Object> first = Map.of("app_name", "first", "uploaded_at", "2026-10-01T00:00:00Z");
        Map<String, Object> second = Map.of("app_name", "second", "uploaded_at", "2026-10-01T00:00:00Z");
        Map<String, Object> third = Map.of("app_name", "third");
        Map<String, Object> fourth = Map.of("app_name", "fourth");

        assertEquals(List.of(first, second, third, fourth),
                sorter.sort(List.of(third, first, fourth, second), SectionProfile.APPS));
    }

    @Test
    void sort_DoesNotTouchInput() {
        List<Map<String, Object>> input = List.of(Map.of("uploaded_at", "2026-01-01T00:00:00Z"),
                Map.of("uploaded_at", "2026-02-01T00:00:00Z"));

        sorter.sort(input, SectionProfile.APPS);

        assertEquals("2026-01-01T00:00:00Z", input.get(0).get("uploaded_at"));
    }
}
