package org.example.reporting.report.pipeline;

import org.example.reporting.report.model.OverviewRow;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OverviewAggregatorTest {

    private final OverviewAggregator aggregator = new OverviewAggregator();

    @Test
    void aggregate_CountsDistinctBuildsAcrossSources() {
        List<Map<String, Object>> builds = List.of(Map.of("build_id", "b1"), Map.of("build_id", "b2"));
        List<Map<String, Object>> tests = List.of(
                Map.of("source_build_id", "b1", "test_status", "passed"),
                Map.of("source_build_id", "b3", "test_status", "failed"),
                Map.of("source_build_id", "b1", "test_status", "passed"));
        List<Map<String, Object>> sessions = List.of(
                Map.of("build_id", "aa1", "session_status", "done"),
                Map.of("build_id", " ", "session_status", ""));

        List<OverviewRow> overview = aggregator.aggregate(builds, tests, sessions);

        assertEquals(List.of(
                new OverviewRow("total_builds", 4),
                new OverviewRow("total_tests", 3),
                new OverviewRow("total_sessions", 2),
                new OverviewRow("tests_passed", 2),
                new OverviewRow("tests_failed", 1),
                new OverviewRow("sessions_done", 1),
                new OverviewRow("sessions_unknown", 1)), overview);
    }

    @Test
    void aggregate_NoRows_OnlyTotals() {
        List<OverviewRow> overview = aggregator.aggregate(List.of(), List.of(), List.of());

        assertEquals(3, overview.size());
        assertTrue(overview.stream().allMatch(row -> row.getValue() == 0));
    }
}
