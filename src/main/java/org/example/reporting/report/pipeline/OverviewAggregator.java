package org.example.reporting.report.pipeline;

import org.example.reporting.report.model.OverviewRow;
import org.example.reporting.report.model.Rows;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Summary metrics over the filtered rows: distinct builds, totals and per-status counts.
 */
public class OverviewAggregator {

    static final String UNKNOWN_STATUS = "unknown";

    public List<OverviewRow> aggregate(List<Map<String, Object>> builds, List<Map<String, Object>> tests,
                                       List<Map<String, Object>> sessions) {
        Set<String> buildIds = new LinkedHashSet<>();
        collectIds(builds, "build_id", buildIds);
        collectIds(tests, "source_build_id", buildIds);
        collectIds(sessions, "build_id", buildIds);

        List<OverviewRow> rows = new ArrayList<>();
        rows.add(new OverviewRow("total_builds", buildIds.size()));
        rows.add(new OverviewRow("total_tests", tests.size()));
        rows.add(new OverviewRow("total_sessions", sessions.size()));
        countByStatus(tests, "test_status").forEach((status, count) ->
                rows.add(new OverviewRow("tests_" + status, count)));
        countByStatus(sessions, "session_status").forEach((status, count) ->
                rows.add(new OverviewRow("sessions_" + status, count)));
        return rows;
    }

    private static void collectIds(List<Map<String, Object>> rows, String field, Set<String> ids) {
        for (Map<String, Object> row : rows) {
            String id = Rows.text(row.get(field)).trim();
            if (!id.isEmpty()) {
                ids.add(id);
            }
        }
    }

    private static Map<String, Long> countByStatus(List<Map<String, Object>> rows, String field) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            String status = Rows.text(row.get(field)).trim();
            counts.merge(status.isEmpty() ? UNKNOWN_STATUS : status, 1L, Long::sum);
        }
        return counts;
    }
}
