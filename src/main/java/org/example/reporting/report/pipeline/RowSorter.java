package org.example.reporting.report.pipeline;

import org.example.reporting.utils.Timestamps;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Newest first by the latest timestamp among the profile's sort fields; rows without one go last.
 * {@link List#sort} is stable, so rows with equal keys keep their fetch order.
 */
public class RowSorter {

    private static final long NO_TIMESTAMP = Long.MIN_VALUE;

    public List<Map<String, Object>> sort(List<Map<String, Object>> rows, SectionProfile profile) {
        List<Map<String, Object>> sorted = new ArrayList<>(rows);
        sorted.sort(Comparator.comparingLong((Map<String, Object> row) -> latestTimestamp(row, profile.sortFields()))
                .reversed());
        return sorted;
    }

    static long latestTimestamp(Map<String, Object> row, List<String> fields) {
        return fields.stream()
                .map(field -> Timestamps.parse(row.get(field)))
                .flatMap(Optional::stream)
                .mapToLong(Instant::toEpochMilli)
                .max()
                .orElse(NO_TIMESTAMP);
    }
}
