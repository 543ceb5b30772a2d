package org.example.reporting.report.pipeline;

import org.example.reporting.config.ReportConfig;
import org.example.reporting.config.ReportConfigResolver;
import org.example.reporting.report.model.Rows;
import org.example.reporting.utils.Timestamps;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Keyword and time-window filter over generic rows. Order of the surviving rows is preserved.
 */
public class RowFilter {

    private final Clock clock;

    public RowFilter(Clock clock) {
        this.clock = clock;
    }

    public List<Map<String, Object>> apply(List<Map<String, Object>> rows, SectionProfile profile,
                                           ReportConfig.Filters filters) {
        boolean caseSensitive = Boolean.TRUE.equals(filters.getCaseSensitive());
        List<String> projects = normalizeTerms(filters.getProjects());
        List<String> teams = normalizeTerms(filters.getTeams());
        List<String> people = normalizeTerms(filters.getPeople());
        Double days = profile.daysApply(Boolean.TRUE.equals(filters.getApplyDaysToApps())) ? filters.getDays() : null;
        Optional<Instant> cutoff = cutoff(days);

        List<Map<String, Object>> result = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            if (matchesAnyTerm(compositeText(row, profile.projectFields()), projects, caseSensitive)
                    && matchesAnyTerm(compositeText(row, profile.teamFields()), teams, caseSensitive)
                    && matchesAnyTerm(compositeText(row, profile.personFields()), people, caseSensitive)
                    && withinWindow(row, profile.dateFields(), cutoff)) {
                result.add(row);
            }
        }
        return result;
    }

    Optional<Instant> cutoff(Double days) {
        if (days == null || days <= 0) {
            return Optional.empty();
        }
        return Optional.of(clock.instant().minus(Duration.ofMillis(Math.round(days * 24 * 60 * 60 * 1000))));
    }

    /**
     * Trimmed keywords without empty or template placeholder entries.
     */
    static List<String> normalizeTerms(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(value -> !ReportConfigResolver.isPlaceholder(value))
                .collect(Collectors.toList());
    }

    static String compositeText(Map<String, Object> row, List<String> fields) {
        return fields.stream()
                .map(field -> Rows.text(row.get(field)).trim())
                .filter(value -> !value.isEmpty())
                .collect(Collectors.joining(", "));
    }

    static boolean matchesAnyTerm(String text, List<String> terms, boolean caseSensitive) {
        if (terms.isEmpty()) {
            return true;
        }
        if (caseSensitive) {
            return terms.stream().anyMatch(text::contains);
        }
        String haystack = text.toLowerCase(Locale.ROOT);
        return terms.stream().anyMatch(term -> haystack.contains(term.toLowerCase(Locale.ROOT)));
    }

    /**
     * Rows without any parseable timestamp always pass.
     */
    static boolean withinWindow(Map<String, Object> row, List<String> dateFields, Optional<Instant> cutoff) {
        if (cutoff.isEmpty()) {
            return true;
        }
        List<Instant> timestamps = new ArrayList<>();
        for (String field : dateFields) {
            Timestamps.parse(row.get(field)).ifPresent(timestamps::add);
        }
        return timestamps.isEmpty() || timestamps.stream().anyMatch(t -> !t.isBefore(cutoff.get()));
    }
}
