package org.example.reporting.config;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Merges a partial configuration document with the defaults and validates the result.
 * Resolution never mutates its input; resolving an already resolved config yields an equal config.
 */
@Component
public class ReportConfigResolver {

    public static final String DEFAULT_USERNAME_ENV = "BROWSERSTACK_USERNAME";
    public static final String DEFAULT_ACCESS_KEY_ENV = "BROWSERSTACK_ACCESS_KEY";
    public static final int DEFAULT_MAX_BUILDS_PER_SOURCE = 20;
    public static final double DEFAULT_DISCOVERY_DAYS = 7;
    public static final int DEFAULT_SESSION_LIMIT = 25;
    public static final int DEFAULT_APP_LIST_LIMIT = 10;
    public static final String DEFAULT_OUTPUT_DIRECTORY = "reports/browserstack-report";
    public static final String DEFAULT_BASE_NAME = "browserstack-report";
    public static final List<OutputFormat> DEFAULT_FORMATS =
            List.of(OutputFormat.CSV, OutputFormat.XLSX, OutputFormat.MD, OutputFormat.JSON);

    private static final List<String> PLACEHOLDER_MARKERS = List.of("replace-with", "optional-", "your-");
    private static final List<String> COLUMN_SECTIONS = List.of("overview", "builds", "tests", "sessions", "apps");

    public ReportConfig resolve(ReportConfig raw) {
        ReportConfig in = raw != null ? raw : new ReportConfig();

        ReportConfig.Credentials credentials = orEmpty(in.getCredentials(), ReportConfig.Credentials::new);
        ReportConfig.Inputs inputs = orEmpty(in.getInputs(), ReportConfig.Inputs::new);
        ReportConfig.Discovery discovery = orEmpty(inputs.getDiscoverRecentBuilds(), ReportConfig.Discovery::new);
        ReportConfig.TestReporting testReporting = orEmpty(in.getTestReporting(), ReportConfig.TestReporting::new);
        ReportConfig.AppAutomate appAutomate = orEmpty(in.getAppAutomate(), ReportConfig.AppAutomate::new);
        ReportConfig.Outputs outputs = orEmpty(in.getOutputs(), ReportConfig.Outputs::new);
        ReportConfig.Filters filters = orEmpty(in.getFilters(), ReportConfig.Filters::new);
        ReportConfig.Columns columns = orEmpty(in.getColumns(), ReportConfig.Columns::new);

        return ReportConfig.builder()
                .credentials(ReportConfig.Credentials.builder()
                        .usernameEnv(orDefault(credentials.getUsernameEnv(), DEFAULT_USERNAME_ENV))
                        .accessKeyEnv(orDefault(credentials.getAccessKeyEnv(), DEFAULT_ACCESS_KEY_ENV))
                        .build())
                .inputs(ReportConfig.Inputs.builder()
                        .testReportingBuildIds(copy(inputs.getTestReportingBuildIds()))
                        .appAutomateBuildIds(copy(inputs.getAppAutomateBuildIds()))
                        .appCustomIds(copy(inputs.getAppCustomIds()))
                        .discoverRecentBuilds(ReportConfig.Discovery.builder()
                                .enabled(orDefault(discovery.getEnabled(), Boolean.TRUE))
                                .maxBuildsPerSource(orDefault(discovery.getMaxBuildsPerSource(), DEFAULT_MAX_BUILDS_PER_SOURCE))
                                .testReportingProjectIds(copy(discovery.getTestReportingProjectIds()))
                                .days(orDefault(discovery.getDays(), DEFAULT_DISCOVERY_DAYS))
                                .build())
                        .build())
                .testReporting(ReportConfig.TestReporting.builder()
                        .enabled(orDefault(testReporting.getEnabled(), Boolean.TRUE))
                        .fetchAllPages(orDefault(testReporting.getFetchAllPages(), Boolean.TRUE))
                        .includeHooks(orDefault(testReporting.getIncludeHooks(), Boolean.FALSE))
                        .testRunQuery(copy(testReporting.getTestRunQuery()))
                        .build())
                .appAutomate(ReportConfig.AppAutomate.builder()
                        .enabled(orDefault(appAutomate.getEnabled(), Boolean.TRUE))
                        .sessionLimit(orDefault(appAutomate.getSessionLimit(), DEFAULT_SESSION_LIMIT))
                        .includeSessionDetails(orDefault(appAutomate.getIncludeSessionDetails(), Boolean.TRUE))
                        .sessionStatusFilter(orDefault(appAutomate.getSessionStatusFilter(), ""))
                        .appListLimit(orDefault(appAutomate.getAppListLimit(), DEFAULT_APP_LIST_LIMIT))
                        .build())
                .outputs(ReportConfig.Outputs.builder()
                        .directory(orDefault(outputs.getDirectory(), DEFAULT_OUTPUT_DIRECTORY))
                        .baseName(orDefault(outputs.getBaseName(), DEFAULT_BASE_NAME))
                        .formats(outputs.getFormats() != null ? distinct(outputs.getFormats()) : DEFAULT_FORMATS)
                        .markdownMaxRows(orDefault(outputs.getMarkdownMaxRows(), 0))
                        .build())
                .filters(ReportConfig.Filters.builder()
                        .days(filters.getDays())
                        .projects(copy(filters.getProjects()))
                        .teams(copy(filters.getTeams()))
                        .people(copy(filters.getPeople()))
                        .caseSensitive(orDefault(filters.getCaseSensitive(), Boolean.FALSE))
                        .applyDaysToApps(orDefault(filters.getApplyDaysToApps(), Boolean.FALSE))
                        .build())
                .columns(ReportConfig.Columns.builder()
                        .overview(copy(columns.getOverview()))
                        .builds(copy(columns.getBuilds()))
                        .tests(copy(columns.getTests()))
                        .sessions(copy(columns.getSessions()))
                        .apps(copy(columns.getApps()))
                        .build())
                .build();
    }

    /**
     * Validates a resolved config and throws a {@link ConfigurationException} listing all violations.
     */
    public void validate(ReportConfig config) {
        List<String> errors = new ArrayList<>();
        boolean canDiscover = Boolean.TRUE.equals(config.getInputs().getDiscoverRecentBuilds().getEnabled());

        if (Boolean.TRUE.equals(config.getTestReporting().getEnabled())) {
            List<String> ids = config.getInputs().getTestReportingBuildIds();
            if (ids.isEmpty() && !canDiscover) {
                errors.add("testReporting.enabled is true but inputs.testReportingBuildIds is empty.");
            }
            List<String> invalid = placeholders(ids);
            if (!invalid.isEmpty()) {
                errors.add("testReportingBuildIds contains placeholder values: " + String.join(", ", invalid));
            }
        }

        if (Boolean.TRUE.equals(config.getAppAutomate().getEnabled())) {
            List<String> ids = config.getInputs().getAppAutomateBuildIds();
            if (ids.isEmpty() && !canDiscover) {
                errors.add("appAutomate.enabled is true but inputs.appAutomateBuildIds is empty.");
            }
            List<String> invalid = placeholders(ids);
            if (!invalid.isEmpty()) {
                errors.add("appAutomateBuildIds contains placeholder values: " + String.join(", ", invalid));
            }
            List<String> invalidCustomIds = placeholders(config.getInputs().getAppCustomIds());
            if (!invalidCustomIds.isEmpty()) {
                errors.add("appCustomIds contains placeholder values: " + String.join(", ", invalidCustomIds));
            }
        }

        if (config.getInputs().getDiscoverRecentBuilds().getTestReportingProjectIds().stream().anyMatch(Objects::isNull)) {
            errors.add("inputs.discoverRecentBuilds.testReportingProjectIds contains null entries.");
        }
        if (config.getOutputs().getFormats().stream().anyMatch(Objects::isNull)) {
            errors.add("outputs.formats contains null entries.");
        }
        for (String section : COLUMN_SECTIONS) {
            List<ColumnSpec> specs = config.getColumns().forSection(section);
            for (int i = 0; i < specs.size(); i++) {
                ColumnSpec spec = specs.get(i);
                if (spec == null || spec.getKey() == null || spec.getKey().isBlank()) {
                    errors.add("columns." + section + "[" + i + "] has no key.");
                }
            }
        }

        Double days = config.getFilters().getDays();
        if (days != null && (days.isNaN() || days.isInfinite() || days <= 0)) {
            errors.add("Invalid filters.days. Use a positive number or null.");
        }
        Double discoveryDays = config.getInputs().getDiscoverRecentBuilds().getDays();
        if (discoveryDays.isNaN() || discoveryDays.isInfinite() || discoveryDays <= 0) {
            errors.add("Invalid inputs.discoverRecentBuilds.days. Use a positive number.");
        }

        if (!errors.isEmpty()) {
            throw new ConfigurationException(errors);
        }
    }

    /**
     * Empty values and values carrying template markers ("replace-with", "optional-", "your-") are placeholders.
     */
    public static boolean isPlaceholder(String value) {
        if (value == null) {
            return true;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            return true;
        }
        return PLACEHOLDER_MARKERS.stream().anyMatch(normalized::contains);
    }

    private static List<String> placeholders(List<String> values) {
        List<String> invalid = new ArrayList<>();
        for (String value : values) {
            if (isPlaceholder(value)) {
                invalid.add(value == null ? "<null>" : "\"" + value + "\"");
            }
        }
        return invalid;
    }

    private static <T> T orEmpty(T value, Supplier<T> empty) {
        return value != null ? value : empty.get();
    }

    private static <T> T orDefault(T value, T fallback) {
        return value != null ? value : fallback;
    }

    private static <T> List<T> copy(List<T> values) {
        return values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
    }

    private static <T> List<T> distinct(List<T> values) {
        return Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(values)));
    }

    private static Map<String, String> copy(Map<String, String> values) {
        return values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
