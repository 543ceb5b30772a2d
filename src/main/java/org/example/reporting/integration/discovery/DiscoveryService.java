package org.example.reporting.integration.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.example.reporting.config.ReportConfig;
import org.example.reporting.integration.appautomate.AppAutomateClient;
import org.example.reporting.integration.http.JsonPayloads;
import org.example.reporting.integration.http.TransportException;
import org.example.reporting.integration.testreporting.TestReportingClient;
import org.example.reporting.utils.Timestamps;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Fills in missing build IDs from the most recent builds of each enabled source.
 * <p>
 * Discovery is best effort: a failed request ends the traversal it belongs to and is
 * reported as a {@link DiscoveryTransportException} in the result instead of being thrown.
 * Only a source that ends up with no IDs at all fails the run.
 */
@Slf4j
public class DiscoveryService {

    static final String TEST_REPORTING = "test-reporting";
    static final String APP_AUTOMATE = "app-automate";

    private static final List<String> APP_AUTOMATE_TIME_FIELDS = List.of("started_at", "created_at", "uploaded_at");

    private final TestReportingClient testReportingClient;
    private final AppAutomateClient appAutomateClient;
    private final Clock clock;

    public DiscoveryService(TestReportingClient testReportingClient, AppAutomateClient appAutomateClient, Clock clock) {
        this.testReportingClient = testReportingClient;
        this.appAutomateClient = appAutomateClient;
        this.clock = clock;
    }

    public record Resolution(ReportConfig config, List<DiscoveryTransportException> failures) {

        public List<String> warnings() {
            return failures.stream().map(Throwable::getMessage).toList();
        }
    }

    /**
     * Returns a copy of {@code config} whose build ID lists are filled for every enabled source.
     *
     * @throws DiscoveryExhaustedException if an enabled source still has no build IDs
     */
    public Resolution resolveBuildInputs(ReportConfig config) {
        ReportConfig.Inputs inputs = config.getInputs();
        ReportConfig.Discovery discovery = inputs.getDiscoverRecentBuilds();
        if (!Boolean.TRUE.equals(discovery.getEnabled())) {
            return new Resolution(config, List.of());
        }

        boolean testReportingEnabled = Boolean.TRUE.equals(config.getTestReporting().getEnabled());
        boolean appAutomateEnabled = Boolean.TRUE.equals(config.getAppAutomate().getEnabled());
        List<DiscoveryTransportException> failures = new ArrayList<>();

        List<String> testReportingBuildIds = inputs.getTestReportingBuildIds();
        if (testReportingEnabled && testReportingBuildIds.isEmpty()) {
            testReportingBuildIds = discoverTestReportingBuildIds(discovery, failures);
        }
        List<String> appAutomateBuildIds = inputs.getAppAutomateBuildIds();
        if (appAutomateEnabled && appAutomateBuildIds.isEmpty()) {
            appAutomateBuildIds = discoverAppAutomateBuildIds(discovery, failures);
        }

        if (testReportingEnabled && testReportingBuildIds.isEmpty()) {
            throw new DiscoveryExhaustedException(TEST_REPORTING, String.join("\n",
                    "No Test Reporting build IDs available.",
                    "Could not discover builds using GET /ext/v1/projects/{project_id}/builds.",
                    "Set inputs.discoverRecentBuilds.testReportingProjectIds (one or more project IDs),",
                    "or set inputs.testReportingBuildIds manually, or disable testReporting."));
        }
        if (appAutomateEnabled && appAutomateBuildIds.isEmpty()) {
            throw new DiscoveryExhaustedException(APP_AUTOMATE,
                    "No App Automate builds found. Add inputs.appAutomateBuildIds manually, "
                            + "increase inputs.discoverRecentBuilds.maxBuildsPerSource, or disable appAutomate.");
        }

        ReportConfig resolved = config.toBuilder()
                .inputs(inputs.toBuilder()
                        .testReportingBuildIds(testReportingBuildIds)
                        .appAutomateBuildIds(appAutomateBuildIds)
                        .build())
                .build();
        return new Resolution(resolved, Collections.unmodifiableList(failures));
    }

    List<Long> discoverProjectIds(List<DiscoveryTransportException> failures) {
        Set<Long> projectIds = new LinkedHashSet<>();
        int pageCount = 0;
        try {
            for (JsonNode page : testReportingClient.projectPages()) {
                pageCount++;
                for (JsonNode project : JsonPayloads.records(page)) {
                    numericId(project).ifPresent(projectIds::add);
                }
                log.info("Discovering Test Reporting projects: page={} projects_so_far={}", pageCount, projectIds.size());
            }
        } catch (TransportException e) {
            failures.add(warn("Project discovery", e));
        }
        log.info("Discovered {} Test Reporting project(s)", projectIds.size());
        return new ArrayList<>(projectIds);
    }

    List<String> discoverTestReportingBuildIds(ReportConfig.Discovery discovery,
                                               List<DiscoveryTransportException> failures) {
        int maxBuilds = Math.max(1, discovery.getMaxBuildsPerSource());
        Instant now = clock.instant();
        Instant from = now.minus(daysToDuration(discovery.getDays()));

        List<Long> projectIds = new ArrayList<>(new LinkedHashSet<>(discovery.getTestReportingProjectIds()));
        if (projectIds.isEmpty()) {
            projectIds = discoverProjectIds(failures);
        }
        if (projectIds.isEmpty()) {
            return List.of();
        }

        Map<String, String> query = new LinkedHashMap<>();
        query.put("date_range", from.toEpochMilli() + "," + now.toEpochMilli());
        query.put("limit", String.valueOf(maxBuilds));

        Set<String> buildIds = new LinkedHashSet<>();
        for (Long projectId : projectIds) {
            int collectedForProject = 0;
            int pageCount = 0;
            try {
                for (JsonNode page : testReportingClient.projectBuildPages(projectId, query)) {
                    pageCount++;
                    for (JsonNode build : JsonPayloads.records(page)) {
                        String id = JsonPayloads.firstText(build, "build_id", "build_uuid", "id").trim();
                        if (!id.isEmpty()) {
                            buildIds.add(id);
                            collectedForProject++;
                        }
                    }
                    log.debug("Project {} build pages: page={} builds_in_project={}",
                            projectId, pageCount, collectedForProject);
                    if (collectedForProject >= maxBuilds) {
                        break;
                    }
                }
            } catch (TransportException e) {
                failures.add(warn("Build discovery for project " + projectId, e));
            }
            log.info("Discovering Test Reporting builds: project={} builds={} pages={}",
                    projectId, collectedForProject, pageCount);
        }
        log.info("Discovered {} Test Reporting build(s)", buildIds.size());
        return new ArrayList<>(buildIds);
    }

    List<String> discoverAppAutomateBuildIds(ReportConfig.Discovery discovery,
                                             List<DiscoveryTransportException> failures) {
        int maxBuilds = Math.max(1, discovery.getMaxBuildsPerSource());
        JsonNode payload;
        try {
            payload = appAutomateClient.listBuilds(maxBuilds, 0);
        } catch (TransportException e) {
            failures.add(warn("App Automate build discovery", e));
            return List.of();
        }

        Instant cutoff = clock.instant().minus(daysToDuration(discovery.getDays()));
        Set<String> buildIds = new LinkedHashSet<>();
        List<JsonNode> records = JsonPayloads.records(payload);
        for (JsonNode record : records) {
            JsonNode build = record.path("automation_build").isObject() ? record.get("automation_build") : record;
            if (!isRecent(build, cutoff)) {
                continue;
            }
            String id = JsonPayloads.firstText(build, "hashed_id", "id", "build_id", "uuid").trim();
            if (!id.isEmpty()) {
                buildIds.add(id);
            }
        }
        log.info("Discovering App Automate builds: records={} builds={}", records.size(), buildIds.size());
        return new ArrayList<>(buildIds);
    }

    /**
     * Builds without any parseable timestamp count as recent.
     */
    static boolean isRecent(JsonNode build, Instant cutoff) {
        List<Instant> timestamps = new ArrayList<>();
        for (String field : APP_AUTOMATE_TIME_FIELDS) {
            Timestamps.parse(JsonPayloads.text(build.get(field))).ifPresent(timestamps::add);
        }
        return timestamps.isEmpty() || timestamps.stream().anyMatch(t -> !t.isBefore(cutoff));
    }

    static Duration daysToDuration(double days) {
        return Duration.ofMillis(Math.round(days * 24 * 60 * 60 * 1000));
    }

    private static Optional<Long> numericId(JsonNode project) {
        JsonNode id = project.hasNonNull("id") ? project.get("id") : project.get("project_id");
        if (id == null || id.isNull()) {
            return Optional.empty();
        }
        if (id.isIntegralNumber()) {
            return Optional.of(id.asLong());
        }
        try {
            return Optional.of(Long.parseLong(id.asText().trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static DiscoveryTransportException warn(String step, TransportException cause) {
        log.warn("{} failed with status {} for {}, continuing with what was found",
                step, cause.getStatusCode(), cause.getUrl());
        return new DiscoveryTransportException(step, cause);
    }
}
