package org.example.reporting.integration.testreporting;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.example.reporting.config.ReportConfig;
import org.example.reporting.integration.model.BuildDetails;
import org.example.reporting.integration.model.TestRunsPage;
import org.example.reporting.report.model.BuildRow;
import org.example.reporting.report.model.TestRow;
import org.example.reporting.utils.Timestamps;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Fetches build details and the flattened test runs for every configured Test Reporting build.
 * Requests are issued strictly one after another.
 */
@Slf4j
public class TestReportingService {

    private final TestReportingClient client;
    private final HierarchyFlattener flattener;

    public TestReportingService(TestReportingClient client, HierarchyFlattener flattener) {
        this.client = client;
        this.flattener = flattener;
    }

    public record Result(List<BuildRow> builds, List<TestRow> tests) {
    }

    public Result fetch(ReportConfig config) {
        List<String> buildIds = config.getInputs().getTestReportingBuildIds();
        if (!Boolean.TRUE.equals(config.getTestReporting().getEnabled()) || buildIds.isEmpty()) {
            return new Result(List.of(), List.of());
        }

        boolean fetchAllPages = Boolean.TRUE.equals(config.getTestReporting().getFetchAllPages());
        boolean includeHooks = Boolean.TRUE.equals(config.getTestReporting().getIncludeHooks());
        Map<String, String> testRunQuery = config.getTestReporting().getTestRunQuery();

        List<BuildRow> builds = new ArrayList<>();
        List<TestRow> tests = new ArrayList<>();
        int index = 0;
        for (String buildId : buildIds) {
            index++;
            BuildDetails details = client.getBuildDetails(buildId);
            BuildRow buildRow = toBuildRow(buildId, details);
            builds.add(buildRow);
            log.info("Fetched Test Reporting build {}/{}: id={}, name={}",
                    index, buildIds.size(), buildId, buildRow.getBuildName());

            int pageCount = 0;
            int testsForBuild = 0;
            for (JsonNode page : client.testRunPages(buildId, testRunQuery)) {
                pageCount++;
                TestRunsPage testRuns = client.toTestRunsPage(page);
                HierarchyFlattener.BuildContext context = new HierarchyFlattener.BuildContext(
                        buildId,
                        firstNonBlank(testRuns.getBuildName(), details.getName()),
                        testRuns.getBuildNumber() != null ? testRuns.getBuildNumber() : details.getBuildNumber(),
                        buildRow.getStartedAt(),
                        buildRow.getFinishedAt());
                List<TestRow> rows = flattener.flatten(context, testRuns.getHierarchy(), includeHooks);
                tests.addAll(rows);
                testsForBuild += rows.size();
                log.debug("Test runs page {} of build {}: {} rows", pageCount, buildId, rows.size());
                if (!fetchAllPages) {
                    break;
                }
            }
            log.info("Build {}: {} test rows from {} page(s)", buildId, testsForBuild, pageCount);
        }

        log.info("Test Reporting done: {} builds, {} tests", builds.size(), tests.size());
        return new Result(builds, tests);
    }

    BuildRow toBuildRow(String buildId, BuildDetails details) {
        Map<String, Integer> stats = details.getStatusStats() != null ? details.getStatusStats() : Map.of();
        Map<String, Integer> smartTags = details.getSmartTags() != null ? details.getSmartTags() : Map.of();
        return BuildRow.builder()
                .buildId(buildId)
                .buildName(nz(details.getName()))
                .originalBuildName(nz(details.getOriginalName()))
                .buildNumber(details.getBuildNumber() != null ? details.getBuildNumber() : "")
                .buildStatus(nz(details.getStatus()))
                .durationMs(details.getDuration())
                .user(nz(details.getUser()))
                .tags(HierarchyFlattener.joinNonEmpty(details.getTags()))
                .startedAt(Timestamps.toIsoOrEmpty(details.getStartedAt()))
                .finishedAt(Timestamps.toIsoOrEmpty(details.getFinishedAt()))
                .passed(count(stats, "passed"))
                .failed(count(stats, "failed"))
                .skipped(count(stats, "skipped"))
                .pending(count(stats, "pending"))
                .unknown(count(stats, "unknown"))
                .flakyCount(count(smartTags, "is_flaky"))
                .alwaysFailingCount(count(smartTags, "is_always_failing"))
                .performanceAnomalyCount(count(smartTags, "is_performance_anomaly"))
                .newFailureCount(count(smartTags, "is_new_failure"))
                .observabilityUrl(nz(details.getObservabilityUrl()))
                .tcmTestRunIdentifier(nz(details.getTcmTestRunIdentifier()))
                .build();
    }

    private static int count(Map<String, Integer> values, String key) {
        Integer value = values.get(key);
        return value != null ? value : 0;
    }

    private static String firstNonBlank(String preferred, String fallback) {
        if (preferred != null && !preferred.isEmpty()) {
            return preferred;
        }
        return fallback != null ? fallback : "";
    }

    private static String nz(String value) {
        return value != null ? value : "";
    }
}
