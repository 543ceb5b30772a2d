package org.example.reporting.integration.testreporting;

import com.fasterxml.jackson.databind.JsonNode;
import org.example.reporting.integration.http.ApiClient;
import org.example.reporting.integration.http.CursorPaginator;
import org.example.reporting.integration.http.PageCeiling;
import org.example.reporting.integration.model.BuildDetails;
import org.example.reporting.integration.model.TestRunsPage;

import java.util.Map;

/**
 * Endpoints of the BrowserStack Test Reporting API ({@code /ext/v1}).
 */
public class TestReportingClient {

    private static final String API_BASE = "/ext/v1";

    private final ApiClient apiClient;
    private final CursorPaginator paginator;
    private final String baseUrl;

    public TestReportingClient(ApiClient apiClient, String baseUrl) {
        this.apiClient = apiClient;
        this.paginator = new CursorPaginator(apiClient);
        this.baseUrl = baseUrl;
    }

    public BuildDetails getBuildDetails(String buildId) {
        BuildDetails details = apiClient.get(baseUrl + API_BASE + "/builds/{buildId}",
                Map.of(), Map.of("buildId", buildId), BuildDetails.class);
        return details != null ? details : new BuildDetails();
    }

    public Iterable<JsonNode> testRunPages(String buildId, Map<String, String> query) {
        return paginator.pages(baseUrl + API_BASE + "/builds/{buildId}/testRuns",
                query, Map.of("buildId", buildId), PageCeiling.TEST_RUNS);
    }

    public TestRunsPage toTestRunsPage(JsonNode page) {
        TestRunsPage testRuns = apiClient.bind(page, TestRunsPage.class);
        return testRuns != null ? testRuns : new TestRunsPage();
    }

    public Iterable<JsonNode> projectPages() {
        return paginator.pages(baseUrl + API_BASE + "/projects", Map.of(), PageCeiling.PROJECT_LISTING);
    }

    public Iterable<JsonNode> projectBuildPages(long projectId, Map<String, String> query) {
        return paginator.pages(baseUrl + API_BASE + "/projects/{projectId}/builds",
                query, Map.of("projectId", String.valueOf(projectId)), PageCeiling.BUILD_LISTING);
    }
}
