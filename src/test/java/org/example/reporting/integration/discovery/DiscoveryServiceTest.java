package org.example.reporting.integration.discovery;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.reporting.config.ReportConfig;
import org.example.reporting.config.ReportConfigResolver;
import org.example.reporting.integration.appautomate.AppAutomateClient;
import org.example.reporting.integration.http.ApiClient;
import org.example.reporting.integration.testreporting.TestReportingClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class DiscoveryServiceTest {

    private static final String TR_URL = "https://api-automation.browserstack.com";
    private static final String AA_URL = "https://api-cloud.browserstack.com";
    private static final Instant NOW = Instant.parse("2026-10-18T12:00:00Z");
    private static final String DATE_RANGE = "date_range="
            + NOW.minus(Duration.ofDays(7)).toEpochMilli() + "%2C" + NOW.toEpochMilli();

    private MockRestServiceServer mockServer;
    private DiscoveryService discovery;
    private final ReportConfigResolver resolver = new ReportConfigResolver();

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        mockServer = MockRestServiceServer.createServer(restTemplate);
        ApiClient apiClient = new ApiClient(restTemplate, new HttpHeaders(), new ObjectMapper());
        discovery = new DiscoveryService(new TestReportingClient(apiClient, TR_URL),
                new AppAutomateClient(apiClient, AA_URL), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private ReportConfig testReportingOnly(int maxBuilds, List<Long> projectIds) {
        return resolver.resolve(ReportConfig.builder()
                .inputs(ReportConfig.Inputs.builder()
                        .discoverRecentBuilds(ReportConfig.Discovery.builder()
                                .maxBuildsPerSource(maxBuilds)
                                .testReportingProjectIds(projectIds)
                                .build())
                        .build())
                .appAutomate(ReportConfig.AppAutomate.builder().enabled(false).build())
                .build());
    }

    private ReportConfig appAutomateOnly() {
        return resolver.resolve(ReportConfig.builder()
                .testReporting(ReportConfig.TestReporting.builder().enabled(false).build())
                .build());
    }

    private static String builds(boolean hasNext, String nextPage, String... ids) {
        StringBuilder records = new StringBuilder();
        for (String id : ids) {
            records.append(records.length() == 0 ? "" : ",").append("{\"build_id\": \"").append(id).append("\"}");
        }
        String cursor = nextPage == null ? "" : ", \"next_page\": \"" + nextPage + "\"";
        return "{\"builds\": [" + records + "], \"pagination\": {\"has_next\": " + hasNext + cursor + "}}";
    }

    @Test
    void resolveBuildInputs_ConfiguredProjects_StopsPerProjectAtCap() {
        String projectBuilds = TR_URL + "/ext/v1/projects/11/builds";
        mockServer.expect(requestTo(allOf(startsWith(projectBuilds), containsString(DATE_RANGE),
                        endsWith("&limit=3"))))
                .andRespond(withSuccess(builds(true, "c2", "b1", "b2"), MediaType.APPLICATION_JSON));
        mockServer.expect(requestTo(allOf(startsWith(projectBuilds), endsWith("&limit=3&next_page=c2"))))
                .andRespond(withSuccess(builds(true, "c3", "b3", "b4"), MediaType.APPLICATION_JSON));

        DiscoveryService.Resolution resolution = discovery.resolveBuildInputs(testReportingOnly(3, List.of(11L)));

        mockServer.verify();
        assertEquals(List.of("b1", "b2", "b3", "b4"), resolution.config().getInputs().getTestReportingBuildIds());
        assertTrue(resolution.failures().isEmpty());
    }

    @Test
    void resolveBuildInputs_DiscoversNumericProjectIdsOnce() {
        mockServer.expect(requestTo(TR_URL + "/ext/v1/projects"))
                .andRespond(withSuccess("""
                        {"projects": [{"id": 11}, {"project_id": "12"}, {"id": "not-a-number"}, {"id": 11}],
                         "pagination": {"has_next": false}}
                        """, MediaType.APPLICATION_JSON));
        mockServer.expect(requestTo(startsWith(TR_URL + "/ext/v1/projects/11/builds?")))
                .andRespond(withSuccess(builds(false, null, "b1"), MediaType.APPLICATION_JSON));
        mockServer.expect(requestTo(startsWith(TR_URL + "/ext/v1/projects/12/builds?")))
                .andRespond(withSuccess("[{\"build_uuid\": \"u2\"}, {\"id\": \"b1\"}]", MediaType.APPLICATION_JSON));

        DiscoveryService.Resolution resolution = discovery.resolveBuildInputs(testReportingOnly(20, List.of()));

        mockServer.verify();
        assertEquals(List.of("b1", "u2"), resolution.config().getInputs().getTestReportingBuildIds());
    }

    @Test
    void resolveBuildInputs_FailedProjectListing_IsWarningThenExhaustion() {
        mockServer.expect(requestTo(TR_URL + "/ext/v1/projects"))
                .andRespond(withStatus(HttpStatus.FORBIDDEN).body("forbidden"));

        DiscoveryExhaustedException e = assertThrows(DiscoveryExhaustedException.class,
                () -> discovery.resolveBuildInputs(testReportingOnly(20, List.of())));

        mockServer.verify();
        assertEquals("test-reporting", e.getSource());
        assertTrue(e.getMessage().startsWith("No Test Reporting build IDs available."));
        assertTrue(e.getMessage().contains("testReportingProjectIds"));
    }

    @Test
    void resolveBuildInputs_OneFailingProject_KeepsOtherProjectsBuilds() {
        mockServer.expect(requestTo(startsWith(TR_URL + "/ext/v1/projects/11/builds?")))
                .andRespond(withSuccess(builds(false, null, "b1", "b2"), MediaType.APPLICATION_JSON));
        mockServer.expect(requestTo(startsWith(TR_URL + "/ext/v1/projects/12/builds?")))
                .andRespond(withServerError());

        DiscoveryService.Resolution resolution = discovery.resolveBuildInputs(testReportingOnly(20, List.of(11L, 12L)));

        mockServer.verify();
        assertEquals(List.of("b1", "b2"), resolution.config().getInputs().getTestReportingBuildIds());
        assertEquals(1, resolution.failures().size());
        assertEquals(500, resolution.failures().get(0).getStatusCode());
        assertTrue(resolution.warnings().get(0).startsWith("Build discovery for project 12 stopped"));
    }

    @Test
    void resolveBuildInputs_AppAutomate_FiltersByDayWindowAndKeepsUndatedBuilds() {
        mockServer.expect(requestTo(AA_URL + "/app-automate/builds.json?limit=20&offset=0"))
                .andRespond(withSuccess("""
                        [
                          {"automation_build": {"hashed_id": "recent", "created_at": "2026-10-17T09:00:00Z"}},
                          {"automation_build": {"hashed_id": "stale", "created_at": "2026-10-08T09:00:00Z"}},
                          {"automation_build": {"hashed_id": "undated"}},
                          {"id": "plain", "started_at": "2026-10-18T08:00:00Z"},
                          {"automation_build": {"hashed_id": "recent", "created_at": "2026-10-17T09:00:00Z"}}
                        ]
                        """, MediaType.APPLICATION_JSON));

        DiscoveryService.Resolution resolution = discovery.resolveBuildInputs(appAutomateOnly());

        mockServer.verify();
        assertEquals(List.of("recent", "undated", "plain"), resolution.config().getInputs().getAppAutomateBuildIds());
    }

    @Test
    void resolveBuildInputs_AppAutomateListingFails_RaisesExhaustion() {
        mockServer.expect(requestTo(AA_URL + "/app-automate/builds.json?limit=20&offset=0"))
                .andRespond(withStatus(HttpStatus.BAD_GATEWAY));

        DiscoveryExhaustedException e = assertThrows(DiscoveryExhaustedException.class,
                () -> discovery.resolveBuildInputs(appAutomateOnly()));

        assertEquals("app-automate", e.getSource());
        assertTrue(e.getMessage().startsWith("No App Automate builds found."));
    }

    @Test
    void resolveBuildInputs_ExplicitIds_SkipDiscovery() {
        ReportConfig config = resolver.resolve(ReportConfig.builder()
                .inputs(ReportConfig.Inputs.builder()
                        .testReportingBuildIds(List.of("b-1"))
                        .appAutomateBuildIds(List.of("a-1"))
                        .build())
                .build());

        DiscoveryService.Resolution resolution = discovery.resolveBuildInputs(config);

        mockServer.verify();
        assertEquals(List.of("b-1"), resolution.config().getInputs().getTestReportingBuildIds());
        assertEquals(List.of("a-1"), resolution.config().getInputs().getAppAutomateBuildIds());
    }

    @Test
    void resolveBuildInputs_DiscoveryDisabled_ReturnsConfigUnchanged() {
        ReportConfig config = resolver.resolve(ReportConfig.builder()
                .inputs(ReportConfig.Inputs.builder()
                        .discoverRecentBuilds(ReportConfig.Discovery.builder().enabled(false).build())
                        .build())
                .build());

        assertSame(config, discovery.resolveBuildInputs(config).config());
    }

    @Test
    void isRecent_UnparseableTimestampsCountAsMissing() throws Exception {
        var build = new ObjectMapper().readTree("{\"created_at\": \"yesterday-ish\"}");

        assertTrue(DiscoveryService.isRecent(build, NOW.minus(Duration.ofDays(1))));
    }
}
