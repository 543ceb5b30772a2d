package org.example.reporting.report.controller;

import org.example.reporting.auth.CredentialException;
import org.example.reporting.config.ConfigurationException;
import org.example.reporting.config.ReportConfig;
import org.example.reporting.integration.discovery.DiscoveryExhaustedException;
import org.example.reporting.integration.http.TransportException;
import org.example.reporting.report.model.ReportResult;
import org.example.reporting.report.service.ReportService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
class ReportControllerTest {

    private MockMvc mockMvc;

    @Mock
    private ReportService reportService;

    @InjectMocks
    private ReportController controller;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    // --- POST /api/v1/report/generate ---

    @Test
    void generate_PartialConfig_Returns200() throws Exception {
        ReportResult result = ReportResult.builder()
                .outputDirectory("/tmp/reports")
                .files(List.of("/tmp/reports/browserstack-report.md"))
                .rowCounts(Map.of("overview", 3))
                .warnings(List.of())
                .generatedAt("2026-10-18T12:00:00.000Z")
                .build();
        when(reportService.generate(any())).thenReturn(result);

        String requestJson = """
                {
                    "inputs": {"testReportingBuildIds": ["b-1"]},
                    "appAutomate": {"enabled": false},
                    "outputs": {"formats": ["md"]}
                }
                """;

        mockMvc.perform(post("/api/v1/report/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(requestJson))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outputDirectory").value("/tmp/reports"))
                .andExpect(jsonPath("$.rowCounts.overview").value(3))
                .andExpect(jsonPath("$.files", hasSize(1)));

        ArgumentCaptor<ReportConfig> captor = ArgumentCaptor.forClass(ReportConfig.class);
        verify(reportService).generate(captor.capture());
        assertEquals(List.of("b-1"), captor.getValue().getInputs().getTestReportingBuildIds());
        assertEquals(Boolean.FALSE, captor.getValue().getAppAutomate().getEnabled());
        assertNull(captor.getValue().getFilters());
    }

    @Test
    void generate_NoBody_UsesDefaults() throws Exception {
        when(reportService.generate(null)).thenReturn(ReportResult.builder().outputDirectory("/out").build());

        mockMvc.perform(post("/api/v1/report/generate"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outputDirectory").value("/out"));
    }

    @Test
    void generate_InvalidConfig_Returns400WithViolations() throws Exception {
        when(reportService.generate(any())).thenThrow(new ConfigurationException(List.of(
                "testReporting.enabled is true but inputs.testReportingBuildIds is empty.",
                "appAutomate.enabled is true but inputs.appAutomateBuildIds is empty.")));

        mockMvc.perform(post("/api/v1/report/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("configuration"))
                .andExpect(jsonPath("$.details", hasSize(2)))
                .andExpect(jsonPath("$.message", startsWith("Invalid report configuration.")));
    }

    @Test
    void generate_ColumnWithoutKey_Returns400BeforeGenerating() throws Exception {
        mockMvc.perform(post("/api/v1/report/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"columns\": {\"overview\": [{\"header\": \"Metric\"}]}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("configuration"))
                .andExpect(jsonPath("$.details", hasSize(1)))
                .andExpect(jsonPath("$.details[0]", startsWith("columns.overview[0].key")));

        verifyNoInteractions(reportService);
    }

    @Test
    void generate_MissingCredentials_Returns400() throws Exception {
        when(reportService.generate(any())).thenThrow(new CredentialException("Missing credentials."));

        mockMvc.perform(post("/api/v1/report/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("credentials"));
    }

    @Test
    void generate_NothingDiscovered_Returns422() throws Exception {
        when(reportService.generate(any())).thenThrow(
                new DiscoveryExhaustedException("app-automate", "No App Automate builds found."));

        mockMvc.perform(post("/api/v1/report/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("discovery"))
                .andExpect(jsonPath("$.details[0]").value("app-automate"));
    }

    @Test
    void generate_UpstreamFailure_Returns502() throws Exception {
        when(reportService.generate(any())).thenThrow(new TransportException(401,
                "https://api-automation.browserstack.com/ext/v1/builds/b-1", "unauthorized", null));

        mockMvc.perform(post("/api/v1/report/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("transport"))
                .andExpect(jsonPath("$.details", contains(
                        "https://api-automation.browserstack.com/ext/v1/builds/b-1", "unauthorized")));
    }

    // --- GET /api/v1/report/health ---

    @Test
    void healthCheck_Returns200() throws Exception {
        mockMvc.perform(get("/api/v1/report/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }
}
