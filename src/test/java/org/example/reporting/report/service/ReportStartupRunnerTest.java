package org.example.reporting.report.service;

import org.example.reporting.config.ConfigurationException;
import org.example.reporting.config.ReportConfig;
import org.example.reporting.config.ReportConfigLoader;
import org.example.reporting.integration.http.TransportException;
import org.example.reporting.report.model.ReportResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReportStartupRunnerTest {

    @Mock
    private ReportService reportService;

    @Test
    void run_Disabled_DoesNothing() {
        new ReportStartupRunner(reportService, new ReportConfigLoader(), false, "")
                .run(new DefaultApplicationArguments());

        verifyNoInteractions(reportService);
    }

    @Test
    void run_EnabledWithoutPath_Fails() {
        ReportStartupRunner runner = new ReportStartupRunner(reportService, new ReportConfigLoader(), true, " ");

        assertThrows(ConfigurationException.class, () -> runner.run(new DefaultApplicationArguments()));
        verifyNoInteractions(reportService);
    }

    @Test
    void run_Enabled_GeneratesFromConfigFile(@TempDir Path dir) throws Exception {
        Path config = dir.resolve("report-config.json");
        Files.writeString(config, "{\"inputs\": {\"testReportingBuildIds\": [\"b-1\"]}}");
        when(reportService.generate(any())).thenReturn(ReportResult.builder()
                .outputDirectory("/out").warnings(List.of("Project discovery stopped: HTTP 500")).build());

        new ReportStartupRunner(reportService, new ReportConfigLoader(), true, config.toString())
                .run(new DefaultApplicationArguments());

        ArgumentCaptor<ReportConfig> captor = ArgumentCaptor.forClass(ReportConfig.class);
        verify(reportService).generate(captor.capture());
        assertEquals(List.of("b-1"), captor.getValue().getInputs().getTestReportingBuildIds());
    }

    @Test
    void run_ReportFails_Rethrows(@TempDir Path dir) throws Exception {
        Path config = dir.resolve("report-config.json");
        Files.writeString(config, "{}");
        when(reportService.generate(any())).thenThrow(new TransportException(503, "https://x", "", null));

        ReportStartupRunner runner = new ReportStartupRunner(reportService, new ReportConfigLoader(), true, config.toString());

        TransportException e = assertThrows(TransportException.class, () -> runner.run(new DefaultApplicationArguments()));
        assertEquals(503, e.getStatusCode());
    }
}
