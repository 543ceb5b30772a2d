package org.example.reporting.report.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.example.reporting.auth.Authenticator;
import org.example.reporting.config.ReportConfig;
import org.example.reporting.config.ReportConfigResolver;
import org.example.reporting.integration.appautomate.AppAutomateClient;
import org.example.reporting.integration.appautomate.AppAutomateService;
import org.example.reporting.integration.discovery.DiscoveryService;
import org.example.reporting.integration.http.ApiClient;
import org.example.reporting.integration.testreporting.HierarchyFlattener;
import org.example.reporting.integration.testreporting.TestReportingClient;
import org.example.reporting.integration.testreporting.TestReportingService;
import org.example.reporting.report.model.ReportResult;
import org.example.reporting.report.pipeline.ColumnProjector;
import org.example.reporting.report.pipeline.OverviewAggregator;
import org.example.reporting.report.pipeline.ReportAssembler;
import org.example.reporting.report.pipeline.RowFilter;
import org.example.reporting.report.pipeline.RowSorter;
import org.example.reporting.report.render.CsvRenderer;
import org.example.reporting.report.render.JsonRenderer;
import org.example.reporting.report.render.MarkdownRenderer;
import org.example.reporting.report.render.RenderContext;
import org.example.reporting.report.render.ReportWriter;
import org.example.reporting.report.render.WorkbookRenderer;
import org.example.reporting.utils.Timestamps;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fuehrt einen kompletten Report-Lauf aus: Konfiguration aufloesen, authentifizieren,
 * Builds ermitteln, beide Quellen abrufen, Sektionen aufbereiten und Dateien schreiben.
 * <p>
 * Alle Requests laufen nacheinander; die Dateien werden erst geschrieben, wenn beide Quellen
 * vollstaendig abgerufen sind.
 */
@Slf4j
@Service
public class ReportService {

    private final ReportConfigResolver resolver;
    private final Authenticator authenticator;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String testReportingBaseUrl;
    private final String appAutomateBaseUrl;

    @Autowired
    public ReportService(
            ReportConfigResolver resolver,
            Authenticator authenticator,
            RestTemplateBuilder restTemplateBuilder,
            ObjectMapper objectMapper,
            @Value("${browserstack.test-reporting.base-url:https://api-automation.browserstack.com}") String testReportingBaseUrl,
            @Value("${browserstack.app-automate.base-url:https://api-cloud.browserstack.com}") String appAutomateBaseUrl,
            @Value("${report.http.connect-timeout-ms:10000}") long connectTimeoutMs,
            @Value("${report.http.read-timeout-ms:60000}") long readTimeoutMs) {
        this(resolver, authenticator,
                restTemplateBuilder
                        .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                        .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                        .build(),
                objectMapper, Clock.systemUTC(), testReportingBaseUrl, appAutomateBaseUrl);
    }

    public ReportService(ReportConfigResolver resolver, Authenticator authenticator, RestTemplate restTemplate,
                         ObjectMapper objectMapper, Clock clock, String testReportingBaseUrl, String appAutomateBaseUrl) {
        this.resolver = resolver;
        this.authenticator = authenticator;
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.testReportingBaseUrl = testReportingBaseUrl;
        this.appAutomateBaseUrl = appAutomateBaseUrl;
    }

    public ReportResult generate(ReportConfig rawConfig) {
        ReportConfig config = resolver.resolve(rawConfig);
        resolver.validate(config);
        HttpHeaders headers = authenticator.authenticate(config.getCredentials());

        ApiClient apiClient = new ApiClient(restTemplate, headers, objectMapper);
        TestReportingClient testReportingClient = new TestReportingClient(apiClient, testReportingBaseUrl);
        AppAutomateClient appAutomateClient = new AppAutomateClient(apiClient, appAutomateBaseUrl);

        DiscoveryService.Resolution resolution =
                new DiscoveryService(testReportingClient, appAutomateClient, clock).resolveBuildInputs(config);
        config = resolution.config();
        log.info("Report inputs: {} Test Reporting build(s), {} App Automate build(s)",
                config.getInputs().getTestReportingBuildIds().size(),
                config.getInputs().getAppAutomateBuildIds().size());

        TestReportingService.Result testReporting =
                new TestReportingService(testReportingClient, new HierarchyFlattener()).fetch(config);
        AppAutomateService.Result appAutomate = new AppAutomateService(appAutomateClient).fetch(config);

        ReportAssembler assembler = new ReportAssembler(
                new RowFilter(clock), new RowSorter(), new ColumnProjector(), new OverviewAggregator());
        Map<String, List<Map<String, Object>>> sections = assembler.assemble(config,
                testReporting.builds(), testReporting.tests(), appAutomate.sessions(), appAutomate.apps());

        Instant generatedAt = clock.instant();
        Path outputDir = Paths.get(config.getOutputs().getDirectory()).toAbsolutePath().normalize();
        RenderContext context = new RenderContext(outputDir, config.getOutputs().getBaseName(),
                config.getOutputs().getMarkdownMaxRows(), generatedAt);
        List<Path> files = reportWriter().write(sections, config.getOutputs().getFormats(), context);

        Map<String, Integer> rowCounts = new LinkedHashMap<>();
        sections.forEach((section, rows) -> rowCounts.put(section, rows.size()));
        log.info("Report generated in: {} ({} files, rows={})", outputDir, files.size(), rowCounts);

        return ReportResult.builder()
                .outputDirectory(outputDir.toString())
                .files(files.stream().map(Path::toString).toList())
                .rowCounts(rowCounts)
                .warnings(resolution.warnings())
                .generatedAt(Timestamps.format(generatedAt))
                .build();
    }

    private ReportWriter reportWriter() {
        return new ReportWriter(List.of(
                new CsvRenderer(), new WorkbookRenderer(), new MarkdownRenderer(), new JsonRenderer(objectMapper)));
    }
}
