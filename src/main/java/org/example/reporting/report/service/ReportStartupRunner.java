package org.example.reporting.report.service;

import lombok.extern.slf4j.Slf4j;
import org.example.reporting.config.ConfigurationException;
import org.example.reporting.config.ReportConfigLoader;
import org.example.reporting.report.model.ReportResult;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Paths;
import java.util.List;

/**
 * Erzeugt beim Start einen Report aus {@code report.config-path}, wenn {@code report.run-on-startup} gesetzt ist.
 * Fehler werden nicht abgefangen, damit die Anwendung mit Exit-Code ungleich 0 endet.
 */
@Slf4j
@Component
public class ReportStartupRunner implements ApplicationRunner {

    private final ReportService reportService;
    private final ReportConfigLoader configLoader;
    private final boolean runOnStartup;
    private final String configPath;

    public ReportStartupRunner(ReportService reportService,
                               ReportConfigLoader configLoader,
                               @Value("${report.run-on-startup:false}") boolean runOnStartup,
                               @Value("${report.config-path:}") String configPath) {
        this.reportService = reportService;
        this.configLoader = configLoader;
        this.runOnStartup = runOnStartup;
        this.configPath = configPath;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!runOnStartup) {
            return;
        }
        if (configPath == null || configPath.isBlank()) {
            throw new ConfigurationException(List.of("report.run-on-startup is true but report.config-path is not set."));
        }
        try {
            ReportResult result = reportService.generate(configLoader.load(Paths.get(configPath)));
            result.getWarnings().forEach(warning -> log.warn("Discovery: {}", warning));
            log.info("Report generated in: {}", result.getOutputDirectory());
        } catch (RuntimeException e) {
            log.error("Report run failed: {}", e.getMessage());
            throw e;
        }
    }
}
