package org.example.reporting.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Liest ein (partielles) Konfigurations-Dokument im JSON-Format.
 */
@Slf4j
@Component
public class ReportConfigLoader {

    private final ObjectMapper objectMapper = new ObjectMapper();

    public ReportConfig load(Path configPath) {
        if (!Files.isRegularFile(configPath)) {
            throw new ConfigurationException("Report configuration not found: " + configPath.toAbsolutePath(), null);
        }
        try {
            ReportConfig config = objectMapper.readValue(configPath.toFile(), ReportConfig.class);
            log.info("Loaded report configuration from {}", configPath.toAbsolutePath());
            return config != null ? config : new ReportConfig();
        } catch (IOException e) {
            throw new ConfigurationException("Cannot parse report configuration " + configPath + ": " + e.getMessage(), e);
        }
    }
}
