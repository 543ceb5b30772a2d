package org.example.reporting.report.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.reporting.auth.CredentialException;
import org.example.reporting.config.ConfigurationException;
import org.example.reporting.config.ReportConfig;
import org.example.reporting.integration.discovery.DiscoveryExhaustedException;
import org.example.reporting.integration.http.TransportException;
import org.example.reporting.report.model.ReportResult;
import org.example.reporting.report.service.ReportService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST API Controller fuer BrowserStack Reports
 *
 * Erzeugt einen Report aus einem (partiellen) Konfigurations-Dokument und
 * liefert die geschriebenen Dateien zurueck.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/report")
@RequiredArgsConstructor
@Validated
@Tag(name = "BrowserStack Report", description = "API fuer die Report-Erzeugung")
public class ReportController {

    private final ReportService reportService;

    /**
     * Erzeugt einen Report
     *
     * @param config Report-Konfiguration, fehlende Felder werden mit Defaults belegt
     * @return geschriebene Dateien und Zeilen pro Sektion
     */
    @PostMapping(value = "/generate",
            produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Report erzeugen",
            description = "Ruft Test Reporting und App Automate ab und schreibt CSV, XLSX, Markdown und JSON")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Report erfolgreich erzeugt"),
            @ApiResponse(responseCode = "400", description = "Ungueltige Konfiguration oder fehlende Zugangsdaten"),
            @ApiResponse(responseCode = "422", description = "Keine Builds gefunden"),
            @ApiResponse(responseCode = "502", description = "BrowserStack API nicht erreichbar oder Fehlerantwort")
    })
    public ResponseEntity<ReportResult> generate(@Valid @RequestBody(required = false) ReportConfig config) {
        log.info("Received report request");
        ReportResult result = reportService.generate(config);
        return ResponseEntity.ok(result);
    }

    /**
     * Health Check Endpoint
     */
    @GetMapping(value = "/health",
            produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Service Health Check",
            description = "Prueft die Verfuegbarkeit des Report Service")
    public ResponseEntity<String> healthCheck() {
        return ResponseEntity.ok("{\"status\": \"UP\"}");
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<Map<String, Object>> handleConfiguration(ConfigurationException e) {
        log.error("Report configuration rejected: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "configuration", e.getMessage(), e.getViolations());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidBody(MethodArgumentNotValidException e) {
        List<String> violations = e.getBindingResult().getFieldErrors().stream()
                .map(fieldError -> fieldError.getField() + ": " + fieldError.getDefaultMessage())
                .toList();
        log.error("Report request rejected: {}", violations);
        return error(HttpStatus.BAD_REQUEST, "configuration", "Invalid report configuration.", violations);
    }

    @ExceptionHandler(CredentialException.class)
    public ResponseEntity<Map<String, Object>> handleCredentials(CredentialException e) {
        log.error(e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "credentials", e.getMessage(), List.of());
    }

    @ExceptionHandler(DiscoveryExhaustedException.class)
    public ResponseEntity<Map<String, Object>> handleDiscovery(DiscoveryExhaustedException e) {
        log.error("Discovery found no builds for {}", e.getSource());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "discovery", e.getMessage(), List.of(e.getSource()));
    }

    @ExceptionHandler(TransportException.class)
    public ResponseEntity<Map<String, Object>> handleTransport(TransportException e) {
        log.error("BrowserStack request failed: status={}, url={}", e.getStatusCode(), e.getUrl());
        List<String> details = e.getResponseBody() == null || e.getResponseBody().isEmpty()
                ? List.of(e.getUrl()) : List.of(e.getUrl(), e.getResponseBody());
        return error(HttpStatus.BAD_GATEWAY, "transport", e.getMessage(), details);
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String error, String message,
                                                             List<String> details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        body.put("details", details);
        return ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON).body(body);
    }
}
