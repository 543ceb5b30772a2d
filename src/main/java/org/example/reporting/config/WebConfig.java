package org.example.reporting.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Web MVC Konfiguration: geschriebene Report-Dateien unter {@code /reports/**} ausliefern
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Value("${report.files.path:reports}")
    private String reportFilesPath;

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        String envPath = System.getenv("REPORT_FILES_PATH");
        String filesPath = (envPath != null && !envPath.isBlank())
            ? envPath
            : reportFilesPath;

        Path absolutePath = Paths.get(filesPath).toAbsolutePath().normalize();
        String locationUri = absolutePath.toUri().toString();
        if (!locationUri.endsWith("/")) {
            locationUri += "/";
        }

        // e.g. reports/browserstack-report/browserstack-report.md -> /reports/browserstack-report/browserstack-report.md
        registry.addResourceHandler("/reports/**")
                .addResourceLocations(locationUri);
    }
}
