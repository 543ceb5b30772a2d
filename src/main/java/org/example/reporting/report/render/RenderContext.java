package org.example.reporting.report.render;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Where and how a report run writes its files.
 *
 * @param directory       output directory, created before any renderer runs
 * @param baseName        file name prefix
 * @param markdownMaxRows rows per Markdown table, 0 for all
 * @param generatedAt     timestamp printed into the Markdown document
 */
public record RenderContext(Path directory, String baseName, int markdownMaxRows, Instant generatedAt) {

    public Path resolve(String fileName) {
        return directory.resolve(fileName);
    }
}
