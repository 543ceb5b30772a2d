package org.example.reporting.report.render;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.example.reporting.config.OutputFormat;
import org.example.reporting.report.model.Rows;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One {@code <base>-<section>.csv} per section. An empty section yields an empty file.
 */
public class CsvRenderer implements ReportRenderer {

    static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setRecordSeparator("\n")
            .build();

    @Override
    public OutputFormat format() {
        return OutputFormat.CSV;
    }

    @Override
    public List<Path> render(Map<String, List<Map<String, Object>>> sections, RenderContext context) throws IOException {
        List<Path> written = new ArrayList<>();
        for (Map.Entry<String, List<Map<String, Object>>> section : sections.entrySet()) {
            Path file = context.resolve(context.baseName() + "-" + section.getKey() + ".csv");
            Files.writeString(file, toCsv(section.getValue()), StandardCharsets.UTF_8);
            written.add(file);
        }
        return written;
    }

    public String toCsv(List<Map<String, Object>> rows) throws IOException {
        if (rows.isEmpty()) {
            return "";
        }
        List<String> headers = ReportRenderer.headers(rows);
        StringBuilder out = new StringBuilder();
        try (CSVPrinter printer = new CSVPrinter(out, FORMAT)) {
            printer.printRecord(headers);
            for (Map<String, Object> row : rows) {
                List<String> values = new ArrayList<>(headers.size());
                for (String header : headers) {
                    values.add(Rows.text(row.get(header)));
                }
                printer.printRecord(values);
            }
        }
        // no separator after the last record
        out.setLength(out.length() - 1);
        return out.toString();
    }
}
