package org.example.reporting.report.render;

import org.example.reporting.config.OutputFormat;
import org.example.reporting.report.model.Rows;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Writes {@code <base>.xlsx} (SpreadsheetML) with one sheet per section, header row in bold.
 * Numbers and booleans become typed cells, everything else inline strings.
 */
public class WorkbookRenderer implements ReportRenderer {

    static final int MAX_SHEET_NAME = 31;

    private static final String MAIN_NS = "http://schemas.openxmlformats.org/spreadsheetml/2006/main";
    private static final String REL_NS = "http://schemas.openxmlformats.org/package/2006/relationships";
    private static final String DOC_REL = "http://schemas.openxmlformats.org/officeDocument/2006/relationships";

    @Override
    public OutputFormat format() {
        return OutputFormat.XLSX;
    }

    @Override
    public List<Path> render(Map<String, List<Map<String, Object>>> sections, RenderContext context) throws IOException {
        Path file = context.resolve(context.baseName() + ".xlsx");
        try (OutputStream out = Files.newOutputStream(file)) {
            write(sections, out);
        }
        return List.of(file);
    }

    public void write(Map<String, List<Map<String, Object>>> sections, OutputStream out) throws IOException {
        List<String> names = List.copyOf(sections.keySet());
        try (ZipOutputStream zip = new ZipOutputStream(out)) {
            putEntry(zip, "[Content_Types].xml", contentTypesXml(names.size()));
            putEntry(zip, "_rels/.rels", "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
                    + "<Relationships xmlns=\"" + REL_NS + "\">"
                    + "<Relationship Id=\"rId1\" Type=\"" + DOC_REL + "/officeDocument\" Target=\"xl/workbook.xml\"/>"
                    + "</Relationships>");
            putEntry(zip, "xl/workbook.xml", workbookXml(names));
            putEntry(zip, "xl/_rels/workbook.xml.rels", workbookRelsXml(names.size()));
            putEntry(zip, "xl/styles.xml", stylesXml());
            int index = 1;
            for (List<Map<String, Object>> rows : sections.values()) {
                putEntry(zip, "xl/worksheets/sheet" + index + ".xml", sheetXml(rows));
                index++;
            }
        }
    }

    private static void putEntry(ZipOutputStream zip, String name, String xml) throws IOException {
        zip.putNextEntry(new ZipEntry(name));
        zip.write(xml.getBytes(StandardCharsets.UTF_8));
        zip.closeEntry();
    }

    private static String contentTypesXml(int sheetCount) {
        StringBuilder sb = new StringBuilder();
        sb.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>");
        sb.append("<Types xmlns=\"http://schemas.openxmlformats.org/package/2006/content-types\">");
        sb.append("<Default Extension=\"rels\" ContentType=\"application/vnd.openxmlformats-package.relationships+xml\"/>");
        sb.append("<Default Extension=\"xml\" ContentType=\"application/xml\"/>");
        sb.append("<Override PartName=\"/xl/workbook.xml\" ContentType=\"application/vnd.openxmlformats-officedocument.spreadsheetml.sheet.main+xml\"/>");
        sb.append("<Override PartName=\"/xl/styles.xml\" ContentType=\"application/vnd.openxmlformats-officedocument.spreadsheetml.styles+xml\"/>");
        for (int i = 1; i <= sheetCount; i++) {
            sb.append("<Override PartName=\"/xl/worksheets/sheet").append(i)
                    .append(".xml\" ContentType=\"application/vnd.openxmlformats-officedocument.spreadsheetml.worksheet+xml\"/>");
        }
        sb.append("</Types>");
        return sb.toString();
    }

    private static String workbookXml(List<String> names) {
        StringBuilder sb = new StringBuilder();
        sb.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>");
        sb.append("<workbook xmlns=\"").append(MAIN_NS).append("\" xmlns:r=\"").append(DOC_REL).append("\"><sheets>");
        for (int i = 0; i < names.size(); i++) {
            sb.append("<sheet name=\"").append(xmlEscape(sheetName(names.get(i))))
                    .append("\" sheetId=\"").append(i + 1)
                    .append("\" r:id=\"rId").append(i + 1).append("\"/>");
        }
        sb.append("</sheets></workbook>");
        return sb.toString();
    }

    private static String workbookRelsXml(int sheetCount) {
        StringBuilder sb = new StringBuilder();
        sb.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>");
        sb.append("<Relationships xmlns=\"").append(REL_NS).append("\">");
        for (int i = 1; i <= sheetCount; i++) {
            sb.append("<Relationship Id=\"rId").append(i).append("\" Type=\"").append(DOC_REL)
                    .append("/worksheet\" Target=\"worksheets/sheet").append(i).append(".xml\"/>");
        }
        sb.append("<Relationship Id=\"rId").append(sheetCount + 1).append("\" Type=\"").append(DOC_REL)
                .append("/styles\" Target=\"styles.xml\"/>");
        sb.append("</Relationships>");
        return sb.toString();
    }

    private static String stylesXml() {
        // xf 0 = normal, xf 1 = bold header
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
                + "<styleSheet xmlns=\"" + MAIN_NS + "\">"
                + "<fonts count=\"2\"><font><sz val=\"11\"/><name val=\"Calibri\"/></font>"
                + "<font><b/><sz val=\"11\"/><name val=\"Calibri\"/></font></fonts>"
                + "<fills count=\"2\"><fill><patternFill patternType=\"none\"/></fill>"
                + "<fill><patternFill patternType=\"gray125\"/></fill></fills>"
                + "<borders count=\"1\"><border/></borders>"
                + "<cellStyleXfs count=\"1\"><xf numFmtId=\"0\" fontId=\"0\" fillId=\"0\" borderId=\"0\"/></cellStyleXfs>"
                + "<cellXfs count=\"2\"><xf numFmtId=\"0\" fontId=\"0\" fillId=\"0\" borderId=\"0\" xfId=\"0\"/>"
                + "<xf numFmtId=\"0\" fontId=\"1\" fillId=\"0\" borderId=\"0\" xfId=\"0\" applyFont=\"1\"/></cellXfs>"
                + "</styleSheet>";
    }

    static String sheetXml(List<Map<String, Object>> rows) {
        List<String> headers = ReportRenderer.headers(rows);
        StringBuilder sb = new StringBuilder();
        sb.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>");
        sb.append("<worksheet xmlns=\"").append(MAIN_NS).append("\"><sheetData>");
        if (!headers.isEmpty()) {
            sb.append("<row r=\"1\">");
            for (int c = 0; c < headers.size(); c++) {
                appendCell(sb, colRef(c + 1) + 1, headers.get(c), true);
            }
            sb.append("</row>");
            for (int r = 0; r < rows.size(); r++) {
                int rowNumber = r + 2;
                sb.append("<row r=\"").append(rowNumber).append("\">");
                for (int c = 0; c < headers.size(); c++) {
                    appendCell(sb, colRef(c + 1) + rowNumber, rows.get(r).get(headers.get(c)), false);
                }
                sb.append("</row>");
            }
        }
        sb.append("</sheetData></worksheet>");
        return sb.toString();
    }

    private static void appendCell(StringBuilder sb, String ref, Object value, boolean header) {
        String style = header ? " s=\"1\"" : "";
        if (value instanceof Number) {
            sb.append("<c r=\"").append(ref).append("\" t=\"n\"").append(style).append("><v>")
                    .append(value).append("</v></c>");
        } else if (value instanceof Boolean) {
            sb.append("<c r=\"").append(ref).append("\" t=\"b\"").append(style).append("><v>")
                    .append((Boolean) value ? 1 : 0).append("</v></c>");
        } else {
            sb.append("<c r=\"").append(ref).append("\" t=\"inlineStr\"").append(style)
                    .append("><is><t xml:space=\"preserve\">").append(xmlEscape(Rows.text(value)))
                    .append("</t></is></c>");
        }
    }

    static String colRef(int index) {
        StringBuilder sb = new StringBuilder();
        while (index > 0) {
            index--;
            sb.insert(0, (char) ('A' + (index % 26)));
            index /= 26;
        }
        return sb.toString();
    }

    static String sheetName(String name) {
        String cleaned = name == null ? "" : name.replaceAll("[\\\\/:*?\\[\\]]", " ");
        if (cleaned.length() > MAX_SHEET_NAME) {
            cleaned = cleaned.substring(0, MAX_SHEET_NAME);
        }
        return cleaned.isBlank() ? "sheet" : cleaned;
    }

    static String xmlEscape(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            switch (ch) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append("&quot;");
                default -> {
                    // control characters other than tab, CR and LF are not allowed in XML 1.0
                    if (ch >= 0x20 || ch == '\t' || ch == '\n' || ch == '\r') {
                        sb.append(ch);
                    }
                }
            }
        }
        return sb.toString();
    }
}
