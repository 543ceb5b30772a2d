package org.example.reporting.report.pipeline;

import org.example.reporting.config.ColumnSpec;
import org.example.reporting.report.model.Rows;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Selects, renames and defaults the output columns of a section.
 */
public class ColumnProjector {

    public List<Map<String, Object>> project(List<Map<String, Object>> rows, List<ColumnSpec> columns) {
        if (columns == null || columns.isEmpty()) {
            return rows;
        }
        List<Map<String, Object>> projected = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (ColumnSpec column : columns) {
                Object value = Rows.lookup(row, column.getKey());
                if (value == null) {
                    value = column.getDefaultValue() != null ? column.getDefaultValue() : "";
                }
                out.put(column.effectiveHeader(), value);
            }
            projected.add(out);
        }
        return projected;
    }
}
