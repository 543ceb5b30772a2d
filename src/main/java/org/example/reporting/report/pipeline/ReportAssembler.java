package org.example.reporting.report.pipeline;

import org.example.reporting.config.ReportConfig;
import org.example.reporting.report.model.AppRow;
import org.example.reporting.report.model.BuildRow;
import org.example.reporting.report.model.Rows;
import org.example.reporting.report.model.Section;
import org.example.reporting.report.model.SessionRow;
import org.example.reporting.report.model.TestRow;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the fetched rows into the final sections: filter, sort, overview over the surviving
 * rows, then column projection. The overview itself is never filtered or sorted.
 */
public class ReportAssembler {

    private final RowFilter filter;
    private final RowSorter sorter;
    private final ColumnProjector projector;
    private final OverviewAggregator aggregator;

    public ReportAssembler(RowFilter filter, RowSorter sorter, ColumnProjector projector, OverviewAggregator aggregator) {
        this.filter = filter;
        this.sorter = sorter;
        this.projector = projector;
        this.aggregator = aggregator;
    }

    /**
     * @return sections keyed by id, in output order (overview, builds, tests, sessions, apps)
     */
    public Map<String, List<Map<String, Object>>> assemble(ReportConfig config, List<BuildRow> builds,
                                                           List<TestRow> tests, List<SessionRow> sessions,
                                                           List<AppRow> apps) {
        List<Map<String, Object>> buildRows = prepare(Rows.toMaps(builds), SectionProfile.BUILDS, config);
        List<Map<String, Object>> testRows = prepare(Rows.toMaps(tests), SectionProfile.TESTS, config);
        List<Map<String, Object>> sessionRows = prepare(Rows.toMaps(sessions), SectionProfile.SESSIONS, config);
        List<Map<String, Object>> appRows = prepare(Rows.toMaps(apps), SectionProfile.APPS, config);
        List<Map<String, Object>> overview = Rows.toMaps(aggregator.aggregate(buildRows, testRows, sessionRows));

        ReportConfig.Columns columns = config.getColumns();
        Map<String, List<Map<String, Object>>> sections = new LinkedHashMap<>();
        sections.put(Section.OVERVIEW.id(), projector.project(overview, columns.forSection(Section.OVERVIEW.id())));
        put(sections, SectionProfile.BUILDS, buildRows, columns);
        put(sections, SectionProfile.TESTS, testRows, columns);
        put(sections, SectionProfile.SESSIONS, sessionRows, columns);
        put(sections, SectionProfile.APPS, appRows, columns);
        return sections;
    }

    private void put(Map<String, List<Map<String, Object>>> sections, SectionProfile profile,
                     List<Map<String, Object>> rows, ReportConfig.Columns columns) {
        String id = profile.section().id();
        sections.put(id, projector.project(rows, columns.forSection(id)));
    }

    private List<Map<String, Object>> prepare(List<Map<String, Object>> rows, SectionProfile profile, ReportConfig config) {
        return sorter.sort(filter.apply(rows, profile, config.getFilters()), profile);
    }
}
