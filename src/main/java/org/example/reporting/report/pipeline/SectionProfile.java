package org.example.reporting.report.pipeline;

import org.example.reporting.report.model.Section;

import java.util.List;

/**
 * Which row fields feed the time window, the keyword filters and the ordering of a section.
 */
public enum SectionProfile {

    BUILDS(Section.BUILDS,
            List.of("started_at", "finished_at"),
            List.of("build_name", "original_build_name", "tags"),
            List.of("tags", "build_name"),
            List.of("user", "tags"),
            List.of("finished_at", "started_at")),
    TESTS(Section.TESTS,
            List.of("build_started_at", "build_finished_at", "finished_at"),
            List.of("source_build_name", "root_scope", "test_tags"),
            List.of("test_tags", "root_scope"),
            List.of("test_tags", "test_name", "scope_path"),
            List.of("build_finished_at", "build_started_at", "finished_at")),
    SESSIONS(Section.SESSIONS,
            List.of("session_created_at", "app_uploaded_at"),
            List.of("project_name", "build_name", "session_name"),
            List.of("project_name", "session_name"),
            List.of("session_name", "project_name", "build_name"),
            List.of("session_started_at", "session_created_at", "session_finished_at", "app_uploaded_at")),
    APPS(Section.APPS,
            List.of("uploaded_at"),
            List.of("custom_id", "shareable_id", "app_name"),
            List.of("custom_id", "shareable_id"),
            List.of("shareable_id", "custom_id"),
            List.of("uploaded_at"));

    private final Section section;
    private final List<String> dateFields;
    private final List<String> projectFields;
    private final List<String> teamFields;
    private final List<String> personFields;
    private final List<String> sortFields;

    SectionProfile(Section section, List<String> dateFields, List<String> projectFields,
                   List<String> teamFields, List<String> personFields, List<String> sortFields) {
        this.section = section;
        this.dateFields = dateFields;
        this.projectFields = projectFields;
        this.teamFields = teamFields;
        this.personFields = personFields;
        this.sortFields = sortFields;
    }

    public Section section() {
        return section;
    }

    public List<String> dateFields() {
        return dateFields;
    }

    public List<String> projectFields() {
        return projectFields;
    }

    public List<String> teamFields() {
        return teamFields;
    }

    public List<String> personFields() {
        return personFields;
    }

    public List<String> sortFields() {
        return sortFields;
    }

    /** The app inventory honours the day window only when explicitly asked to. */
    public boolean daysApply(boolean applyDaysToApps) {
        return this != APPS || applyDaysToApps;
    }
}
