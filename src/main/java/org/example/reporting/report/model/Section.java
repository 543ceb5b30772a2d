package org.example.reporting.report.model;

/**
 * Logische Report-Sektionen in Ausgabe-Reihenfolge.
 */
public enum Section {
    OVERVIEW("overview", "Overview"),
    BUILDS("builds", "Test Reporting Builds"),
    TESTS("tests", "Test Reporting Tests"),
    SESSIONS("sessions", "App Automate Sessions"),
    APPS("apps", "App Automate Apps");

    private final String id;
    private final String label;

    Section(String id, String label) {
        this.id = id;
        this.label = label;
    }

    public String id() {
        return id;
    }

    public String label() {
        return label;
    }

    public static String labelFor(String sectionId) {
        for (Section section : values()) {
            if (section.id.equals(sectionId)) {
                return section.label;
            }
        }
        return sectionId;
    }
}
