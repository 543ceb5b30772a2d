package org.example.reporting.integration.http;

/**
 * Hard upper bounds on the number of pages read in a single cursor traversal.
 */
public enum PageCeiling {
    PROJECT_LISTING(200),
    BUILD_LISTING(500),
    TEST_RUNS(1000);

    private final int maxPages;

    PageCeiling(int maxPages) {
        this.maxPages = maxPages;
    }

    public int maxPages() {
        return maxPages;
    }
}
