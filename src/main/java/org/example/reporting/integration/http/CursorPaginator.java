package org.example.reporting.integration.http;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Walks a cursor-paginated listing ({@code pagination.has_next} + opaque {@code next_page} token).
 * <p>
 * Pages are fetched lazily, one request per {@link Iterator#hasNext()} that needs a new page, so a
 * caller may stop early simply by leaving the loop. A traversal ends when the payload reports no
 * further page, omits the cursor, repeats a cursor already seen, or reaches the page ceiling.
 * Transport failures propagate as {@link TransportException}; callers decide whether that is fatal.
 */
@Slf4j
public class CursorPaginator {

    static final String CURSOR_PARAM = "next_page";

    private final ApiClient apiClient;

    public CursorPaginator(ApiClient apiClient) {
        this.apiClient = apiClient;
    }

    public Iterable<JsonNode> pages(String urlTemplate, Map<String, String> query,
                                    Map<String, String> pathVars, PageCeiling ceiling) {
        return () -> new PageIterator(urlTemplate, query, pathVars, ceiling);
    }

    public Iterable<JsonNode> pages(String url, Map<String, String> query, PageCeiling ceiling) {
        return pages(url, query, Map.of(), ceiling);
    }

    private final class PageIterator implements Iterator<JsonNode> {

        private final String urlTemplate;
        private final Map<String, String> query;
        private final Map<String, String> pathVars;
        private final PageCeiling ceiling;
        private final Set<String> seenCursors = new HashSet<>();

        private String cursor = "";
        private int pageCount;
        private boolean exhausted;
        private JsonNode pending;

        private PageIterator(String urlTemplate, Map<String, String> query,
                             Map<String, String> pathVars, PageCeiling ceiling) {
            this.urlTemplate = urlTemplate;
            this.query = query != null ? query : Map.of();
            this.pathVars = pathVars;
            this.ceiling = ceiling;
        }

        @Override
        public boolean hasNext() {
            if (pending != null) {
                return true;
            }
            if (exhausted) {
                return false;
            }
            Map<String, String> pageQuery = new LinkedHashMap<>(query);
            if (!cursor.isEmpty()) {
                pageQuery.put(CURSOR_PARAM, cursor);
            }
            JsonNode page;
            try {
                page = apiClient.get(urlTemplate, pageQuery, pathVars);
            } catch (TransportException e) {
                exhausted = true;
                throw e;
            }
            pageCount++;
            advance(page);
            pending = page;
            return true;
        }

        @Override
        public JsonNode next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            JsonNode page = pending;
            pending = null;
            return page;
        }

        private void advance(JsonNode page) {
            String nextCursor = JsonPayloads.nextCursor(page);
            if (!JsonPayloads.hasNext(page) || nextCursor.isEmpty()) {
                exhausted = true;
            } else if (!seenCursors.add(nextCursor)) {
                log.warn("Cursor {} repeated after {} pages of {}, stopping", nextCursor, pageCount, urlTemplate);
                exhausted = true;
            } else if (pageCount >= ceiling.maxPages()) {
                log.warn("Page ceiling {} reached for {}, stopping", ceiling.maxPages(), urlTemplate);
                exhausted = true;
            } else {
                cursor = nextCursor;
            }
        }
    }
}
