package org.example.reporting.integration.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class CursorPaginatorTest {

    private static final String URL = "https://api.example.com/ext/v1/projects";

    private MockRestServiceServer mockServer;
    private CursorPaginator paginator;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        mockServer = MockRestServiceServer.createServer(restTemplate);
        paginator = new CursorPaginator(new ApiClient(restTemplate, new HttpHeaders(), new ObjectMapper()));
    }

    private static String page(String id, boolean hasNext, String nextPage) {
        String cursor = nextPage == null ? "" : ", \"next_page\": \"" + nextPage + "\"";
        return "{\"projects\": [{\"id\": \"" + id + "\"}], \"pagination\": {\"has_next\": " + hasNext + cursor + "}}";
    }

    private List<String> ids(Iterable<JsonNode> pages) {
        List<String> ids = new ArrayList<>();
        for (JsonNode page : pages) {
            JsonPayloads.records(page).forEach(record -> ids.add(record.get("id").asText()));
        }
        return ids;
    }

    @Test
    void pages_NoNextPage_StopsAfterOneRequest() {
        mockServer.expect(ExpectedCount.once(), requestTo(URL))
                .andRespond(withSuccess(page("p1", false, null), MediaType.APPLICATION_JSON));

        List<String> ids = ids(paginator.pages(URL, Map.of(), PageCeiling.PROJECT_LISTING));

        mockServer.verify();
        assertEquals(List.of("p1"), ids);
    }

    @Test
    void pages_FollowsCursorUntilExhausted() {
        mockServer.expect(requestTo(URL))
                .andRespond(withSuccess(page("p1", true, "cursorA"), MediaType.APPLICATION_JSON));
        mockServer.expect(requestTo(URL + "?next_page=cursorA"))
                .andRespond(withSuccess(page("p2", true, "cursorB"), MediaType.APPLICATION_JSON));
        mockServer.expect(requestTo(URL + "?next_page=cursorB"))
                .andRespond(withSuccess(page("p3", false, null), MediaType.APPLICATION_JSON));

        List<String> ids = ids(paginator.pages(URL, Map.of(), PageCeiling.PROJECT_LISTING));

        mockServer.verify();
        assertEquals(List.of("p1", "p2", "p3"), ids);
    }

    @Test
    void pages_RepeatedCursor_StopsWithoutRefetching() {
        mockServer.expect(requestTo(URL))
                .andRespond(withSuccess(page("p1", true, "cursorA"), MediaType.APPLICATION_JSON));
        mockServer.expect(requestTo(URL + "?next_page=cursorA"))
                .andRespond(withSuccess(page("p2", true, "cursorB"), MediaType.APPLICATION_JSON));
        mockServer.expect(requestTo(URL + "?next_page=cursorB"))
                .andRespond(withSuccess(page("p3", true, "cursorA"), MediaType.APPLICATION_JSON));

        List<String> ids = ids(paginator.pages(URL, Map.of(), PageCeiling.PROJECT_LISTING));

        mockServer.verify();
        assertEquals(List.of("p1", "p2", "p3"), ids);
    }

    @Test
    void pages_HasNextWithoutCursor_Stops() {
        mockServer.expect(ExpectedCount.once(), requestTo(URL))
                .andRespond(withSuccess(page("p1", true, null), MediaType.APPLICATION_JSON));

        assertEquals(List.of("p1"), ids(paginator.pages(URL, Map.of(), PageCeiling.PROJECT_LISTING)));
        mockServer.verify();
    }

    @Test
    void pages_TopLevelCursor_IsAccepted() {
        mockServer.expect(requestTo(URL))
                .andRespond(withSuccess("{\"data\": [{\"id\": \"p1\"}], \"pagination\": {\"has_next\": true},"
                        + " \"next_page\": \"cursorA\"}", MediaType.APPLICATION_JSON));
        mockServer.expect(requestTo(URL + "?next_page=cursorA"))
                .andRespond(withSuccess(page("p2", false, null), MediaType.APPLICATION_JSON));

        assertEquals(List.of("p1", "p2"), ids(paginator.pages(URL, Map.of(), PageCeiling.PROJECT_LISTING)));
        mockServer.verify();
    }

    @Test
    void pages_TransportFailure_PropagatesAndEndsTraversal() {
        mockServer.expect(requestTo(URL))
                .andRespond(withSuccess(page("p1", true, "cursorA"), MediaType.APPLICATION_JSON));
        mockServer.expect(requestTo(URL + "?next_page=cursorA"))
                .andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR));

        Iterator<JsonNode> pages = paginator.pages(URL, Map.of(), PageCeiling.PROJECT_LISTING).iterator();
        assertTrue(pages.hasNext());
        pages.next();

        TransportException e = assertThrows(TransportException.class, pages::hasNext);
        assertEquals(500, e.getStatusCode());
        assertFalse(pages.hasNext());
        mockServer.verify();
    }

    @Test
    void pages_EndlessCursors_StopAtPageCeiling() {
        AtomicInteger served = new AtomicInteger();
        mockServer.expect(ExpectedCount.times(PageCeiling.PROJECT_LISTING.maxPages()), requestTo(startsWith(URL)))
                .andRespond(request -> {
                    int n = served.incrementAndGet();
                    return withSuccess(page("p" + n, true, "cursor" + n), MediaType.APPLICATION_JSON)
                            .createResponse(request);
                });

        List<String> ids = ids(paginator.pages(URL, Map.of(), PageCeiling.PROJECT_LISTING));

        mockServer.verify();
        assertEquals(200, ids.size());
        assertEquals(200, served.get());
    }

    @Test
    void pages_StaticQueryIsKeptOnEveryPage() {
        mockServer.expect(requestTo(URL + "?limit=2"))
                .andRespond(withSuccess(page("p1", true, "cursorA"), MediaType.APPLICATION_JSON));
        mockServer.expect(requestTo(URL + "?limit=2&next_page=cursorA"))
                .andRespond(withSuccess(page("p2", false, null), MediaType.APPLICATION_JSON));

        assertEquals(List.of("p1", "p2"), ids(paginator.pages(URL, Map.of("limit", "2"), PageCeiling.PROJECT_LISTING)));
        mockServer.verify();
    }
}
