package org.example.reporting.integration.appautomate;

import com.fasterxml.jackson.databind.JsonNode;
import org.example.reporting.integration.http.ApiClient;
import org.example.reporting.integration.http.JsonPayloads;
import org.example.reporting.integration.model.AppListItem;
import org.example.reporting.integration.model.AutomationSession;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Endpoints of the BrowserStack App Automate REST API. Listings use offset/limit paging.
 */
public class AppAutomateClient {

    private static final String API_BASE = "/app-automate";

    private final ApiClient apiClient;
    private final String baseUrl;

    public AppAutomateClient(ApiClient apiClient, String baseUrl) {
        this.apiClient = apiClient;
        this.baseUrl = baseUrl;
    }

    public JsonNode listBuilds(int limit, int offset) {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("limit", String.valueOf(limit));
        query.put("offset", String.valueOf(offset));
        return apiClient.get(baseUrl + API_BASE + "/builds.json", query);
    }

    public List<AutomationSession> listSessions(String buildId, int limit, int offset, String status) {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("limit", String.valueOf(limit));
        query.put("offset", String.valueOf(offset));
        query.put("status", status);
        JsonNode payload = apiClient.get(baseUrl + API_BASE + "/builds/{buildId}/sessions.json",
                query, Map.of("buildId", buildId));
        List<AutomationSession> sessions = new ArrayList<>();
        for (JsonNode record : JsonPayloads.records(payload)) {
            AutomationSession.Envelope envelope = apiClient.bind(record, AutomationSession.Envelope.class);
            AutomationSession session = envelope != null ? envelope.getAutomationSession() : null;
            sessions.add(session != null ? session : new AutomationSession());
        }
        return sessions;
    }

    public AutomationSession getSession(String sessionId) {
        AutomationSession.Envelope envelope = apiClient.get(baseUrl + API_BASE + "/sessions/{sessionId}.json",
                Map.of(), Map.of("sessionId", sessionId), AutomationSession.Envelope.class);
        if (envelope == null || envelope.getAutomationSession() == null) {
            return new AutomationSession();
        }
        return envelope.getAutomationSession();
    }

    public List<AppListItem> recentApps(int limit) {
        JsonNode payload = apiClient.get(baseUrl + API_BASE + "/recent_apps",
                Map.of("limit", String.valueOf(limit)));
        return toApps(payload);
    }

    public List<AppListItem> recentAppsByCustomId(String customId) {
        JsonNode payload = apiClient.get(baseUrl + API_BASE + "/recent_apps/{customId}",
                Map.of(), Map.of("customId", customId));
        return toApps(payload);
    }

    private List<AppListItem> toApps(JsonNode payload) {
        List<AppListItem> apps = new ArrayList<>();
        for (JsonNode record : JsonPayloads.records(payload)) {
            apps.add(apiClient.bind(record, AppListItem.class));
        }
        return apps;
    }
}
