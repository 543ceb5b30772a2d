package org.example.reporting.integration.appautomate;

import lombok.extern.slf4j.Slf4j;
import org.example.reporting.config.ReportConfig;
import org.example.reporting.integration.model.AppDetails;
import org.example.reporting.integration.model.AppListItem;
import org.example.reporting.integration.model.AutomationSession;
import org.example.reporting.report.model.AppRow;
import org.example.reporting.report.model.SessionRow;
import org.example.reporting.utils.Timestamps;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects App Automate sessions (optionally enriched with per-session details) and the app inventory.
 */
@Slf4j
public class AppAutomateService {

    private final AppAutomateClient client;

    public AppAutomateService(AppAutomateClient client) {
        this.client = client;
    }

    public record Result(List<SessionRow> sessions, List<AppRow> apps) {
    }

    public Result fetch(ReportConfig config) {
        if (!Boolean.TRUE.equals(config.getAppAutomate().getEnabled())) {
            return new Result(List.of(), List.of());
        }

        List<String> buildIds = config.getInputs().getAppAutomateBuildIds();
        List<SessionRow> sessions = new ArrayList<>();
        int index = 0;
        for (String buildId : buildIds) {
            index++;
            List<SessionRow> perBuild = fetchSessions(buildId, config.getAppAutomate());
            sessions.addAll(perBuild);
            log.info("Fetched App Automate build {}/{}: id={}, sessions={}",
                    index, buildIds.size(), buildId, perBuild.size());
        }

        List<AppRow> apps = fetchApps(config);
        log.info("App Automate done: {} sessions, {} apps", sessions.size(), apps.size());
        return new Result(sessions, apps);
    }

    /**
     * Pages through the sessions of one build until a page returns fewer rows than requested.
     */
    public List<SessionRow> fetchSessions(String buildId, ReportConfig.AppAutomate settings) {
        int limit = Math.max(1, settings.getSessionLimit());
        boolean includeDetails = Boolean.TRUE.equals(settings.getIncludeSessionDetails());
        List<SessionRow> rows = new ArrayList<>();
        int offset = 0;
        boolean hasMore = true;
        while (hasMore) {
            List<AutomationSession> page = client.listSessions(buildId, limit, offset, settings.getSessionStatusFilter());
            for (AutomationSession session : page) {
                SessionRow row = toSessionRow(buildId, session);
                if (includeDetails && !row.getSessionId().isEmpty()) {
                    row = enrich(row, client.getSession(row.getSessionId()));
                }
                rows.add(row);
            }
            hasMore = page.size() == limit;
            offset += limit;
        }
        return rows;
    }

    public List<AppRow> fetchApps(ReportConfig config) {
        int limit = config.getAppAutomate().getAppListLimit();
        List<String> customIds = config.getInputs().getAppCustomIds();
        List<AppRow> rows = new ArrayList<>();
        if (customIds.isEmpty()) {
            for (AppListItem app : client.recentApps(limit)) {
                rows.add(toAppRow(app));
            }
            return rows;
        }
        for (String customId : customIds) {
            List<AppListItem> apps = client.recentAppsByCustomId(customId);
            apps.stream().limit(Math.max(0, limit)).map(AppAutomateService::toAppRow).forEach(rows::add);
            log.debug("Custom id {}: {} apps listed", customId, apps.size());
        }
        return rows;
    }

    SessionRow toSessionRow(String buildId, AutomationSession session) {
        return SessionRow.builder()
                .buildId(buildId)
                .sessionId(nz(session.getHashedId()))
                .sessionName(nz(session.getName()))
                .sessionCreatedAt(Timestamps.toIsoOrEmpty(session.getCreatedAt()))
                .sessionStartedAt(Timestamps.toIsoOrEmpty(session.getStartedAt()))
                .sessionFinishedAt(Timestamps.toIsoOrEmpty(session.getFinishedAt()))
                .sessionStatus(nz(session.getStatus()))
                .sessionDurationSec(session.getDuration())
                .os(nz(session.getOs()))
                .osVersion(nz(session.getOsVersion()))
                .device(nz(session.getDevice()))
                .reason(nz(session.getReason()))
                .buildName(nz(session.getBuildName()))
                .projectName(nz(session.getProjectName()))
                .logsUrl(nz(session.getLogs()))
                .appiumLogsUrl(nz(session.getAppiumLogsUrl()))
                .videoUrl(nz(session.getVideoUrl()))
                .publicUrl(nz(session.getPublicUrl()))
                .appUrl("")
                .appName("")
                .appVersion("")
                .appCustomId("")
                .appUploadedAt("")
                .build();
    }

    /**
     * Overlays detail values onto a summary row. Detail timestamps win only when non-empty.
     */
    SessionRow enrich(SessionRow summary, AutomationSession details) {
        AppDetails app = details.getAppDetails() != null ? details.getAppDetails() : new AppDetails();
        return summary.toBuilder()
                .sessionCreatedAt(preferDetail(details.getCreatedAt(), summary.getSessionCreatedAt()))
                .sessionStartedAt(preferDetail(details.getStartedAt(), summary.getSessionStartedAt()))
                .sessionFinishedAt(preferDetail(details.getFinishedAt(), summary.getSessionFinishedAt()))
                .appUrl(nz(app.getAppUrl()))
                .appName(nz(app.getAppName()))
                .appVersion(nz(app.getAppVersion()))
                .appCustomId(nz(app.getAppCustomId()))
                .appUploadedAt(Timestamps.toIsoOrEmpty(app.getUploadedAt()))
                .build();
    }

    private static String preferDetail(String detailValue, String summaryValue) {
        String iso = Timestamps.toIsoOrEmpty(detailValue);
        return !iso.isEmpty() ? iso : nz(summaryValue);
    }

    static AppRow toAppRow(AppListItem app) {
        AppListItem item = app != null ? app : new AppListItem();
        return AppRow.builder()
                .appName(nz(item.getAppName()))
                .appVersion(nz(item.getAppVersion()))
                .appUrl(nz(item.getAppUrl()))
                .appId(nz(item.getAppId()))
                .uploadedAt(Timestamps.toIsoOrEmpty(item.getUploadedAt()))
                .customId(nz(item.getCustomId()))
                .shareableId(nz(item.getShareableId()))
                .build();
    }

    private static String nz(String value) {
        return value != null ? value : "";
    }
}
