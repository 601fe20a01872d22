package dev.atlassiansdk.jira.dashboard;

import com.fasterxml.jackson.databind.JsonNode;
import dev.atlassiansdk.jira.ApiResult;
import dev.atlassiansdk.jira.JiraValidationException;
import dev.atlassiansdk.jira.StubJiraServer;
import dev.atlassiansdk.jira.filter.SharePermission;
import dev.atlassiansdk.jira.internal.Json;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DashboardServiceTest {

    private static final String DASHBOARD_JSON = "{\"id\":\"10000\",\"isFavourite\":true,\"name\":\"System Dashboard\","
        + "\"owner\":{\"accountId\":\"5b10a2844c20165700ede21g\",\"displayName\":\"Mia Krystof\"},"
        + "\"popularity\":1,\"self\":\"https://example.atlassian.net/rest/api/3/dashboard/10000\","
        + "\"sharePermissions\":[{\"type\":\"global\"}],\"view\":\"/jira/dashboards/10000\"}";

    private StubJiraServer server;
    private DashboardService service;

    @BeforeEach
    void setUp() throws IOException {
        server = StubJiraServer.start();
        service = server.client().dashboards();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void getsPagesThroughDashboards() throws Exception {
        server.stub("GET", "/rest/api/3/dashboard", 200,
            "{\"startAt\":0,\"maxResults\":50,\"total\":1,\"dashboards\":[" + DASHBOARD_JSON + "]}");

        ApiResult<DashboardPage> result = service.gets(0, 50, "");

        assertEquals("startAt=0&maxResults=50", server.lastRequest().query());
        Dashboard dashboard = result.result().dashboards().get(0);
        assertEquals("System Dashboard", dashboard.name());
        assertTrue(dashboard.favourite());
        assertEquals("Mia Krystof", dashboard.owner().displayName());
        assertEquals("global", dashboard.sharePermissions().get(0).type());
    }

    @Test
    void getsForwardsSupportedFilter() throws Exception {
        server.stub("GET", "/rest/api/3/dashboard", 200, "{\"dashboards\":[]}");

        service.gets(0, 20, "favourite");

        assertEquals("startAt=0&maxResults=20&filter=favourite", server.lastRequest().query());
    }

    @Test
    void getsRejectsUnknownFilter() {
        JiraValidationException ex = assertThrows(JiraValidationException.class, () -> service.gets(0, 50, "shared"));

        assertTrue(ex.getMessage().contains("my,favourite"));
        assertTrue(server.requests().isEmpty());
    }

    @Test
    void createSendsPermissionsEvenWhenEmpty() throws Exception {
        server.stub("POST", "/rest/api/3/dashboard", 200, DASHBOARD_JSON);

        service.create(DashboardPayload.named("Team board", null));

        JsonNode body = Json.mapper().readTree(server.lastRequest().body());
        assertEquals("Team board", body.path("name").asText());
        assertFalse(body.has("description"));
        assertTrue(body.path("sharePermissions").isArray());
        assertEquals(0, body.path("sharePermissions").size());
        assertTrue(body.path("editPermissions").isArray());
    }

    @Test
    void copyAndUpdateTargetDashboard() throws Exception {
        server.stub("POST", "/rest/api/3/dashboard/10000/copy", 200, DASHBOARD_JSON);
        server.stub("PUT", "/rest/api/3/dashboard/10000", 200, DASHBOARD_JSON);

        SharePermission group = new SharePermission(null, "group", null, null,
            new SharePermission.Group(null, "jira-users", null), null);
        service.copy("10000", new DashboardPayload("Copy", "", List.of(group), null));
        JsonNode body = Json.mapper().readTree(server.lastRequest().body());
        assertEquals("jira-users", body.path("sharePermissions").get(0).path("group").path("name").asText());
        assertFalse(body.path("sharePermissions").get(0).has("id"));

        service.update("10000", DashboardPayload.named("Renamed", "Quarterly"));
        assertEquals("PUT", server.lastRequest().method());
    }

    @Test
    void getAndDeleteRequireId() throws Exception {
        server.stub("GET", "/rest/api/3/dashboard/10000", 200, DASHBOARD_JSON);
        server.stub("DELETE", "/rest/api/3/dashboard/10000", 204, "");

        assertEquals("10000", service.get("10000").result().id());
        assertEquals(204, service.delete("10000").statusCode());

        assertEquals(JiraValidationException.NO_DASHBOARD_ID,
            assertThrows(JiraValidationException.class, () -> service.delete("")).getMessage());
        assertEquals(2, server.requests().size());
    }

    @Test
    void payloadNameIsRequired() {
        assertThrows(JiraValidationException.class, () -> service.create(null));
        assertThrows(JiraValidationException.class, () -> service.create(DashboardPayload.named(" ", null)));
        assertTrue(server.requests().isEmpty());
    }
}
