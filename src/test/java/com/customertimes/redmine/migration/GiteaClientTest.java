package com.customertimes.redmine.migration;

import org.apache.http.client.HttpClient;
import org.apache.http.client.methods.HttpUriRequest;
import org.codehaus.jettison.json.JSONArray;
import org.codehaus.jettison.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class GiteaClientTest {

    private static final String REPO = "https://gitea.test/api/v1/repos/acme/demo";

    @Mock
    private HttpClient httpClient;

    private HttpStub http;
    private Map<String, String> params;

    @BeforeEach
    void setUp() throws Exception {
        http = new HttpStub();
        when(httpClient.execute(any(HttpUriRequest.class))).thenAnswer(http);
        params = new HashMap<String, String>();
        params.put("target-api-token", "token");
    }

    private GiteaClient client() {
        return new GiteaClient(new MigrationServiceConnector(httpClient, params), "https://gitea.test", "acme/demo");
    }

    private static CreateIssueRequest request(String assignee) {
        return new CreateIssueRequest("Crash on save", "body", true, List.of(1L, 4L), assignee);
    }

    @Test
    @DisplayName("Issue is created as the author with labels and assignee")
    void createIssue() throws Exception {
        http.on("POST", REPO + "/issues?sudo=jdoe", 201,
                "{\"number\":17,\"labels\":[{\"id\":1,\"name\":\"wontfix\"},{\"id\":4,\"name\":\"bug\"}]}");

        CreatedIssue created = client().createIssue(request("mmajor"), "jdoe");

        assertEquals(17, created.getNumber());
        assertEquals(List.of(1L, 4L), created.getLabelIds());
        HttpUriRequest sent = http.lastRequest();
        assertEquals("token token", sent.getFirstHeader("Authorization").getValue());
        JSONObject json = new JSONObject(HttpStub.entity(sent));
        assertEquals("Crash on save", json.getString("title"));
        assertTrue(json.getBoolean("closed"));
        assertEquals(2, json.getJSONArray("labels").length());
        assertEquals(4L, json.getJSONArray("labels").getLong(1));
        assertEquals("mmajor", json.getJSONArray("assignees").getString(0));
    }

    @Test
    @DisplayName("Unassigned issue is created without an assignee list or sudo")
    void createUnassigned() throws Exception {
        http.on("POST", REPO + "/issues", 201, "{\"number\":3,\"labels\":[]}");

        CreatedIssue created = client().createIssue(request(null), null);

        assertEquals(3, created.getNumber());
        assertTrue(created.getLabelIds().isEmpty());
        assertFalse(new JSONObject(HttpStub.entity(http.lastRequest())).has("assignees"));
    }

    @Test
    @DisplayName("Unknown assignee is reported separately from other failures")
    void assigneeRejected() {
        http.on("POST", REPO + "/issues", 422, "{\"message\":\"user does not exist [uid: 0, name: ghost]\"}");

        AssigneeRejectedException e = assertThrows(AssigneeRejectedException.class,
                () -> client().createIssue(request("ghost"), null));
        assertEquals(422, e.getStatusCode());
    }

    @Test
    @DisplayName("Unknown sudo user is not mistaken for a rejected assignee")
    void unknownSudoUser() {
        http.on("POST", REPO + "/issues?sudo=ghost", 404, "{\"message\":\"user does not exist [uid: 0, name: ghost]\"}");

        TargetSystemException e = assertThrows(TargetSystemException.class,
                () -> client().createIssue(request("mmajor"), "ghost"));
        assertFalse(e instanceof AssigneeRejectedException);
        assertEquals(404, e.getStatusCode());
    }

    @Test
    @DisplayName("Unknown user other than the assignee is a plain target failure")
    void unknownOtherUser() {
        http.on("POST", REPO + "/issues", 422, "{\"message\":\"user does not exist [uid: 0, name: jdoe]\"}");

        TargetSystemException e = assertThrows(TargetSystemException.class,
                () -> client().createIssue(request("mmajor"), null));
        assertFalse(e instanceof AssigneeRejectedException);
    }

    @Test
    @DisplayName("Validation failure without assignee is a plain target failure")
    void otherFailure() {
        http.on("POST", REPO + "/issues", 422, "{\"message\":\"title is required\"}");

        TargetSystemException e = assertThrows(TargetSystemException.class,
                () -> client().createIssue(request(null), null));
        assertFalse(e instanceof AssigneeRejectedException);
        assertEquals("{\"message\":\"title is required\"}", e.getResponseBody());
    }

    @Test
    @DisplayName("Comment is posted as the acting user and its id returned")
    void createComment() throws Exception {
        http.on("POST", REPO + "/issues/17/comments?sudo=jan+de+vries", 201, "{\"id\":555,\"body\":\"hi\"}");

        assertEquals(555L, client().createComment(17, "hi", "jan de vries"));
        assertEquals("hi", new JSONObject(HttpStub.entity(http.lastRequest())).getString("body"));
    }

    @Test
    @DisplayName("Bodies and comments are edited with PATCH")
    void edits() throws Exception {
        http.on("PATCH", REPO + "/issues/17", 201, "{\"number\":17}");
        http.on("PATCH", REPO + "/issues/comments/555", 200, "{\"id\":555}");

        GiteaClient client = client();
        client.editIssueBody(17, "new body");
        assertEquals("new body", new JSONObject(HttpStub.entity(http.lastRequest())).getString("body"));
        client.editComment(555, "new comment");
        assertEquals("PATCH", http.lastRequest().getMethod());

        assertThrows(TargetSystemException.class, () -> client.editComment(556, "missing"));
    }

    @Test
    @DisplayName("Labels are added and read back as ids")
    void labels() throws Exception {
        String labels = "[{\"id\":1,\"name\":\"wontfix\"},{\"id\":4,\"name\":\"bug\"}]";
        http.on("POST", REPO + "/issues/17/labels", 200, labels);
        http.on("GET", REPO + "/issues/17/labels", 200, labels);

        GiteaClient client = client();
        assertEquals(List.of(1L, 4L), client.addLabels(17, List.of(1L, 4L)));
        assertEquals(2, new JSONObject(HttpStub.entity(http.lastRequest())).getJSONArray("labels").length());
        assertEquals(List.of(1L, 4L), client.getLabelIds(17));
    }

    @Test
    @DisplayName("Repository labels are read across pages")
    void listLabelsPaged() throws Exception {
        JSONArray full = new JSONArray();
        for (int i = 1; i <= 50; i++) {
            full.put(new JSONObject().put("id", i).put("name", "label-" + i));
        }
        http.on("GET", REPO + "/labels?page=1&limit=50", 200, full.toString());
        http.on("GET", REPO + "/labels?page=2&limit=50", 200, "[{\"id\":51,\"name\":\"wontfix\"}]");

        Map<String, Long> labels = client().listLabels();

        assertEquals(51, labels.size());
        assertEquals(Long.valueOf(51), labels.get("wontfix"));
        assertEquals(Long.valueOf(7), labels.get("label-7"));
        assertEquals(2, http.getRequests().size());
    }

    @Test
    @DisplayName("Without a token the target uses basic auth")
    void basicAuth() throws Exception {
        params.clear();
        params.put("target-username", "admin");
        params.put("target-password", "pw");
        http.on("GET", REPO + "/issues/1/labels", 200, "[]");

        client().getLabelIds(1);

        assertEquals("Basic YWRtaW46cHc=", http.lastRequest().getFirstHeader("Authorization").getValue());
        assertEquals("application/json", http.lastRequest().getFirstHeader("Accept").getValue());
    }
}
