package com.customertimes.redmine.migration;

import org.apache.log4j.Logger;
import org.codehaus.jettison.json.JSONArray;
import org.codehaus.jettison.json.JSONException;
import org.codehaus.jettison.json.JSONObject;

import java.io.IOException;
import java.io.UnsupportedEncodingException;
import java.net.URLEncoder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * {@link GiteaTarget} over the Gitea v1 REST API.
 */
public class GiteaClient implements GiteaTarget {
    private static final Logger logger = Logger.getLogger(GiteaClient.class);

    private static final int LABEL_PAGE_SIZE = 50;

    private final MigrationServiceConnector connector;
    private final String repository;
    private final String repoUrl;

    public GiteaClient(MigrationServiceConnector connector, String baseUrl, String repository) {
        this.connector = connector;
        this.repository = repository;
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.repoUrl = base + "/api/v1/repos/" + repository;
    }

    @Override
    public String getRepository() {
        return repository;
    }

    @Override
    public CreatedIssue createIssue(CreateIssueRequest request, String sudo) throws TargetSystemException {
        String json;
        try {
            JSONObject jsonBody = new JSONObject();
            jsonBody.put("title", request.getTitle());
            jsonBody.put("body", request.getBody());
            jsonBody.put("closed", request.isClosed());
            jsonBody.put("labels", idArray(request.getLabelIds()));
            if (request.getAssignee() != null) {
                JSONArray assignees = new JSONArray();
                assignees.put(request.getAssignee());
                jsonBody.put("assignees", assignees);
            }
            json = jsonBody.toString();
        } catch (JSONException e) {
            throw new TargetSystemException("cannot build issue request", e);
        }
        String url = repoUrl + "/issues" + sudoQuery(sudo);
        MigrationServiceConnector.Response response = post(url, json);
        if (!response.isSuccess()) {
            if (request.getAssignee() != null && isUnknownAssignee(response, request.getAssignee())) {
                throw new AssigneeRejectedException(response.statusCode, response.body);
            }
            throw new TargetSystemException("POST " + url + " failed", response.statusCode, response.body);
        }
        try {
            JSONObject created = new JSONObject(response.body);
            return new CreatedIssue(created.getLong("number"), labelIds(created.optJSONArray("labels")));
        } catch (JSONException e) {
            throw new TargetSystemException("unexpected issue json from " + url, e);
        }
    }

    /**
     * Gitea answers 422 naming the assignee it cannot find. An unknown sudo user is a 404 and is
     * not an assignee problem.
     */
    private static boolean isUnknownAssignee(MigrationServiceConnector.Response response, String assignee) {
        if (response.statusCode != 422 || response.body == null) {
            return false;
        }
        String body = response.body.toLowerCase(Locale.ROOT);
        return (body.contains("user does not exist") || body.contains("user not exist"))
                && body.contains(assignee.toLowerCase(Locale.ROOT));
    }

    @Override
    public long createComment(long issueNumber, String body, String sudo) throws TargetSystemException {
        String url = repoUrl + "/issues/" + issueNumber + "/comments" + sudoQuery(sudo);
        MigrationServiceConnector.Response response = post(url, bodyJson(body));
        if (!response.isSuccess()) {
            throw new TargetSystemException("POST " + url + " failed", response.statusCode, response.body);
        }
        try {
            return new JSONObject(response.body).getLong("id");
        } catch (JSONException e) {
            throw new TargetSystemException("unexpected comment json from " + url, e);
        }
    }

    @Override
    public void editIssueBody(long issueNumber, String body) throws TargetSystemException {
        patch(repoUrl + "/issues/" + issueNumber, bodyJson(body));
    }

    @Override
    public void editComment(long commentId, String body) throws TargetSystemException {
        patch(repoUrl + "/issues/comments/" + commentId, bodyJson(body));
    }

    @Override
    public List<Long> addLabels(long issueNumber, List<Long> labelIds) throws TargetSystemException {
        String url = repoUrl + "/issues/" + issueNumber + "/labels";
        String json;
        try {
            JSONObject jsonBody = new JSONObject();
            jsonBody.put("labels", idArray(labelIds));
            json = jsonBody.toString();
        } catch (JSONException e) {
            throw new TargetSystemException("cannot build label request", e);
        }
        MigrationServiceConnector.Response response = post(url, json);
        if (!response.isSuccess()) {
            throw new TargetSystemException("POST " + url + " failed", response.statusCode, response.body);
        }
        return parseLabelIds(url, response.body);
    }

    @Override
    public List<Long> getLabelIds(long issueNumber) throws TargetSystemException {
        String url = repoUrl + "/issues/" + issueNumber + "/labels";
        MigrationServiceConnector.Response response = get(url);
        if (!response.isSuccess()) {
            throw new TargetSystemException("GET " + url + " failed", response.statusCode, response.body);
        }
        return parseLabelIds(url, response.body);
    }

    @Override
    public Map<String, Long> listLabels() throws TargetSystemException {
        Map<String, Long> labels = new LinkedHashMap<String, Long>();
        for (int page = 1;; page++) {
            String url = repoUrl + "/labels?page=" + page + "&limit=" + LABEL_PAGE_SIZE;
            MigrationServiceConnector.Response response = get(url);
            if (!response.isSuccess()) {
                throw new TargetSystemException("GET " + url + " failed", response.statusCode, response.body);
            }
            try {
                JSONArray jsonLabels = new JSONArray(response.body);
                for (int i = 0; i < jsonLabels.length(); i++) {
                    JSONObject label = jsonLabels.getJSONObject(i);
                    labels.put(label.getString("name"), label.getLong("id"));
                }
                if (jsonLabels.length() < LABEL_PAGE_SIZE) break;
            } catch (JSONException e) {
                throw new TargetSystemException("unexpected label json from " + url, e);
            }
        }
        logger.info("repository " + repository + " has labels " + labels.keySet());
        return labels;
    }

    private List<Long> parseLabelIds(String url, String body) throws TargetSystemException {
        try {
            return labelIds(new JSONArray(body));
        } catch (JSONException e) {
            throw new TargetSystemException("unexpected label json from " + url, e);
        }
    }

    private static List<Long> labelIds(JSONArray jsonLabels) throws JSONException {
        List<Long> ids = new ArrayList<Long>();
        if (jsonLabels == null) {
            return ids;
        }
        for (int i = 0; i < jsonLabels.length(); i++) {
            ids.add(jsonLabels.getJSONObject(i).getLong("id"));
        }
        return ids;
    }

    private static JSONArray idArray(List<Long> ids) {
        JSONArray array = new JSONArray();
        for (Long id : ids) {
            array.put(id);
        }
        return array;
    }

    private static String bodyJson(String body) throws TargetSystemException {
        try {
            JSONObject jsonBody = new JSONObject();
            jsonBody.put("body", body);
            return jsonBody.toString();
        } catch (JSONException e) {
            throw new TargetSystemException("cannot build body request", e);
        }
    }

    private static String sudoQuery(String sudo) throws TargetSystemException {
        if (sudo == null || sudo.isEmpty()) {
            return "";
        }
        try {
            return "?sudo=" + URLEncoder.encode(sudo, "UTF-8");
        } catch (UnsupportedEncodingException e) {
            throw new TargetSystemException("cannot encode sudo user " + sudo, e);
        }
    }

    private void patch(String url, String json) throws TargetSystemException {
        MigrationServiceConnector.Response response;
        try {
            response = connector.patchJson(MigrationServiceConnector.TARGET, url, json);
        } catch (IOException e) {
            throw new TargetSystemException("PATCH " + url + " failed", e);
        }
        if (!response.isSuccess()) {
            throw new TargetSystemException("PATCH " + url + " failed", response.statusCode, response.body);
        }
    }

    private MigrationServiceConnector.Response post(String url, String json) throws TargetSystemException {
        try {
            return connector.postJson(MigrationServiceConnector.TARGET, url, json);
        } catch (IOException e) {
            throw new TargetSystemException("POST " + url + " failed", e);
        }
    }

    private MigrationServiceConnector.Response get(String url) throws TargetSystemException {
        try {
            return connector.get(MigrationServiceConnector.TARGET, url);
        } catch (IOException e) {
            throw new TargetSystemException("GET " + url + " failed", e);
        }
    }
}
