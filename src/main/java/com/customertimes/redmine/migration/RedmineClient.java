package com.customertimes.redmine.migration;

import org.apache.log4j.Logger;
import org.codehaus.jettison.json.JSONArray;
import org.codehaus.jettison.json.JSONException;
import org.codehaus.jettison.json.JSONObject;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link RedmineSource} over the Redmine REST API.
 */
public class RedmineClient implements RedmineSource {
    private static final Logger logger = Logger.getLogger(RedmineClient.class);

    private final MigrationServiceConnector connector;
    private final String baseUrl;
    private final String projectName;
    private final int pageSize;

    public RedmineClient(MigrationServiceConnector connector, String baseUrl, String projectName, int pageSize) {
        this.connector = connector;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.projectName = projectName;
        this.pageSize = pageSize;
    }

    @Override
    public List<SourceIssue> listIssues() throws SourceSystemException {
        List<SourceIssue> issues = new ArrayList<SourceIssue>();
        try {
            for (JSONObject json : fetchAll("/projects/" + projectName + "/issues.json?status_id=*&sort=id", "issues")) {
                issues.add(RedmineJson.parseIssue(json));
            }
        } catch (JSONException e) {
            throw new SourceSystemException("unexpected issue json", e);
        }
        logger.info("fetched " + issues.size() + " issues of project " + projectName);
        return issues;
    }

    @Override
    public List<ChangeEvent> listJournals(long issueId) throws SourceSystemException {
        JSONObject json = getJson("/issues/" + issueId + ".json?include=journals");
        List<ChangeEvent> events = new ArrayList<ChangeEvent>();
        try {
            JSONArray journals = json.getJSONObject("issue").optJSONArray("journals");
            if (journals != null) {
                for (int i = 0; i < journals.length(); i++) {
                    events.add(RedmineJson.parseJournal(journals.getJSONObject(i)));
                }
            }
        } catch (JSONException e) {
            throw new SourceSystemException("unexpected journal json for issue #" + issueId, e);
        }
        Collections.sort(events, ChangeEvent.CHRONOLOGICAL);
        return events;
    }

    /**
     * Needs an administrator key. Without one the project memberships are used instead, which
     * misses former members.
     */
    @Override
    public Map<String, String> listUsers() throws SourceSystemException {
        Map<String, String> users = new LinkedHashMap<String, String>();
        try {
            for (JSONObject json : fetchAll("/users.json?status=", "users")) {
                users.put(json.getString("id"), (json.optString("firstname") + " " + json.optString("lastname")).trim());
            }
        } catch (ForbiddenException e) {
            logger.warn("no access to the user directory, falling back to project memberships");
            try {
                for (JSONObject json : fetchAll("/projects/" + projectName + "/memberships.json", "memberships")) {
                    JSONObject user = json.optJSONObject("user");
                    if (user != null) {
                        users.put(user.getString("id"), user.getString("name"));
                    }
                }
            } catch (JSONException e2) {
                throw new SourceSystemException("unexpected membership json", e2);
            }
        } catch (JSONException e) {
            throw new SourceSystemException("unexpected user json", e);
        }
        return users;
    }

    @Override
    public Map<String, String> listProjects() throws SourceSystemException {
        return namedTable(fetchAllQuietly("/projects.json", "projects"));
    }

    @Override
    public Map<String, String> listStatuses() throws SourceSystemException {
        return namedTable(getArray("/issue_statuses.json", "issue_statuses"));
    }

    @Override
    public Map<String, String> listTrackers() throws SourceSystemException {
        return namedTable(getArray("/trackers.json", "trackers"));
    }

    @Override
    public Map<String, String> listPriorities() throws SourceSystemException {
        return namedTable(getArray("/enumerations/issue_priorities.json", "issue_priorities"));
    }

    /** Administrator only; journals then name custom fields by id. */
    @Override
    public Map<String, String> listCustomFields() throws SourceSystemException {
        try {
            return namedTable(getArray("/custom_fields.json", "custom_fields"));
        } catch (ForbiddenException e) {
            logger.warn("no access to custom field definitions, history will show their ids");
            return new LinkedHashMap<String, String>();
        }
    }

    @Override
    public String issueUrl(long issueId) {
        return baseUrl + "/issues/" + issueId;
    }

    private List<JSONObject> fetchAllQuietly(String path, String key) throws SourceSystemException {
        try {
            return fetchAll(path, key);
        } catch (JSONException e) {
            throw new SourceSystemException("unexpected " + key + " json", e);
        }
    }

    private List<JSONObject> fetchAll(String path, String key) throws SourceSystemException, JSONException {
        List<JSONObject> result = new ArrayList<JSONObject>();
        String separator = path.contains("?") ? "&" : "?";
        for (int offset = 0;; offset += pageSize) {
            JSONObject page = getJson(path + separator + "limit=" + pageSize + "&offset=" + offset);
            JSONArray items = page.optJSONArray(key);
            if (items == null || items.length() == 0) break;
            for (int i = 0; i < items.length(); i++) {
                result.add(items.getJSONObject(i));
            }
            int total = page.optInt("total_count", -1);
            if (total < 0 || offset + items.length() >= total) break;
        }
        return result;
    }

    private List<JSONObject> getArray(String path, String key) throws SourceSystemException {
        JSONObject json = getJson(path);
        List<JSONObject> result = new ArrayList<JSONObject>();
        try {
            JSONArray items = json.getJSONArray(key);
            for (int i = 0; i < items.length(); i++) {
                result.add(items.getJSONObject(i));
            }
        } catch (JSONException e) {
            throw new SourceSystemException("unexpected " + key + " json", e);
        }
        return result;
    }

    private static Map<String, String> namedTable(List<JSONObject> items) throws SourceSystemException {
        Map<String, String> table = new LinkedHashMap<String, String>();
        try {
            for (JSONObject item : items) {
                table.put(item.getString("id"), item.getString("name"));
            }
        } catch (JSONException e) {
            throw new SourceSystemException("directory entry without id or name", e);
        }
        return table;
    }

    private JSONObject getJson(String path) throws SourceSystemException {
        String url = baseUrl + path;
        MigrationServiceConnector.Response response;
        try {
            response = connector.get(MigrationServiceConnector.SOURCE, url);
        } catch (IOException e) {
            throw new SourceSystemException("GET " + url + " failed", e);
        }
        if (response.statusCode == 401 || response.statusCode == 403) {
            throw new ForbiddenException("GET " + url + " returned " + response.statusCode);
        }
        if (!response.isSuccess()) {
            throw new SourceSystemException("GET " + url + " returned " + response.statusCode + ": " + response.body);
        }
        try {
            return new JSONObject(response.body);
        } catch (JSONException e) {
            throw new SourceSystemException("GET " + url + " did not return json", e);
        }
    }

    static class ForbiddenException extends SourceSystemException {
        ForbiddenException(String message) {
            super(message);
        }
    }
}
