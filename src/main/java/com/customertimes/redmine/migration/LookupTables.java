package com.customertimes.redmine.migration;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Redmine id to name tables needed to render journal details. All tables are keyed by
 * the id as it appears in journal values (a decimal string).
 */
public class LookupTables {
    private final Map<String, String> statuses;
    private final Map<String, String> trackers;
    private final Map<String, String> projects;
    private final Map<String, String> priorities;
    private final Map<String, String> users;
    private final Map<String, String> customFields;

    public LookupTables(Map<String, String> statuses, Map<String, String> trackers, Map<String, String> projects,
                        Map<String, String> priorities, Map<String, String> users,
                        Map<String, String> customFields) {
        this.statuses = copy(statuses);
        this.trackers = copy(trackers);
        this.projects = copy(projects);
        this.priorities = copy(priorities);
        this.users = copy(users);
        this.customFields = copy(customFields);
    }

    private static Map<String, String> copy(Map<String, String> map) {
        if (map == null) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new HashMap<String, String>(map));
    }

    public Map<String, String> getStatuses() {
        return statuses;
    }

    public Map<String, String> getTrackers() {
        return trackers;
    }

    public Map<String, String> getProjects() {
        return projects;
    }

    public Map<String, String> getPriorities() {
        return priorities;
    }

    public Map<String, String> getUsers() {
        return users;
    }

    public Map<String, String> getCustomFields() {
        return customFields;
    }
}
