package com.customertimes.redmine.migration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Maps Redmine vocabulary (tracker, status, users) onto Gitea labels, the closed flag and usernames.
 */
public class FieldTranslator {
    private final Map<String, String> trackerLabels;
    private final Set<String> closedStatuses;
    private final String rejectedStatus;
    private final String rejectedLabel;
    private final Map<String, String> userMap;
    private final String fallbackUsername;
    private final boolean deriveUsernames;

    public FieldTranslator(Map<String, String> trackerLabels, Set<String> closedStatuses, String rejectedStatus,
                           String rejectedLabel, Map<String, String> userMap, String fallbackUsername,
                           boolean deriveUsernames) {
        this.trackerLabels = new HashMap<String, String>(trackerLabels);
        this.closedStatuses = new HashSet<String>(closedStatuses);
        this.rejectedStatus = rejectedStatus;
        this.rejectedLabel = rejectedLabel;
        this.userMap = new HashMap<String, String>(userMap);
        this.fallbackUsername = fallbackUsername == null ? "" : fallbackUsername;
        this.deriveUsernames = deriveUsernames;
    }

    /**
     * Label names for an issue: the tracker's type label, plus the rejected label when the
     * status is the rejected one. Sorted.
     */
    public List<String> labelNames(String tracker, String status) throws UnmappedTrackerException {
        String typeLabel = trackerLabels.get(tracker);
        if (typeLabel == null) {
            throw new UnmappedTrackerException(tracker);
        }
        TreeSet<String> names = new TreeSet<String>();
        names.add(typeLabel);
        if (rejectedStatus != null && rejectedStatus.equals(status) && rejectedLabel != null) {
            names.add(rejectedLabel);
        }
        return Collections.unmodifiableList(new ArrayList<String>(names));
    }

    public LabelSpec labelSpec(SourceIssue issue, Map<String, Long> repositoryLabels) throws MigrationException {
        return LabelSpec.resolve(labelNames(issue.getTracker(), issue.getStatus()), repositoryLabels);
    }

    public boolean isClosed(String status) {
        return closedStatuses.contains(status);
    }

    /**
     * Gitea username for a Redmine user: the mapped name, a name derived from the display name
     * when enabled, the fallback username, or an empty string when none is configured.
     */
    public String toUsername(NamedRef user) {
        String username = mappedUsername(user);
        return username != null ? username : fallbackUsername;
    }

    /** True when {@link #toUsername} does not have to fall back to the default username. */
    public boolean isMapped(NamedRef user) {
        return mappedUsername(user) != null;
    }

    private String mappedUsername(NamedRef user) {
        if (user == null || user.getName() == null) {
            return null;
        }
        String username = userMap.get(user.getName());
        if (username == null && deriveUsernames) {
            username = deriveUsername(user.getName());
        }
        return username == null || username.isEmpty() ? null : username;
    }

    /**
     * "Jan van Dijk" becomes "jvdijk": first initial, initial of the first infix word, last name.
     */
    static String deriveUsername(String displayName) {
        String[] parts = displayName.trim().split("\\s+");
        if (parts.length == 0 || parts[0].isEmpty()) {
            return null;
        }
        if (parts.length == 1) {
            return parts[0].toLowerCase(Locale.ROOT);
        }
        StringBuilder sb = new StringBuilder();
        sb.append(parts[0].charAt(0));
        if (parts.length > 2) {
            sb.append(parts[1].charAt(0));
        }
        sb.append(parts[parts.length - 1]);
        return sb.toString().toLowerCase(Locale.ROOT);
    }
}
