package com.customertimes.redmine.migration;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Kinds of journal detail that are rendered differently. Anything not recognised is {@link #GENERIC}.
 */
public enum PropertyKind {
    STATUS,
    TRACKER,
    PROJECT,
    PRIORITY,
    ASSIGNEE,
    DONE_RATIO,
    RELATION,
    LONG_TEXT,
    GENERIC;

    public static final Set<String> RELATION_NAMES = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(
            "blocks", "blocked", "precedes", "follows", "relates", "duplicates", "duplicated",
            "copied_to", "copied_from")));

    public static PropertyKind of(FieldChange change) {
        String property = change.getProperty();
        String name = change.getName();
        if ("relation".equals(property)) {
            return RELATION;
        }
        if (property != null && !"attr".equals(property)) {
            return GENERIC;
        }
        if (name == null) {
            return GENERIC;
        }
        if (property == null && RELATION_NAMES.contains(name)) {
            return RELATION;
        }
        switch (name) {
            case "status_id":
                return STATUS;
            case "tracker_id":
                return TRACKER;
            case "project_id":
                return PROJECT;
            case "priority_id":
                return PRIORITY;
            case "assigned_to_id":
                return ASSIGNEE;
            case "done_ratio":
                return DONE_RATIO;
            case "subject":
            case "description":
                return LONG_TEXT;
            default:
                return GENERIC;
        }
    }
}
