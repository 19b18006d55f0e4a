package com.customertimes.redmine.migration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.List;

/**
 * Read-only snapshot of a Redmine issue as fetched at the start of a run.
 */
public class SourceIssue {
    private final long id;
    private final NamedRef project;
    private final String subject;
    private final String description;
    private final String status;
    private final String tracker;
    private final String priority;
    private final NamedRef author;
    private final NamedRef assignee;
    private final String category;
    private final int doneRatio;
    private final boolean privateIssue;
    private final Date createdOn;
    private final List<CustomField> customFields;

    public SourceIssue(long id, NamedRef project, String subject, String description, String status,
                       String tracker, String priority, NamedRef author, NamedRef assignee, String category,
                       int doneRatio, boolean privateIssue, Date createdOn, List<CustomField> customFields) {
        this.id = id;
        this.project = project;
        this.subject = subject;
        this.description = description == null ? "" : description;
        this.status = status;
        this.tracker = tracker;
        this.priority = priority;
        this.author = author;
        this.assignee = assignee;
        this.category = category;
        this.doneRatio = doneRatio;
        this.privateIssue = privateIssue;
        this.createdOn = createdOn == null ? null : new Date(createdOn.getTime());
        List<CustomField> fields = new ArrayList<CustomField>();
        if (customFields != null) {
            for (CustomField field : customFields) {
                if (field.getValue() != null && !field.getValue().isEmpty()) {
                    fields.add(field);
                }
            }
        }
        this.customFields = Collections.unmodifiableList(fields);
    }

    public long getId() {
        return id;
    }

    public NamedRef getProject() {
        return project;
    }

    public String getSubject() {
        return subject;
    }

    public String getDescription() {
        return description;
    }

    public String getStatus() {
        return status;
    }

    public String getTracker() {
        return tracker;
    }

    public String getPriority() {
        return priority;
    }

    public NamedRef getAuthor() {
        return author;
    }

    /** May be null. */
    public NamedRef getAssignee() {
        return assignee;
    }

    /** May be null. */
    public String getCategory() {
        return category;
    }

    public int getDoneRatio() {
        return doneRatio;
    }

    public boolean isPrivate() {
        return privateIssue;
    }

    public Date getCreatedOn() {
        return createdOn == null ? null : new Date(createdOn.getTime());
    }

    public List<CustomField> getCustomFields() {
        return customFields;
    }
}
