package com.customertimes.redmine.migration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class CreateIssueRequest {
    private final String title;
    private final String body;
    private final boolean closed;
    private final List<Long> labelIds;
    private final String assignee;

    public CreateIssueRequest(String title, String body, boolean closed, List<Long> labelIds, String assignee) {
        this.title = title;
        this.body = body;
        this.closed = closed;
        this.labelIds = Collections.unmodifiableList(new ArrayList<Long>(labelIds));
        this.assignee = assignee;
    }

    public String getTitle() {
        return title;
    }

    public String getBody() {
        return body;
    }

    public boolean isClosed() {
        return closed;
    }

    public List<Long> getLabelIds() {
        return labelIds;
    }

    /** Gitea username, or null to leave the issue unassigned. */
    public String getAssignee() {
        return assignee;
    }

    public CreateIssueRequest withoutAssignee() {
        return new CreateIssueRequest(title, body, closed, labelIds, null);
    }
}
