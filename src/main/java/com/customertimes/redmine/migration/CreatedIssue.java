package com.customertimes.redmine.migration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Gitea's answer to an issue creation: the assigned number and the labels it reports.
 */
public class CreatedIssue {
    private final long number;
    private final List<Long> labelIds;

    public CreatedIssue(long number, List<Long> labelIds) {
        this.number = number;
        this.labelIds = Collections.unmodifiableList(new ArrayList<Long>(labelIds));
    }

    public long getNumber() {
        return number;
    }

    public List<Long> getLabelIds() {
        return labelIds;
    }
}
