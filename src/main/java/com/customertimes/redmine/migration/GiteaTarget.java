package com.customertimes.redmine.migration;

import java.util.List;
import java.util.Map;

/**
 * Operations the migration needs from the Gitea repository it writes into.
 */
public interface GiteaTarget {

    /**
     * @param sudo username to create the issue as, or null to post as the API user
     * @throws AssigneeRejectedException if the assignee is unknown to Gitea; nothing was created
     */
    CreatedIssue createIssue(CreateIssueRequest request, String sudo) throws TargetSystemException;

    /** @return the id of the new comment */
    long createComment(long issueNumber, String body, String sudo) throws TargetSystemException;

    void editIssueBody(long issueNumber, String body) throws TargetSystemException;

    void editComment(long commentId, String body) throws TargetSystemException;

    /** Adds labels and returns the label ids the issue reports afterwards. */
    List<Long> addLabels(long issueNumber, List<Long> labelIds) throws TargetSystemException;

    List<Long> getLabelIds(long issueNumber) throws TargetSystemException;

    /** Repository labels, name to id. */
    Map<String, Long> listLabels() throws TargetSystemException;

    String getRepository();
}
