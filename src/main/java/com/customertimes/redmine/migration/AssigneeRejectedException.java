package com.customertimes.redmine.migration;

/**
 * Gitea refused to create an issue because the requested assignee does not exist there.
 * No issue has been created when this is thrown.
 */
public class AssigneeRejectedException extends TargetSystemException {

    public AssigneeRejectedException(int statusCode, String responseBody) {
        super("assignee rejected", statusCode, responseBody);
    }
}
