package com.customertimes.redmine.migration;

import java.util.List;
import java.util.Map;

/**
 * Read access to the Redmine project being migrated. Directory lookups return id to name.
 */
public interface RedmineSource {

    /** Every issue of the project regardless of status, oldest first. */
    List<SourceIssue> listIssues() throws SourceSystemException;

    List<ChangeEvent> listJournals(long issueId) throws SourceSystemException;

    Map<String, String> listUsers() throws SourceSystemException;

    Map<String, String> listProjects() throws SourceSystemException;

    Map<String, String> listStatuses() throws SourceSystemException;

    Map<String, String> listTrackers() throws SourceSystemException;

    Map<String, String> listPriorities() throws SourceSystemException;

    Map<String, String> listCustomFields() throws SourceSystemException;

    /** Browser URL of an issue, used in the imported-metadata table. */
    String issueUrl(long issueId);
}
