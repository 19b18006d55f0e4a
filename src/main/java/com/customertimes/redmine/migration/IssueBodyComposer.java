package com.customertimes.redmine.migration;

import java.text.SimpleDateFormat;
import java.util.Locale;
import java.util.TimeZone;

/**
 * Builds the Gitea issue body: imported-metadata table, original description, custom fields.
 */
public class IssueBodyComposer {
    private static final String NONE = "-";

    private final RedmineSource source;
    private final String datePattern;
    private final TimeZone timeZone;

    public IssueBodyComposer(RedmineSource source, String datePattern, TimeZone timeZone) {
        this.source = source;
        this.datePattern = datePattern;
        this.timeZone = timeZone;
    }

    public String compose(SourceIssue issue) {
        StringBuilder sb = new StringBuilder();
        sb.append("## Imported from Redmine\n");
        sb.append("| Property | Value |\n");
        sb.append("| --- | --- |\n");
        row(sb, "ID", "[" + issue.getId() + "](" + source.issueUrl(issue.getId()) + ")");
        row(sb, "Project", issue.getProject() != null ? issue.getProject().getName() : NONE);
        row(sb, "Priority", issue.getPriority());
        row(sb, "Status", issue.getStatus());
        row(sb, "Issue type", issue.getTracker());
        row(sb, "Author", issue.getAuthor() != null ? issue.getAuthor().getName() : NONE);
        row(sb, "Assigned to", issue.getAssignee() != null ? issue.getAssignee().getName() : NONE);
        row(sb, "Category", issue.getCategory());
        row(sb, "Progress", issue.getDoneRatio() + "%");
        row(sb, "Created", issue.getCreatedOn() != null ? formatDate(issue) : NONE);

        sb.append("\n## Description\n");
        sb.append(JournalRenderer.normalizeNewlines(issue.getDescription())).append('\n');

        if (!issue.getCustomFields().isEmpty()) {
            sb.append("\n## Custom fields\n");
            sb.append("| Field | Value |\n");
            sb.append("| --- | --- |\n");
            for (CustomField field : issue.getCustomFields()) {
                row(sb, field.getName(), field.getValue());
            }
        }
        return sb.toString();
    }

    private String formatDate(SourceIssue issue) {
        SimpleDateFormat format = new SimpleDateFormat(datePattern, Locale.US);
        format.setTimeZone(timeZone);
        return format.format(issue.getCreatedOn());
    }

    private static void row(StringBuilder sb, String property, String value) {
        String cell = value == null || value.isEmpty() ? NONE : value.replace("\r", "").replace("\n", " ")
                .replace("|", "\\|");
        sb.append("| ").append(property).append(" | ").append(cell).append(" |\n");
    }
}
