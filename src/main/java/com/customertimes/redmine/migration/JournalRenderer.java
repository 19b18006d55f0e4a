package com.customertimes.redmine.migration;

import org.apache.log4j.Logger;

import java.text.SimpleDateFormat;
import java.util.ArrayList;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TimeZone;

/**
 * Turns a Redmine journal entry into the markdown body of a Gitea comment.
 */
public class JournalRenderer {
    private static final Logger logger = Logger.getLogger(JournalRenderer.class);

    public static final String DEFAULT_DATE_FORMAT = "dd/MMM/yyyy hh:mm aaa z";
    static final String SEPARATOR = "---";
    private static final String NONE = "None";

    private static final Map<String, String> FIELD_LABELS = new HashMap<String, String>();

    static {
        FIELD_LABELS.put("status_id", "Status");
        FIELD_LABELS.put("tracker_id", "Tracker");
        FIELD_LABELS.put("project_id", "Project");
        FIELD_LABELS.put("priority_id", "Priority");
        FIELD_LABELS.put("assigned_to_id", "Assignee");
        FIELD_LABELS.put("done_ratio", "% Done");
        FIELD_LABELS.put("subject", "Subject");
        FIELD_LABELS.put("description", "Description");
        FIELD_LABELS.put("category_id", "Category");
        FIELD_LABELS.put("fixed_version_id", "Target version");
        FIELD_LABELS.put("parent_id", "Parent task");
        FIELD_LABELS.put("start_date", "Start date");
        FIELD_LABELS.put("due_date", "Due date");
        FIELD_LABELS.put("estimated_hours", "Estimated time");
        FIELD_LABELS.put("is_private", "Private");
        FIELD_LABELS.put("blocks", "Blocks");
        FIELD_LABELS.put("blocked", "Blocked by");
        FIELD_LABELS.put("precedes", "Precedes");
        FIELD_LABELS.put("follows", "Follows");
        FIELD_LABELS.put("relates", "Related to");
        FIELD_LABELS.put("duplicates", "Is duplicate of");
        FIELD_LABELS.put("duplicated", "Has duplicate");
        FIELD_LABELS.put("copied_to", "Copied to");
        FIELD_LABELS.put("copied_from", "Copied from");
    }

    private final LookupTables tables;
    private final String datePattern;
    private final TimeZone timeZone;

    public JournalRenderer(LookupTables tables, String datePattern, TimeZone timeZone) {
        this.tables = tables;
        this.datePattern = datePattern == null ? DEFAULT_DATE_FORMAT : datePattern;
        this.timeZone = timeZone;
    }

    /**
     * @param authorFallback true when the comment will be posted as the fallback user, in which
     *                       case a line naming the original author is appended
     */
    public String render(ChangeEvent event, boolean authorFallback) throws JournalRenderException {
        String notes = event.hasNotes() ? normalizeNewlines(event.getNotes()).trim() : "";
        List<String> clauses = new ArrayList<String>();
        for (FieldChange change : event.getChanges()) {
            clauses.add(renderChange(change));
        }

        StringBuilder sb = new StringBuilder();
        sb.append(notes);
        if (!notes.isEmpty() && !clauses.isEmpty()) {
            sb.append("\n\n").append(SEPARATOR).append("\n\n");
        }
        sb.append(String.join("\n", clauses));
        if (sb.length() > 0) {
            sb.append("\n\n");
        }
        sb.append('_').append(formatTimestamp(event.getCreatedOn())).append('_');
        if (authorFallback && event.getUser() != null) {
            sb.append("\n_Originally posted by ").append(event.getUser().getName()).append('_');
        }
        return sb.toString();
    }

    public String formatTimestamp(Date date) {
        SimpleDateFormat format = new SimpleDateFormat(datePattern, Locale.US);
        format.setTimeZone(timeZone);
        return format.format(date);
    }

    String renderChange(FieldChange change) throws JournalRenderException {
        PropertyKind kind = PropertyKind.of(change);
        String oldValue = resolveValue(kind, change.getOldValue());
        String newValue = resolveValue(kind, change.getNewValue());
        String shownOld = oldValue == null || oldValue.isEmpty() ? NONE : oldValue;
        String shownNew = newValue == null ? NONE : newValue;
        String label = fieldLabel(change);

        if (kind == PropertyKind.LONG_TEXT) {
            return "_" + label + " changed from_\n"
                    + quote(shownOld) + "\n\n"
                    + "_to_\n"
                    + quote(shownNew) + "\n";
        }
        return "_" + label + " changed from " + shownOld + " to " + shownNew + "_";
    }

    private String resolveValue(PropertyKind kind, String value) throws JournalRenderException {
        if (value == null || value.isEmpty()) {
            return value;
        }
        switch (kind) {
            case STATUS:
                return resolveCode(tables.getStatuses(), value, "status");
            case TRACKER:
                return resolveCode(tables.getTrackers(), value, "tracker");
            case PROJECT:
                return resolveCode(tables.getProjects(), value, "project");
            case PRIORITY:
                return resolveCode(tables.getPriorities(), value, "priority");
            case ASSIGNEE:
                String user = tables.getUsers().get(value);
                if (user == null) {
                    logger.debug("user " + value + " not found, keeping raw id");
                    return value;
                }
                return user;
            case DONE_RATIO:
                return value + "%";
            case RELATION:
                return "#" + value;
            default:
                return value;
        }
    }

    private String resolveCode(Map<String, String> table, String code, String what) throws JournalRenderException {
        String name = table.get(code);
        if (name == null) {
            throw new JournalRenderException("unknown " + what + " code <" + code + ">");
        }
        return name;
    }

    private String fieldLabel(FieldChange change) {
        String name = change.getName();
        if ("cf".equals(change.getProperty())) {
            String fieldName = tables.getCustomFields().get(name);
            return fieldName != null ? fieldName : "Custom field " + name;
        }
        if ("attachment".equals(change.getProperty())) {
            return "File";
        }
        String label = FIELD_LABELS.get(name);
        return label != null ? label : name;
    }

    private static String quote(String text) {
        return "> " + normalizeNewlines(text).replace("\n", "\n> ");
    }

    static String normalizeNewlines(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\r\n", "\n").replace('\r', '\n');
    }
}
