package com.customertimes.redmine.migration;

import org.codehaus.jettison.json.JSONArray;
import org.codehaus.jettison.json.JSONException;
import org.codehaus.jettison.json.JSONObject;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/**
 * Reads Redmine REST API objects into the migration model.
 */
final class RedmineJson {

    private RedmineJson() {
    }

    static SourceIssue parseIssue(JSONObject json) throws JSONException {
        List<CustomField> customFields = new ArrayList<CustomField>();
        JSONArray jsonFields = json.optJSONArray("custom_fields");
        if (jsonFields != null) {
            for (int i = 0; i < jsonFields.length(); i++) {
                JSONObject jsonField = jsonFields.getJSONObject(i);
                customFields.add(new CustomField(jsonField.getString("name"), fieldValue(jsonField)));
            }
        }
        JSONObject category = json.optJSONObject("category");
        return new SourceIssue(
                json.getLong("id"),
                namedRef(json.optJSONObject("project")),
                json.getString("subject"),
                string(json, "description"),
                name(json, "status"),
                name(json, "tracker"),
                name(json, "priority"),
                namedRef(json.optJSONObject("author")),
                namedRef(json.optJSONObject("assigned_to")),
                category != null ? string(category, "name") : null,
                json.optInt("done_ratio", 0),
                json.optBoolean("is_private", false),
                parseDate(string(json, "created_on")),
                customFields);
    }

    static ChangeEvent parseJournal(JSONObject json) throws JSONException {
        List<FieldChange> changes = new ArrayList<FieldChange>();
        JSONArray details = json.optJSONArray("details");
        if (details != null) {
            for (int i = 0; i < details.length(); i++) {
                JSONObject detail = details.getJSONObject(i);
                changes.add(new FieldChange(string(detail, "property"), string(detail, "name"),
                        string(detail, "old_value"), string(detail, "new_value")));
            }
        }
        return new ChangeEvent(
                json.getLong("id"),
                changes,
                string(json, "notes"),
                namedRef(json.optJSONObject("user")),
                parseDate(json.getString("created_on")),
                json.optBoolean("private_notes", false));
    }

    /** Multi-value custom fields come as arrays and are joined with commas. */
    private static String fieldValue(JSONObject jsonField) throws JSONException {
        if (jsonField.isNull("value")) {
            return null;
        }
        JSONArray values = jsonField.optJSONArray("value");
        if (values == null) {
            return jsonField.getString("value");
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < values.length(); i++) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(values.getString(i));
        }
        return sb.toString();
    }

    static NamedRef namedRef(JSONObject json) throws JSONException {
        if (json == null) {
            return null;
        }
        return new NamedRef(json.getString("id"), string(json, "name"));
    }

    private static String name(JSONObject json, String key) throws JSONException {
        JSONObject ref = json.optJSONObject(key);
        return ref == null ? null : string(ref, "name");
    }

    /** Null for a missing key or JSON null, the text otherwise. */
    static String string(JSONObject json, String key) throws JSONException {
        if (json.isNull(key)) {
            return null;
        }
        return json.getString(key);
    }

    static Date parseDate(String value) throws JSONException {
        if (value == null) {
            return null;
        }
        try {
            return Date.from(OffsetDateTime.parse(value).toInstant());
        } catch (DateTimeParseException e) {
            throw new JSONException("bad timestamp " + value);
        }
    }
}
