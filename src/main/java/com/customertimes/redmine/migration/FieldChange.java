package com.customertimes.redmine.migration;

/**
 * One journal detail: {@code property} is Redmine's detail kind (attr, relation, cf, attachment),
 * {@code name} the attribute within it (status_id, blocks, a custom field id, ...).
 * Values are raw and may be null.
 */
public class FieldChange {
    private final String property;
    private final String name;
    private final String oldValue;
    private final String newValue;

    public FieldChange(String property, String name, String oldValue, String newValue) {
        this.property = property;
        this.name = name;
        this.oldValue = oldValue;
        this.newValue = newValue;
    }

    public String getProperty() {
        return property;
    }

    public String getName() {
        return name;
    }

    public String getOldValue() {
        return oldValue;
    }

    public String getNewValue() {
        return newValue;
    }
}
