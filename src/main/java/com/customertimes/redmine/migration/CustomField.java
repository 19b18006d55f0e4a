package com.customertimes.redmine.migration;

public class CustomField {
    private final String name;
    private final String value;

    public CustomField(String name, String value) {
        this.name = name;
        this.value = value;
    }

    public String getName() {
        return name;
    }

    public String getValue() {
        return value;
    }
}
