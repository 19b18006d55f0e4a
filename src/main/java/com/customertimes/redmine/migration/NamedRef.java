package com.customertimes.redmine.migration;

/**
 * Redmine's {id, name} pair, used for users, projects and other directory entries.
 */
public class NamedRef {
    private final String id;
    private final String name;

    public NamedRef(String id, String name) {
        this.id = id;
        this.name = name;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return name + " (" + id + ")";
    }
}
