package com.customertimes.redmine.migration;

public class UnresolvedReference {
    private final String location;
    private final long sourceId;

    public UnresolvedReference(String location, long sourceId) {
        this.location = location;
        this.sourceId = sourceId;
    }

    public String getLocation() {
        return location;
    }

    public long getSourceId() {
        return sourceId;
    }

    @Override
    public String toString() {
        return "#" + sourceId + " in " + location;
    }
}
