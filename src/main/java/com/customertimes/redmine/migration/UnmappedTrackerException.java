package com.customertimes.redmine.migration;

public class UnmappedTrackerException extends MigrationException {
    private final String tracker;

    public UnmappedTrackerException(String tracker) {
        super("tracker <" + tracker + "> has no label mapping");
        this.tracker = tracker;
    }

    public String getTracker() {
        return tracker;
    }
}
