package com.customertimes.redmine.migration;

public class JournalRenderException extends MigrationException {

    public JournalRenderException(String message) {
        super(message);
    }
}
