package com.customertimes.redmine.migration;

public class SourceSystemException extends MigrationException {

    public SourceSystemException(String message) {
        super(message);
    }

    public SourceSystemException(String message, Throwable cause) {
        super(message, cause);
    }
}
