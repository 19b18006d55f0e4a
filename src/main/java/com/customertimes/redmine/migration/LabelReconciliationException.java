package com.customertimes.redmine.migration;

public class LabelReconciliationException extends MigrationException {

    public LabelReconciliationException(String message) {
        super(message);
    }

    public LabelReconciliationException(String message, Throwable cause) {
        super(message, cause);
    }
}
