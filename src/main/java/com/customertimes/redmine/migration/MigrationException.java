package com.customertimes.redmine.migration;

/**
 * Fatal migration failure. Anything thrown as a MigrationException aborts the run
 * before the reference rewrite pass.
 */
public class MigrationException extends Exception {

    public MigrationException(String message) {
        super(message);
    }

    public MigrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
