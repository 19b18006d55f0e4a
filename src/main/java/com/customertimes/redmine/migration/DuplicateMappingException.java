package com.customertimes.redmine.migration;

public class DuplicateMappingException extends MigrationException {

    public DuplicateMappingException(String message) {
        super(message);
    }
}
