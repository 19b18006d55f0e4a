package com.customertimes.redmine.migration;

/**
 * Non-success response (or transport failure) from Gitea.
 */
public class TargetSystemException extends MigrationException {
    private final int statusCode;
    private final String responseBody;

    public TargetSystemException(String message, int statusCode, String responseBody) {
        super(message + " (" + statusCode + "): " + responseBody);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public TargetSystemException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
        this.responseBody = null;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
