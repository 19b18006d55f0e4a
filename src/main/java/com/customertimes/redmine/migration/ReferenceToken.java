package com.customertimes.redmine.migration;

/**
 * A {@code #123} style mention of a Redmine issue found in text.
 */
public class ReferenceToken {
    private final String token;
    private final long sourceId;

    public ReferenceToken(String token, long sourceId) {
        this.token = token;
        this.sourceId = sourceId;
    }

    public String getToken() {
        return token;
    }

    public long getSourceId() {
        return sourceId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReferenceToken)) return false;
        ReferenceToken that = (ReferenceToken) o;
        return sourceId == that.sourceId && token.equals(that.token);
    }

    @Override
    public int hashCode() {
        return 31 * token.hashCode() + Long.hashCode(sourceId);
    }

    @Override
    public String toString() {
        return token;
    }
}
