package com.customertimes.redmine.migration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Text already posted to Gitea that mentions Redmine issue numbers. The rewrite pass
 * edits it in place once every issue has its Gitea number.
 */
public class DeferredReference {
    private final String repository;
    private final long issueNumber;
    private final Long commentId;
    private final String originalText;
    private final List<ReferenceToken> tokens;

    public DeferredReference(String repository, long issueNumber, Long commentId, String originalText,
                             List<ReferenceToken> tokens) {
        this.repository = repository;
        this.issueNumber = issueNumber;
        this.commentId = commentId;
        this.originalText = originalText;
        this.tokens = Collections.unmodifiableList(new ArrayList<ReferenceToken>(tokens));
    }

    public String getRepository() {
        return repository;
    }

    public long getIssueNumber() {
        return issueNumber;
    }

    /** Null when the reference lives in the issue body. */
    public Long getCommentId() {
        return commentId;
    }

    public boolean isIssueBody() {
        return commentId == null;
    }

    public String getOriginalText() {
        return originalText;
    }

    public List<ReferenceToken> getTokens() {
        return tokens;
    }

    public String describeLocation() {
        if (isIssueBody()) {
            return repository + "#" + issueNumber + " body";
        }
        return repository + "#" + issueNumber + " comment " + commentId;
    }
}
