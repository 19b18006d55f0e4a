package com.customertimes.redmine.migration;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds Redmine issue mentions ({@code #123}) in text posted to Gitea.
 */
public class ReferenceScanner {

    /** Not part of a word, an HTML entity ({@code &#123;}) or a {@code ##} heading run. */
    static final Pattern TOKEN_PATTERN = Pattern.compile("(?<![\\w&#])#(\\d+)(?!\\w)");

    private final String repository;

    public ReferenceScanner(String repository) {
        this.repository = repository;
    }

    /**
     * Distinct tokens in order of first appearance.
     */
    public List<ReferenceToken> scan(String text) {
        if (text == null || text.indexOf('#') < 0) {
            return new ArrayList<ReferenceToken>();
        }
        Set<ReferenceToken> tokens = new LinkedHashSet<ReferenceToken>();
        Matcher matcher = TOKEN_PATTERN.matcher(text);
        while (matcher.find()) {
            try {
                tokens.add(new ReferenceToken(matcher.group(), Long.parseLong(matcher.group(1))));
            } catch (NumberFormatException e) {
                // more digits than a long holds, cannot be an issue id
                continue;
            }
        }
        return new ArrayList<ReferenceToken>(tokens);
    }

    /**
     * Captures the text for the rewrite pass.
     *
     * @param commentId null for the issue body
     * @return the deferred reference, or null when the text mentions no issue
     */
    public DeferredReference capture(String text, long issueNumber, Long commentId) {
        List<ReferenceToken> tokens = scan(text);
        if (tokens.isEmpty()) {
            return null;
        }
        return new DeferredReference(repository, issueNumber, commentId, text, tokens);
    }
}
