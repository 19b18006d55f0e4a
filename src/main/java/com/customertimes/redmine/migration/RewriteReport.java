package com.customertimes.redmine.migration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of the reference rewrite pass.
 */
public class RewriteReport {
    private int updatedLocations;
    private int rewrittenTokens;
    private final List<UnresolvedReference> unresolved = new ArrayList<UnresolvedReference>();

    void locationUpdated(int tokens) {
        updatedLocations++;
        rewrittenTokens += tokens;
    }

    void unresolved(UnresolvedReference reference) {
        unresolved.add(reference);
    }

    public int getUpdatedLocations() {
        return updatedLocations;
    }

    public int getRewrittenTokens() {
        return rewrittenTokens;
    }

    public List<UnresolvedReference> getUnresolved() {
        return Collections.unmodifiableList(unresolved);
    }
}
