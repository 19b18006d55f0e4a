package com.customertimes.redmine.migration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * State of one migration run: the identifier registry, per-issue progress, the repository label
 * table and the references waiting for the rewrite pass.
 */
public class MigrationContext {
    private final IdentifierRegistry registry;
    private final PendingReferenceStore pendingStore;
    private final IssueProgressStore progress;
    private final Map<String, Long> repositoryLabels;
    private final LookupTables lookupTables;
    private final List<DeferredReference> deferred = new ArrayList<DeferredReference>();
    private int migrated;
    private int skippedPrivate;
    private int resumed;
    private int unassigned;
    private int completed;
    private RewriteReport rewriteReport;

    public MigrationContext(IdentifierRegistry registry, PendingReferenceStore pendingStore,
                            IssueProgressStore progress, Map<String, Long> repositoryLabels,
                            LookupTables lookupTables, List<DeferredReference> pending) {
        this.registry = registry;
        this.pendingStore = pendingStore;
        this.progress = progress;
        this.repositoryLabels = repositoryLabels;
        this.lookupTables = lookupTables;
        this.deferred.addAll(pending);
    }

    public IdentifierRegistry getRegistry() {
        return registry;
    }

    public IssueProgressStore getProgress() {
        return progress;
    }

    public Map<String, Long> getRepositoryLabels() {
        return repositoryLabels;
    }

    public LookupTables getLookupTables() {
        return lookupTables;
    }

    /** Queues a reference for the rewrite pass; null is ignored. */
    void defer(DeferredReference reference) throws MigrationException {
        if (reference == null) {
            return;
        }
        deferred.add(reference);
        pendingStore.save(deferred);
    }

    /** Called once the rewrite pass has consumed every deferred reference. */
    void clearPending() throws MigrationException {
        pendingStore.clear();
    }

    public List<DeferredReference> getDeferred() {
        return Collections.unmodifiableList(deferred);
    }

    void issueMigrated() {
        migrated++;
    }

    void issueSkipped() {
        skippedPrivate++;
    }

    void issueResumed() {
        resumed++;
    }

    void assigneeDropped() {
        unassigned++;
    }

    void issueCompleted() {
        completed++;
    }

    public int getMigrated() {
        return migrated;
    }

    public int getSkippedPrivate() {
        return skippedPrivate;
    }

    public int getResumed() {
        return resumed;
    }

    public int getUnassigned() {
        return unassigned;
    }

    /** Issues left unfinished by an earlier run and finished by this one. */
    public int getCompleted() {
        return completed;
    }

    public RewriteReport getRewriteReport() {
        return rewriteReport;
    }

    void setRewriteReport(RewriteReport rewriteReport) {
        this.rewriteReport = rewriteReport;
    }
}
