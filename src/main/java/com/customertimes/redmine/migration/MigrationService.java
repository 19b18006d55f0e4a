package com.customertimes.redmine.migration;

import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Migrates a Redmine project into a Gitea repository in two phases. Phase one creates every
 * issue with its journals as comments and records the Redmine id to Gitea number mapping.
 * Phase two, which only starts once phase one is complete, rewrites {@code #id} mentions
 * captured along the way.
 */
public class MigrationService {
    private static final Logger logger = Logger.getLogger(MigrationService.class);

    private final MigrationConfig config;
    private final RedmineSource source;
    private final GiteaTarget target;
    private final FieldTranslator translator;
    private final IssueBodyComposer composer;
    private final ReferenceScanner scanner;
    private final ReferenceRewriter rewriter;
    private final LabelReconciler reconciler;

    public MigrationService(MigrationConfig config, RedmineSource source, GiteaTarget target) {
        this.config = config;
        this.source = source;
        this.target = target;
        this.translator = new FieldTranslator(config.getTrackerMap(), config.getClosedStatuses(),
                config.getRejectedStatus(), config.getRejectedLabel(), config.getUserMap(),
                config.getFallbackUsername(), config.isDeriveUsernames());
        this.composer = new IssueBodyComposer(source, config.getDateFormat(), config.getTimeZone());
        this.scanner = new ReferenceScanner(target.getRepository());
        this.rewriter = new ReferenceRewriter(target);
        this.reconciler = new LabelReconciler(target, config.getLabelMaxAttempts(),
                config.getLabelRetryIntervalMillis(), config.getLabelMaxIntervalMillis());
    }

    public static void main(String args[]) {
        try {
            MigrationConfig config = MigrationConfig.load();
            MigrationServiceConnector connector = new MigrationServiceConnector(config.getInitParams());
            RedmineSource source = new RedmineClient(connector, config.get("source-redmine-url"),
                    config.get("source-project-name"), config.getPageSize());
            GiteaTarget target = new GiteaClient(connector, config.get("target-gitea-url"), config.getRepository());
            new MigrationService(config, source, target).run();
        } catch (MigrationException e) {
            logger.error("migration aborted: " + e.getMessage(), e);
            logger.error("the registry file holds the progress made so far, run again to resume");
            System.exit(1);
        }
    }

    public MigrationContext run() throws MigrationException {
        long timeoutMinutes = config.getRunTimeoutMinutes();
        long deadline = timeoutMinutes > 0 ? System.currentTimeMillis() + timeoutMinutes * 60000L : Long.MAX_VALUE;

        MigrationContext context = prepare();
        List<SourceIssue> issues = source.listIssues();
        logger.info("migration of " + issues.size() + " issues to " + target.getRepository());
        for (SourceIssue issue : issues) {
            if (System.currentTimeMillis() > deadline) {
                throw new MigrationException("run timeout of " + timeoutMinutes + " minutes exceeded after "
                        + context.getMigrated() + " issues");
            }
            migrateIssue(issue, context);
        }

        context.getRegistry().close();
        RewriteReport report = rewriter.rewrite(context.getDeferred(), context.getRegistry());
        context.setRewriteReport(report);
        context.clearPending();
        logSummary(context);
        return context;
    }

    private MigrationContext prepare() throws MigrationException {
        IdentifierRegistry registry = new IdentifierRegistry(config.getRegistryFile());
        int loaded = registry.load();
        if (loaded > 0) {
            logger.info("resuming, " + loaded + " issues were migrated by a previous run");
        }
        IssueProgressStore progress = new IssueProgressStore(config.getProgressFile());
        progress.load();
        PendingReferenceStore pendingStore = new PendingReferenceStore(config.getPendingReferencesFile());
        List<DeferredReference> pending = pendingStore.load();
        Map<String, Long> labels = target.listLabels();
        LookupTables tables = new LookupTables(source.listStatuses(), source.listTrackers(), source.listProjects(),
                source.listPriorities(), source.listUsers(), source.listCustomFields());
        return new MigrationContext(registry, pendingStore, progress, labels, tables, pending);
    }

    void migrateIssue(SourceIssue issue, MigrationContext context) throws MigrationException {
        IdentifierRegistry registry = context.getRegistry();
        IssueProgressStore progress = context.getProgress();
        long id = issue.getId();
        if (issue.isPrivate()) {
            logger.info("skipping private issue #" + id);
            context.issueSkipped();
            return;
        }
        boolean finishing = registry.contains(id);
        if (finishing && !progress.isIncomplete(id)) {
            logger.info("issue #" + id + " was already migrated to #" + registry.resolve(id));
            context.issueResumed();
            return;
        }

        LabelSpec labels = translator.labelSpec(issue, context.getRepositoryLabels());
        String body = composer.compose(issue);
        long number;
        List<Long> observed;
        if (finishing) {
            number = registry.resolve(id);
            logger.info("finishing issue #" + id + ", created as #" + number + " by a previous run");
            observed = target.getLabelIds(number);
        } else {
            String assignee = issue.getAssignee() != null ? translator.toUsername(issue.getAssignee()) : "";
            CreateIssueRequest request = new CreateIssueRequest(issue.getSubject(), body,
                    translator.isClosed(issue.getStatus()), labels.getIds(), assignee.isEmpty() ? null : assignee);
            progress.start(id);
            CreatedIssue created = create(request, sudo(issue.getAuthor()), issue, context);
            number = created.getNumber();
            registry.record(id, number);
            observed = created.getLabelIds();
        }

        if (!progress.isBodyCaptured(id)) {
            context.defer(scanner.capture(body, number, null));
            progress.bodyCaptured(id);
        }
        reconciler.reconcile(number, labels, observed);
        int posted = postJournals(issue, number, context);
        progress.complete(id);

        if (finishing) {
            context.issueCompleted();
        } else {
            context.issueMigrated();
        }
        logger.info("migrated issue #" + id + " to #" + number + " with " + posted + " comments");
    }

    /**
     * Posts the journals of an issue in chronological order, leaving out those a previous run
     * already posted. Private notes are dropped but the field changes of their journal are kept.
     */
    private int postJournals(SourceIssue issue, long number, MigrationContext context) throws MigrationException {
        IssueProgressStore progress = context.getProgress();
        JournalRenderer renderer = new JournalRenderer(context.getLookupTables(), config.getDateFormat(),
                config.getTimeZone());
        List<ChangeEvent> events = new ArrayList<ChangeEvent>(source.listJournals(issue.getId()));
        Collections.sort(events, ChangeEvent.CHRONOLOGICAL);
        int posted = 0;
        for (ChangeEvent event : events) {
            if (progress.isJournalPosted(issue.getId(), event.getId())) {
                continue;
            }
            ChangeEvent shown = event;
            if (event.isPrivateNotes()) {
                if (event.getChanges().isEmpty()) {
                    logger.debug("skipping private journal " + event.getId() + " of issue #" + issue.getId());
                    continue;
                }
                shown = event.withoutNotes();
            }
            if (shown.isEmpty() && config.isSkipEmptyJournals()) {
                continue;
            }
            boolean fallback = !translator.isMapped(shown.getUser());
            String comment = renderer.render(shown, fallback);
            long commentId = target.createComment(number, comment, sudo(shown.getUser()));
            context.defer(scanner.capture(comment, number, commentId));
            progress.journalPosted(issue.getId(), event.getId());
            posted++;
        }
        return posted;
    }

    private CreatedIssue create(CreateIssueRequest request, String sudo, SourceIssue issue, MigrationContext context)
            throws MigrationException {
        try {
            return target.createIssue(request, sudo);
        } catch (AssigneeRejectedException e) {
            if (request.getAssignee() == null) {
                throw e;
            }
            logger.warn("assignee " + request.getAssignee() + " rejected for issue #" + issue.getId()
                    + ", creating it unassigned");
            context.assigneeDropped();
            return target.createIssue(request.withoutAssignee(), sudo);
        }
    }

    private String sudo(NamedRef user) {
        String username = translator.toUsername(user);
        return username.isEmpty() ? null : username;
    }

    private void logSummary(MigrationContext context) {
        RewriteReport report = context.getRewriteReport();
        logger.info("------ migration summary start ------");
        logger.info("migrated " + context.getMigrated() + " issues, finished " + context.getCompleted()
                + " left over by a previous run, skipped " + context.getSkippedPrivate() + " private, "
                + context.getResumed() + " already migrated, " + context.getUnassigned()
                + " created without assignee");
        logger.info("registry holds " + context.getRegistry().size() + " issue mappings");
        logger.info("rewrote " + report.getRewrittenTokens() + " references in " + report.getUpdatedLocations()
                + " places");
        for (UnresolvedReference unresolved : report.getUnresolved()) {
            logger.warn("unresolved reference " + unresolved);
        }
        logger.info("------ migration summary end ------");
    }
}
