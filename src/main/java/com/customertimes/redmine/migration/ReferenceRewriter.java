package com.customertimes.redmine.migration;

import org.apache.log4j.Logger;

import java.util.List;
import java.util.regex.Matcher;

/**
 * Second pass: replaces Redmine issue mentions with their Gitea numbers once every issue exists.
 */
public class ReferenceRewriter {
    private static final Logger logger = Logger.getLogger(ReferenceRewriter.class);

    private final GiteaTarget target;

    public ReferenceRewriter(GiteaTarget target) {
        this.target = target;
    }

    public RewriteReport rewrite(List<DeferredReference> references, IdentifierRegistry registry)
            throws MigrationException {
        if (!registry.isClosed()) {
            throw new IllegalStateException("references can only be rewritten once all issues are migrated");
        }
        RewriteReport report = new RewriteReport();
        logger.info("rewriting references in " + references.size() + " locations");
        for (DeferredReference reference : references) {
            rewrite(reference, registry, report);
        }
        return report;
    }

    private void rewrite(DeferredReference reference, IdentifierRegistry registry, RewriteReport report)
            throws MigrationException {
        for (ReferenceToken token : reference.getTokens()) {
            if (registry.resolve(token.getSourceId()) == null) {
                UnresolvedReference unresolved = new UnresolvedReference(reference.describeLocation(),
                        token.getSourceId());
                logger.warn("cannot resolve " + unresolved + ", leaving it as is");
                report.unresolved(unresolved);
            }
        }

        String original = reference.getOriginalText();
        Matcher matcher = ReferenceScanner.TOKEN_PATTERN.matcher(original);
        StringBuffer sb = new StringBuffer();
        int replaced = 0;
        while (matcher.find()) {
            Long targetId = resolve(registry, matcher.group(1));
            String replacement = targetId == null ? matcher.group() : composite(targetId, matcher.group(1));
            if (targetId != null) {
                replaced++;
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);

        if (replaced == 0) {
            return;
        }
        String rewritten = sb.toString();
        if (reference.isIssueBody()) {
            target.editIssueBody(reference.getIssueNumber(), rewritten);
        } else {
            target.editComment(reference.getCommentId(), rewritten);
        }
        report.locationUpdated(replaced);
        logger.info("rewrote " + replaced + " references in " + reference.describeLocation());
    }

    private static Long resolve(IdentifierRegistry registry, String digits) {
        try {
            return registry.resolve(Long.parseLong(digits));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static String composite(long targetId, String sourceId) {
        return "#" + targetId + " (original-id: " + sourceId + ")";
    }
}
