package com.customertimes.redmine.migration;

import org.apache.log4j.Logger;

import java.util.List;

/**
 * Gitea may attach labels some time after the issue is created. The reconciler re-asserts the
 * intended label set until the issue reports it, with a capped number of attempts.
 */
public class LabelReconciler {
    private static final Logger logger = Logger.getLogger(LabelReconciler.class);

    private final GiteaTarget target;
    private final int maxAttempts;
    private final long initialIntervalMillis;
    private final long maxIntervalMillis;

    public LabelReconciler(GiteaTarget target, int maxAttempts, long initialIntervalMillis, long maxIntervalMillis) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.target = target;
        this.maxAttempts = maxAttempts;
        this.initialIntervalMillis = initialIntervalMillis;
        this.maxIntervalMillis = Math.max(initialIntervalMillis, maxIntervalMillis);
    }

    /**
     * @param observed label ids reported by the creation response
     * @return number of repair attempts that were needed
     * @throws LabelReconciliationException when the labels still differ after the last attempt
     */
    public int reconcile(long issueNumber, LabelSpec intended, List<Long> observed) throws MigrationException {
        if (intended.matches(observed)) {
            return 0;
        }
        long interval = initialIntervalMillis;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            logger.info("labels of issue #" + issueNumber + " are " + observed + ", expected " + intended.getIds()
                    + " (attempt " + attempt + "/" + maxAttempts + ")");
            target.addLabels(issueNumber, intended.getIds());
            sleep(interval);
            observed = target.getLabelIds(issueNumber);
            if (intended.matches(observed)) {
                return attempt;
            }
            interval = Math.min(interval * 2, maxIntervalMillis);
        }
        throw new LabelReconciliationException("labels of issue #" + issueNumber + " did not converge to "
                + intended + " after " + maxAttempts + " attempts, last seen " + observed);
    }

    private void sleep(long millis) throws LabelReconciliationException {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LabelReconciliationException("interrupted while waiting for labels", e);
        }
    }
}
