package io.secondbrain.tier;

import org.jobrunr.jobs.annotations.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * The tier sweep as it runs inside JobRunr.
 */
@Component
public class RebalanceJob {

    private static final Logger log = LoggerFactory.getLogger(RebalanceJob.class);

    private final TieringManager tieringManager;

    public RebalanceJob(TieringManager tieringManager) {
        this.tieringManager = tieringManager;
    }

    @Job(name = "Rebalance memory tiers", retries = 1)
    public void execute() {
        RebalanceResult result = tieringManager.rebalance();
        if (result.demoted() > 0 || result.promoted() > 0) {
            log.info("Rebalance moved {} memories", result.demoted() + result.promoted());
        }
    }
}
