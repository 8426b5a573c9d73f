package io.secondbrain.tier;

import io.secondbrain.config.SecondBrainProperties;
import org.jobrunr.scheduling.JobScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Manages the tier rebalance recurring job via JobRunr.
 * On application startup, registers a recurring job that sweeps all memories into their policy tier
 * every {@code secondbrain.tiering.rebalance-interval-minutes}.
 */
@Service
public class RebalanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(RebalanceScheduler.class);
    static final String REBALANCE_JOB_ID = "memory-tier-rebalance";

    private final JobScheduler jobScheduler;
    private final RebalanceJob rebalanceJob;
    private final Duration interval;
    private final boolean enabled;

    public RebalanceScheduler(JobScheduler jobScheduler, RebalanceJob rebalanceJob, SecondBrainProperties properties) {
        this.jobScheduler = jobScheduler;
        this.rebalanceJob = rebalanceJob;
        this.interval = rebalanceInterval(properties.tiering().rebalanceIntervalMinutes());
        this.enabled = properties.tiering().enabled();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!enabled) {
            log.info("Tier rebalance disabled via configuration");
            return;
        }

        jobScheduler.<RebalanceJob>scheduleRecurrently(REBALANCE_JOB_ID, interval, x -> x.execute());
        log.info("Tier rebalance job registered every {}", interval);
    }

    /**
     * Runs a rebalance immediately, outside the schedule.
     */
    public void triggerNow() {
        log.info("Triggering immediate tier rebalance");
        rebalanceJob.execute();
    }

    /**
     * Cancels the recurring rebalance job.
     */
    public void stop() {
        jobScheduler.deleteRecurringJob(REBALANCE_JOB_ID);
        log.info("Tier rebalance job stopped");
    }

    static Duration rebalanceInterval(int intervalMinutes) {
        if (intervalMinutes <= 0) throw new IllegalArgumentException("Interval must be positive");
        return Duration.ofMinutes(intervalMinutes);
    }
}
