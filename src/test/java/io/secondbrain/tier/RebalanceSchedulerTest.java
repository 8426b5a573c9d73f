package io.secondbrain.tier;

import io.secondbrain.config.SecondBrainProperties;
import org.jobrunr.jobs.lambdas.IocJobLambda;
import org.jobrunr.scheduling.JobScheduler;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class RebalanceSchedulerTest {

    private static SecondBrainProperties tiering(int intervalMinutes, boolean enabled) {
        return SecondBrainProperties.defaults().withTiering(
                new SecondBrainProperties.Tiering(null, null, intervalMinutes, enabled, null));
    }

    @Test
    void shouldRejectNonPositiveInterval() {
        assertThrows(IllegalArgumentException.class, () -> RebalanceScheduler.rebalanceInterval(0));
        assertThrows(IllegalArgumentException.class,
                () -> new RebalanceScheduler(mock(JobScheduler.class), mock(RebalanceJob.class), tiering(-5, true)));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldRegisterRecurringJobOnStart() {
        var jobScheduler = mock(JobScheduler.class);
        var scheduler = new RebalanceScheduler(jobScheduler, mock(RebalanceJob.class), tiering(15, true));

        scheduler.start();

        verify(jobScheduler).scheduleRecurrently(eq(RebalanceScheduler.REBALANCE_JOB_ID), eq(Duration.ofMinutes(15)),
                any(IocJobLambda.class));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldKeepExactIntervalsThatCronCannotExpress() {
        var jobScheduler = mock(JobScheduler.class);

        new RebalanceScheduler(jobScheduler, mock(RebalanceJob.class), tiering(45, true)).start();
        new RebalanceScheduler(jobScheduler, mock(RebalanceJob.class), tiering(90, true)).start();

        verify(jobScheduler).scheduleRecurrently(anyString(), eq(Duration.ofMinutes(45)), any(IocJobLambda.class));
        verify(jobScheduler).scheduleRecurrently(anyString(), eq(Duration.ofMinutes(90)), any(IocJobLambda.class));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldNotRegisterWhenDisabled() {
        var jobScheduler = mock(JobScheduler.class);
        var scheduler = new RebalanceScheduler(jobScheduler, mock(RebalanceJob.class), tiering(60, false));

        scheduler.start();

        verify(jobScheduler, never()).scheduleRecurrently(anyString(), any(Duration.class), any(IocJobLambda.class));
    }

    @Test
    void shouldDeleteRecurringJobOnStop() {
        var jobScheduler = mock(JobScheduler.class);
        var scheduler = new RebalanceScheduler(jobScheduler, mock(RebalanceJob.class), tiering(60, true));

        scheduler.stop();

        verify(jobScheduler).deleteRecurringJob(RebalanceScheduler.REBALANCE_JOB_ID);
    }

    @Test
    void shouldRunRebalanceImmediately() {
        var job = mock(RebalanceJob.class);
        var scheduler = new RebalanceScheduler(mock(JobScheduler.class), job, tiering(60, true));

        scheduler.triggerNow();

        verify(job).execute();
    }
}
