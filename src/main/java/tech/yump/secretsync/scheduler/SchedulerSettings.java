package tech.yump.secretsync.scheduler;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;

import java.time.Duration;

/**
 * Tuning of the reconciliation scheduler, bound from {@code sync.scheduler}.
 *
 * @param concurrent       maximum number of passes running at once
 * @param requeueInterval  time between successful passes when a definition sets no refresh interval
 * @param backoffBase      first retry delay after a failure
 * @param backoffCeiling   upper bound of the retry delay
 * @param probeInterval    re-check delay of a definition held back by the flood gate
 * @param passTimeout      deadline of one pass
 * @param floodGateEnabled whether passes wait for their stores to be healthy
 */
public record SchedulerSettings(
        @Min(value = 1, message = "Scheduler concurrency (sync.scheduler.concurrent) must be at least 1.")
        int concurrent,
        Duration requeueInterval,
        Duration backoffBase,
        Duration backoffCeiling,
        Duration probeInterval,
        Duration passTimeout,
        Boolean floodGateEnabled
) {

    public static final int DEFAULT_CONCURRENT = 1;
    public static final Duration DEFAULT_REQUEUE_INTERVAL = Duration.ofMinutes(5);
    public static final Duration DEFAULT_BACKOFF_BASE = Duration.ofSeconds(5);
    public static final Duration DEFAULT_BACKOFF_CEILING = Duration.ofMinutes(5);
    public static final Duration DEFAULT_PROBE_INTERVAL = Duration.ofSeconds(10);
    public static final Duration DEFAULT_PASS_TIMEOUT = Duration.ofSeconds(30);

    public SchedulerSettings {
        if (concurrent == 0) {
            concurrent = DEFAULT_CONCURRENT;
        }
        requeueInterval = requeueInterval == null ? DEFAULT_REQUEUE_INTERVAL : requeueInterval;
        backoffBase = backoffBase == null ? DEFAULT_BACKOFF_BASE : backoffBase;
        backoffCeiling = backoffCeiling == null ? DEFAULT_BACKOFF_CEILING : backoffCeiling;
        probeInterval = probeInterval == null ? DEFAULT_PROBE_INTERVAL : probeInterval;
        passTimeout = passTimeout == null ? DEFAULT_PASS_TIMEOUT : passTimeout;
        floodGateEnabled = floodGateEnabled == null ? Boolean.TRUE : floodGateEnabled;
    }

    public static SchedulerSettings defaults() {
        return new SchedulerSettings(0, null, null, null, null, null, null);
    }

    @AssertTrue(message = "Scheduler intervals must be positive and the backoff ceiling must not be lower than its base.")
    public boolean isIntervalsValid() {
        return isPositive(requeueInterval) && isPositive(backoffBase) && isPositive(probeInterval)
                && isPositive(passTimeout) && backoffCeiling.compareTo(backoffBase) >= 0;
    }

    public BackoffPolicy backoffPolicy() {
        return new BackoffPolicy(backoffBase, backoffCeiling);
    }

    public boolean isFloodGateEnabled() {
        return floodGateEnabled;
    }

    private static boolean isPositive(Duration duration) {
        return !duration.isNegative() && !duration.isZero();
    }
}
