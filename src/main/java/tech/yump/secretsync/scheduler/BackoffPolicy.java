package tech.yump.secretsync.scheduler;

import java.time.Duration;

/**
 * Exponential backoff: {@code min(base * 2^(failures - 1), ceiling)}.
 */
public record BackoffPolicy(Duration base, Duration ceiling) {

    public BackoffPolicy {
        if (base.isNegative() || base.isZero()) {
            throw new IllegalArgumentException("Backoff base must be positive: " + base);
        }
        if (ceiling.compareTo(base) < 0) {
            throw new IllegalArgumentException("Backoff ceiling " + ceiling + " is lower than base " + base);
        }
    }

    /**
     * @param failures consecutive failures so far, at least 1
     */
    public Duration delayFor(int failures) {
        if (failures <= 1) {
            return base;
        }
        int shift = Math.min(failures - 1, 62);
        long baseNanos = base.toNanos();
        long ceilingNanos = ceiling.toNanos();
        if (baseNanos > (ceilingNanos >> shift)) {
            return ceiling;
        }
        return Duration.ofNanos(Math.min(baseNanos << shift, ceilingNanos));
    }
}
