package tech.yump.ledger.retention;

import java.time.Duration;
import java.time.Instant;

/**
 * Decides whether a policy is due from its schedule and last run. Pure; the caller supplies "now".
 */
public final class RetentionScheduler {

    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private RetentionScheduler() {
    }

    /**
     * A policy that never ran is due. Otherwise it is due once the whole days elapsed since its last run
     * reach the schedule interval.
     */
    public static boolean isDue(RetentionSchedule schedule, Instant lastRun, Instant now) {
        if (lastRun == null) {
            return true;
        }
        long elapsedDays = Duration.between(lastRun, now).toDays();
        return elapsedDays >= schedule.intervalDays();
    }

    /**
     * Days until the policy is next due, rounded to one decimal and never negative.
     */
    public static double dueInDays(RetentionSchedule schedule, Instant lastRun, Instant now) {
        if (lastRun == null) {
            return 0.0;
        }
        double elapsed = Duration.between(lastRun, now).toMillis() / MILLIS_PER_DAY;
        double remaining = Math.max(0.0, schedule.intervalDays() - elapsed);
        return Math.round(remaining * 10.0) / 10.0;
    }
}
