package io.seriesfetch.budget;

import io.seriesfetch.error.QuotaExceededException;
import io.seriesfetch.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide request/token accounting against daily, per-minute and concurrency ceilings.
 *
 * <p>Admission reserves the estimated cost so concurrent callers cannot jointly overshoot a budget; the reservation
 * is charged to the counters on {@link #complete} and returned on {@link #release}. Daily counters reset when the
 * UTC date changes. The minute budget is a rolling window: each charge counts against it for exactly 60 seconds
 * after its completion and then drops out on its own.
 *
 * <p>Only completed calls are charged. Attempts that fail and are retried, or give up, return their reservation
 * through {@link #release}, so the counters undercount what the upstream service may have metered for them.
 *
 * <p>When the minute or concurrency budget is full the caller waits on a condition (the lock is released while
 * waiting) and re-checks whenever capacity is freed, and at least every 100ms so that a moved clock is noticed.
 * When the daily budget is full the caller fails immediately with {@link QuotaExceededException}.
 */
public class QuotaGovernor implements Budget {
    private static final Logger log = LoggerFactory.getLogger(QuotaGovernor.class);

    /** Approximate upstream tokens per metric, dimension and row. Tunable, not an upstream contract. */
    public static final long TOKENS_PER_UNIT = 10;
    static final Duration MINUTE_WINDOW = Duration.ofSeconds(60);
    private static final long RECHECK_NANOS = TimeUnit.MILLISECONDS.toNanos(100);

    private final QuotaLimits limits;
    private final Clock clock;
    private final Metrics metrics;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition capacity = lock.newCondition();

    // guarded by lock
    private LocalDate day;
    private int dailyRequests;
    private long dailyTokens;
    private long minuteTokens;
    private final Deque<Charge> minuteCharges = new ArrayDeque<>();
    private int concurrent;
    private int reservedRequests;
    private long reservedTokens;

    public QuotaGovernor(QuotaLimits limits, Clock clock) {
        this(limits, clock, null);
    }

    public QuotaGovernor(QuotaLimits limits, Clock clock, Metrics metrics) {
        this.limits = Objects.requireNonNull(limits, "limits");
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.metrics = metrics == null ? Metrics.detached() : metrics;
        Instant now = this.clock.instant();
        this.day = LocalDate.ofInstant(now, ZoneOffset.UTC);
    }

    /** {@code (metrics + dimensions + expectedRows) * 10}. */
    public static long estimateCost(int metricCount, int dimensionCount, long expectedRows) {
        return (metricCount + dimensionCount + expectedRows) * TOKENS_PER_UNIT;
    }

    public QuotaLimits limits() { return limits; }

    @Override
    public Permit admit(long estimatedCost) throws InterruptedException {
        if (estimatedCost < 0) throw new IllegalArgumentException("negative cost " + estimatedCost);
        lock.lockInterruptibly();
        try {
            boolean waited = false;
            while (true) {
                roll(clock.instant());
                rejectIfDailyExhausted(estimatedCost);
                if (estimatedCost > limits.minuteTokens()) {
                    // no window will ever be large enough
                    metrics.counter("quota.rejections").inc();
                    throw new QuotaExceededException("estimated cost " + estimatedCost
                            + " exceeds the per-minute budget of " + limits.minuteTokens() + " tokens",
                            remainingRequests(), remainingTokens());
                }
                long waitNanos = nanosUntilAdmissible(estimatedCost, clock.instant());
                if (waitNanos == 0) {
                    concurrent++;
                    reservedRequests++;
                    reservedTokens += estimatedCost;
                    if (waited) log.debug("Admitted cost={} after waiting; concurrent={}", estimatedCost, concurrent);
                    return new Permit(estimatedCost);
                }
                if (!waited) {
                    waited = true;
                    metrics.counter("quota.waits").inc();
                    log.debug("Waiting for quota: cost={} minuteTokens={} reserved={} concurrent={}",
                            estimatedCost, minuteTokens, reservedTokens, concurrent);
                }
                capacity.awaitNanos(Math.min(waitNanos, RECHECK_NANOS));
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void complete(Permit permit) {
        if (!permit.settle()) return;
        lock.lock();
        try {
            unreserve(permit);
            Instant now = clock.instant();
            roll(now);
            dailyRequests++;
            dailyTokens += permit.cost();
            minuteTokens += permit.cost();
            minuteCharges.addLast(new Charge(now, permit.cost()));
            capacity.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void release(Permit permit) {
        if (!permit.settle()) return;
        lock.lock();
        try {
            unreserve(permit);
            capacity.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public QuotaState snapshot() {
        lock.lock();
        try {
            roll(clock.instant());
            Instant oldest = minuteCharges.isEmpty() ? null : minuteCharges.peekFirst().at();
            return new QuotaState(day, dailyRequests, dailyTokens, minuteTokens, oldest, concurrent);
        } finally {
            lock.unlock();
        }
    }

    private void unreserve(Permit permit) {
        concurrent--;
        reservedRequests--;
        reservedTokens -= permit.cost();
    }

    private void roll(Instant now) {
        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
        if (!today.equals(day)) {
            log.info("UTC day rolled over to {}; resetting daily quota (used {} requests, {} tokens on {})",
                    today, dailyRequests, dailyTokens, day);
            day = today;
            dailyRequests = 0;
            dailyTokens = 0;
        }
        while (!minuteCharges.isEmpty() && minuteCharges.peekFirst().expired(now)) {
            minuteTokens -= minuteCharges.removeFirst().cost();
        }
    }

    private void rejectIfDailyExhausted(long cost) {
        if (dailyRequests + reservedRequests >= limits.dailyRequests()) {
            metrics.counter("quota.rejections").inc();
            log.warn("Daily request quota exhausted: {} of {} used", dailyRequests, limits.dailyRequests());
            throw new QuotaExceededException("daily request quota of " + limits.dailyRequests() + " exhausted",
                    remainingRequests(), remainingTokens());
        }
        if (dailyTokens + reservedTokens + cost > limits.dailyTokens()) {
            metrics.counter("quota.rejections").inc();
            log.warn("Daily token quota would be exceeded: used={} reserved={} cost={} limit={}",
                    dailyTokens, reservedTokens, cost, limits.dailyTokens());
            throw new QuotaExceededException("estimated cost " + cost + " exceeds the remaining daily token quota",
                    remainingRequests(), remainingTokens());
        }
    }

    private long nanosUntilAdmissible(long cost, Instant now) {
        if (concurrent >= limits.concurrency()) return RECHECK_NANOS;
        if (minuteTokens + reservedTokens + cost <= limits.minuteTokens()) return 0;
        if (minuteTokens + cost > limits.minuteTokens()) {
            // only older charges leaving the window help; wait for just enough of them
            long excess = minuteTokens + cost - limits.minuteTokens();
            for (Charge charge : minuteCharges) {
                excess -= charge.cost();
                if (excess <= 0) {
                    return Math.max(1, Duration.between(now, charge.expiresAt()).toNanos());
                }
            }
            return RECHECK_NANOS;
        }
        // in-flight reservations are holding the budget; they settle with a signal
        return RECHECK_NANOS;
    }

    private long remainingRequests() {
        return Math.max(0, limits.dailyRequests() - dailyRequests - reservedRequests);
    }

    private long remainingTokens() {
        return Math.max(0, limits.dailyTokens() - dailyTokens - reservedTokens);
    }

    private record Charge(Instant at, long cost) {
        Instant expiresAt() { return at.plus(MINUTE_WINDOW); }

        boolean expired(Instant now) { return !now.isBefore(expiresAt()); }
    }
}
