package io.seriesfetch.retry;

import io.seriesfetch.error.Failures;
import io.seriesfetch.error.RetriesExhaustedException;
import io.seriesfetch.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Runs one call with bounded exponential backoff.
 *
 * <p>Fatal failures propagate after the first attempt, unchanged. Retryable failures are retried until the policy
 * refuses another attempt or the next delay would exceed the policy's total wait, at which point the last failure is
 * surfaced wrapped in {@link RetriesExhaustedException}. An interrupt during backoff aborts the call.
 */
public class RetryExecutor {
    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final RetryPolicy policy;
    private final FailureClassifier classifier;
    private final Sleeper sleeper;
    private final Metrics metrics;

    public RetryExecutor(RetryPolicy policy) {
        this(policy, FailureClassifier.DEFAULT, Sleeper.THREAD, null);
    }

    public RetryExecutor(RetryPolicy policy, FailureClassifier classifier, Sleeper sleeper, Metrics metrics) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.classifier = classifier == null ? FailureClassifier.DEFAULT : classifier;
        this.sleeper = sleeper == null ? Sleeper.THREAD : sleeper;
        this.metrics = metrics == null ? Metrics.detached() : metrics;
    }

    public <T> T execute(Callable<T> call) throws InterruptedException {
        return execute("call", call);
    }

    public <T> T execute(String operation, Callable<T> call) throws InterruptedException {
        long waited = 0;
        int attempt = 0;
        while (true) {
            attempt++;
            metrics.counter("retry.attempts").inc();
            try {
                return call.call();
            } catch (InterruptedException ie) {
                throw ie;
            } catch (Exception e) {
                if (classifier.classify(e) == FailureClassifier.Kind.FATAL) {
                    throw Failures.propagate(e);
                }
                if (!policy.shouldRetry(attempt, e)) {
                    throw exhausted(operation, attempt, e);
                }
                long delay = policy.backoffMillis(attempt);
                if (waited + delay > policy.maxTotalWaitMillis()) {
                    log.warn("{}: next delay {}ms would exceed the {}ms total wait budget", operation, delay,
                            policy.maxTotalWaitMillis());
                    throw exhausted(operation, attempt, e);
                }
                log.warn("{}: attempt {} failed ({}); retrying in {}ms", operation, attempt, e.getMessage(), delay);
                sleeper.sleep(delay);
                waited += delay;
            }
        }
    }

    private RetriesExhaustedException exhausted(String operation, int attempts, Exception last) {
        metrics.counter("retry.exhausted").inc();
        return new RetriesExhaustedException(operation, attempts, last);
    }
}
