package io.seriesfetch.analytics;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;

/**
 * One upstream report call over {@code [start, end]}.
 *
 * <p>Failures are reported typed: {@link AuthException} and {@link InvalidArgumentException} are fatal,
 * {@link RateLimitException} and {@link TransientNetworkException} are retryable. A plain {@link IOException}
 * counts as transient.
 */
@FunctionalInterface
public interface AnalyticsTransport {
    RawResponse call(String propertyId, List<String> metrics, List<String> dimensions,
                     LocalDate start, LocalDate end) throws IOException, InterruptedException;
}
