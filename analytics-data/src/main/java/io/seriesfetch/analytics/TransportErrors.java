package io.seriesfetch.analytics;

import io.seriesfetch.error.PipelineException;

/**
 * Maps upstream HTTP statuses onto the exception taxonomy.
 */
public final class TransportErrors {
    private static final int MAX_BODY_IN_MESSAGE = 300;

    private TransportErrors() {}

    public static PipelineException fromStatus(int status, String body) {
        String msg = "upstream returned HTTP " + status + describe(body);
        if (status == 401 || status == 403) return new AuthException(msg);
        if (status == 429) return new RateLimitException(msg);
        if (status >= 500 && status <= 599) return new TransientNetworkException(msg);
        return new InvalidArgumentException(msg);
    }

    public static boolean isSuccess(int status) {
        return status >= 200 && status < 300;
    }

    private static String describe(String body) {
        if (body == null || body.isBlank()) return "";
        String b = body.strip();
        return ": " + (b.length() > MAX_BODY_IN_MESSAGE ? b.substring(0, MAX_BODY_IN_MESSAGE) + "..." : b);
    }
}
