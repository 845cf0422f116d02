package io.seriesfetch.error;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Helpers to surface the original failure from executor and future wrappers.
 */
public final class Failures {
    private Failures() {}

    public static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof ExecutionException || cur instanceof CompletionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }

    /**
     * Returns an unchecked exception to throw for {@code t}: runtime exceptions and errors as they are,
     * checked exceptions wrapped in a non-retryable {@link PipelineException}.
     */
    public static RuntimeException propagate(Throwable t) {
        Throwable cause = unwrap(t);
        if (cause instanceof RuntimeException re) return re;
        if (cause instanceof Error err) throw err;
        return new PipelineException(cause.getMessage() == null ? cause.toString() : cause.getMessage(), cause);
    }
}
