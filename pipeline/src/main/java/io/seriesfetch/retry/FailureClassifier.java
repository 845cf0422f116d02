package io.seriesfetch.retry;

import io.seriesfetch.error.PipelineException;

import java.io.IOException;

/**
 * Splits failures into ones worth retrying and ones to surface immediately.
 */
@FunctionalInterface
public interface FailureClassifier {
    enum Kind { RETRYABLE, FATAL }

    Kind classify(Exception e);

    /** Pipeline exceptions flagged retryable and raw I/O errors are retried; everything else is fatal. */
    FailureClassifier DEFAULT = e -> {
        if (e instanceof PipelineException pe) return pe.isRetryable() ? Kind.RETRYABLE : Kind.FATAL;
        if (e instanceof IOException) return Kind.RETRYABLE;
        return Kind.FATAL;
    };
}
