package io.seriesfetch.retry;

/** Backoff delay seam so tests can observe delays without waiting them out. */
@FunctionalInterface
public interface Sleeper {
    void sleep(long millis) throws InterruptedException;

    Sleeper THREAD = Thread::sleep;
}
