package io.hearthwarrio.veilguard.core.host;

/**
 * Single-threaded event loop contract of the host.
 * <p>
 * All callbacks (timers, idle callbacks, mutation batches, UI events) run on the same thread and never
 * concurrently with each other.
 */
public interface HostScheduler {

    /**
     * @return monotonic time in nanoseconds
     */
    long nanoTime();

    /**
     * @return wall-clock time in epoch milliseconds
     */
    long currentTimeMillis();

    Cancellable schedule(Runnable task, long delayMillis);

    /**
     * Hands {@code task} over to the loop thread. Unlike the other methods, this one may be called from any thread.
     *
     * @param task task
     */
    void post(Runnable task);

    /**
     * @param task         task
     * @param periodMillis period, must be positive
     * @return handle that stops further runs
     */
    Cancellable scheduleAtFixedRate(Runnable task, long periodMillis);

    /**
     * @return true if {@link #requestIdle(Runnable, long)} is available
     */
    boolean supportsIdleCallbacks();

    /**
     * Runs {@code task} in an idle slice, or once {@code timeoutMillis} elapsed without one.
     *
     * @param task          task
     * @param timeoutMillis maximum wait for an idle slice
     * @return handle
     * @throws UnsupportedOperationException when idle callbacks are not supported
     */
    Cancellable requestIdle(Runnable task, long timeoutMillis);
}
