package io.hearthwarrio.veilguard.testkit;

/**
 * Manually driven clock for deterministic tests.
 * <p>
 * Optionally advances by a fixed step on every {@link #nanoTime()} read, which makes any loop that checks the
 * time eventually run out of budget.
 */
public final class VirtualClock {

    private static final long NANOS_PER_MILLI = 1_000_000L;

    private final long epochMillisAtZero;
    private long nanos;
    private long autoAdvanceNanos;

    public VirtualClock() {
        this(1_700_000_000_000L);
    }

    /**
     * @param epochMillisAtZero wall-clock time reported while the monotonic clock reads zero
     */
    public VirtualClock(long epochMillisAtZero) {
        this.epochMillisAtZero = epochMillisAtZero;
    }

    public long nanoTime() {
        long n = nanos;
        nanos += autoAdvanceNanos;
        return n;
    }

    /**
     * @return current time without triggering auto-advance
     */
    public long peekNanos() {
        return nanos;
    }

    public long currentTimeMillis() {
        return epochMillisAtZero + nanos / NANOS_PER_MILLI;
    }

    public void advanceNanos(long delta) {
        if (delta < 0) {
            throw new IllegalArgumentException("delta must not be negative: " + delta);
        }
        nanos += delta;
    }

    public void advanceMillis(long millis) {
        advanceNanos(millis * NANOS_PER_MILLI);
    }

    void setNanos(long value) {
        if (value > nanos) {
            nanos = value;
        }
    }

    /**
     * @param stepNanos time added on every {@link #nanoTime()} read (0 disables)
     */
    public void setAutoAdvanceNanos(long stepNanos) {
        if (stepNanos < 0) {
            throw new IllegalArgumentException("stepNanos must not be negative: " + stepNanos);
        }
        this.autoAdvanceNanos = stepNanos;
    }
}
