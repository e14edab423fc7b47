package io.hearthwarrio.veilguard.core;

/**
 * Outcome of one deferred classification pass.
 */
public final class PassResult {

    private final int examined;
    private final int hides;
    private final int remaining;
    private final boolean exhausted;
    private final long startNanos;
    private final long lastStartedNanos;

    public PassResult(int examined, int hides, int remaining, boolean exhausted, long startNanos, long lastStartedNanos) {
        this.examined = examined;
        this.hides = hides;
        this.remaining = remaining;
        this.exhausted = exhausted;
        this.startNanos = startNanos;
        this.lastStartedNanos = lastStartedNanos;
    }

    /**
     * @return elements classified, descendants included
     */
    public int getExamined() {
        return examined;
    }

    public int getHides() {
        return hides;
    }

    /**
     * @return top-level candidates left unclassified when the budget ran out
     */
    public int getRemaining() {
        return remaining;
    }

    /**
     * @return true if the pass stopped on its deadline
     */
    public boolean isExhausted() {
        return exhausted;
    }

    public long getStartNanos() {
        return startNanos;
    }

    /**
     * @return time at which the last element classification started
     */
    public long getLastStartedNanos() {
        return lastStartedNanos;
    }

    @Override
    public String toString() {
        return "PassResult{" +
                "examined=" + examined +
                ", hides=" + hides +
                ", remaining=" + remaining +
                ", exhausted=" + exhausted +
                ", elapsedNanos=" + (lastStartedNanos - startNanos) +
                '}';
    }
}
