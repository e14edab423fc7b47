package io.hearthwarrio.veilguard.core;

/**
 * Adaptive sensitivity switch.
 * <p>
 * Quiet mode turns on after a pass without hides once enough time passed since the last hide, and turns
 * off on the next hide. While quiet, advanced heuristics are skipped.
 */
public final class QuietState {

    private boolean active;
    private long lastHideNanos;

    /**
     * @param referenceNanos initial "last hide" reference, usually the engine start time
     */
    public QuietState(long referenceNanos) {
        this.lastHideNanos = referenceNanos;
    }

    public boolean isActive() {
        return active;
    }

    public long getLastHideNanos() {
        return lastHideNanos;
    }

    /**
     * @param nowNanos hide time
     */
    public void recordHide(long nowNanos) {
        active = false;
        lastHideNanos = nowNanos;
    }

    /**
     * @param hides           hides performed by the pass
     * @param nowNanos        pass completion time
     * @param thresholdNanos  minimal silence before going quiet
     * @return resulting quiet flag
     */
    public boolean onPassCompleted(int hides, long nowNanos, long thresholdNanos) {
        if (hides > 0) {
            recordHide(nowNanos);
        } else if (!active && nowNanos - lastHideNanos >= thresholdNanos) {
            active = true;
        }
        return active;
    }

    @Override
    public String toString() {
        return "QuietState{" +
                "active=" + active +
                ", lastHideNanos=" + lastHideNanos +
                '}';
    }
}
