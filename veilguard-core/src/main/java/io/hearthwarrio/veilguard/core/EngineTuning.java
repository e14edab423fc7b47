package io.hearthwarrio.veilguard.core;

/**
 * Timing and size limits of the engine.
 * <p>
 * Immutable. Start from {@link #defaults()} and derive variants with the {@code with*} methods.
 */
public final class EngineTuning {

    public static final long DEFAULT_BUDGET_MILLIS = 8;
    public static final int DEFAULT_REMOVAL_CHUNK_SIZE = 50;
    public static final long DEFAULT_REMOVAL_COOLDOWN_MILLIS = 2_000;
    public static final long DEFAULT_QUIET_THRESHOLD_MILLIS = 10_000;
    public static final long DEFAULT_HEAL_INTERVAL_MILLIS = 8_000;
    public static final int DEFAULT_MAX_CHILD_FAN_OUT = 30;
    public static final int DEFAULT_MAX_DESCENT_DEPTH = 32;
    public static final int DEFAULT_MAX_ESCALATION_DEPTH = 10;
    public static final long DEFAULT_ALERT_CADENCE_MILLIS = 150;
    public static final int DEFAULT_ALERT_REPETITIONS = 13;
    public static final long DEFAULT_IDLE_FALLBACK_DELAY_MILLIS = 50;
    public static final long DEFAULT_IDLE_TIMEOUT_MILLIS = 200;
    public static final long DEFAULT_DRAIN_IDLE_TIMEOUT_MILLIS = 500;

    private static final EngineTuning DEFAULTS = new EngineTuning(
            DEFAULT_BUDGET_MILLIS,
            DEFAULT_REMOVAL_CHUNK_SIZE,
            DEFAULT_REMOVAL_COOLDOWN_MILLIS,
            DEFAULT_QUIET_THRESHOLD_MILLIS,
            DEFAULT_HEAL_INTERVAL_MILLIS,
            DEFAULT_MAX_CHILD_FAN_OUT,
            DEFAULT_MAX_DESCENT_DEPTH,
            DEFAULT_MAX_ESCALATION_DEPTH,
            DEFAULT_ALERT_CADENCE_MILLIS,
            DEFAULT_ALERT_REPETITIONS,
            DEFAULT_IDLE_FALLBACK_DELAY_MILLIS,
            DEFAULT_IDLE_TIMEOUT_MILLIS,
            DEFAULT_DRAIN_IDLE_TIMEOUT_MILLIS
    );

    private final long budgetMillis;
    private final int removalChunkSize;
    private final long removalCooldownMillis;
    private final long quietThresholdMillis;
    private final long healIntervalMillis;
    private final int maxChildFanOut;
    private final int maxDescentDepth;
    private final int maxEscalationDepth;
    private final long alertCadenceMillis;
    private final int alertRepetitions;
    private final long idleFallbackDelayMillis;
    private final long idleTimeoutMillis;
    private final long drainIdleTimeoutMillis;

    private EngineTuning(
            long budgetMillis,
            int removalChunkSize,
            long removalCooldownMillis,
            long quietThresholdMillis,
            long healIntervalMillis,
            int maxChildFanOut,
            int maxDescentDepth,
            int maxEscalationDepth,
            long alertCadenceMillis,
            int alertRepetitions,
            long idleFallbackDelayMillis,
            long idleTimeoutMillis,
            long drainIdleTimeoutMillis
    ) {
        this.budgetMillis = positive(budgetMillis, "budgetMillis");
        this.removalChunkSize = (int) positive(removalChunkSize, "removalChunkSize");
        this.removalCooldownMillis = positive(removalCooldownMillis, "removalCooldownMillis");
        this.quietThresholdMillis = positive(quietThresholdMillis, "quietThresholdMillis");
        this.healIntervalMillis = positive(healIntervalMillis, "healIntervalMillis");
        this.maxChildFanOut = (int) positive(maxChildFanOut, "maxChildFanOut");
        this.maxDescentDepth = (int) positive(maxDescentDepth, "maxDescentDepth");
        this.maxEscalationDepth = (int) positive(maxEscalationDepth, "maxEscalationDepth");
        this.alertCadenceMillis = positive(alertCadenceMillis, "alertCadenceMillis");
        this.alertRepetitions = (int) positive(alertRepetitions, "alertRepetitions");
        this.idleFallbackDelayMillis = positive(idleFallbackDelayMillis, "idleFallbackDelayMillis");
        this.idleTimeoutMillis = positive(idleTimeoutMillis, "idleTimeoutMillis");
        this.drainIdleTimeoutMillis = positive(drainIdleTimeoutMillis, "drainIdleTimeoutMillis");
    }

    private static long positive(long v, String name) {
        if (v <= 0) {
            throw new IllegalArgumentException(name + " must be positive: " + v);
        }
        return v;
    }

    public static EngineTuning defaults() {
        return DEFAULTS;
    }

    /**
     * @return wall-clock budget of one deferred classification pass
     */
    public long getBudgetMillis() {
        return budgetMillis;
    }

    public int getRemovalChunkSize() {
        return removalChunkSize;
    }

    public long getRemovalCooldownMillis() {
        return removalCooldownMillis;
    }

    public long getQuietThresholdMillis() {
        return quietThresholdMillis;
    }

    public long getHealIntervalMillis() {
        return healIntervalMillis;
    }

    /**
     * @return descent happens only into elements with fewer direct children than this
     */
    public int getMaxChildFanOut() {
        return maxChildFanOut;
    }

    public int getMaxDescentDepth() {
        return maxDescentDepth;
    }

    public int getMaxEscalationDepth() {
        return maxEscalationDepth;
    }

    public long getAlertCadenceMillis() {
        return alertCadenceMillis;
    }

    public int getAlertRepetitions() {
        return alertRepetitions;
    }

    public long getIdleFallbackDelayMillis() {
        return idleFallbackDelayMillis;
    }

    public long getIdleTimeoutMillis() {
        return idleTimeoutMillis;
    }

    public long getDrainIdleTimeoutMillis() {
        return drainIdleTimeoutMillis;
    }

    public EngineTuning withBudgetMillis(long v) {
        return new EngineTuning(v, removalChunkSize, removalCooldownMillis, quietThresholdMillis, healIntervalMillis,
                maxChildFanOut, maxDescentDepth, maxEscalationDepth, alertCadenceMillis, alertRepetitions,
                idleFallbackDelayMillis, idleTimeoutMillis, drainIdleTimeoutMillis);
    }

    public EngineTuning withRemovalChunkSize(int v) {
        return new EngineTuning(budgetMillis, v, removalCooldownMillis, quietThresholdMillis, healIntervalMillis,
                maxChildFanOut, maxDescentDepth, maxEscalationDepth, alertCadenceMillis, alertRepetitions,
                idleFallbackDelayMillis, idleTimeoutMillis, drainIdleTimeoutMillis);
    }

    public EngineTuning withRemovalCooldownMillis(long v) {
        return new EngineTuning(budgetMillis, removalChunkSize, v, quietThresholdMillis, healIntervalMillis,
                maxChildFanOut, maxDescentDepth, maxEscalationDepth, alertCadenceMillis, alertRepetitions,
                idleFallbackDelayMillis, idleTimeoutMillis, drainIdleTimeoutMillis);
    }

    public EngineTuning withQuietThresholdMillis(long v) {
        return new EngineTuning(budgetMillis, removalChunkSize, removalCooldownMillis, v, healIntervalMillis,
                maxChildFanOut, maxDescentDepth, maxEscalationDepth, alertCadenceMillis, alertRepetitions,
                idleFallbackDelayMillis, idleTimeoutMillis, drainIdleTimeoutMillis);
    }

    public EngineTuning withHealIntervalMillis(long v) {
        return new EngineTuning(budgetMillis, removalChunkSize, removalCooldownMillis, quietThresholdMillis, v,
                maxChildFanOut, maxDescentDepth, maxEscalationDepth, alertCadenceMillis, alertRepetitions,
                idleFallbackDelayMillis, idleTimeoutMillis, drainIdleTimeoutMillis);
    }

    public EngineTuning withMaxChildFanOut(int v) {
        return new EngineTuning(budgetMillis, removalChunkSize, removalCooldownMillis, quietThresholdMillis,
                healIntervalMillis, v, maxDescentDepth, maxEscalationDepth, alertCadenceMillis, alertRepetitions,
                idleFallbackDelayMillis, idleTimeoutMillis, drainIdleTimeoutMillis);
    }

    public EngineTuning withMaxDescentDepth(int v) {
        return new EngineTuning(budgetMillis, removalChunkSize, removalCooldownMillis, quietThresholdMillis,
                healIntervalMillis, maxChildFanOut, v, maxEscalationDepth, alertCadenceMillis, alertRepetitions,
                idleFallbackDelayMillis, idleTimeoutMillis, drainIdleTimeoutMillis);
    }

    public EngineTuning withMaxEscalationDepth(int v) {
        return new EngineTuning(budgetMillis, removalChunkSize, removalCooldownMillis, quietThresholdMillis,
                healIntervalMillis, maxChildFanOut, maxDescentDepth, v, alertCadenceMillis, alertRepetitions,
                idleFallbackDelayMillis, idleTimeoutMillis, drainIdleTimeoutMillis);
    }

    public EngineTuning withAlertCadenceMillis(long v) {
        return new EngineTuning(budgetMillis, removalChunkSize, removalCooldownMillis, quietThresholdMillis,
                healIntervalMillis, maxChildFanOut, maxDescentDepth, maxEscalationDepth, v, alertRepetitions,
                idleFallbackDelayMillis, idleTimeoutMillis, drainIdleTimeoutMillis);
    }

    public EngineTuning withAlertRepetitions(int v) {
        return new EngineTuning(budgetMillis, removalChunkSize, removalCooldownMillis, quietThresholdMillis,
                healIntervalMillis, maxChildFanOut, maxDescentDepth, maxEscalationDepth, alertCadenceMillis, v,
                idleFallbackDelayMillis, idleTimeoutMillis, drainIdleTimeoutMillis);
    }

    public EngineTuning withIdleFallbackDelayMillis(long v) {
        return new EngineTuning(budgetMillis, removalChunkSize, removalCooldownMillis, quietThresholdMillis,
                healIntervalMillis, maxChildFanOut, maxDescentDepth, maxEscalationDepth, alertCadenceMillis,
                alertRepetitions, v, idleTimeoutMillis, drainIdleTimeoutMillis);
    }

    public EngineTuning withIdleTimeoutMillis(long v) {
        return new EngineTuning(budgetMillis, removalChunkSize, removalCooldownMillis, quietThresholdMillis,
                healIntervalMillis, maxChildFanOut, maxDescentDepth, maxEscalationDepth, alertCadenceMillis,
                alertRepetitions, idleFallbackDelayMillis, v, drainIdleTimeoutMillis);
    }

    public EngineTuning withDrainIdleTimeoutMillis(long v) {
        return new EngineTuning(budgetMillis, removalChunkSize, removalCooldownMillis, quietThresholdMillis,
                healIntervalMillis, maxChildFanOut, maxDescentDepth, maxEscalationDepth, alertCadenceMillis,
                alertRepetitions, idleFallbackDelayMillis, idleTimeoutMillis, v);
    }

    @Override
    public String toString() {
        return "EngineTuning{" +
                "budgetMillis=" + budgetMillis +
                ", removalChunkSize=" + removalChunkSize +
                ", removalCooldownMillis=" + removalCooldownMillis +
                ", quietThresholdMillis=" + quietThresholdMillis +
                ", healIntervalMillis=" + healIntervalMillis +
                ", maxChildFanOut=" + maxChildFanOut +
                ", maxDescentDepth=" + maxDescentDepth +
                ", maxEscalationDepth=" + maxEscalationDepth +
                ", alertCadenceMillis=" + alertCadenceMillis +
                ", alertRepetitions=" + alertRepetitions +
                ", idleFallbackDelayMillis=" + idleFallbackDelayMillis +
                ", idleTimeoutMillis=" + idleTimeoutMillis +
                ", drainIdleTimeoutMillis=" + drainIdleTimeoutMillis +
                '}';
    }
}
