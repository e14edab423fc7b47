package io.hearthwarrio.veilguard.core;

/**
 * Local, monotonic activity counters of one engine.
 * <p>
 * Never persisted or transmitted.
 */
public final class Counters {

    private long hides;
    private long heuristicRemovals;
    private long batches;
    private long droppedBatches;
    private long urgentEscalations;
    private long detachFailures;
    private long loggerFailures;

    Counters() {
    }

    /**
     * @return elements visually suppressed
     */
    public long getHides() {
        return hides;
    }

    /**
     * @return hides caused by advanced structural heuristics
     */
    public long getHeuristicRemovals() {
        return heuristicRemovals;
    }

    /**
     * @return completed deferred classification passes
     */
    public long getBatches() {
        return batches;
    }

    /**
     * @return mutation batches discarded because a deferred pass was already pending
     */
    public long getDroppedBatches() {
        return droppedBatches;
    }

    public long getUrgentEscalations() {
        return urgentEscalations;
    }

    public long getDetachFailures() {
        return detachFailures;
    }

    /**
     * @return calls into the {@link HideEventLogger} that threw
     */
    public long getLoggerFailures() {
        return loggerFailures;
    }

    void incrementHides() {
        hides++;
    }

    void incrementHeuristicRemovals() {
        heuristicRemovals++;
    }

    void incrementBatches() {
        batches++;
    }

    void incrementDroppedBatches() {
        droppedBatches++;
    }

    void incrementUrgentEscalations() {
        urgentEscalations++;
    }

    void incrementDetachFailures() {
        detachFailures++;
    }

    void incrementLoggerFailures() {
        loggerFailures++;
    }

    @Override
    public String toString() {
        return "Counters{" +
                "hides=" + hides +
                ", heuristicRemovals=" + heuristicRemovals +
                ", batches=" + batches +
                ", droppedBatches=" + droppedBatches +
                ", urgentEscalations=" + urgentEscalations +
                ", detachFailures=" + detachFailures +
                ", loggerFailures=" + loggerFailures +
                '}';
    }
}
