package io.hearthwarrio.veilguard.core;

import io.hearthwarrio.veilguard.core.host.HostNode;

import java.util.Objects;

/**
 * The single hide primitive shared by every component.
 * <p>
 * Hiding is two-phase: the element is made invisible synchronously, then handed to the
 * {@link RemovalQueue} for detachment in idle time.
 */
public final class Suppressor {

    private final ProcessedSet processed;
    private final RemovalQueue removalQueue;
    private final Counters counters;
    private final HideEventLogger logger;

    public Suppressor(ProcessedSet processed, RemovalQueue removalQueue, Counters counters, HideEventLogger logger) {
        this.processed = Objects.requireNonNull(processed, "processed must not be null");
        this.removalQueue = Objects.requireNonNull(removalQueue, "removalQueue must not be null");
        this.counters = Objects.requireNonNull(counters, "counters must not be null");
        this.logger = FailSafeHideEventLogger.guard(logger, counters);
    }

    /**
     * Hides an element once. Repeated calls for the same element are no-ops.
     * <p>
     * A throwing logger does not undo or interrupt the hide.
     *
     * @param node   element to hide (null is ignored)
     * @param reason why it is hidden
     * @return true if the element was hidden by this call
     */
    public boolean hide(HostNode node, HideReason reason) {
        Objects.requireNonNull(reason, "reason must not be null");
        if (node == null || processed.contains(node)) {
            return false;
        }

        try {
            forceInvisible(node);
        } catch (RuntimeException e) {
            logger.logSuppressedError("hide", e);
            return false;
        }

        processed.add(node);
        counters.incrementHides();
        if (reason.isHeuristic()) {
            counters.incrementHeuristicRemovals();
        }
        removalQueue.enqueue(node);

        ElementSnapshot snapshot = logger.detail() == LogDetail.NONE
                ? ElementSnapshot.empty()
                : ElementSnapshot.of(node);
        logger.logHidden(reason, snapshot);
        return true;
    }

    public boolean isProcessed(HostNode node) {
        return processed.contains(node);
    }

    /**
     * Forces {@code display:none} and {@code visibility:hidden} with maximal priority.
     *
     * @param node element
     */
    public static void forceInvisible(HostNode node) {
        node.setStyleProperty("display", "none", true);
        node.setStyleProperty("visibility", "hidden", true);
    }
}
