package io.hearthwarrio.veilguard.core;

import io.hearthwarrio.veilguard.core.host.Cancellable;
import io.hearthwarrio.veilguard.core.host.HostNode;
import io.hearthwarrio.veilguard.core.host.HostScheduler;

import java.util.ArrayDeque;
import java.util.Objects;

/**
 * FIFO of hidden elements waiting to be detached.
 * <p>
 * Drains at most {@link EngineTuning#getRemovalChunkSize()} elements per idle slice and keeps requesting
 * slices while elements remain. Once empty it waits {@link EngineTuning#getRemovalCooldownMillis()} before
 * looking again.
 */
public final class RemovalQueue {

    private final HostScheduler scheduler;
    private final EngineTuning tuning;
    private final ProcessedSet processed;
    private final Counters counters;
    private final HideEventLogger logger;

    private final ArrayDeque<HostNode> queue = new ArrayDeque<>();
    private Cancellable pending;
    private boolean running;
    private long detached;

    public RemovalQueue(
            HostScheduler scheduler,
            EngineTuning tuning,
            ProcessedSet processed,
            Counters counters,
            HideEventLogger logger
    ) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.tuning = Objects.requireNonNull(tuning, "tuning must not be null");
        this.processed = Objects.requireNonNull(processed, "processed must not be null");
        this.counters = Objects.requireNonNull(counters, "counters must not be null");
        this.logger = FailSafeHideEventLogger.guard(logger, counters);
    }

    void enqueue(HostNode node) {
        queue.add(node);
    }

    /**
     * Starts the drain loop. Calling it again while running has no effect.
     */
    public void start() {
        if (running) {
            return;
        }
        running = true;
        requestSlice();
    }

    public void stop() {
        running = false;
        if (pending != null) {
            pending.cancel();
            pending = null;
        }
    }

    public boolean isRunning() {
        return running;
    }

    public int size() {
        return queue.size();
    }

    /**
     * @return elements detached so far
     */
    public long getDetachedCount() {
        return detached;
    }

    private void requestSlice() {
        pending = IdleScheduling.runWhenIdle(
                scheduler,
                this::processChunk,
                tuning.getDrainIdleTimeoutMillis(),
                tuning.getIdleFallbackDelayMillis()
        );
    }

    private void processChunk() {
        if (!running) {
            return;
        }

        int chunk = tuning.getRemovalChunkSize();
        for (int i = 0; i < chunk && !queue.isEmpty(); i++) {
            detach(queue.poll());
        }

        if (!queue.isEmpty()) {
            requestSlice();
            return;
        }

        // a pruned element that is inserted again counts as new: it is hidden and counted once more
        processed.pruneDisconnected();
        pending = scheduler.schedule(this::requestSliceAfterCooldown, tuning.getRemovalCooldownMillis());
    }

    private void requestSliceAfterCooldown() {
        if (running) {
            requestSlice();
        }
    }

    private void detach(HostNode node) {
        try {
            if (!node.isConnected()) {
                return;
            }
            node.remove();
            detached++;
        } catch (RuntimeException e) {
            counters.incrementDetachFailures();
            logger.logSuppressedError("detach", e);
        }
    }
}
