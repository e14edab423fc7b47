package io.hearthwarrio.veilguard.core;

import io.hearthwarrio.veilguard.core.host.Cancellable;
import io.hearthwarrio.veilguard.core.host.HostDocument;
import io.hearthwarrio.veilguard.core.host.HostNode;
import io.hearthwarrio.veilguard.core.host.HostScheduler;
import io.hearthwarrio.veilguard.core.host.Mutation;
import io.hearthwarrio.veilguard.core.host.MutationListener;
import io.hearthwarrio.veilguard.core.host.MutationSubscription;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Turns raw mutation batches into classification work.
 * <p>
 * Every batch takes the urgent path first: elements carrying a marker attribute are escalated and hidden
 * synchronously. The whole batch then becomes the candidate list of a deferred pass run in idle time.
 * At most one deferred pass is pending; see {@link PendingBatchPolicy} for later batches.
 */
public final class MutationWatcher implements MutationListener {

    private final BudgetedClassifier classifier;
    private final HostScheduler scheduler;
    private final EngineTuning tuning;
    private final Counters counters;
    private final PendingBatchPolicy policy;

    private WatcherState state = WatcherState.IDLE;
    private List<HostNode> pending = new ArrayList<>();
    private Cancellable pendingTask;
    private MutationSubscription subscription;
    private PassResult lastPassResult;
    private boolean stopped;

    public MutationWatcher(
            BudgetedClassifier classifier,
            HostScheduler scheduler,
            EngineTuning tuning,
            Counters counters,
            PendingBatchPolicy policy
    ) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.tuning = Objects.requireNonNull(tuning, "tuning must not be null");
        this.counters = Objects.requireNonNull(counters, "counters must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
    }

    /**
     * Subscribes to child-list changes and marker attribute changes of the whole document.
     *
     * @param document document to observe
     */
    public void start(HostDocument document) {
        Objects.requireNonNull(document, "document must not be null");
        if (subscription != null) {
            return;
        }
        stopped = false;
        subscription = document.observe(this, Set.copyOf(AdSignatures.MARKER_ATTRIBUTES));
    }

    public void stop() {
        stopped = true;
        if (subscription != null) {
            subscription.disconnect();
            subscription = null;
        }
        if (pendingTask != null) {
            pendingTask.cancel();
            pendingTask = null;
        }
        pending = new ArrayList<>();
        state = WatcherState.IDLE;
    }

    @Override
    public void onMutations(List<Mutation> mutations) {
        if (stopped || mutations == null || mutations.isEmpty()) {
            return;
        }

        boolean deferred = state == WatcherState.DEFERRED;
        if (!deferred) {
            state = WatcherState.COLLECTING;
        }

        List<HostNode> targets = collect(mutations);
        if (targets.isEmpty()) {
            if (!deferred) {
                state = WatcherState.IDLE;
            }
            return;
        }

        for (HostNode t : targets) {
            if (AdSignatures.hasMarkerAttribute(t)) {
                counters.incrementUrgentEscalations();
                classifier.escalate(t, HideReason.URGENT_MARKER);
            }
        }

        if (deferred) {
            if (policy == PendingBatchPolicy.MERGE) {
                pending.addAll(targets);
            } else {
                counters.incrementDroppedBatches();
            }
            return;
        }

        pending = new ArrayList<>(targets);
        state = WatcherState.DEFERRED;
        pendingTask = IdleScheduling.runWhenIdle(
                scheduler,
                this::runDeferredPass,
                tuning.getIdleTimeoutMillis(),
                tuning.getIdleFallbackDelayMillis()
        );
    }

    private void runDeferredPass() {
        List<HostNode> batch = pending;
        pending = new ArrayList<>();
        pendingTask = null;
        if (stopped) {
            return;
        }
        try {
            lastPassResult = classifier.runPass(batch);
        } finally {
            state = WatcherState.IDLE;
        }
    }

    private static List<HostNode> collect(List<Mutation> mutations) {
        Set<HostNode> out = new LinkedHashSet<>();
        for (Mutation m : mutations) {
            if (m.getType() == Mutation.Type.CHILD_LIST) {
                out.addAll(m.getAddedNodes());
            } else {
                out.add(m.getTarget());
            }
        }
        return new ArrayList<>(out);
    }

    public WatcherState getState() {
        return state;
    }

    public PendingBatchPolicy getPolicy() {
        return policy;
    }

    /**
     * @return number of candidates waiting for the pending pass
     */
    public int getPendingCount() {
        return pending.size();
    }

    /**
     * @return result of the last deferred pass, or null before the first one
     */
    public PassResult getLastPassResult() {
        return lastPassResult;
    }
}
