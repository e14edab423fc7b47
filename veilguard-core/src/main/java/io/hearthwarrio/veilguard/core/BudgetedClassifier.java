package io.hearthwarrio.veilguard.core;

import io.hearthwarrio.veilguard.core.host.HostDocument;
import io.hearthwarrio.veilguard.core.host.HostNode;
import io.hearthwarrio.veilguard.core.host.HostScheduler;
import io.hearthwarrio.veilguard.core.host.Viewport;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Classifies mutation candidates under a wall-clock budget.
 * <p>
 * Each element goes through these steps, stopping at the first match:
 * <ol>
 *   <li>fast-rule match: hide</li>
 *   <li>marker attribute: escalate to the positioned ancestor and hide</li>
 *   <li>ad slot class: escalate and hide</li>
 *   <li>{@code iframe} with an ad-network source: hide</li>
 *   <li>{@link ElementHeuristic}s, only in {@link FilteringMode#ADVANCED} while quiet mode is off</li>
 *   <li>descent into children of small subtrees through an explicit bounded worklist</li>
 * </ol>
 * The pass stops as soon as the deadline is exceeded; unvisited candidates are dropped for that pass.
 * <p>
 * Owns the {@link QuietState}.
 */
public final class BudgetedClassifier {

    private static final long NANOS_PER_MILLI = 1_000_000L;

    private final HostDocument document;
    private final HostScheduler scheduler;
    private final Suppressor suppressor;
    private final Counters counters;
    private final EngineTuning tuning;
    private final List<ElementHeuristic> heuristics;
    private final HideEventLogger logger;
    private final QuietState quietState;

    private SelectorConfig config = SelectorConfig.empty();
    private FilteringMode mode = FilteringMode.LITE;
    private long hidesAtLastPass;

    public BudgetedClassifier(
            HostDocument document,
            HostScheduler scheduler,
            Suppressor suppressor,
            Counters counters,
            EngineTuning tuning,
            List<? extends ElementHeuristic> heuristics,
            HideEventLogger logger
    ) {
        this.document = Objects.requireNonNull(document, "document must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.suppressor = Objects.requireNonNull(suppressor, "suppressor must not be null");
        this.counters = Objects.requireNonNull(counters, "counters must not be null");
        this.tuning = Objects.requireNonNull(tuning, "tuning must not be null");
        this.heuristics = ElementHeuristics.normalize(heuristics);
        this.logger = FailSafeHideEventLogger.guard(logger, this.counters);
        this.quietState = new QuietState(scheduler.nanoTime());
        this.hidesAtLastPass = counters.getHides();
    }

    public void configure(SelectorConfig config, FilteringMode mode) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
    }

    public SelectorConfig getConfig() {
        return config;
    }

    public boolean isQuiet() {
        return quietState.isActive();
    }

    public QuietState getQuietState() {
        return quietState;
    }

    public List<ElementHeuristic> getHeuristics() {
        return heuristics;
    }

    /**
     * Runs one deferred pass over {@code candidates} in arrival order.
     *
     * @param candidates candidate elements
     * @return pass outcome
     */
    public PassResult runPass(List<HostNode> candidates) {
        Objects.requireNonNull(candidates, "candidates must not be null");

        long start = scheduler.nanoTime();
        long deadline = start + tuning.getBudgetMillis() * NANOS_PER_MILLI;
        String fastGroup = config.fastRuleGroup();
        HeuristicContext context = heuristicContext();

        Pass pass = new Pass(deadline, fastGroup, context, start);
        int index = 0;
        for (; index < candidates.size(); index++) {
            if (scheduler.nanoTime() > deadline) {
                pass.exhausted = true;
                break;
            }
            HostNode node = candidates.get(index);
            if (node == null || !isConnected(node) || suppressor.isProcessed(node)) {
                continue;
            }
            walk(node, pass);
            if (pass.exhausted) {
                index++;
                break;
            }
        }

        long end = scheduler.nanoTime();
        counters.incrementBatches();
        long hidesSinceLastPass = counters.getHides() - hidesAtLastPass;
        hidesAtLastPass = counters.getHides();
        quietState.onPassCompleted((int) Math.min(Integer.MAX_VALUE, hidesSinceLastPass), end,
                tuning.getQuietThresholdMillis() * NANOS_PER_MILLI);

        return new PassResult(pass.examined, pass.hides, candidates.size() - index, pass.exhausted,
                start, pass.lastStartedNanos);
    }

    /**
     * Ancestor escalation: hides the highest positioned ancestor of {@code node}, or the node itself.
     *
     * @param node   matched element
     * @param reason hide reason
     * @return true if an element was hidden
     */
    public boolean escalate(HostNode node, HideReason reason) {
        HostNode body = null;
        try {
            body = document.getBody();
        } catch (RuntimeException e) {
            logger.logSuppressedError("escalate", e);
        }
        HostNode root = AncestorEscalation.findRoot(node, body, tuning.getMaxEscalationDepth());
        return hide(root, reason);
    }

    private void walk(HostNode root, Pass pass) {
        Deque<Frame> worklist = new ArrayDeque<>();
        worklist.push(new Frame(root, 0));

        while (!worklist.isEmpty()) {
            Frame frame = worklist.pop();
            if (frame.depth > 0) {
                long now = scheduler.nanoTime();
                if (now > pass.deadline) {
                    pass.exhausted = true;
                    return;
                }
                if (suppressor.isProcessed(frame.node)) {
                    continue;
                }
            }

            pass.lastStartedNanos = scheduler.nanoTime();
            pass.examined++;
            Verdict verdict = classify(frame.node, pass);
            if (verdict == Verdict.HIDDEN) {
                pass.hides++;
            }
            if (verdict != Verdict.NO_MATCH) {
                continue;
            }

            if (frame.depth >= tuning.getMaxDescentDepth()) {
                continue;
            }
            List<HostNode> children = childrenOf(frame.node);
            int n = children.size();
            if (n > 0 && n < tuning.getMaxChildFanOut()) {
                for (int i = n - 1; i >= 0; i--) {
                    worklist.push(new Frame(children.get(i), frame.depth + 1));
                }
            }
        }
    }

    private Verdict classify(HostNode node, Pass pass) {
        if (!pass.fastGroup.isEmpty() && matchesFastRule(node, pass.fastGroup)) {
            return verdict(hide(node, HideReason.FAST_RULE));
        }
        if (AdSignatures.hasMarkerAttribute(node)) {
            return verdict(escalate(node, HideReason.MARKER_ATTRIBUTE));
        }
        if (AdSignatures.hasAdSlotClass(node)) {
            return verdict(escalate(node, HideReason.AD_SLOT_CLASS));
        }
        if (isAdFrame(node)) {
            return verdict(hide(node, HideReason.AD_FRAME));
        }
        if (mode == FilteringMode.ADVANCED && !quietState.isActive() && pass.context != null) {
            for (ElementHeuristic h : heuristics) {
                HostNode target = apply(h, node, pass.context);
                if (target != null) {
                    return verdict(hide(target, h.reason()));
                }
            }
        }
        return Verdict.NO_MATCH;
    }

    private boolean hide(HostNode node, HideReason reason) {
        boolean hidden = suppressor.hide(node, reason);
        if (hidden) {
            quietState.recordHide(scheduler.nanoTime());
        }
        return hidden;
    }

    private static Verdict verdict(boolean hidden) {
        return hidden ? Verdict.HIDDEN : Verdict.MATCHED;
    }

    private boolean matchesFastRule(HostNode node, String fastGroup) {
        try {
            return node.matches(fastGroup);
        } catch (RuntimeException e) {
            logger.logSuppressedError("fast-rule match", e);
            return false;
        }
    }

    private static boolean isAdFrame(HostNode node) {
        try {
            return "iframe".equals(node.getTagName()) && AdSignatures.isAdFrameSource(node.getAttribute("src"));
        } catch (RuntimeException e) {
            return false;
        }
    }

    private static HostNode apply(ElementHeuristic h, HostNode node, HeuristicContext context) {
        try {
            return h.match(node, context);
        } catch (RuntimeException e) {
            return null;
        }
    }

    private HeuristicContext heuristicContext() {
        if (mode != FilteringMode.ADVANCED || heuristics.isEmpty()) {
            return null;
        }
        try {
            Viewport viewport = document.getViewport();
            return viewport == null ? null : new HeuristicContext(viewport);
        } catch (RuntimeException e) {
            logger.logSuppressedError("viewport", e);
            return null;
        }
    }

    private static List<HostNode> childrenOf(HostNode node) {
        try {
            return node.getChildren();
        } catch (RuntimeException e) {
            return List.of();
        }
    }

    private static boolean isConnected(HostNode node) {
        try {
            return node.isConnected();
        } catch (RuntimeException e) {
            return false;
        }
    }

    private enum Verdict {
        NO_MATCH,
        MATCHED,
        HIDDEN
    }

    private static final class Frame {
        final HostNode node;
        final int depth;

        Frame(HostNode node, int depth) {
            this.node = node;
            this.depth = depth;
        }
    }

    private static final class Pass {
        final long deadline;
        final String fastGroup;
        final HeuristicContext context;
        int examined;
        int hides;
        boolean exhausted;
        long lastStartedNanos;

        Pass(long deadline, String fastGroup, HeuristicContext context, long start) {
            this.deadline = deadline;
            this.fastGroup = fastGroup;
            this.context = context;
            this.lastStartedNanos = start;
        }
    }
}
