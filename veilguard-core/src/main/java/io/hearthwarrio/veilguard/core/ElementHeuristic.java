package io.hearthwarrio.veilguard.core;

import io.hearthwarrio.veilguard.core.host.HostNode;

/**
 * Pluggable structural rule evaluated by {@link BudgetedClassifier} in {@link FilteringMode#ADVANCED}.
 * <p>
 * Heuristics are intended to extend Veilguard for ad formats that fast rules cannot express (obfuscated
 * class names, generated overlays, recognizable icons) without rewriting the classifier.
 * <p>
 * Contract:
 * <ul>
 *   <li>A heuristic is independently sufficient: a non-null result is hidden right away.</li>
 *   <li>The result may be the candidate itself or a related element (for example an ancestor).</li>
 *   <li>Host read failures are non-matches; implementations may throw, the classifier treats it as null.</li>
 *   <li>Heuristics are applied in {@link #order()} sequence (ascending) and the first match wins.</li>
 * </ul>
 */
public interface ElementHeuristic {

    /**
     * Stable identifier used in diagnostics.
     *
     * @return heuristic identifier
     */
    default String id() {
        return getClass().getSimpleName();
    }

    /**
     * Defines the application order of heuristics.
     * Lower values run earlier.
     *
     * @return order value
     */
    default int order() {
        return 0;
    }

    /**
     * @return reason reported when this heuristic hides an element
     */
    HideReason reason();

    /**
     * @param candidate element under classification
     * @param context   page-level data shared by all heuristics of one pass
     * @return element to hide, or null when the heuristic does not apply
     */
    HostNode match(HostNode candidate, HeuristicContext context);
}
