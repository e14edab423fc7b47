package io.hearthwarrio.veilguard.core.heuristics;

import io.hearthwarrio.veilguard.core.AdSignatures;
import io.hearthwarrio.veilguard.core.ElementHeuristic;
import io.hearthwarrio.veilguard.core.HeuristicContext;
import io.hearthwarrio.veilguard.core.HideReason;
import io.hearthwarrio.veilguard.core.host.ComputedStyle;
import io.hearthwarrio.veilguard.core.host.HostNode;

/**
 * Matches positioned, high-stacking elements that cover most of the viewport and carry no text
 * (or carry an ad marker attribute).
 */
public final class FullBleedOverlayHeuristic implements ElementHeuristic {

    public static final int MIN_Z_INDEX_EXCLUSIVE = 100;
    public static final double MIN_VIEWPORT_COVERAGE = 0.7;

    @Override
    public int order() {
        return 20;
    }

    @Override
    public HideReason reason() {
        return HideReason.FULL_BLEED_OVERLAY;
    }

    @Override
    public HostNode match(HostNode candidate, HeuristicContext context) {
        ComputedStyle style = candidate.getComputedStyle();
        if (!style.isFixedOrAbsolute() || !style.zIndexAbove(MIN_Z_INDEX_EXCLUSIVE)) {
            return null;
        }
        if (!candidate.getBoundingRect().coversAtLeast(context.getViewport(), MIN_VIEWPORT_COVERAGE)) {
            return null;
        }
        if (candidate.getInnerText().trim().isEmpty() || AdSignatures.hasMarkerAttribute(candidate)) {
            return candidate;
        }
        return null;
    }
}
