package io.hearthwarrio.veilguard.core.heuristics;

import io.hearthwarrio.veilguard.core.ElementHeuristic;
import io.hearthwarrio.veilguard.core.HeuristicContext;
import io.hearthwarrio.veilguard.core.HideReason;
import io.hearthwarrio.veilguard.core.host.HostNode;

import java.util.Set;

/**
 * Recognizes the close buttons of known ad widgets by their icon {@code viewBox}, then hides the nearest
 * {@code div} (the element itself included) whose inline style is fixed-positioned.
 */
public final class CloseIconFingerprintHeuristic implements ElementHeuristic {

    public static final Set<String> KNOWN_VIEW_BOXES = Set.of("0 0 8 8", "0 0 87 16", "0 0 85 16");

    @Override
    public int order() {
        return 30;
    }

    @Override
    public HideReason reason() {
        return HideReason.CLOSE_ICON;
    }

    @Override
    public HostNode match(HostNode candidate, HeuristicContext context) {
        HostNode svg = "svg".equals(candidate.getTagName()) ? candidate : candidate.querySelector("svg");
        if (svg == null) {
            return null;
        }
        String viewBox = svg.getAttribute("viewBox");
        if (viewBox == null || !KNOWN_VIEW_BOXES.contains(viewBox)) {
            return null;
        }
        return closestFixedDiv(candidate);
    }

    private static HostNode closestFixedDiv(HostNode from) {
        for (HostNode n = from; n != null; n = n.getParent()) {
            if ("div".equals(n.getTagName())) {
                String style = n.getAttribute("style");
                if (style != null && style.contains("fixed")) {
                    return n;
                }
            }
        }
        return null;
    }
}
