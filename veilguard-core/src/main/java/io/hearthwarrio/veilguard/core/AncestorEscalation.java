package io.hearthwarrio.veilguard.core;

import io.hearthwarrio.veilguard.core.host.ComputedStyle;
import io.hearthwarrio.veilguard.core.host.HostNode;

/**
 * Finds the positioned container that should be hidden instead of a matched inner element.
 */
final class AncestorEscalation {

    private AncestorEscalation() {
    }

    /**
     * Walks up at most {@code maxDepth} ancestors, stopping at {@code body}, and keeps the highest ancestor that is
     * fixed or absolutely positioned or has a non-{@code auto} z-index. A failing style read ends the walk.
     *
     * @param node     matched element
     * @param body     document body (may be null)
     * @param maxDepth maximum number of ancestors to inspect
     * @return highest qualifying ancestor, or {@code node} itself
     */
    static HostNode findRoot(HostNode node, HostNode body, int maxDepth) {
        HostNode root = node;
        try {
            HostNode current = node.getParent();
            int depth = 0;
            while (current != null && current != body && depth < maxDepth) {
                ComputedStyle style = current.getComputedStyle();
                if (style.isFixedOrAbsolute() || style.hasNonAutoZIndex()) {
                    root = current;
                }
                current = current.getParent();
                depth++;
            }
        } catch (RuntimeException e) {
            return root;
        }
        return root;
    }
}
