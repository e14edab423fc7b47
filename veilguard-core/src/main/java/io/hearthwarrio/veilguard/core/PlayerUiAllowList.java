package io.hearthwarrio.veilguard.core;

import io.hearthwarrio.veilguard.core.host.HostNode;

/**
 * Structural and semantic patterns of legitimate page and player chrome.
 * <p>
 * Overlay sweeps and click protection never hide an element matching this list.
 */
public final class PlayerUiAllowList {

    public static final String SELECTOR = String.join(", ",
            "video",
            "main",
            "article",
            "nav",
            "header",
            "footer",
            "form",
            "dialog",
            ".content",
            ".video-player",
            "[class*=\"player\"]",
            "[class*=\"controls\"]",
            "[id*=\"player\"]",
            "[class^=\"ytp-\"]"
    );

    private PlayerUiAllowList() {
        // utility class
    }

    /**
     * Fails towards protection: an element that cannot be evaluated counts as allow-listed.
     *
     * @param node element
     * @return true if the element must not be hidden by overlay heuristics
     */
    public static boolean isPlayerUi(HostNode node) {
        if (node == null) {
            return true;
        }
        try {
            return node.matches(SELECTOR);
        } catch (RuntimeException e) {
            return true;
        }
    }
}
