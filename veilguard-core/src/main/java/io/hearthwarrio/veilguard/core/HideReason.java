package io.hearthwarrio.veilguard.core;

/**
 * Why an element was hidden.
 */
public enum HideReason {

    FAST_RULE(false),
    MARKER_ATTRIBUTE(false),
    AD_SLOT_CLASS(false),
    AD_FRAME(false),
    OBFUSCATED_CLUSTER(true),
    FULL_BLEED_OVERLAY(true),
    CLOSE_ICON(true),

    /**
     * Marker attribute seen directly in a mutation batch, escalated before any deferred pass.
     */
    URGENT_MARKER(false),

    /**
     * Overlay stacked above a guarded media element.
     */
    MEDIA_OVERLAY(false),

    /**
     * Full-screen click target vetoed by click protection.
     */
    CLICK_OVERLAY(false);

    private final boolean heuristic;

    HideReason(boolean heuristic) {
        this.heuristic = heuristic;
    }

    /**
     * @return true if the hide came from an advanced structural heuristic
     */
    public boolean isHeuristic() {
        return heuristic;
    }
}
