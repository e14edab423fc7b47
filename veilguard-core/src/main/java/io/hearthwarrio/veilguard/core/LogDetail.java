package io.hearthwarrio.veilguard.core;

/**
 * Controls how much element data a {@link HideEventLogger} wants.
 */
public enum LogDetail {

    /**
     * Only the hide reason.
     */
    NONE,

    /**
     * Reason, tag and id.
     */
    SUMMARY,

    /**
     * Everything in {@link #SUMMARY} plus classes and marker attribute.
     */
    FULL
}
