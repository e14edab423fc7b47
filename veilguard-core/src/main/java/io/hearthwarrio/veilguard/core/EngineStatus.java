package io.hearthwarrio.veilguard.core;

/**
 * Lifecycle of a {@link VeilguardEngine}.
 */
public enum EngineStatus {
    CREATED,
    RESOLVING,
    ACTIVE,

    /**
     * Settings resolved but nothing installed (no domain, relaxed site, lite mode or failed resolution).
     */
    DORMANT,
    STOPPED
}
