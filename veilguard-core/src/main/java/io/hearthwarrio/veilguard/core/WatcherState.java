package io.hearthwarrio.veilguard.core;

/**
 * Lifecycle of {@link MutationWatcher}.
 */
public enum WatcherState {

    /**
     * No deferred pass pending.
     */
    IDLE,

    /**
     * A mutation batch is being collected.
     */
    COLLECTING,

    /**
     * A deferred pass is scheduled and has not run yet.
     */
    DEFERRED
}
