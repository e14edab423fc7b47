package io.hearthwarrio.veilguard.core;

/**
 * What {@link MutationWatcher} does with candidates that arrive while a deferred pass is pending.
 */
public enum PendingBatchPolicy {

    /**
     * Discard the new candidates. Elements are caught again only if a later mutation re-surfaces them.
     */
    DROP,

    /**
     * Append the new candidates to the pending pass.
     */
    MERGE
}
