package io.hearthwarrio.veilguard.core.host;

/**
 * Handle to scheduled work.
 */
public interface Cancellable {

    void cancel();

    boolean isCancelled();
}
