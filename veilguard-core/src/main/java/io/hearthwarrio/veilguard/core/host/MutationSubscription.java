package io.hearthwarrio.veilguard.core.host;

@FunctionalInterface
public interface MutationSubscription {

    /**
     * Stops delivery. Calling it more than once has no effect.
     */
    void disconnect();
}
