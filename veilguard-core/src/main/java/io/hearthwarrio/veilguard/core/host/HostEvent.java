package io.hearthwarrio.veilguard.core.host;

/**
 * UI event delivered by the host.
 */
public interface HostEvent {

    String getType();

    /**
     * @return the exact element the event was dispatched to
     */
    HostNode getTarget();

    void preventDefault();

    void stopPropagation();

    boolean isDefaultPrevented();

    boolean isPropagationStopped();
}
