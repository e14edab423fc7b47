package io.hearthwarrio.veilguard.core.host;

@FunctionalInterface
public interface HostEventListener {

    void handleEvent(HostEvent event);
}
