package io.hearthwarrio.veilguard.webdriver;

import io.hearthwarrio.veilguard.core.host.HostEvent;
import io.hearthwarrio.veilguard.core.host.HostNode;

/**
 * Event replayed from the page recorder. The page has already handled it.
 */
final class WebDriverHostEvent implements HostEvent {

    private final String type;
    private final HostNode target;
    private boolean defaultPrevented;
    private boolean propagationStopped;

    WebDriverHostEvent(String type, HostNode target) {
        this.type = type;
        this.target = target;
    }

    @Override
    public String getType() {
        return type;
    }

    @Override
    public HostNode getTarget() {
        return target;
    }

    @Override
    public void preventDefault() {
        defaultPrevented = true;
    }

    @Override
    public void stopPropagation() {
        propagationStopped = true;
    }

    @Override
    public boolean isDefaultPrevented() {
        return defaultPrevented;
    }

    @Override
    public boolean isPropagationStopped() {
        return propagationStopped;
    }
}
