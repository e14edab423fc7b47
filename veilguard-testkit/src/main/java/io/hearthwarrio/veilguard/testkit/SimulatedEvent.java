package io.hearthwarrio.veilguard.testkit;

import io.hearthwarrio.veilguard.core.host.HostEvent;
import io.hearthwarrio.veilguard.core.host.HostNode;

import java.util.Objects;

/**
 * Event dispatched by {@link SimulatedPage#dispatch(HostNode, String)}.
 */
public final class SimulatedEvent implements HostEvent {

    private final String type;
    private final HostNode target;
    private boolean defaultPrevented;
    private boolean propagationStopped;
    private int deliveredCount;

    SimulatedEvent(String type, HostNode target) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.target = Objects.requireNonNull(target, "target must not be null");
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

    /**
     * @return number of listeners that received the event
     */
    public int getDeliveredCount() {
        return deliveredCount;
    }

    void delivered() {
        deliveredCount++;
    }

    @Override
    public String toString() {
        return "SimulatedEvent{" +
                "type='" + type + '\'' +
                ", defaultPrevented=" + defaultPrevented +
                ", propagationStopped=" + propagationStopped +
                ", delivered=" + deliveredCount +
                '}';
    }
}
