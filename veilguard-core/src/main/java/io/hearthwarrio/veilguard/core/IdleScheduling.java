package io.hearthwarrio.veilguard.core;

import io.hearthwarrio.veilguard.core.host.Cancellable;
import io.hearthwarrio.veilguard.core.host.HostScheduler;

/**
 * Idle-time scheduling with a fixed-delay timer fallback.
 */
final class IdleScheduling {

    private IdleScheduling() {
    }

    static Cancellable runWhenIdle(HostScheduler scheduler, Runnable task, long timeoutMillis, long fallbackDelayMillis) {
        if (scheduler.supportsIdleCallbacks()) {
            return scheduler.requestIdle(task, timeoutMillis);
        }
        return scheduler.schedule(task, fallbackDelayMillis);
    }
}
