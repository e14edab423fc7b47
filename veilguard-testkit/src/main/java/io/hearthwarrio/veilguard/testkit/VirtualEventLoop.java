package io.hearthwarrio.veilguard.testkit;

import io.hearthwarrio.veilguard.core.host.CooperativeEventLoop;

import java.util.Objects;

/**
 * {@link CooperativeEventLoop} running on a {@link VirtualClock}.
 */
public final class VirtualEventLoop extends CooperativeEventLoop {

    private static final long NANOS_PER_MILLI = 1_000_000L;
    private static final int MAX_FLUSH_ROUNDS = 10_000;

    private final VirtualClock clock;

    public VirtualEventLoop() {
        this(new VirtualClock(), true);
    }

    public VirtualEventLoop(VirtualClock clock, boolean idleSupported) {
        super(Objects.requireNonNull(clock, "clock must not be null")::nanoTime, clock::currentTimeMillis, idleSupported);
        this.clock = clock;
    }

    public VirtualClock clock() {
        return clock;
    }

    /**
     * Runs posted tasks and grants idle slices until nothing is left to run at the current time.
     *
     * @return number of callbacks executed
     */
    public int flush() {
        int total = 0;
        for (int i = 0; i < MAX_FLUSH_ROUNDS; i++) {
            int ran = runDueTasks() + runIdleSlice();
            if (ran == 0) {
                return total;
            }
            total += ran;
        }
        throw new IllegalStateException("event loop did not settle after " + MAX_FLUSH_ROUNDS + " rounds");
    }

    /**
     * Moves time forward, firing timers and idle timeouts at their due times. Idle slices are not granted.
     *
     * @param millis time to advance
     */
    public void advance(long millis) {
        advanceTo(clock.peekNanos() + millis * NANOS_PER_MILLI, false);
    }

    /**
     * Moves time forward like {@link #advance(long)} and grants idle slices whenever the loop catches up.
     *
     * @param millis time to advance
     */
    public void advanceWithIdle(long millis) {
        advanceTo(clock.peekNanos() + millis * NANOS_PER_MILLI, true);
    }

    private void advanceTo(long target, boolean grantIdle) {
        if (grantIdle) {
            flush();
        }
        for (int i = 0; i < MAX_FLUSH_ROUNDS; i++) {
            long next = nextDeadlineNanos();
            if (next > target) {
                clock.setNanos(target);
                if (grantIdle) {
                    flush();
                } else {
                    runDueTasks();
                }
                return;
            }
            clock.setNanos(next);
            if (grantIdle) {
                flush();
            } else {
                runDueTasks();
            }
        }
        throw new IllegalStateException("event loop did not settle after " + MAX_FLUSH_ROUNDS + " rounds");
    }
}
