package io.hearthwarrio.veilguard.core.host;

import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Reference {@link HostScheduler}: a single-threaded loop with a timer queue and an idle queue.
 * <p>
 * The loop never runs by itself. The owner drives it by calling {@link #runDueTasks()} (timers and idle
 * callbacks whose timeout expired) and {@link #runIdleSlice()} (grants one idle slice). Tests drive it with a
 * virtual clock; the WebDriver adapter drives it from its pump with {@link System#nanoTime()}.
 * <p>
 * A task that throws does not stop the round: the failure is counted, passed to the
 * {@link #withTaskFailureHandler(Consumer) failure handler} and the remaining tasks still run.
 * <p>
 * This class is not thread-safe, except for {@link #post(Runnable)}.
 */
public class CooperativeEventLoop implements HostScheduler {

    private static final long NANOS_PER_MILLI = 1_000_000L;

    private final LongSupplier nanoSource;
    private final LongSupplier wallClock;
    private final boolean idleSupported;

    private final PriorityQueue<TimerEntry> timers = new PriorityQueue<>(
            Comparator.comparingLong((TimerEntry t) -> t.dueNanos).thenComparingLong(t -> t.sequence)
    );
    private final ArrayDeque<IdleEntry> idleEntries = new ArrayDeque<>();
    private final ConcurrentLinkedQueue<Runnable> posted = new ConcurrentLinkedQueue<>();
    private long sequence;

    private Consumer<RuntimeException> taskFailureHandler;
    private long failedTasks;

    /**
     * Creates a real-time loop with idle callback support.
     */
    public CooperativeEventLoop() {
        this(System::nanoTime, System::currentTimeMillis, true);
    }

    /**
     * @param nanoSource    monotonic nanosecond clock
     * @param wallClock     epoch millisecond clock
     * @param idleSupported whether {@link #requestIdle(Runnable, long)} is available
     */
    public CooperativeEventLoop(LongSupplier nanoSource, LongSupplier wallClock, boolean idleSupported) {
        this.nanoSource = Objects.requireNonNull(nanoSource, "nanoSource must not be null");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock must not be null");
        this.idleSupported = idleSupported;
    }

    /**
     * @param handler receives every exception thrown by a task; must not throw itself
     * @return this loop
     */
    public CooperativeEventLoop withTaskFailureHandler(Consumer<RuntimeException> handler) {
        this.taskFailureHandler = handler;
        return this;
    }

    /**
     * @return tasks that ended with an exception so far
     */
    public long getFailedTaskCount() {
        return failedTasks;
    }

    @Override
    public long nanoTime() {
        return nanoSource.getAsLong();
    }

    @Override
    public long currentTimeMillis() {
        return wallClock.getAsLong();
    }

    @Override
    public Cancellable schedule(Runnable task, long delayMillis) {
        Objects.requireNonNull(task, "task must not be null");
        TimerEntry entry = new TimerEntry(task, nanoTime() + Math.max(0L, delayMillis) * NANOS_PER_MILLI, 0L, sequence++);
        timers.add(entry);
        return entry;
    }

    @Override
    public void post(Runnable task) {
        posted.add(Objects.requireNonNull(task, "task must not be null"));
    }

    @Override
    public Cancellable scheduleAtFixedRate(Runnable task, long periodMillis) {
        Objects.requireNonNull(task, "task must not be null");
        if (periodMillis <= 0) {
            throw new IllegalArgumentException("periodMillis must be positive: " + periodMillis);
        }
        long period = periodMillis * NANOS_PER_MILLI;
        TimerEntry entry = new TimerEntry(task, nanoTime() + period, period, sequence++);
        timers.add(entry);
        return entry;
    }

    @Override
    public boolean supportsIdleCallbacks() {
        return idleSupported;
    }

    @Override
    public Cancellable requestIdle(Runnable task, long timeoutMillis) {
        Objects.requireNonNull(task, "task must not be null");
        if (!idleSupported) {
            throw new UnsupportedOperationException("idle callbacks are not supported by this loop");
        }
        IdleEntry entry = new IdleEntry(task, nanoTime() + Math.max(0L, timeoutMillis) * NANOS_PER_MILLI);
        idleEntries.add(entry);
        return entry;
    }

    /**
     * Runs posted tasks, every timer that is due and every idle callback whose timeout expired.
     * <p>
     * Work scheduled while this method runs is left for the next call, even when it is already due.
     *
     * @return number of callbacks executed
     */
    public int runDueTasks() {
        long now = nanoTime();
        long limit = sequence;
        int ran = 0;

        int postedCount = posted.size();
        for (int i = 0; i < postedCount; i++) {
            Runnable p = posted.poll();
            if (p == null) {
                break;
            }
            runTask(p);
            ran++;
        }

        while (!timers.isEmpty()) {
            TimerEntry next = timers.peek();
            if (next.dueNanos > now || next.sequence >= limit) {
                break;
            }
            timers.poll();
            if (next.cancelled) {
                continue;
            }
            if (next.periodNanos > 0) {
                next.dueNanos += next.periodNanos;
                timers.add(next);
            }
            runTask(next.task);
            ran++;
        }

        int idleCount = idleEntries.size();
        for (int i = 0; i < idleCount && !idleEntries.isEmpty(); i++) {
            IdleEntry e = idleEntries.poll();
            if (e.cancelled || e.done) {
                continue;
            }
            if (e.deadlineNanos <= now) {
                e.done = true;
                runTask(e.task);
                ran++;
            } else {
                idleEntries.add(e);
            }
        }
        return ran;
    }

    /**
     * Grants one idle slice: runs the idle callbacks queued before this call.
     *
     * @return number of callbacks executed
     */
    public int runIdleSlice() {
        int count = idleEntries.size();
        int ran = 0;
        for (int i = 0; i < count && !idleEntries.isEmpty(); i++) {
            IdleEntry e = idleEntries.poll();
            if (e.cancelled || e.done) {
                continue;
            }
            e.done = true;
            runTask(e.task);
            ran++;
        }
        return ran;
    }

    private void runTask(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            failedTasks++;
            if (taskFailureHandler != null) {
                taskFailureHandler.accept(e);
            }
        }
    }

    /**
     * @return due time of the earliest live timer or idle timeout, or {@link Long#MAX_VALUE} when nothing is pending
     */
    public long nextDeadlineNanos() {
        long best = posted.isEmpty() ? Long.MAX_VALUE : nanoTime();
        for (TimerEntry t : timers) {
            if (!t.cancelled && t.dueNanos < best) {
                best = t.dueNanos;
            }
        }
        for (IdleEntry e : idleEntries) {
            if (!e.cancelled && e.deadlineNanos < best) {
                best = e.deadlineNanos;
            }
        }
        return best;
    }

    public int pendingIdleCount() {
        int n = 0;
        for (IdleEntry e : idleEntries) {
            if (!e.cancelled) {
                n++;
            }
        }
        return n;
    }

    public int pendingTimerCount() {
        int n = 0;
        for (TimerEntry t : timers) {
            if (!t.cancelled) {
                n++;
            }
        }
        return n;
    }

    private static final class TimerEntry implements Cancellable {
        final Runnable task;
        final long periodNanos;
        final long sequence;
        long dueNanos;
        boolean cancelled;

        TimerEntry(Runnable task, long dueNanos, long periodNanos, long sequence) {
            this.task = task;
            this.dueNanos = dueNanos;
            this.periodNanos = periodNanos;
            this.sequence = sequence;
        }

        @Override
        public void cancel() {
            cancelled = true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }
    }

    private static final class IdleEntry implements Cancellable {
        final Runnable task;
        final long deadlineNanos;
        boolean cancelled;
        boolean done;

        IdleEntry(Runnable task, long deadlineNanos) {
            this.task = task;
            this.deadlineNanos = deadlineNanos;
        }

        @Override
        public void cancel() {
            cancelled = true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }
    }
}
