package io.hearthwarrio.veilguard.core;

import java.util.Objects;

/**
 * Keeps a failing {@link HideEventLogger} from breaking the component that reports to it.
 * <p>
 * Failures of the delegate are counted in {@link Counters#getLoggerFailures()} and otherwise dropped.
 */
final class FailSafeHideEventLogger implements HideEventLogger {

    private final HideEventLogger delegate;
    private final Counters counters;

    private FailSafeHideEventLogger(HideEventLogger delegate, Counters counters) {
        this.delegate = delegate;
        this.counters = counters;
    }

    /**
     * @return {@code logger} itself when it is already guarded, otherwise a guarding wrapper
     */
    static HideEventLogger guard(HideEventLogger logger, Counters counters) {
        Objects.requireNonNull(logger, "logger must not be null");
        Objects.requireNonNull(counters, "counters must not be null");
        if (logger instanceof FailSafeHideEventLogger) {
            return logger;
        }
        return new FailSafeHideEventLogger(logger, counters);
    }

    @Override
    public void logHidden(HideReason reason, ElementSnapshot snapshot) {
        try {
            delegate.logHidden(reason, snapshot);
        } catch (RuntimeException e) {
            counters.incrementLoggerFailures();
        }
    }

    @Override
    public void logSuppressedError(String operation, Throwable error) {
        try {
            delegate.logSuppressedError(operation, error);
        } catch (RuntimeException e) {
            counters.incrementLoggerFailures();
        }
    }

    @Override
    public LogDetail detail() {
        try {
            LogDetail d = delegate.detail();
            return d == null ? LogDetail.NONE : d;
        } catch (RuntimeException e) {
            counters.incrementLoggerFailures();
            return LogDetail.NONE;
        }
    }
}
