package io.hearthwarrio.veilguard.core;

/**
 * Receives information about hidden elements and swallowed errors.
 * <p>
 * Implementations may log to stdout, Allure, files, etc. Nothing is ever transmitted off the page.
 * <p>
 * Note: {@link #detail()} is used by the engine to decide whether it should take an
 * {@link ElementSnapshot} at all.
 */
@FunctionalInterface
public interface HideEventLogger {

    /**
     * Called after an element has been visually suppressed.
     *
     * @param reason   why the element was hidden
     * @param snapshot element data (empty snapshot when {@link #detail()} is {@link LogDetail#NONE})
     */
    void logHidden(HideReason reason, ElementSnapshot snapshot);

    /**
     * Called when an operation failed and the engine carried on.
     *
     * @param operation short operation name (for example {@code "detach"})
     * @param error     the swallowed error
     */
    default void logSuppressedError(String operation, Throwable error) {
        // ignored unless overridden
    }

    /**
     * Default is {@link LogDetail#SUMMARY}.
     */
    default LogDetail detail() {
        return LogDetail.SUMMARY;
    }

    static HideEventLogger noop() {
        return (reason, snapshot) -> {
        };
    }
}
