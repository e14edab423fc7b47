package io.hearthwarrio.veilguard.core.intercept;

import io.hearthwarrio.veilguard.core.HideEventLogger;

import java.util.Objects;
import java.util.Optional;

/**
 * Installs {@link InterceptingCapabilities} on a {@link CapabilityHost}.
 */
public final class CapabilityInterceptor {

    static final String TOKEN_KEY = "veilguard.capability-interceptor";

    private CapabilityInterceptor() {
    }

    /**
     * Installs the interceptor once per context, in top-level contexts only.
     *
     * @param host   execution context
     * @param logger error sink
     * @return installed decorator, or empty when skipped (nested context or already installed)
     */
    public static Optional<InterceptingCapabilities> install(CapabilityHost host, HideEventLogger logger) {
        return install(host, logger, false);
    }

    /**
     * @param host                execution context
     * @param logger              error sink
     * @param allowNestedContexts install in nested frames too
     * @return installed decorator, or empty when skipped
     */
    public static Optional<InterceptingCapabilities> install(
            CapabilityHost host,
            HideEventLogger logger,
            boolean allowNestedContexts
    ) {
        Objects.requireNonNull(host, "host must not be null");
        Objects.requireNonNull(logger, "logger must not be null");

        if (!allowNestedContexts && !host.isTopLevelContext()) {
            return Optional.empty();
        }
        if (!host.initializationToken().claim(TOKEN_KEY)) {
            return Optional.empty();
        }

        InterceptingCapabilities intercepting = new InterceptingCapabilities(host.getCapabilities(), logger);
        host.setCapabilities(intercepting);
        return Optional.of(intercepting);
    }
}
