package io.hearthwarrio.veilguard.core;

import io.hearthwarrio.veilguard.core.host.Viewport;

import java.util.Objects;

/**
 * Page-level data handed to {@link ElementHeuristic} implementations.
 */
public final class HeuristicContext {

    private final Viewport viewport;

    public HeuristicContext(Viewport viewport) {
        this.viewport = Objects.requireNonNull(viewport, "viewport must not be null");
    }

    public Viewport getViewport() {
        return viewport;
    }
}
