package io.hearthwarrio.veilguard.testkit;

import io.hearthwarrio.veilguard.core.HideEventLogger;
import io.hearthwarrio.veilguard.core.SiteSettings;
import io.hearthwarrio.veilguard.core.VeilguardEngine;

import java.util.Objects;

/**
 * One simulated page load: event loop, page, native capabilities and an engine wired together.
 * <p>
 * The engine is returned unstarted by {@link #engine()} so tests can configure it; {@link #start()} starts it
 * and lets settings resolution complete.
 */
public final class PageSession {

    private final VirtualEventLoop loop;
    private final SimulatedPage page;
    private final SimulatedCapabilities capabilities;
    private final StaticSettingsProvider settings;
    private final VeilguardEngine engine;

    private PageSession(String html, String domain, StaticSettingsProvider settings, boolean idleSupported) {
        this.loop = new VirtualEventLoop(new VirtualClock(), idleSupported);
        this.page = new SimulatedPage(html, domain, loop);
        this.capabilities = new SimulatedCapabilities(page);
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        VeilguardEngine created = new VeilguardEngine(page, loop, settings).withCapabilityHost(capabilities);
        loop.withTaskFailureHandler(e -> created.getLogger().logSuppressedError("scheduled task", e));
        this.engine = created;
    }

    public static PageSession open(String html, String domain, SiteSettings settings) {
        return new PageSession(html, domain, StaticSettingsProvider.of(settings), true);
    }

    public static PageSession open(String html, String domain, StaticSettingsProvider settings) {
        return new PageSession(html, domain, settings, true);
    }

    /**
     * Same as {@link #open(String, String, SiteSettings)} on a loop without idle callbacks.
     */
    public static PageSession openWithoutIdle(String html, String domain, SiteSettings settings) {
        return new PageSession(html, domain, StaticSettingsProvider.of(settings), false);
    }

    public PageSession withLogger(HideEventLogger logger) {
        engine.withLogger(logger);
        return this;
    }

    /**
     * Starts the engine and runs the loop until settings are applied.
     */
    public PageSession start() {
        engine.start();
        loop.flush();
        return this;
    }

    /**
     * Delivers pending mutations and runs everything runnable now, idle slices included.
     */
    public PageSession settle() {
        loop.flush();
        return this;
    }

    public VirtualEventLoop loop() {
        return loop;
    }

    public VirtualClock clock() {
        return loop.clock();
    }

    public SimulatedPage page() {
        return page;
    }

    public SimulatedCapabilities capabilities() {
        return capabilities;
    }

    public StaticSettingsProvider settings() {
        return settings;
    }

    public VeilguardEngine engine() {
        return engine;
    }
}
