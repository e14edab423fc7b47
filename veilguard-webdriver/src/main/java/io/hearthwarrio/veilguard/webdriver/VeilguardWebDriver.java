package io.hearthwarrio.veilguard.webdriver;

import io.hearthwarrio.veilguard.core.ElementHeuristic;
import io.hearthwarrio.veilguard.core.ElementHeuristics;
import io.hearthwarrio.veilguard.core.EngineTuning;
import io.hearthwarrio.veilguard.core.HideEventLogger;
import io.hearthwarrio.veilguard.core.LogDetail;
import io.hearthwarrio.veilguard.core.PendingBatchPolicy;
import io.hearthwarrio.veilguard.core.SelectorConfigBuilder;
import io.hearthwarrio.veilguard.core.SettingsProvider;
import io.hearthwarrio.veilguard.core.StdOutHideEventLogger;
import io.hearthwarrio.veilguard.core.VeilguardEngine;
import io.hearthwarrio.veilguard.core.host.CooperativeEventLoop;
import org.openqa.selenium.WebDriver;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Runs a {@link VeilguardEngine} against the current page of a Selenium {@link WebDriver}.
 * <p>
 * The engine runs on a real-time {@link CooperativeEventLoop} that only advances inside {@link #pump()}.
 * Each pump pulls the mutations and events recorded in the page, runs due timers and grants one idle slice.
 * When the page navigates away, the next pump stops the old engine and attaches a new one to the new page.
 * <p>
 * This class is not thread-safe and is expected to be used from a single test thread.
 */
public class VeilguardWebDriver {

    public static final Duration DEFAULT_PUMP_INTERVAL = Duration.ofMillis(50);

    private final WebDriver driver;
    private final SettingsProvider settingsProvider;

    private HideEventLogger logger = HideEventLogger.noop();
    private EngineTuning tuning = EngineTuning.defaults();
    private PendingBatchPolicy pendingBatchPolicy = PendingBatchPolicy.DROP;
    private SelectorConfigBuilder selectorConfigBuilder = new SelectorConfigBuilder();
    private List<ElementHeuristic> heuristics = ElementHeuristics.builtIn();

    private WebDriverHostDocument document;
    private CooperativeEventLoop loop;
    private VeilguardEngine engine;
    private int attachCount;

    public VeilguardWebDriver(WebDriver driver, SettingsProvider settingsProvider) {
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
        this.settingsProvider = Objects.requireNonNull(settingsProvider, "settingsProvider must not be null");
    }

    public VeilguardWebDriver withLogger(HideEventLogger logger) {
        this.logger = logger == null ? HideEventLogger.noop() : logger;
        return this;
    }

    public VeilguardWebDriver withLoggingToStdOut(LogDetail detail) {
        this.logger = new StdOutHideEventLogger(detail);
        return this;
    }

    public VeilguardWebDriver withTuning(EngineTuning tuning) {
        this.tuning = Objects.requireNonNull(tuning, "tuning must not be null");
        return this;
    }

    public VeilguardWebDriver withPendingBatchPolicy(PendingBatchPolicy policy) {
        this.pendingBatchPolicy = Objects.requireNonNull(policy, "policy must not be null");
        return this;
    }

    public VeilguardWebDriver withSelectorConfigBuilder(SelectorConfigBuilder builder) {
        this.selectorConfigBuilder = Objects.requireNonNull(builder, "builder must not be null");
        return this;
    }

    public VeilguardWebDriver withElementHeuristics(ElementHeuristic... heuristics) {
        this.heuristics = heuristics == null ? List.of() : ElementHeuristics.normalize(Arrays.asList(heuristics));
        return this;
    }

    /**
     * Starts an engine on the current page, replacing any previous one. Settings resolution completes on a
     * later {@link #pump()}.
     *
     * @return the new engine
     */
    public VeilguardEngine attach() {
        if (engine != null) {
            engine.stop();
        }
        document = new WebDriverHostDocument(driver);
        loop = new CooperativeEventLoop();
        VeilguardEngine created = new VeilguardEngine(document, loop, settingsProvider)
                .withLogger(logger)
                .withTuning(tuning)
                .withPendingBatchPolicy(pendingBatchPolicy)
                .withSelectorConfigBuilder(selectorConfigBuilder)
                .withElementHeuristics(heuristics.toArray(new ElementHeuristic[0]));
        loop.withTaskFailureHandler(e -> created.getLogger().logSuppressedError("scheduled task", e));
        engine = created;
        engine.start();
        attachCount++;
        pump();
        return engine;
    }

    /**
     * Runs one round of the event loop.
     *
     * @return number of callbacks and records processed
     * @throws IllegalStateException when not attached
     */
    public int pump() {
        requireAttached();
        int drained = document.drain();
        if (drained < 0) {
            attach();
            return 0;
        }
        return drained + loop.runDueTasks() + loop.runIdleSlice();
    }

    /**
     * Pumps repeatedly for {@code duration}, sleeping {@link #DEFAULT_PUMP_INTERVAL} between rounds.
     */
    public void pumpFor(Duration duration) {
        pumpFor(duration, DEFAULT_PUMP_INTERVAL);
    }

    public void pumpFor(Duration duration, Duration interval) {
        Objects.requireNonNull(duration, "duration must not be null");
        Objects.requireNonNull(interval, "interval must not be null");
        long deadline = System.nanoTime() + duration.toNanos();
        while (true) {
            pump();
            if (System.nanoTime() >= deadline) {
                return;
            }
            try {
                Thread.sleep(Math.max(1L, interval.toMillis()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    /**
     * Stops the engine. The driver stays open.
     */
    public void detach() {
        if (engine != null) {
            engine.stop();
            engine = null;
        }
        document = null;
        loop = null;
    }

    public boolean isAttached() {
        return engine != null;
    }

    private void requireAttached() {
        if (engine == null) {
            throw new IllegalStateException("not attached; call attach() first");
        }
    }

    public WebDriver getDriver() {
        return driver;
    }

    /**
     * @return current engine, or null when detached
     */
    public VeilguardEngine getEngine() {
        return engine;
    }

    public WebDriverHostDocument getDocument() {
        return document;
    }

    /**
     * @return number of engines started so far, navigations included
     */
    public int getAttachCount() {
        return attachCount;
    }
}
