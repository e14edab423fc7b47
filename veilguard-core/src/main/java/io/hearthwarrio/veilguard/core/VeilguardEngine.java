package io.hearthwarrio.veilguard.core;

import io.hearthwarrio.veilguard.core.host.Cancellable;
import io.hearthwarrio.veilguard.core.host.HostDocument;
import io.hearthwarrio.veilguard.core.host.HostNode;
import io.hearthwarrio.veilguard.core.host.HostScheduler;
import io.hearthwarrio.veilguard.core.intercept.CapabilityHost;
import io.hearthwarrio.veilguard.core.intercept.CapabilityInterceptor;
import io.hearthwarrio.veilguard.core.intercept.InterceptingCapabilities;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionStage;

/**
 * Veilguard entry point for one page load.
 * <p>
 * {@link #start()} resolves the {@link SiteSettings} of the page domain once, then installs the components the
 * settings allow:
 * <ul>
 *   <li>nothing for an empty domain, an active relax window or {@link FilteringMode#LITE}</li>
 *   <li>the capability interceptor unless {@link SiteSettings#isInterceptionOff()} (and a {@link CapabilityHost}
 *       is configured)</li>
 *   <li>suppression style, fast cleanup, mutation watcher, removal queue unless
 *       {@link SiteSettings#isClassificationOff()}</li>
 *   <li>media guard and click interceptor in {@link FilteringMode#ADVANCED} unless
 *       {@link SiteSettings#isSiteFixesOff()}</li>
 * </ul>
 * All work runs on the {@link HostScheduler} thread. Configuration methods must be called before {@link #start()}.
 */
public class VeilguardEngine {

    private final HostDocument document;
    private final HostScheduler scheduler;
    private final SettingsProvider settingsProvider;

    private final Counters counters = new Counters();
    private final ProcessedSet processed = new ProcessedSet();

    private HideEventLogger logger = FailSafeHideEventLogger.guard(HideEventLogger.noop(), counters);
    private EngineTuning tuning = EngineTuning.defaults();
    private PendingBatchPolicy pendingBatchPolicy = PendingBatchPolicy.DROP;
    private SelectorConfigBuilder selectorConfigBuilder = new SelectorConfigBuilder();
    private List<ElementHeuristic> heuristics = ElementHeuristics.builtIn();
    private CapabilityHost capabilityHost;
    private boolean allowNestedContexts;

    private EngineStatus status = EngineStatus.CREATED;
    private String domain = "";
    private SiteSettings settings;
    private SelectorConfig selectorConfig = SelectorConfig.empty();

    private Suppressor suppressor;
    private RemovalQueue removalQueue;
    private SuppressionStyle suppressionStyle;
    private Cancellable healCheck;
    private BudgetedClassifier classifier;
    private MutationWatcher watcher;
    private MediaGuard mediaGuard;
    private ClickInterceptor clickInterceptor;
    private InterceptingCapabilities interceptor;

    public VeilguardEngine(HostDocument document, HostScheduler scheduler, SettingsProvider settingsProvider) {
        this.document = Objects.requireNonNull(document, "document must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.settingsProvider = Objects.requireNonNull(settingsProvider, "settingsProvider must not be null");
    }

    // ----------- configuration -----------

    public VeilguardEngine withLogger(HideEventLogger logger) {
        requireNotStarted();
        this.logger = FailSafeHideEventLogger.guard(logger == null ? HideEventLogger.noop() : logger, counters);
        return this;
    }

    public VeilguardEngine withTuning(EngineTuning tuning) {
        requireNotStarted();
        this.tuning = Objects.requireNonNull(tuning, "tuning must not be null");
        return this;
    }

    public VeilguardEngine withPendingBatchPolicy(PendingBatchPolicy policy) {
        requireNotStarted();
        this.pendingBatchPolicy = Objects.requireNonNull(policy, "policy must not be null");
        return this;
    }

    public VeilguardEngine withSelectorConfigBuilder(SelectorConfigBuilder builder) {
        requireNotStarted();
        this.selectorConfigBuilder = Objects.requireNonNull(builder, "builder must not be null");
        return this;
    }

    /**
     * Enables capability interception on the given context.
     *
     * @param host                context whose capabilities get wrapped
     * @param allowNestedContexts install in nested frames too
     * @return this engine
     */
    public VeilguardEngine withCapabilityHost(CapabilityHost host, boolean allowNestedContexts) {
        requireNotStarted();
        this.capabilityHost = Objects.requireNonNull(host, "host must not be null");
        this.allowNestedContexts = allowNestedContexts;
        return this;
    }

    public VeilguardEngine withCapabilityHost(CapabilityHost host) {
        return withCapabilityHost(host, false);
    }

    /**
     * Replaces the advanced heuristics. Pass the built-ins from {@link ElementHeuristics#builtIn()} along
     * to extend rather than replace them.
     *
     * @param heuristics heuristics (nulls ignored)
     * @return this engine
     */
    public VeilguardEngine withElementHeuristics(ElementHeuristic... heuristics) {
        requireNotStarted();
        this.heuristics = heuristics == null ? List.of() : ElementHeuristics.normalize(Arrays.asList(heuristics));
        return this;
    }

    private void requireNotStarted() {
        if (status != EngineStatus.CREATED) {
            throw new IllegalStateException("engine already started: " + status);
        }
    }

    // ----------- lifecycle -----------

    /**
     * Resolves settings for the page domain. Activation happens on the scheduler thread once they arrive.
     */
    public void start() {
        requireNotStarted();
        status = EngineStatus.RESOLVING;

        String d = document.getDomain();
        domain = d == null ? "" : d.trim();
        if (domain.isEmpty()) {
            status = EngineStatus.DORMANT;
            return;
        }

        CompletionStage<SiteSettings> stage;
        try {
            stage = settingsProvider.resolve(domain);
        } catch (RuntimeException e) {
            logger.logSuppressedError("resolve settings", e);
            status = EngineStatus.DORMANT;
            return;
        }
        if (stage == null) {
            status = EngineStatus.DORMANT;
            return;
        }
        stage.whenComplete((s, error) -> scheduler.post(() -> onSettingsResolved(s, error)));
    }

    private void onSettingsResolved(SiteSettings resolved, Throwable error) {
        if (status != EngineStatus.RESOLVING) {
            return;
        }
        if (error != null) {
            logger.logSuppressedError("resolve settings", error);
            status = EngineStatus.DORMANT;
            return;
        }
        activate(resolved == null ? SiteSettings.defaults() : resolved);
    }

    /**
     * Installs the components allowed by {@code siteSettings}.
     * <p>
     * Called by {@link #start()} once settings resolve. May be called directly instead of {@link #start()}
     * when settings are already known.
     *
     * @param siteSettings resolved settings
     * @return true if the engine became active
     */
    public boolean activate(SiteSettings siteSettings) {
        Objects.requireNonNull(siteSettings, "siteSettings must not be null");
        if (status != EngineStatus.CREATED && status != EngineStatus.RESOLVING) {
            throw new IllegalStateException("engine cannot be activated in status " + status);
        }
        if (status == EngineStatus.CREATED) {
            String d = document.getDomain();
            domain = d == null ? "" : d.trim();
        }
        this.settings = siteSettings;

        if (domain.isEmpty()
                || siteSettings.isRelaxedAt(scheduler.currentTimeMillis())
                || siteSettings.getMode() == FilteringMode.LITE) {
            status = EngineStatus.DORMANT;
            return false;
        }

        if (!siteSettings.isInterceptionOff() && capabilityHost != null) {
            interceptor = CapabilityInterceptor.install(capabilityHost, logger, allowNestedContexts).orElse(null);
        }

        if (!siteSettings.isClassificationOff()) {
            installClassification(siteSettings);
        }

        status = EngineStatus.ACTIVE;
        return true;
    }

    private void installClassification(SiteSettings s) {
        FilteringMode mode = s.getMode();
        selectorConfig = selectorConfigBuilder.build(domain, mode);

        removalQueue = new RemovalQueue(scheduler, tuning, processed, counters, logger);
        suppressor = new Suppressor(processed, removalQueue, counters, logger);

        suppressionStyle = new SuppressionStyle(document, logger);
        suppressionStyle.apply(selectorConfig);

        classifier = new BudgetedClassifier(document, scheduler, suppressor, counters, tuning, heuristics, logger);
        classifier.configure(selectorConfig, mode);

        runFastCleanup();

        watcher = new MutationWatcher(classifier, scheduler, tuning, counters, pendingBatchPolicy);
        watcher.start(document);

        healCheck = suppressionStyle.installHealCheck(scheduler, tuning.getHealIntervalMillis());

        if (mode == FilteringMode.ADVANCED && !s.isSiteFixesOff()) {
            mediaGuard = new MediaGuard(document, scheduler, tuning, suppressor, this::runFastCleanup, logger);
            mediaGuard.start();
            clickInterceptor = new ClickInterceptor(document, suppressor);
            clickInterceptor.install();
        }

        removalQueue.start();
    }

    /**
     * Hides every element matching the fast rules. A malformed rule group counts as no match.
     *
     * @return number of newly hidden elements
     */
    public int runFastCleanup() {
        if (suppressor == null || status == EngineStatus.STOPPED || !selectorConfig.hasFastRules()) {
            return 0;
        }
        List<HostNode> matches;
        try {
            matches = document.querySelectorAll(selectorConfig.fastRuleGroup());
        } catch (RuntimeException e) {
            logger.logSuppressedError("fast cleanup", e);
            return 0;
        }
        int hidden = 0;
        for (HostNode el : matches) {
            if (suppressor.hide(el, HideReason.FAST_RULE)) {
                hidden++;
            }
        }
        return hidden;
    }

    /**
     * Uninstalls every component. The engine cannot be restarted.
     */
    public void stop() {
        if (status == EngineStatus.STOPPED) {
            return;
        }
        status = EngineStatus.STOPPED;
        if (watcher != null) {
            watcher.stop();
        }
        if (mediaGuard != null) {
            mediaGuard.stop();
        }
        if (clickInterceptor != null) {
            clickInterceptor.stop();
        }
        if (healCheck != null) {
            healCheck.cancel();
        }
        if (removalQueue != null) {
            removalQueue.stop();
        }
        if (interceptor != null && capabilityHost != null && capabilityHost.getCapabilities() == interceptor) {
            capabilityHost.setCapabilities(interceptor.getDelegate());
        }
    }

    // ----------- state -----------

    public EngineStatus getStatus() {
        return status;
    }

    public boolean isActive() {
        return status == EngineStatus.ACTIVE;
    }

    public String getDomain() {
        return domain;
    }

    /**
     * @return resolved settings, or null before resolution
     */
    public SiteSettings getSettings() {
        return settings;
    }

    public SelectorConfig getSelectorConfig() {
        return selectorConfig;
    }

    /**
     * @return the configured logger, guarded so that its failures are only counted
     */
    public HideEventLogger getLogger() {
        return logger;
    }

    public Counters getCounters() {
        return counters;
    }

    public EngineTuning getTuning() {
        return tuning;
    }

    public boolean isProcessed(HostNode node) {
        return processed.contains(node);
    }

    public int getProcessedCount() {
        return processed.size();
    }

    public boolean isQuiet() {
        return classifier != null && classifier.isQuiet();
    }

    /**
     * @return classifier, or null when classification is not installed
     */
    public BudgetedClassifier getClassifier() {
        return classifier;
    }

    public MutationWatcher getWatcher() {
        return watcher;
    }

    public RemovalQueue getRemovalQueue() {
        return removalQueue;
    }

    public SuppressionStyle getSuppressionStyle() {
        return suppressionStyle;
    }

    /**
     * @return media guard, or null outside {@link FilteringMode#ADVANCED} or with site fixes off
     */
    public MediaGuard getMediaGuard() {
        return mediaGuard;
    }

    public ClickInterceptor getClickInterceptor() {
        return clickInterceptor;
    }

    /**
     * @return installed capability decorator, or null
     */
    public InterceptingCapabilities getCapabilityInterceptor() {
        return interceptor;
    }
}
