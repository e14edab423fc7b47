package io.hearthwarrio.veilguard.core;

import io.hearthwarrio.veilguard.core.host.Cancellable;
import io.hearthwarrio.veilguard.core.host.ComputedStyle;
import io.hearthwarrio.veilguard.core.host.HostDocument;
import io.hearthwarrio.veilguard.core.host.HostNode;
import io.hearthwarrio.veilguard.core.host.HostScheduler;
import io.hearthwarrio.veilguard.core.host.Mutation;
import io.hearthwarrio.veilguard.core.host.MutationSubscription;
import io.hearthwarrio.veilguard.core.host.Rect;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Protects {@code video} elements against overlays injected on playback transitions.
 * <p>
 * A {@code pause}, {@code play}, {@code fullscreenchange} or captured {@code click} on a guarded element opens a
 * high-alert window: an immediate sweep, then one sweep per {@link EngineTuning#getAlertCadenceMillis()} for
 * {@link EngineTuning#getAlertRepetitions()} repetitions. Triggers during an open window are coalesced.
 */
public final class MediaGuard {

    public static final String GUARD_ATTRIBUTE = "data-veilguard-guarded";
    public static final String OVERLAY_CANDIDATES = "div[style*=\"fixed\"], div[style*=\"absolute\"]";
    public static final List<String> TRIGGER_EVENTS = List.of("pause", "play", "fullscreenchange");
    public static final double MIN_MEDIA_SIZE = 50.0;
    public static final int MIN_Z_INDEX_EXCLUSIVE = 10;

    private final HostDocument document;
    private final HostScheduler scheduler;
    private final EngineTuning tuning;
    private final Suppressor suppressor;
    private final Runnable fastCleanup;
    private final HideEventLogger logger;

    private final Map<HostNode, AlertWindow> activeWindows = new IdentityHashMap<>();
    private MutationSubscription subscription;
    private boolean stopped;
    private int guardedCount;

    public MediaGuard(
            HostDocument document,
            HostScheduler scheduler,
            EngineTuning tuning,
            Suppressor suppressor,
            Runnable fastCleanup,
            HideEventLogger logger
    ) {
        this.document = Objects.requireNonNull(document, "document must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.tuning = Objects.requireNonNull(tuning, "tuning must not be null");
        this.suppressor = Objects.requireNonNull(suppressor, "suppressor must not be null");
        this.fastCleanup = Objects.requireNonNull(fastCleanup, "fastCleanup must not be null");
        this.logger = Objects.requireNonNull(logger, "logger must not be null");
    }

    /**
     * Guards every existing {@code video} element and observes the document for new ones.
     */
    public void start() {
        if (subscription != null) {
            return;
        }
        stopped = false;
        subscription = document.observe(this::onMutations, Set.of());
        for (HostNode video : safeQuery("video")) {
            guard(video);
        }
    }

    public void stop() {
        stopped = true;
        if (subscription != null) {
            subscription.disconnect();
            subscription = null;
        }
        for (AlertWindow w : new ArrayList<>(activeWindows.values())) {
            w.close();
        }
        activeWindows.clear();
    }

    private void onMutations(List<Mutation> mutations) {
        if (stopped) {
            return;
        }
        for (Mutation m : mutations) {
            if (m.getType() != Mutation.Type.CHILD_LIST) {
                continue;
            }
            for (HostNode added : m.getAddedNodes()) {
                if (isVideo(added)) {
                    guard(added);
                } else {
                    for (HostNode video : queryAll(added, "video")) {
                        guard(video);
                    }
                }
            }
        }
    }

    /**
     * Installs the trigger listeners once per element.
     *
     * @param media media element
     * @return true if the element was not guarded before
     */
    public boolean guard(HostNode media) {
        try {
            if (media.hasAttribute(GUARD_ATTRIBUTE)) {
                return false;
            }
            media.setAttribute(GUARD_ATTRIBUTE, "true");

            HostNode parent = media.getParent();
            if (parent != null) {
                parent.setStyleProperty("pointer-events", "auto", true);
            }

            for (String type : TRIGGER_EVENTS) {
                media.addEventListener(type, e -> trigger(media), false);
            }
            media.addEventListener("click", e -> trigger(media), true);
            guardedCount++;
            return true;
        } catch (RuntimeException e) {
            logger.logSuppressedError("guard media", e);
            return false;
        }
    }

    /**
     * Opens a high-alert window for {@code media} unless one is already open.
     *
     * @param media guarded element
     */
    public void trigger(HostNode media) {
        if (stopped || activeWindows.containsKey(media)) {
            return;
        }
        AlertWindow window = new AlertWindow(media);
        activeWindows.put(media, window);
        window.open();
    }

    /**
     * Hides positioned overlays stacked above {@code media}.
     * <p>
     * Never hides an element that contains the media element or matches the {@link PlayerUiAllowList}.
     *
     * @param media guarded element
     * @return number of hidden overlays
     */
    public int sweepOverlays(HostNode media) {
        Rect mediaBox;
        try {
            mediaBox = media.getBoundingRect();
        } catch (RuntimeException e) {
            return 0;
        }
        if (mediaBox.getWidth() < MIN_MEDIA_SIZE || mediaBox.getHeight() < MIN_MEDIA_SIZE) {
            return 0;
        }

        int hidden = 0;
        for (HostNode el : safeQuery(OVERLAY_CANDIDATES)) {
            if (suppressor.isProcessed(el)) {
                continue;
            }
            if (isOverlayAbove(el, media, mediaBox) && suppressor.hide(el, HideReason.MEDIA_OVERLAY)) {
                hidden++;
            }
        }
        return hidden;
    }

    private static boolean isOverlayAbove(HostNode el, HostNode media, Rect mediaBox) {
        try {
            ComputedStyle style = el.getComputedStyle();
            if (!style.isFixedOrAbsolute() || !style.zIndexAbove(MIN_Z_INDEX_EXCLUSIVE)) {
                return false;
            }
            if (!el.getBoundingRect().intersects(mediaBox) || el.contains(media)) {
                return false;
            }
            return !PlayerUiAllowList.isPlayerUi(el);
        } catch (RuntimeException e) {
            return false;
        }
    }

    private void sweep(HostNode media) {
        fastCleanup.run();
        sweepOverlays(media);
    }

    public int activeWindowCount() {
        return activeWindows.size();
    }

    public boolean isAlertActive(HostNode media) {
        return activeWindows.containsKey(media);
    }

    public int getGuardedCount() {
        return guardedCount;
    }

    private List<HostNode> safeQuery(String selector) {
        try {
            return document.querySelectorAll(selector);
        } catch (RuntimeException e) {
            logger.logSuppressedError("media sweep query", e);
            return List.of();
        }
    }

    private static List<HostNode> queryAll(HostNode root, String selector) {
        if (root == null) {
            return List.of();
        }
        try {
            return root.querySelectorAll(selector);
        } catch (RuntimeException e) {
            return List.of();
        }
    }

    private static boolean isVideo(HostNode node) {
        try {
            return "video".equals(node.getTagName());
        } catch (RuntimeException e) {
            return false;
        }
    }

    private final class AlertWindow {
        private final HostNode media;
        private Cancellable timer;
        private int sweeps;

        AlertWindow(HostNode media) {
            this.media = media;
        }

        void open() {
            timer = scheduler.scheduleAtFixedRate(this::tick, tuning.getAlertCadenceMillis());
            sweep(media);
        }

        private void tick() {
            if (stopped) {
                close();
                return;
            }
            sweep(media);
            sweeps++;
            if (sweeps >= tuning.getAlertRepetitions()) {
                close();
                activeWindows.remove(media);
            }
        }

        void close() {
            if (timer != null) {
                timer.cancel();
                timer = null;
            }
        }
    }
}
