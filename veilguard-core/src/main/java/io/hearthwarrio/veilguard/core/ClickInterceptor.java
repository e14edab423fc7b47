package io.hearthwarrio.veilguard.core;

import io.hearthwarrio.veilguard.core.host.ComputedStyle;
import io.hearthwarrio.veilguard.core.host.HostDocument;
import io.hearthwarrio.veilguard.core.host.HostEvent;
import io.hearthwarrio.veilguard.core.host.HostEventListener;
import io.hearthwarrio.veilguard.core.host.HostNode;

import java.util.Objects;

/**
 * Capture-phase click veto for large positioned overlays.
 * <p>
 * The exact event target is evaluated synchronously. A fixed or absolute target with z-index above
 * {@value #MIN_Z_INDEX_EXCLUSIVE}, covering at least 40% of the viewport in both dimensions and not part of the
 * {@link PlayerUiAllowList}, has its click cancelled and is hidden. Everything else passes through untouched,
 * including targets whose style or geometry cannot be read.
 */
public final class ClickInterceptor implements HostEventListener {

    public static final int MIN_Z_INDEX_EXCLUSIVE = 10;
    public static final double MIN_VIEWPORT_COVERAGE = 0.4;

    private final HostDocument document;
    private final Suppressor suppressor;

    private boolean installed;
    private boolean stopped;
    private long vetoed;

    public ClickInterceptor(HostDocument document, Suppressor suppressor) {
        this.document = Objects.requireNonNull(document, "document must not be null");
        this.suppressor = Objects.requireNonNull(suppressor, "suppressor must not be null");
    }

    public void install() {
        if (installed) {
            return;
        }
        installed = true;
        stopped = false;
        document.addEventListener("click", this, true);
    }

    /**
     * Disables the veto. The host offers no listener removal, so the listener stays registered and passes through.
     */
    public void stop() {
        stopped = true;
    }

    @Override
    public void handleEvent(HostEvent event) {
        if (stopped || event == null) {
            return;
        }
        HostNode target = event.getTarget();
        if (target == null || !isBlockingOverlay(target)) {
            return;
        }
        event.preventDefault();
        event.stopPropagation();
        vetoed++;
        suppressor.hide(target, HideReason.CLICK_OVERLAY);
    }

    private boolean isBlockingOverlay(HostNode target) {
        try {
            ComputedStyle style = target.getComputedStyle();
            if (!style.isFixedOrAbsolute() || !style.zIndexAbove(MIN_Z_INDEX_EXCLUSIVE)) {
                return false;
            }
            if (!target.getBoundingRect().coversAtLeast(document.getViewport(), MIN_VIEWPORT_COVERAGE)) {
                return false;
            }
            return !PlayerUiAllowList.isPlayerUi(target);
        } catch (RuntimeException e) {
            return false;
        }
    }

    public long getVetoedCount() {
        return vetoed;
    }
}
