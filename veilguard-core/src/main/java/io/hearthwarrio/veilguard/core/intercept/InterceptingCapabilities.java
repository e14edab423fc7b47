package io.hearthwarrio.veilguard.core.intercept;

import io.hearthwarrio.veilguard.core.AdSignatures;
import io.hearthwarrio.veilguard.core.HideEventLogger;
import io.hearthwarrio.veilguard.core.Suppressor;
import io.hearthwarrio.veilguard.core.host.HostNode;

import java.util.Locale;
import java.util.Objects;

/**
 * Decorator that pre-empts known ad mutations before they reach the document.
 * <p>
 * The original capabilities stay the delegate of every call. Classification errors are reported and the call
 * is delegated unchanged.
 */
public final class InterceptingCapabilities implements DocumentCapabilities {

    /**
     * Markup fragments must be longer than this to be blocked.
     */
    public static final int MIN_BLOCKED_MARKUP_LENGTH = 200;

    private final DocumentCapabilities delegate;
    private final HideEventLogger logger;

    private long blockedNavigations;
    private long blockedMarkup;
    private long neutralizedElements;

    public InterceptingCapabilities(DocumentCapabilities delegate, HideEventLogger logger) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.logger = Objects.requireNonNull(logger, "logger must not be null");
    }

    @Override
    public HostWindow openWindow(String url, String name, String features) {
        try {
            if (shouldBlockNavigation(url)) {
                blockedNavigations++;
                return null;
            }
        } catch (RuntimeException e) {
            logger.logSuppressedError("openWindow", e);
        }
        return delegate.openWindow(url, name, features);
    }

    @Override
    public HostNode appendChild(HostNode parent, HostNode child) {
        try {
            if (AdSignatures.isAdMarkerElement(child)) {
                Suppressor.forceInvisible(child);
                neutralizedElements++;
            }
        } catch (RuntimeException e) {
            logger.logSuppressedError("appendChild", e);
        }
        return delegate.appendChild(parent, child);
    }

    @Override
    public void setAttribute(HostNode element, String name, String value) {
        try {
            if (AdSignatures.isMarkerAttributeName(name) && element != null) {
                Suppressor.forceInvisible(element);
                neutralizedElements++;
            }
        } catch (RuntimeException e) {
            logger.logSuppressedError("setAttribute", e);
        }
        delegate.setAttribute(element, name, value);
    }

    @Override
    public void insertAdjacentMarkup(HostNode element, String position, String markup) {
        try {
            if (shouldBlockMarkup(markup)) {
                blockedMarkup++;
                return;
            }
        } catch (RuntimeException e) {
            logger.logSuppressedError("insertAdjacentMarkup", e);
        }
        delegate.insertAdjacentMarkup(element, position, markup);
    }

    /**
     * Empty, {@code about:blank}, {@code blob:} and {@code data:} targets are always allowed.
     *
     * @param url navigation target
     * @return true if opening {@code url} must be refused
     */
    public static boolean shouldBlockNavigation(String url) {
        if (url == null || url.isEmpty()) {
            return false;
        }
        String lower = url.toLowerCase(Locale.ROOT);
        if (lower.equals("about:blank") || lower.startsWith("blob:") || lower.startsWith("data:")) {
            return false;
        }
        return AdSignatures.isAdNavigationTarget(url);
    }

    /**
     * @param markup markup fragment
     * @return true if the fragment is longer than {@value #MIN_BLOCKED_MARKUP_LENGTH} characters and carries a
     * known ad marker
     */
    public static boolean shouldBlockMarkup(String markup) {
        return markup != null
                && markup.length() > MIN_BLOCKED_MARKUP_LENGTH
                && AdSignatures.containsMarkupMarker(markup);
    }

    public DocumentCapabilities getDelegate() {
        return delegate;
    }

    public long getBlockedNavigations() {
        return blockedNavigations;
    }

    public long getBlockedMarkup() {
        return blockedMarkup;
    }

    public long getNeutralizedElements() {
        return neutralizedElements;
    }
}
