package io.hearthwarrio.veilguard.core;

import io.hearthwarrio.veilguard.core.host.Cancellable;
import io.hearthwarrio.veilguard.core.host.HostDocument;
import io.hearthwarrio.veilguard.core.host.HostNode;
import io.hearthwarrio.veilguard.core.host.HostScheduler;

import java.util.Objects;

/**
 * Maintains the single suppression style element of the document.
 * <p>
 * The element carries the stable id {@value #STYLE_ELEMENT_ID}. Its text is rewritten only when the rule hash
 * changes or the element is missing; a periodic heal check re-injects it after page scripts strip it.
 */
public final class SuppressionStyle {

    public static final String STYLE_ELEMENT_ID = "veilguard-shield";

    private final HostDocument document;
    private final HideEventLogger logger;

    private SelectorConfig config = SelectorConfig.empty();
    private String currentHash = "";
    private long writes;

    public SuppressionStyle(HostDocument document, HideEventLogger logger) {
        this.document = Objects.requireNonNull(document, "document must not be null");
        this.logger = Objects.requireNonNull(logger, "logger must not be null");
    }

    /**
     * @param config rule set to install
     * @return true if the style element was created or rewritten
     */
    public boolean apply(SelectorConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        if (config.isEmpty()) {
            return false;
        }

        try {
            String hash = config.hash();
            HostNode style = document.getElementById(STYLE_ELEMENT_ID);
            if (hash.equals(currentHash) && style != null) {
                return false;
            }
            currentHash = hash;

            if (style == null) {
                style = document.createElement("style");
                style.setAttribute("id", STYLE_ELEMENT_ID);
                HostNode head = document.getHead();
                (head != null ? head : document.getDocumentElement()).appendChild(style);
            }
            style.setTextContent(config.ruleText());
            writes++;
            return true;
        } catch (RuntimeException e) {
            logger.logSuppressedError("apply style", e);
            return false;
        }
    }

    /**
     * Re-injects the style element when it is gone.
     *
     * @return true if the element was re-created
     */
    public boolean healIfMissing() {
        if (config.isEmpty()) {
            return false;
        }
        try {
            if (document.getElementById(STYLE_ELEMENT_ID) != null) {
                return false;
            }
        } catch (RuntimeException e) {
            logger.logSuppressedError("heal style", e);
            return false;
        }
        currentHash = "";
        return apply(config);
    }

    /**
     * @param scheduler      event loop
     * @param intervalMillis check period
     * @return handle that stops the check
     */
    public Cancellable installHealCheck(HostScheduler scheduler, long intervalMillis) {
        Objects.requireNonNull(scheduler, "scheduler must not be null");
        return scheduler.scheduleAtFixedRate(this::healIfMissing, intervalMillis);
    }

    public String getCurrentHash() {
        return currentHash;
    }

    /**
     * @return number of style text writes so far
     */
    public long getWriteCount() {
        return writes;
    }
}
