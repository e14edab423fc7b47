package io.hearthwarrio.veilguard.core;

import io.hearthwarrio.veilguard.core.host.HostNode;

import java.util.List;
import java.util.Locale;

/**
 * Fixed signatures of known ad-delivery frameworks and networks.
 * <p>
 * Every check is null-safe and treats a failing host read as "no match".
 */
public final class AdSignatures {

    /**
     * Attribute names stamped on injected slots by known ad frameworks.
     */
    public static final List<String> MARKER_ATTRIBUTES = List.of("data-element", "data-izone");

    /**
     * Class-name fragment used by generated ad slot containers.
     */
    public static final String AD_SLOT_CLASS_MARKER = "AdSlot";

    /**
     * Network substrings matched against embedded frame sources.
     */
    public static final List<String> FRAME_SOURCE_PATTERNS = List.of(
            "exoclick", "adsterra", "juicyads", "trafficjunky", "popunder",
            "clickunder", "propellerads", "hilltopads", "adcash", "clickadu",
            "popcash", "popads", "admaven", "revcontent", "mgid.com",
            "taboola", "outbrain"
    );

    /**
     * Network substrings matched against new-window navigation targets.
     * Content-recommendation networks are left out: their widgets legitimately open articles.
     */
    public static final List<String> NAVIGATION_PATTERNS = List.of(
            "exoclick", "adsterra", "juicyads", "trafficjunky",
            "popunder", "clickunder", "propellerads", "hilltopads",
            "adcash", "clickadu", "popcash", "popads", "admaven",
            "revcontent"
    );

    public static final List<String> SUSPICIOUS_NAVIGATION_KEYWORDS = List.of("popunder", "clickunder");

    /**
     * Substrings that identify injected ad markup.
     */
    public static final List<String> MARKUP_MARKERS = List.of(
            "data-element", "data-izone", "title=\"offer\"", "title=\"Advertisement\""
    );

    private AdSignatures() {
        // utility class
    }

    public static boolean isMarkerAttributeName(String name) {
        return name != null && MARKER_ATTRIBUTES.contains(name);
    }

    /**
     * @param node element
     * @return true if the element carries any {@link #MARKER_ATTRIBUTES} attribute
     */
    public static boolean hasMarkerAttribute(HostNode node) {
        if (node == null) {
            return false;
        }
        try {
            for (String a : MARKER_ATTRIBUTES) {
                if (node.hasAttribute(a)) {
                    return true;
                }
            }
            return false;
        } catch (RuntimeException e) {
            return false;
        }
    }

    /**
     * @param node element
     * @return name of the first marker attribute present, or null
     */
    public static String markerAttributeOf(HostNode node) {
        if (node == null) {
            return null;
        }
        try {
            for (String a : MARKER_ATTRIBUTES) {
                if (node.hasAttribute(a)) {
                    return a;
                }
            }
            return null;
        } catch (RuntimeException e) {
            return null;
        }
    }

    public static boolean hasAdSlotClass(HostNode node) {
        if (node == null) {
            return false;
        }
        try {
            return node.getClassName().contains(AD_SLOT_CLASS_MARKER);
        } catch (RuntimeException e) {
            return false;
        }
    }

    /**
     * @param node element
     * @return true if the element has a marker attribute or an ad slot class
     */
    public static boolean isAdMarkerElement(HostNode node) {
        return hasMarkerAttribute(node) || hasAdSlotClass(node);
    }

    public static boolean isAdFrameSource(String url) {
        return containsAny(url, FRAME_SOURCE_PATTERNS);
    }

    public static boolean isAdNavigationTarget(String url) {
        return containsAny(url, NAVIGATION_PATTERNS) || containsAny(url, SUSPICIOUS_NAVIGATION_KEYWORDS);
    }

    /**
     * Case-sensitive, like the markup itself.
     *
     * @param markup markup fragment
     * @return true if the fragment contains any {@link #MARKUP_MARKERS} entry
     */
    public static boolean containsMarkupMarker(String markup) {
        if (markup == null || markup.isEmpty()) {
            return false;
        }
        for (String m : MARKUP_MARKERS) {
            if (markup.contains(m)) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsAny(String url, List<String> needles) {
        if (url == null || url.isEmpty()) {
            return false;
        }
        String lower = url.toLowerCase(Locale.ROOT);
        for (String n : needles) {
            if (lower.contains(n)) {
                return true;
            }
        }
        return false;
    }
}
