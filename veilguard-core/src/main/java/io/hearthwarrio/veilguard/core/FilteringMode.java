package io.hearthwarrio.veilguard.core;

import java.util.Locale;

/**
 * Sensitivity level of a site.
 */
public enum FilteringMode {

    /**
     * Network-layer filtering only; the engine performs no document work.
     */
    LITE,

    /**
     * Fast rules, marker escalation and ad-frame detection.
     */
    STANDARD,

    /**
     * Everything in {@link #STANDARD} plus slow rules, structural heuristics, media guard and click protection.
     */
    ADVANCED;

    /**
     * Lenient parse of a stored mode name.
     *
     * @param raw stored value (for example {@code "advanced"})
     * @return parsed mode, {@link #LITE} when null, blank or unknown
     */
    public static FilteringMode parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return LITE;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return LITE;
        }
    }
}
