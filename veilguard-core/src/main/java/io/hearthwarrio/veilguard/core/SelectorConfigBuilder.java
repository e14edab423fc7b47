package io.hearthwarrio.veilguard.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Builds the per-page {@link SelectorConfig} from the domain and the filtering mode.
 * <p>
 * Generic {@code ad-} substring rules are left out on domains listed as false-positive prone: those sites
 * use the fragment in legitimate player ids and classes.
 */
public final class SelectorConfigBuilder {

    public static final List<String> DEFAULT_FAST_RULES = List.of(
            ".ad-container",
            "#sidebar-ads",
            ".sponsored-post",
            ".ads-block",
            ".ad-box",
            ".ad-wrapper",
            ".ads-label",
            "[data-element]",
            "[data-izone]",
            "iframe[src*=\"exoclick\"]",
            "iframe[src*=\"adsterra\"]",
            "iframe[src*=\"juicyads\"]",
            "iframe[src*=\"trafficjunky\"]",
            "iframe[title=\"offer\"]",
            "iframe[title=\"Advertisement\"]",
            "div[id^=\"__clb-spot_\"]",
            "iframe[id^=\"__clb-spot_\"]",
            "div[class*=\"AdSlot\"]",
            "div[class*=\"AdsContainer\"]",
            ".modal-backdrop"
    );

    public static final List<String> GENERIC_FAST_RULES = List.of(
            "div[class*=\"ad-\"]",
            "div[id*=\"ad-\"]"
    );

    public static final List<String> DEFAULT_SLOW_RULES = List.of(
            "div[style*=\"z-index: 2147483647\"]",
            "div[style*=\"bottom: 10px\"] iframe",
            ".overlay-container"
    );

    public static final List<String> DEFAULT_FALSE_POSITIVE_DOMAINS = List.of("youtube.com");

    private final List<String> fastRules;
    private final List<String> genericRules;
    private final List<String> slowRules;
    private final List<String> falsePositiveDomains;

    public SelectorConfigBuilder() {
        this(DEFAULT_FAST_RULES, GENERIC_FAST_RULES, DEFAULT_SLOW_RULES, DEFAULT_FALSE_POSITIVE_DOMAINS);
    }

    /**
     * @param fastRules            rules applied on every domain in STANDARD and ADVANCED
     * @param genericRules         fast rules skipped on false-positive domains
     * @param slowRules            rules applied in ADVANCED only
     * @param falsePositiveDomains domains (and their subdomains) that skip {@code genericRules}
     */
    public SelectorConfigBuilder(
            List<String> fastRules,
            List<String> genericRules,
            List<String> slowRules,
            List<String> falsePositiveDomains
    ) {
        this.fastRules = List.copyOf(Objects.requireNonNull(fastRules, "fastRules must not be null"));
        this.genericRules = List.copyOf(Objects.requireNonNull(genericRules, "genericRules must not be null"));
        this.slowRules = List.copyOf(Objects.requireNonNull(slowRules, "slowRules must not be null"));
        this.falsePositiveDomains = normalizeDomains(
                Objects.requireNonNull(falsePositiveDomains, "falsePositiveDomains must not be null"));
    }

    /**
     * @param domains additional false-positive domains
     * @return new builder with the extended domain list
     */
    public SelectorConfigBuilder withFalsePositiveDomains(List<String> domains) {
        List<String> merged = new ArrayList<>(falsePositiveDomains);
        if (domains != null) {
            merged.addAll(domains);
        }
        return new SelectorConfigBuilder(fastRules, genericRules, slowRules, merged);
    }

    public List<String> getFalsePositiveDomains() {
        return falsePositiveDomains;
    }

    /**
     * @param domain page host name
     * @param mode   filtering mode
     * @return rule set; empty for {@link FilteringMode#LITE}
     */
    public SelectorConfig build(String domain, FilteringMode mode) {
        Objects.requireNonNull(mode, "mode must not be null");
        if (mode == FilteringMode.LITE) {
            return SelectorConfig.empty();
        }

        List<String> fast = new ArrayList<>(fastRules);
        if (!isFalsePositiveDomain(domain)) {
            fast.addAll(genericRules);
        }
        List<String> slow = mode == FilteringMode.ADVANCED ? slowRules : List.of();
        return new SelectorConfig(fast, slow);
    }

    /**
     * @param domain page host name
     * @return true if the domain equals a listed domain or is a subdomain of one
     */
    public boolean isFalsePositiveDomain(String domain) {
        if (domain == null || domain.isBlank()) {
            return false;
        }
        String d = domain.trim().toLowerCase(Locale.ROOT);
        for (String fp : falsePositiveDomains) {
            if (d.equals(fp) || d.endsWith("." + fp)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> normalizeDomains(List<String> domains) {
        List<String> out = new ArrayList<>();
        for (String d : domains) {
            if (d == null) {
                continue;
            }
            String t = d.trim().toLowerCase(Locale.ROOT);
            if (!t.isEmpty() && !out.contains(t)) {
                out.add(t);
            }
        }
        return List.copyOf(out);
    }
}
