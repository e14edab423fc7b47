package io.hearthwarrio.veilguard.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable rule set of one page load.
 * <p>
 * Fast rules are cheap structural selectors (class, id, attribute, frame source). Slow rules depend on
 * inline style text and are only produced in {@link FilteringMode#ADVANCED}.
 */
public final class SelectorConfig {

    private static final SelectorConfig EMPTY = new SelectorConfig(List.of(), List.of());

    private final List<String> fastRules;
    private final List<String> slowRules;

    public SelectorConfig(List<String> fastRules, List<String> slowRules) {
        this.fastRules = clean(fastRules);
        this.slowRules = clean(slowRules);
    }

    public static SelectorConfig empty() {
        return EMPTY;
    }

    private static List<String> clean(List<String> rules) {
        if (rules == null || rules.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String r : rules) {
            if (r != null && !r.isBlank()) {
                out.add(r.trim());
            }
        }
        return List.copyOf(out);
    }

    public List<String> getFastRules() {
        return fastRules;
    }

    public List<String> getSlowRules() {
        return slowRules;
    }

    /**
     * @return fast then slow rules
     */
    public List<String> allRules() {
        List<String> all = new ArrayList<>(fastRules.size() + slowRules.size());
        all.addAll(fastRules);
        all.addAll(slowRules);
        return List.copyOf(all);
    }

    public boolean isEmpty() {
        return fastRules.isEmpty() && slowRules.isEmpty();
    }

    public boolean hasFastRules() {
        return !fastRules.isEmpty();
    }

    /**
     * @return fast rules as one selector group, empty string when there are none
     */
    public String fastRuleGroup() {
        return String.join(", ", fastRules);
    }

    /**
     * @return full suppression style text, empty string when there are no rules
     */
    public String ruleText() {
        if (isEmpty()) {
            return "";
        }
        return String.join(",\n", allRules()) + " {\n"
                + "  display: none !important;\n"
                + "  visibility: hidden !important;\n"
                + "  pointer-events: none !important;\n"
                + "}";
    }

    /**
     * Short fingerprint of the rule list, used to skip redundant style rewrites.
     *
     * @return base-36 hash of all rules joined by commas
     */
    public String hash() {
        return Integer.toString(String.join(",", allRules()).hashCode(), 36);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SelectorConfig)) return false;
        SelectorConfig that = (SelectorConfig) o;
        return fastRules.equals(that.fastRules) && slowRules.equals(that.slowRules);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fastRules, slowRules);
    }

    @Override
    public String toString() {
        return "SelectorConfig{" +
                "fastRules=" + fastRules.size() +
                ", slowRules=" + slowRules.size() +
                ", hash='" + hash() + '\'' +
                '}';
    }
}
