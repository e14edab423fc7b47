package io.hearthwarrio.veilguard.testkit;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Parser and writer for the {@code style} attribute of simulated elements.
 */
final class InlineStyle {

    private static final String IMPORTANT = "!important";

    private InlineStyle() {
        // utility class
    }

    /**
     * @param styleAttribute raw attribute value (may be null)
     * @return property to value, lower-case names, {@code !important} stripped
     */
    static Map<String, String> parse(String styleAttribute) {
        Map<String, String> result = new LinkedHashMap<>();
        if (styleAttribute == null || styleAttribute.isBlank()) {
            return result;
        }
        for (String declaration : styleAttribute.split(";")) {
            int colon = declaration.indexOf(':');
            if (colon <= 0) {
                continue;
            }
            String name = declaration.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            String value = declaration.substring(colon + 1).trim();
            if (value.toLowerCase(Locale.ROOT).endsWith(IMPORTANT)) {
                value = value.substring(0, value.length() - IMPORTANT.length()).trim();
            }
            if (!name.isEmpty()) {
                result.put(name, value);
            }
        }
        return result;
    }

    /**
     * @return attribute value with {@code property} replaced or appended
     */
    static String write(String styleAttribute, String property, String value, boolean important) {
        String name = property.trim().toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder();
        if (styleAttribute != null) {
            for (String declaration : styleAttribute.split(";")) {
                int colon = declaration.indexOf(':');
                if (colon <= 0) {
                    continue;
                }
                String existing = declaration.substring(0, colon).trim().toLowerCase(Locale.ROOT);
                if (existing.equals(name)) {
                    continue;
                }
                sb.append(declaration.trim()).append("; ");
            }
        }
        sb.append(name).append(": ").append(value);
        if (important) {
            sb.append(' ').append(IMPORTANT);
        }
        sb.append(';');
        return sb.toString();
    }

    /**
     * @return leading numeric part of a pixel value, or {@code fallback}
     */
    static double pixels(String value, double fallback) {
        if (value == null) {
            return fallback;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        if (v.endsWith("px")) {
            v = v.substring(0, v.length() - 2).trim();
        }
        try {
            return Double.parseDouble(v);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
