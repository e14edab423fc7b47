package io.hearthwarrio.veilguard.core.host;

import java.util.Locale;
import java.util.OptionalInt;

/**
 * The subset of resolved style Veilguard reads.
 * <p>
 * Values are kept in their textual CSS form; missing values are normalized to the CSS initial values
 * ({@code static}, {@code auto}, {@code block}, {@code visible}).
 */
public final class ComputedStyle {

    private final String position;
    private final String zIndex;
    private final String display;
    private final String visibility;

    public ComputedStyle(String position, String zIndex, String display, String visibility) {
        this.position = normalize(position, "static");
        this.zIndex = normalize(zIndex, "auto");
        this.display = normalize(display, "block");
        this.visibility = normalize(visibility, "visible");
    }

    private static String normalize(String v, String fallback) {
        if (v == null || v.isBlank()) {
            return fallback;
        }
        return v.trim().toLowerCase(Locale.ROOT);
    }

    public String getPosition() {
        return position;
    }

    public String getZIndex() {
        return zIndex;
    }

    public String getDisplay() {
        return display;
    }

    public String getVisibility() {
        return visibility;
    }

    public boolean isFixedOrAbsolute() {
        return "fixed".equals(position) || "absolute".equals(position);
    }

    public boolean hasNonAutoZIndex() {
        return !"auto".equals(zIndex);
    }

    /**
     * Parses the stacking order the way a lenient integer parse would: optional sign followed by the leading digits.
     *
     * @return numeric z-index, or empty for {@code auto} and unparsable values
     */
    public OptionalInt zIndexValue() {
        String s = zIndex;
        int i = 0;
        boolean negative = false;
        if (i < s.length() && (s.charAt(i) == '-' || s.charAt(i) == '+')) {
            negative = s.charAt(i) == '-';
            i++;
        }
        int start = i;
        long value = 0;
        while (i < s.length() && Character.isDigit(s.charAt(i))) {
            value = value * 10 + (s.charAt(i) - '0');
            if (value > Integer.MAX_VALUE) {
                value = Integer.MAX_VALUE;
            }
            i++;
        }
        if (i == start) {
            return OptionalInt.empty();
        }
        return OptionalInt.of((int) (negative ? -value : value));
    }

    /**
     * @param threshold exclusive lower bound
     * @return true if the numeric z-index is strictly greater than {@code threshold}
     */
    public boolean zIndexAbove(int threshold) {
        OptionalInt z = zIndexValue();
        return z.isPresent() && z.getAsInt() > threshold;
    }

    @Override
    public String toString() {
        return "ComputedStyle{" +
                "position='" + position + '\'' +
                ", zIndex='" + zIndex + '\'' +
                ", display='" + display + '\'' +
                ", visibility='" + visibility + '\'' +
                '}';
    }
}
