package io.hearthwarrio.veilguard.core;

import java.util.Objects;

/**
 * Per-site settings as resolved by the settings collaborator.
 * <p>
 * Immutable; the engine only reads it. The {@code with*} helpers exist for collaborators that implement
 * the user actions (mode change, toggles, temporary relax, breakage reports).
 */
public final class SiteSettings {

    public static final int MIN_RELAX_MINUTES = 1;
    public static final int MAX_RELAX_MINUTES = 120;

    /**
     * Number of breakage reports after which a site is downgraded to {@link FilteringMode#LITE}.
     */
    public static final int BREAKAGE_DOWNGRADE_THRESHOLD = 2;

    private static final long MILLIS_PER_MINUTE = 60_000L;

    private final FilteringMode mode;
    private final boolean interceptionOff;
    private final boolean classificationOff;
    private final boolean siteFixesOff;
    private final int breakageCount;

    /**
     * Epoch millis until which filtering is relaxed; 0 when no relax window is set.
     */
    private final long relaxUntilEpochMillis;

    public SiteSettings(
            FilteringMode mode,
            boolean interceptionOff,
            boolean classificationOff,
            boolean siteFixesOff,
            int breakageCount,
            long relaxUntilEpochMillis
    ) {
        this.mode = mode == null ? FilteringMode.LITE : mode;
        this.interceptionOff = interceptionOff;
        this.classificationOff = classificationOff;
        this.siteFixesOff = siteFixesOff;
        this.breakageCount = Math.max(0, breakageCount);
        this.relaxUntilEpochMillis = Math.max(0L, relaxUntilEpochMillis);
    }

    /**
     * @return settings of a site nobody configured: {@link FilteringMode#LITE}, every capability on
     */
    public static SiteSettings defaults() {
        return new SiteSettings(FilteringMode.LITE, false, false, false, 0, 0L);
    }

    public static SiteSettings of(FilteringMode mode) {
        return new SiteSettings(mode, false, false, false, 0, 0L);
    }

    public FilteringMode getMode() {
        return mode;
    }

    /**
     * @return true when the capability interceptor must not be installed
     */
    public boolean isInterceptionOff() {
        return interceptionOff;
    }

    /**
     * @return true when no classification work (style rule, watcher, sweeps) may run
     */
    public boolean isClassificationOff() {
        return classificationOff;
    }

    /**
     * @return true when media guard and click protection must not be installed
     */
    public boolean isSiteFixesOff() {
        return siteFixesOff;
    }

    public int getBreakageCount() {
        return breakageCount;
    }

    public long getRelaxUntilEpochMillis() {
        return relaxUntilEpochMillis;
    }

    /**
     * @param nowEpochMillis wall clock
     * @return true while a temporary relax window is open
     */
    public boolean isRelaxedAt(long nowEpochMillis) {
        return relaxUntilEpochMillis > 0 && nowEpochMillis < relaxUntilEpochMillis;
    }

    public SiteSettings withMode(FilteringMode mode) {
        return new SiteSettings(mode, interceptionOff, classificationOff, siteFixesOff, breakageCount, relaxUntilEpochMillis);
    }

    public SiteSettings withInterceptionOff(boolean off) {
        return new SiteSettings(mode, off, classificationOff, siteFixesOff, breakageCount, relaxUntilEpochMillis);
    }

    public SiteSettings withClassificationOff(boolean off) {
        return new SiteSettings(mode, interceptionOff, off, siteFixesOff, breakageCount, relaxUntilEpochMillis);
    }

    public SiteSettings withSiteFixesOff(boolean off) {
        return new SiteSettings(mode, interceptionOff, classificationOff, off, breakageCount, relaxUntilEpochMillis);
    }

    /**
     * Opens a temporary relax window.
     *
     * @param nowEpochMillis wall clock
     * @param minutes        window length, {@value #MIN_RELAX_MINUTES}..{@value #MAX_RELAX_MINUTES}
     * @return settings with the relax deadline set
     * @throws IllegalArgumentException when {@code minutes} is out of bounds
     */
    public SiteSettings relaxFor(long nowEpochMillis, int minutes) {
        if (minutes < MIN_RELAX_MINUTES || minutes > MAX_RELAX_MINUTES) {
            throw new IllegalArgumentException(
                    "relax minutes must be within [" + MIN_RELAX_MINUTES + "," + MAX_RELAX_MINUTES + "]: " + minutes
            );
        }
        long until = nowEpochMillis + minutes * MILLIS_PER_MINUTE;
        return new SiteSettings(mode, interceptionOff, classificationOff, siteFixesOff, breakageCount, until);
    }

    public SiteSettings withoutRelax() {
        return new SiteSettings(mode, interceptionOff, classificationOff, siteFixesOff, breakageCount, 0L);
    }

    /**
     * Records one breakage report. Reaching {@link #BREAKAGE_DOWNGRADE_THRESHOLD} downgrades the site to
     * {@link FilteringMode#LITE}.
     *
     * @return updated settings
     */
    public SiteSettings withBreakageReported() {
        int count = breakageCount + 1;
        FilteringMode m = count >= BREAKAGE_DOWNGRADE_THRESHOLD ? FilteringMode.LITE : mode;
        return new SiteSettings(m, interceptionOff, classificationOff, siteFixesOff, count, relaxUntilEpochMillis);
    }

    @Override
    public String toString() {
        return "SiteSettings{" +
                "mode=" + mode +
                ", interceptionOff=" + interceptionOff +
                ", classificationOff=" + classificationOff +
                ", siteFixesOff=" + siteFixesOff +
                ", breakageCount=" + breakageCount +
                ", relaxUntilEpochMillis=" + relaxUntilEpochMillis +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SiteSettings)) return false;
        SiteSettings that = (SiteSettings) o;
        return interceptionOff == that.interceptionOff &&
                classificationOff == that.classificationOff &&
                siteFixesOff == that.siteFixesOff &&
                breakageCount == that.breakageCount &&
                relaxUntilEpochMillis == that.relaxUntilEpochMillis &&
                mode == that.mode;
    }

    @Override
    public int hashCode() {
        return Objects.hash(mode, interceptionOff, classificationOff, siteFixesOff, breakageCount, relaxUntilEpochMillis);
    }
}
