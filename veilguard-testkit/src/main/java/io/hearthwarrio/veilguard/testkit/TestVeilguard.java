package io.hearthwarrio.veilguard.testkit;

import io.hearthwarrio.veilguard.core.FilteringMode;
import io.hearthwarrio.veilguard.core.LogDetail;
import io.hearthwarrio.veilguard.core.SettingsProvider;
import io.hearthwarrio.veilguard.core.SiteSettings;
import io.hearthwarrio.veilguard.webdriver.VeilguardWebDriver;
import org.openqa.selenium.WebDriver;

import java.util.Objects;

/**
 * Convenience factory methods for creating Veilguard instances in tests.
 * <p>
 * Does not depend on Allure.
 */
public final class TestVeilguard {

    private TestVeilguard() {
        // utility class
    }

    /**
     * Creates a plain VeilguardWebDriver without logging.
     */
    public static VeilguardWebDriver plain(WebDriver driver, SettingsProvider settings) {
        Objects.requireNonNull(driver, "driver must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        return new VeilguardWebDriver(driver, settings);
    }

    /**
     * Creates a VeilguardWebDriver with stdout hide logging enabled.
     */
    public static VeilguardWebDriver stdout(WebDriver driver, SettingsProvider settings, LogDetail detail) {
        Objects.requireNonNull(driver, "driver must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        return new VeilguardWebDriver(driver, settings)
                .withLoggingToStdOut(detail);
    }

    /**
     * Creates a VeilguardWebDriver that runs every site in the given mode.
     */
    public static VeilguardWebDriver inMode(WebDriver driver, FilteringMode mode) {
        Objects.requireNonNull(driver, "driver must not be null");
        return new VeilguardWebDriver(driver, StaticSettingsProvider.of(SiteSettings.of(mode)));
    }

    /**
     * Opens a simulated page whose every site runs in {@link FilteringMode#ADVANCED}.
     */
    public static PageSession advancedPage(String html, String domain) {
        return PageSession.open(html, domain, SiteSettings.of(FilteringMode.ADVANCED));
    }

    /**
     * Opens a simulated page whose every site runs in {@link FilteringMode#STANDARD}.
     */
    public static PageSession standardPage(String html, String domain) {
        return PageSession.open(html, domain, SiteSettings.of(FilteringMode.STANDARD));
    }
}
