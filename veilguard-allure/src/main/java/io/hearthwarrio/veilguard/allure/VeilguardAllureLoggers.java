package io.hearthwarrio.veilguard.allure;

import io.hearthwarrio.veilguard.core.HideEventLogger;
import io.hearthwarrio.veilguard.core.LogDetail;
import org.openqa.selenium.WebDriver;

/**
 * Factory methods for Allure-related Veilguard loggers.
 * <p>
 * This class lives in the veilguard-allure module to avoid leaking Allure
 * dependencies into veilguard-core or veilguard-webdriver.
 */
public final class VeilguardAllureLoggers {

    private VeilguardAllureLoggers() {
        // utility class
    }

    /**
     * Creates an Allure logger with summary detail and without screenshots.
     */
    public static HideEventLogger hiddenElements(WebDriver driver) {
        return new AllureHideEventLogger(driver, LogDetail.SUMMARY, false);
    }

    /**
     * Creates an Allure logger with explicit detail and screenshot flag.
     */
    public static HideEventLogger hiddenElements(WebDriver driver, LogDetail detail, boolean screenshots) {
        return new AllureHideEventLogger(driver, detail, screenshots);
    }

    /**
     * Creates an Allure logger for pages without a browser.
     */
    public static HideEventLogger hiddenElements(LogDetail detail) {
        return new AllureHideEventLogger(detail);
    }
}
