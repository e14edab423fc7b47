package io.hearthwarrio.veilguard.testkit;

import org.openqa.selenium.Capabilities;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.remote.RemoteWebDriver;

import java.net.URL;
import java.time.Duration;
import java.util.Objects;

/**
 * WebDriver factory for browser-backed tests.
 * <p>
 * Local headless Chrome by default; a Selenium Grid via {@link #remote(URL, Capabilities)}.
 */
public final class TestDrivers {

    public static final Duration DEFAULT_SCRIPT_TIMEOUT = Duration.ofSeconds(5);

    private TestDrivers() {
        // utility class
    }

    public static WebDriver chrome() {
        ChromeOptions options = new ChromeOptions();
        options.addArguments("--headless=new", "--window-size=1280,800");
        return chrome(options);
    }

    public static WebDriver chrome(ChromeOptions options) {
        Objects.requireNonNull(options, "options must not be null");

        WebDriver driver = new ChromeDriver(options);
        applyDefaults(driver);
        return driver;
    }

    public static WebDriver remote(URL remoteUrl, Capabilities capabilities) {
        Objects.requireNonNull(remoteUrl, "remoteUrl must not be null");
        Objects.requireNonNull(capabilities, "capabilities must not be null");

        WebDriver driver = new RemoteWebDriver(remoteUrl, capabilities);
        applyDefaults(driver);
        return driver;
    }

    private static void applyDefaults(WebDriver driver) {
        driver.manage().timeouts().scriptTimeout(DEFAULT_SCRIPT_TIMEOUT);
    }
}
