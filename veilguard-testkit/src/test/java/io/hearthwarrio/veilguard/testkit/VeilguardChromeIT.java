package io.hearthwarrio.veilguard.testkit;

import com.sun.net.httpserver.HttpServer;
import io.hearthwarrio.veilguard.core.EngineStatus;
import io.hearthwarrio.veilguard.core.FilteringMode;
import io.hearthwarrio.veilguard.core.LogDetail;
import io.hearthwarrio.veilguard.core.SiteSettings;
import io.hearthwarrio.veilguard.webdriver.VeilguardWebDriver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs against a local headless Chrome. Not part of the default test run.
 */
public class VeilguardChromeIT {

    private static final String PAGE = "<!doctype html><html><head><title>news</title></head><body>"
            + "<div id=\"story\"><p>Article text</p></div>"
            + "<div id=\"banner\" class=\"ad-container\">Buy now</div>"
            + "</body></html>";

    private HttpServer server;
    private WebDriver driver;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            byte[] body = PAGE.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "text/html; charset=utf-8");
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.start();
        driver = TestDrivers.chrome();
    }

    @AfterEach
    void tearDown() {
        if (driver != null) {
            driver.quit();
        }
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void hidesAndRemovesExistingAndInjectedAds() {
        driver.get("http://localhost:" + server.getAddress().getPort() + "/");
        VeilguardWebDriver veilguard = TestVeilguard.stdout(driver,
                StaticSettingsProvider.of(SiteSettings.of(FilteringMode.STANDARD)), LogDetail.SUMMARY);

        veilguard.attach();
        veilguard.pumpFor(Duration.ofSeconds(1));

        assertEquals(EngineStatus.ACTIVE, veilguard.getEngine().getStatus());
        assertTrue(driver.findElements(By.id("banner")).isEmpty());

        ((JavascriptExecutor) driver).executeScript(
                "var d=document.createElement('div');d.id='late';d.setAttribute('data-element','x');document.body.appendChild(d);");
        veilguard.pumpFor(Duration.ofSeconds(3));

        assertTrue(driver.findElements(By.id("late")).isEmpty());
        assertFalse(driver.findElements(By.id("story")).isEmpty());
        veilguard.detach();
    }
}
