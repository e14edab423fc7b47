package io.hearthwarrio.veilguard.testkit;

import io.hearthwarrio.veilguard.core.FilteringMode;
import io.hearthwarrio.veilguard.core.LogDetail;
import io.hearthwarrio.veilguard.core.SiteSettings;
import io.hearthwarrio.veilguard.webdriver.VeilguardWebDriver;
import org.junit.jupiter.api.Test;
import org.openqa.selenium.WebDriver;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class TestVeilguardTest {

    private final WebDriver driver = mock(WebDriver.class);

    @Test
    void driverFactoriesReturnDetachedFacades() {
        StaticSettingsProvider settings = StaticSettingsProvider.of(SiteSettings.of(FilteringMode.STANDARD));

        VeilguardWebDriver plain = TestVeilguard.plain(driver, settings);
        VeilguardWebDriver stdout = TestVeilguard.stdout(driver, settings, LogDetail.FULL);
        VeilguardWebDriver advanced = TestVeilguard.inMode(driver, FilteringMode.ADVANCED);

        for (VeilguardWebDriver v : new VeilguardWebDriver[]{plain, stdout, advanced}) {
            assertSame(driver, v.getDriver());
            assertFalse(v.isAttached());
            assertEquals(0, v.getAttachCount());
        }
        verifyNoInteractions(driver);
    }

    @Test
    void driverFactoriesRejectNulls() {
        assertThrows(NullPointerException.class, () -> TestVeilguard.plain(null, StaticSettingsProvider.of(SiteSettings.defaults())));
        assertThrows(NullPointerException.class, () -> TestVeilguard.plain(driver, null));
        assertThrows(NullPointerException.class, () -> TestVeilguard.inMode(null, FilteringMode.LITE));
    }

    @Test
    void pageFactoriesPickTheMode() {
        PageSession advanced = TestVeilguard.advancedPage("<p>text</p>", "news.example.com").start();
        PageSession standard = TestVeilguard.standardPage("<p>text</p>", "news.example.com").start();

        assertEquals(FilteringMode.ADVANCED, advanced.engine().getSettings().getMode());
        assertEquals(FilteringMode.STANDARD, standard.engine().getSettings().getMode());
        assertNotNull(advanced.engine().getMediaGuard());
        assertNull(standard.engine().getMediaGuard());
    }
}
