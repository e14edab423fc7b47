package io.hearthwarrio.veilguard.allure;

import io.hearthwarrio.veilguard.core.ElementSnapshot;
import io.hearthwarrio.veilguard.core.HideEventLogger;
import io.hearthwarrio.veilguard.core.HideReason;
import io.hearthwarrio.veilguard.core.LogDetail;
import io.qameta.allure.Allure;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.WebDriver;

import java.io.ByteArrayInputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Allure logger for hidden elements and suppressed errors.
 * <p>
 * Lives in veilguard-allure to avoid leaking the Allure dependency into core/webdriver.
 */
public final class AllureHideEventLogger implements HideEventLogger {

    private final WebDriver driver;
    private final LogDetail detail;
    private final boolean attachScreenshot;

    /**
     * @param driver           driver used for screenshots
     * @param detail           snapshot detail
     * @param attachScreenshot attach a page screenshot to every hide step
     */
    public AllureHideEventLogger(WebDriver driver, LogDetail detail, boolean attachScreenshot) {
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
        this.detail = detail == null ? LogDetail.NONE : detail;
        this.attachScreenshot = attachScreenshot;
    }

    /**
     * Creates a logger without screenshot support, for pages that are not driven by a browser.
     */
    public AllureHideEventLogger(LogDetail detail) {
        this.driver = null;
        this.detail = detail == null ? LogDetail.NONE : detail;
        this.attachScreenshot = false;
    }

    @Override
    public LogDetail detail() {
        return detail;
    }

    @Override
    public void logHidden(HideReason reason, ElementSnapshot snapshot) {
        ElementSnapshot s = snapshot == null ? ElementSnapshot.empty() : snapshot;
        String title = "Veilguard: hidden " + describe(s) + " (" + reason + ")";

        Allure.step(title, () -> {
            if (detail != LogDetail.NONE) {
                StringBuilder sb = new StringBuilder(256);
                sb.append("reason: ").append(reason).append('\n')
                        .append("tag: ").append(s.getTagName()).append('\n')
                        .append("id: ").append(s.getId()).append('\n');
                if (detail == LogDetail.FULL) {
                    sb.append("class: ").append(s.getCssClasses()).append('\n')
                            .append("marker: ").append(s.getMarkerAttribute()).append('\n');
                }
                attachText("Hidden element", sb.toString());
            }

            if (attachScreenshot && driver instanceof TakesScreenshot ts) {
                byte[] png = ts.getScreenshotAs(OutputType.BYTES);
                Allure.addAttachment(
                        "Screenshot",
                        "image/png",
                        new ByteArrayInputStream(png),
                        ".png"
                );
            }
        });
    }

    @Override
    public void logSuppressedError(String operation, Throwable error) {
        String title = "Veilguard: suppressed error in " + (operation == null ? "unknown" : operation);
        Allure.step(title, () -> {
            if (error != null) {
                StringWriter trace = new StringWriter();
                error.printStackTrace(new PrintWriter(trace));
                attachText("Error", trace.toString());
            }
        });
    }

    private static void attachText(String name, String text) {
        byte[] txt = text.getBytes(StandardCharsets.UTF_8);
        Allure.addAttachment(
                name,
                "text/plain",
                new ByteArrayInputStream(txt),
                ".txt"
        );
    }

    private static String describe(ElementSnapshot s) {
        if (s.getTagName().isEmpty()) {
            return "element";
        }
        return s.getId().isEmpty() ? "<" + s.getTagName() + ">" : "<" + s.getTagName() + "#" + s.getId() + ">";
    }
}
