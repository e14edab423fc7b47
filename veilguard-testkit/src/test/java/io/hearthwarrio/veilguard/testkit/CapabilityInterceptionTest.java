package io.hearthwarrio.veilguard.testkit;

import io.hearthwarrio.veilguard.core.FilteringMode;
import io.hearthwarrio.veilguard.core.SiteSettings;
import io.hearthwarrio.veilguard.core.VeilguardEngine;
import io.hearthwarrio.veilguard.core.host.HostNode;
import io.hearthwarrio.veilguard.core.intercept.DocumentCapabilities;
import io.hearthwarrio.veilguard.core.intercept.InterceptingCapabilities;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CapabilityInterceptionTest {

    private static final String PAGE = "<div id=\"story\"><p>Article text</p></div>";

    private static String padded(String markup) {
        StringBuilder sb = new StringBuilder(markup);
        while (sb.length() <= InterceptingCapabilities.MIN_BLOCKED_MARKUP_LENGTH) {
            sb.append("<p>padding text</p>");
        }
        return sb.toString();
    }

    @Test
    void popupsToAdNetworksAreRefused() {
        PageSession s = TestVeilguard.standardPage(PAGE, "news.example.com").start();
        DocumentCapabilities caps = s.capabilities().current();

        assertNull(caps.openWindow("https://go.popads.net/landing?id=7", "_blank", ""));
        assertNull(caps.openWindow("https://x.example.net/popunder.html", "_blank", ""));
        assertNotNull(caps.openWindow("https://example.org/article", "_blank", ""));
        assertNotNull(caps.openWindow("about:blank", "_blank", ""));

        assertEquals(2, s.capabilities().getOpenedUrls().size());
        assertEquals(2, s.engine().getCapabilityInterceptor().getBlockedNavigations());
    }

    @Test
    void largeMarkupWithAdMarkersIsDropped() {
        PageSession s = TestVeilguard.standardPage(PAGE, "news.example.com").start();
        DocumentCapabilities caps = s.capabilities().current();
        HostNode story = s.page().node("#story");

        caps.insertAdjacentMarkup(story, "beforeend", padded("<div data-izone=\"9\">offer</div>"));
        caps.insertAdjacentMarkup(story, "beforeend", "<p id=\"ok\">short</p>");
        caps.insertAdjacentMarkup(story, "beforeend", padded("<div id=\"plain\">news</div>"));

        assertTrue(s.page().nodes("[data-izone]").isEmpty());
        assertNotNull(s.page().getElementById("ok"));
        assertNotNull(s.page().getElementById("plain"));
        assertEquals(1, s.engine().getCapabilityInterceptor().getBlockedMarkup());
    }

    @Test
    void markedElementsAreInvisibleBeforeInsertion() {
        PageSession s = TestVeilguard.standardPage(PAGE, "news.example.com").start();
        DocumentCapabilities caps = s.capabilities().current();
        SimulatedNode slot = (SimulatedNode) s.page().createElement("div");
        slot.setAttribute("data-element", "banner");

        caps.appendChild(s.page().getBody(), slot);

        assertTrue(slot.isConnected());
        assertEquals("none", slot.inlineStyle("display"));
        assertEquals(1, s.engine().getCapabilityInterceptor().getNeutralizedElements());

        s.settle();
        assertTrue(s.engine().isProcessed(slot));
    }

    @Test
    void markerAttributeWritesNeutralizeTheTarget() {
        PageSession s = TestVeilguard.standardPage(PAGE, "news.example.com").start();
        DocumentCapabilities caps = s.capabilities().current();
        SimulatedNode story = s.page().node("#story");

        caps.setAttribute(story, "data-izone", "3");
        caps.setAttribute(story, "title", "harmless");

        assertEquals("3", story.getAttribute("data-izone"));
        assertEquals("hidden", story.inlineStyle("visibility"));
        assertEquals(1, s.engine().getCapabilityInterceptor().getNeutralizedElements());
    }

    @Test
    void secondEngineOnTheSameContextDoesNotWrapAgain() {
        PageSession s = TestVeilguard.standardPage(PAGE, "news.example.com").start();
        InterceptingCapabilities first = s.engine().getCapabilityInterceptor();

        VeilguardEngine second = new VeilguardEngine(s.page(), s.loop(), StaticSettingsProvider.of(SiteSettings.of(FilteringMode.STANDARD)))
                .withCapabilityHost(s.capabilities());
        assertTrue(second.activate(SiteSettings.of(FilteringMode.STANDARD)));

        assertNull(second.getCapabilityInterceptor());
        assertSame(first, s.capabilities().getCapabilities());
        assertSame(s.capabilities(), first.getDelegate());
    }

    @Test
    void nestedFramesAreSkippedUnlessAllowed() {
        VirtualEventLoop loop = new VirtualEventLoop();
        SimulatedPage page = new SimulatedPage(PAGE, "news.example.com", loop);
        SimulatedCapabilities frame = new SimulatedCapabilities(page, false);
        SimulatedCapabilities allowedFrame = new SimulatedCapabilities(page, false);
        StaticSettingsProvider settings = StaticSettingsProvider.of(SiteSettings.of(FilteringMode.STANDARD));

        VeilguardEngine skipped = new VeilguardEngine(page, loop, settings).withCapabilityHost(frame);
        skipped.activate(SiteSettings.of(FilteringMode.STANDARD));
        VeilguardEngine allowed = new VeilguardEngine(page, loop, settings).withCapabilityHost(allowedFrame, true);
        allowed.activate(SiteSettings.of(FilteringMode.STANDARD));

        assertSame(frame, frame.getCapabilities());
        assertNotNull(allowed.getCapabilityInterceptor());
        assertSame(allowed.getCapabilityInterceptor(), allowedFrame.getCapabilities());
    }
}
