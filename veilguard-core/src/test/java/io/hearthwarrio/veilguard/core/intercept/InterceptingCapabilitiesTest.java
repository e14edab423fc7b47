package io.hearthwarrio.veilguard.core.intercept;

import io.hearthwarrio.veilguard.core.ElementSnapshot;
import io.hearthwarrio.veilguard.core.HideEventLogger;
import io.hearthwarrio.veilguard.core.HideReason;
import io.hearthwarrio.veilguard.core.StubNode;
import io.hearthwarrio.veilguard.core.host.HostNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class InterceptingCapabilitiesTest {

    private final RecordingCapabilities original = new RecordingCapabilities();
    private final List<String> errors = new ArrayList<>();
    private final InterceptingCapabilities caps = new InterceptingCapabilities(original, new HideEventLogger() {
        @Override
        public void logHidden(HideReason reason, ElementSnapshot snapshot) {
        }

        @Override
        public void logSuppressedError(String operation, Throwable error) {
            errors.add(operation);
        }
    });

    private static String markup(int length, String marker) {
        StringBuilder sb = new StringBuilder("<div ").append(marker).append(">");
        while (sb.length() < length - 6) {
            sb.append('x');
        }
        sb.append("</div>");
        return sb.toString();
    }

    @Test
    void adNetworkNavigationIsBlocked() {
        assertNull(caps.openWindow("https://ads.exoclick.com/x", "_blank", ""));
        assertNull(caps.openWindow("https://example.com/?type=POPUNDER", "_blank", ""));

        assertTrue(original.calls.isEmpty());
        assertEquals(2, caps.getBlockedNavigations());
    }

    @Test
    void emptyAndInternalNavigationIsAllowed() {
        assertNotNull(caps.openWindow("", "_blank", ""));
        assertNotNull(caps.openWindow(null, "_blank", ""));
        assertNotNull(caps.openWindow("blob:abcd", "_blank", ""));
        assertNotNull(caps.openWindow("about:blank", "_blank", ""));
        assertNotNull(caps.openWindow("data:text/html,exoclick", "_blank", ""));

        assertEquals(5, original.calls.size());
    }

    @Test
    void recommendationNetworksAreNotBlockedForNavigation() {
        assertNotNull(caps.openWindow("https://www.taboola.com/article", "_blank", ""));
        assertNotNull(caps.openWindow("https://accounts.example.com/oauth", "_blank", ""));
    }

    @Test
    void largeMarkupWithMarkerIsBlocked() {
        String big = markup(250, "title=\"offer\"");
        assertEquals(250, big.length());

        caps.insertAdjacentMarkup(new StubNode("div"), "beforeend", big);

        assertTrue(original.calls.isEmpty());
        assertEquals(1, caps.getBlockedMarkup());
    }

    @Test
    void smallMarkupWithMarkerIsDelegated() {
        String small = markup(150, "data-izone=\"1\"");
        assertEquals(150, small.length());

        caps.insertAdjacentMarkup(new StubNode("div"), "beforeend", small);

        assertEquals(List.of("insertAdjacentMarkup"), original.calls);
    }

    @Test
    void largeMarkupWithoutMarkerIsDelegated() {
        caps.insertAdjacentMarkup(new StubNode("div"), "beforeend", markup(300, "class=\"article\""));

        assertEquals(List.of("insertAdjacentMarkup"), original.calls);
    }

    @Test
    void markerChildIsHiddenButStillAppended() {
        StubNode parent = new StubNode("body");
        StubNode ad = new StubNode("div").attr("class", "top AdSlot_3");

        HostNode result = caps.appendChild(parent, ad);

        assertSame(ad, result);
        assertEquals(List.of("appendChild"), original.calls);
        assertEquals("none !important", ad.inlineStyle("display"));
        assertEquals("hidden !important", ad.inlineStyle("visibility"));
        assertEquals(1, caps.getNeutralizedElements());
    }

    @Test
    void plainChildIsUntouched() {
        StubNode child = new StubNode("p");

        caps.appendChild(new StubNode("body"), child);

        assertNull(child.inlineStyle("display"));
        assertEquals(0, caps.getNeutralizedElements());
    }

    @Test
    void markerAttributeWriteHidesOwnerThenDelegates() {
        StubNode el = new StubNode("div");

        caps.setAttribute(el, "data-element", "banner");
        caps.setAttribute(el, "data-other", "x");

        assertEquals(List.of("setAttribute", "setAttribute"), original.calls);
        assertEquals("none !important", el.inlineStyle("display"));
        assertEquals(1, caps.getNeutralizedElements());
    }

    @Test
    void classificationFailureFailsOpen() {
        StubNode hostile = new StubNode("div").failReads(new IllegalStateException("boom"));
        StubNode parent = new StubNode("body");

        caps.appendChild(parent, hostile);

        assertEquals(List.of("appendChild"), original.calls);
        assertNull(hostile.inlineStyle("display"));
    }

    @Test
    void installIsIdempotentAndTopLevelOnly() {
        TestCapabilityHost top = new TestCapabilityHost(true, original);

        assertTrue(CapabilityInterceptor.install(top, HideEventLogger.noop()).isPresent());
        assertTrue(top.getCapabilities() instanceof InterceptingCapabilities);
        assertFalse(CapabilityInterceptor.install(top, HideEventLogger.noop()).isPresent());
        assertSame(original, ((InterceptingCapabilities) top.getCapabilities()).getDelegate());

        TestCapabilityHost nested = new TestCapabilityHost(false, original);
        assertFalse(CapabilityInterceptor.install(nested, HideEventLogger.noop()).isPresent());
        assertSame(original, nested.getCapabilities());
        assertTrue(CapabilityInterceptor.install(nested, HideEventLogger.noop(), true).isPresent());
    }

    static final class RecordingCapabilities implements DocumentCapabilities {
        final List<String> calls = new ArrayList<>();

        @Override
        public HostWindow openWindow(String url, String name, String features) {
            calls.add("openWindow");
            return () -> url == null ? "" : url;
        }

        @Override
        public HostNode appendChild(HostNode parent, HostNode child) {
            calls.add("appendChild");
            parent.appendChild(child);
            return child;
        }

        @Override
        public void setAttribute(HostNode element, String name, String value) {
            calls.add("setAttribute");
            element.setAttribute(name, value);
        }

        @Override
        public void insertAdjacentMarkup(HostNode element, String position, String markup) {
            calls.add("insertAdjacentMarkup");
        }
    }

    static final class TestCapabilityHost implements CapabilityHost {
        private final boolean topLevel;
        private final InitializationToken token = new InitializationToken();
        private DocumentCapabilities capabilities;

        TestCapabilityHost(boolean topLevel, DocumentCapabilities capabilities) {
            this.topLevel = topLevel;
            this.capabilities = capabilities;
        }

        @Override
        public boolean isTopLevelContext() {
            return topLevel;
        }

        @Override
        public DocumentCapabilities getCapabilities() {
            return capabilities;
        }

        @Override
        public void setCapabilities(DocumentCapabilities capabilities) {
            this.capabilities = capabilities;
        }

        @Override
        public InitializationToken initializationToken() {
            return token;
        }
    }
}
