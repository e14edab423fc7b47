package io.hearthwarrio.veilguard.testkit;

import io.hearthwarrio.veilguard.core.ElementSnapshot;
import io.hearthwarrio.veilguard.core.HideEventLogger;
import io.hearthwarrio.veilguard.core.HideReason;
import io.hearthwarrio.veilguard.core.LogDetail;
import io.hearthwarrio.veilguard.core.SuppressionStyle;
import io.hearthwarrio.veilguard.core.VeilguardEngine;
import io.hearthwarrio.veilguard.core.host.HostNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SuppressionLifecycleTest {

    private static final String PAGE =
            "<div id=\"story\"><p>Article text</p></div>" +
                    "<div id=\"a1\" class=\"ad-container\">one</div>" +
                    "<div id=\"a2\" class=\"sponsored-post\">two</div>";

    @Test
    void hidingTheSameElementTwiceCountsOnce() {
        List<HideReason> logged = new ArrayList<>();
        PageSession s = TestVeilguard.standardPage(PAGE, "news.example.com")
                .withLogger((reason, snapshot) -> logged.add(reason));
        s.engine().start();
        s.loop().runDueTasks();

        VeilguardEngine engine = s.engine();
        assertEquals(2, engine.getCounters().getHides());
        assertEquals(0, engine.runFastCleanup());
        assertEquals(2, engine.getCounters().getHides());
        assertEquals(List.of(HideReason.FAST_RULE, HideReason.FAST_RULE), logged);
        assertTrue(engine.isProcessed(s.page().node("#a1")));
    }

    @Test
    void hiddenElementsAreInvisibleBeforeTheyAreDetached() {
        PageSession s = TestVeilguard.standardPage(PAGE, "news.example.com");
        s.engine().start();
        s.loop().runDueTasks();

        SimulatedNode ad = s.page().node("#a1");
        assertTrue(ad.isConnected());
        assertEquals("none", ad.inlineStyle("display"));
        assertEquals("hidden", ad.inlineStyle("visibility"));
        assertEquals(2, s.engine().getRemovalQueue().size());
    }

    @Test
    void removalQueueDetachesHiddenElementsInIdleTime() {
        PageSession s = TestVeilguard.standardPage(PAGE, "news.example.com");
        s.engine().start();
        s.loop().runDueTasks();
        SimulatedNode a1 = s.page().node("#a1");
        SimulatedNode a2 = s.page().node("#a2");

        s.settle();

        assertFalse(a1.isConnected());
        assertFalse(a2.isConnected());
        assertEquals(0, s.engine().getRemovalQueue().size());
        assertEquals(2, s.engine().getRemovalQueue().getDetachedCount());
        assertEquals(0, s.engine().getCounters().getDetachFailures());
        assertTrue(s.page().node("#story").isConnected());
    }

    @Test
    void busyPageStillDrainsWithinTheIdleTimeout() {
        PageSession s = TestVeilguard.standardPage(PAGE, "news.example.com");
        s.engine().start();
        s.loop().runDueTasks();
        SimulatedNode a1 = s.page().node("#a1");

        s.loop().advance(499);
        assertTrue(a1.isConnected());

        s.loop().advance(1);
        assertFalse(a1.isConnected());
    }

    @Test
    void drainResumesAfterCooldownForLaterHides() {
        PageSession s = TestVeilguard.standardPage(PAGE, "news.example.com").start();
        List<HostNode> added = s.page().appendHtml(s.page().getBody(), "<div class=\"ads-block\">late</div>");
        s.settle();

        HostNode late = added.get(0);
        assertTrue(s.engine().isProcessed(late));
        assertTrue(late.isConnected());

        s.loop().advanceWithIdle(2_000);
        assertFalse(late.isConnected());
        assertEquals(3, s.engine().getRemovalQueue().getDetachedCount());
    }

    @Test
    void elementsRemovedByThePageAreSkippedSilently() {
        PageSession s = TestVeilguard.standardPage(PAGE, "news.example.com");
        s.engine().start();
        s.loop().runDueTasks();
        s.page().node("#a1").remove();

        s.settle();

        assertEquals(1, s.engine().getRemovalQueue().getDetachedCount());
        assertEquals(0, s.engine().getCounters().getDetachFailures());
    }

    @Test
    void styleIsRewrittenOnlyWhenRulesChange() {
        PageSession s = TestVeilguard.standardPage(PAGE, "news.example.com").start();
        SuppressionStyle style = s.engine().getSuppressionStyle();

        assertEquals(1, style.getWriteCount());
        assertEquals(s.engine().getSelectorConfig().hash(), style.getCurrentHash());
        assertFalse(style.apply(s.engine().getSelectorConfig()));
        assertEquals(1, style.getWriteCount());
    }

    @Test
    void removedStyleIsRestoredByTheHealCheck() {
        PageSession s = TestVeilguard.standardPage(PAGE, "news.example.com").start();
        s.page().getElementById(SuppressionStyle.STYLE_ELEMENT_ID).remove();
        assertNull(s.page().getElementById(SuppressionStyle.STYLE_ELEMENT_ID));

        s.loop().advance(8_000);

        HostNode restored = s.page().getElementById(SuppressionStyle.STYLE_ELEMENT_ID);
        assertNotNull(restored);
        assertEquals(s.engine().getSelectorConfig().ruleText(), restored.getInnerText());
        assertEquals(2, s.engine().getSuppressionStyle().getWriteCount());
    }

    @Test
    void loggerDetailControlsSnapshots() {
        List<ElementSnapshot> snapshots = new ArrayList<>();
        HideEventLogger silent = new HideEventLogger() {
            @Override
            public void logHidden(HideReason reason, ElementSnapshot snapshot) {
                snapshots.add(snapshot);
            }

            @Override
            public LogDetail detail() {
                return LogDetail.NONE;
            }
        };
        PageSession s = TestVeilguard.standardPage(PAGE, "news.example.com").withLogger(silent).start();

        assertEquals(2, snapshots.size());
        assertEquals(ElementSnapshot.empty(), snapshots.get(0));
    }
}
