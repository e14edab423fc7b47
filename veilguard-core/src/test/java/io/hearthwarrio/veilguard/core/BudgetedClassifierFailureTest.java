package io.hearthwarrio.veilguard.core;

import io.hearthwarrio.veilguard.core.host.ComputedStyle;
import io.hearthwarrio.veilguard.core.host.CooperativeEventLoop;
import io.hearthwarrio.veilguard.core.host.HostAccessException;
import io.hearthwarrio.veilguard.core.host.HostDocument;
import io.hearthwarrio.veilguard.core.host.HostNode;
import io.hearthwarrio.veilguard.core.host.Viewport;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class BudgetedClassifierFailureTest {

    private static final long MS = 1_000_000L;

    private final AtomicLong now = new AtomicLong();
    private final CooperativeEventLoop loop = new CooperativeEventLoop(now::get, () -> now.get() / MS, true);
    private final Counters counters = new Counters();
    private final ProcessedSet processed = new ProcessedSet();
    private final HostDocument document = mock(HostDocument.class);
    private final List<HideReason> hidden = new ArrayList<>();
    private final HideEventLogger logger = new HideEventLogger() {
        @Override
        public void logHidden(HideReason reason, ElementSnapshot snapshot) {
            hidden.add(reason);
        }

        @Override
        public void logSuppressedError(String operation, Throwable error) {
            // read failures are not asserted on here
        }
    };

    private BudgetedClassifier classifier(HideEventLogger log) {
        when(document.getViewport()).thenReturn(new Viewport(1280, 800));
        RemovalQueue queue = new RemovalQueue(loop, EngineTuning.defaults(), processed, counters, log);
        Suppressor suppressor = new Suppressor(processed, queue, counters, log);
        BudgetedClassifier classifier = new BudgetedClassifier(document, loop, suppressor, counters,
                EngineTuning.defaults(), ElementHeuristics.builtIn(), log);
        classifier.configure(SelectorConfig.empty(), FilteringMode.ADVANCED);
        return classifier;
    }

    private static StubNode unreadable() {
        return new StubNode("div").failReads(new HostAccessException("stale element"));
    }

    private static StubNode inFlow(String tag) {
        return new StubNode(tag).style(new ComputedStyle("static", "auto", "block", "visible"));
    }

    @Test
    void unreadableNodeIsSkippedAndPassContinues() {
        BudgetedClassifier classifier = classifier(logger);
        StubNode stale = unreadable();
        StubNode ad = new StubNode("div").attr("class", "AdSlot-top");
        StubNode staleChild = unreadable();
        StubNode nestedAd = new StubNode("div").attr("data-izone", "7");
        StubNode section = inFlow("section").child(staleChild).child(nestedAd);

        now.set(3_000 * MS);
        PassResult result = classifier.runPass(List.<HostNode>of(stale, ad, section));

        assertEquals(5, result.getExamined());
        assertEquals(2, result.getHides());
        assertEquals(0, result.getRemaining());
        assertFalse(result.isExhausted());
        assertEquals(List.of(HideReason.AD_SLOT_CLASS, HideReason.MARKER_ATTRIBUTE), hidden);
        assertTrue(processed.contains(ad));
        assertTrue(processed.contains(nestedAd));
        assertFalse(processed.contains(stale));
        assertFalse(processed.contains(staleChild));
        assertEquals(1, counters.getBatches());
        assertEquals(3_000 * MS, classifier.getQuietState().getLastHideNanos());
        assertFalse(classifier.isQuiet());
    }

    @Test
    void passesOverUnreadableNodesStillReachQuiet() {
        BudgetedClassifier classifier = classifier(logger);
        StubNode stale = unreadable();

        now.set(9_999 * MS);
        PassResult first = classifier.runPass(List.<HostNode>of(stale));
        assertEquals(1, first.getExamined());
        assertEquals(0, first.getHides());
        assertFalse(classifier.isQuiet());

        now.set(10_000 * MS);
        classifier.runPass(List.<HostNode>of(stale));

        assertTrue(classifier.isQuiet());
        assertEquals(2, counters.getBatches());
        assertEquals(0, counters.getHides());
    }

    @Test
    void throwingLoggerLeavesPassBookkeepingIntact() {
        HideEventLogger broken = new HideEventLogger() {
            @Override
            public void logHidden(HideReason reason, ElementSnapshot snapshot) {
                throw new IllegalStateException("report sink down");
            }

            @Override
            public void logSuppressedError(String operation, Throwable error) {
                throw new IllegalStateException("report sink down");
            }
        };
        BudgetedClassifier classifier = classifier(broken);
        StubNode first = new StubNode("div").attr("class", "AdSlot-top");
        StubNode second = new StubNode("div").attr("data-element", "banner");

        now.set(500 * MS);
        PassResult result = classifier.runPass(List.<HostNode>of(unreadable(), first, second));

        assertEquals(2, result.getHides());
        assertEquals(2, counters.getHides());
        assertEquals(2, counters.getLoggerFailures());
        assertEquals(1, counters.getBatches());
        assertEquals("none !important", first.inlineStyle("display"));
        assertEquals("none !important", second.inlineStyle("display"));
        assertEquals(500 * MS, classifier.getQuietState().getLastHideNanos());
    }
}
