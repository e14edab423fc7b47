package io.hearthwarrio.veilguard.testkit;

import io.hearthwarrio.veilguard.core.BudgetedClassifier;
import io.hearthwarrio.veilguard.core.EngineTuning;
import io.hearthwarrio.veilguard.core.HideReason;
import io.hearthwarrio.veilguard.core.PassResult;
import io.hearthwarrio.veilguard.core.host.HostNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class BudgetedClassifierTest {

    private static final long NANOS_PER_MILLI = 1_000_000L;
    private static final long CLOCK_STEP_NANOS = 1_000L;

    private static final String OVERLAY =
            "<div style=\"position: fixed; z-index: 999; left: 0px; top: 0px; width: 1280px; height: 800px\"></div>";

    @Test
    void passStopsStartingCandidatesOnceTheBudgetIsSpent() {
        PageSession s = TestVeilguard.standardPage("", "news.example.com").start();
        StringBuilder html = new StringBuilder();
        for (int i = 0; i < 10_000; i++) {
            html.append("<p>item ").append(i).append("</p>");
        }
        List<HostNode> candidates = s.page().appendHtml(s.page().getBody(), html.toString());
        assertEquals(10_000, candidates.size());

        BudgetedClassifier classifier = s.engine().getClassifier();
        s.clock().setAutoAdvanceNanos(CLOCK_STEP_NANOS);
        PassResult result = classifier.runPass(candidates);
        s.clock().setAutoAdvanceNanos(0);

        long budget = EngineTuning.DEFAULT_BUDGET_MILLIS * NANOS_PER_MILLI;
        assertTrue(result.isExhausted());
        assertTrue(result.getRemaining() > 0);
        assertTrue(result.getExamined() < 10_000);
        assertTrue(result.getLastStartedNanos() - result.getStartNanos() <= budget + CLOCK_STEP_NANOS,
                () -> "last candidate started after the budget: " + result);
    }

    @Test
    void unexhaustedPassVisitsEveryCandidate() {
        PageSession s = TestVeilguard.standardPage("", "news.example.com").start();
        List<HostNode> candidates = s.page().appendHtml(s.page().getBody(), "<p>a</p><p>b</p><div class=\"ad-box\"></div>");

        PassResult result = s.engine().getClassifier().runPass(candidates);

        assertFalse(result.isExhausted());
        assertEquals(0, result.getRemaining());
        assertEquals(3, result.getExamined());
        assertEquals(1, result.getHides());
    }

    @Test
    void wideSubtreesAreNotDescended() {
        PageSession s = TestVeilguard.standardPage("", "news.example.com").start();
        List<HostNode> wide = s.page().appendHtml(s.page().getBody(), container(30));
        List<HostNode> narrow = s.page().appendHtml(s.page().getBody(), container(29));

        s.engine().getClassifier().runPass(List.of(wide.get(0), narrow.get(0)));

        assertFalse(s.engine().isProcessed(wide.get(0).querySelector(".ad-box")));
        assertTrue(s.engine().isProcessed(narrow.get(0).querySelector(".ad-box")));
    }

    @Test
    void descentStopsAtTheDepthLimit() {
        PageSession s = TestVeilguard.standardPage("", "news.example.com").start();
        List<HostNode> shallow = s.page().appendHtml(s.page().getBody(), nested(32));
        List<HostNode> deep = s.page().appendHtml(s.page().getBody(), nested(33));

        s.engine().getClassifier().runPass(List.of(shallow.get(0), deep.get(0)));

        assertTrue(s.engine().isProcessed(shallow.get(0).querySelector(".ad-box")));
        assertFalse(s.engine().isProcessed(deep.get(0).querySelector(".ad-box")));
    }

    @Test
    void matchedElementIsNotDescended() {
        PageSession s = TestVeilguard.standardPage("", "news.example.com").start();
        List<HostNode> added = s.page().appendHtml(s.page().getBody(),
                "<div class=\"ad-wrapper\"><div class=\"ad-box\"></div></div>");

        PassResult result = s.engine().getClassifier().runPass(added);

        assertEquals(1, result.getExamined());
        assertFalse(s.engine().isProcessed(added.get(0).querySelector(".ad-box")));
    }

    @Test
    void adNetworkFramesAreHidden() {
        List<HideReason> reasons = new ArrayList<>();
        PageSession s = TestVeilguard.standardPage("", "news.example.com")
                .withLogger((reason, snapshot) -> reasons.add(reason))
                .start();
        List<HostNode> added = s.page().appendHtml(s.page().getBody(),
                "<iframe src=\"https://cdn.popcash.net/show\"></iframe><iframe src=\"https://video.example.com/embed\"></iframe>");

        s.engine().getClassifier().runPass(added);

        assertTrue(s.engine().isProcessed(added.get(0)));
        assertFalse(s.engine().isProcessed(added.get(1)));
        assertEquals(List.of(HideReason.AD_FRAME), reasons);
    }

    @Test
    void heuristicsRunOnlyInAdvancedMode() {
        PageSession standard = TestVeilguard.standardPage("", "news.example.com").start();
        List<HostNode> a = standard.page().appendHtml(standard.page().getBody(), OVERLAY);
        standard.engine().getClassifier().runPass(a);
        assertFalse(standard.engine().isProcessed(a.get(0)));

        PageSession advanced = TestVeilguard.advancedPage("", "news.example.com").start();
        List<HostNode> b = advanced.page().appendHtml(advanced.page().getBody(), OVERLAY);
        advanced.engine().getClassifier().runPass(b);
        assertTrue(advanced.engine().isProcessed(b.get(0)));
        assertEquals(1, advanced.engine().getCounters().getHeuristicRemovals());
    }

    @Test
    void quietModeSuspendsHeuristicsUntilTheNextHide() {
        PageSession s = TestVeilguard.advancedPage("", "news.example.com").start();
        BudgetedClassifier classifier = s.engine().getClassifier();

        s.loop().advance(9_999);
        classifier.runPass(s.page().appendHtml(s.page().getBody(), "<p>still loading</p>"));
        assertFalse(s.engine().isQuiet());

        s.loop().advance(1);
        classifier.runPass(s.page().appendHtml(s.page().getBody(), "<p>settled</p>"));
        assertTrue(s.engine().isQuiet());

        List<HostNode> ignored = s.page().appendHtml(s.page().getBody(), OVERLAY);
        classifier.runPass(ignored);
        assertFalse(s.engine().isProcessed(ignored.get(0)));
        assertTrue(s.engine().isQuiet());

        classifier.runPass(s.page().appendHtml(s.page().getBody(), "<div class=\"ad-box\"></div>"));
        assertFalse(s.engine().isQuiet());

        List<HostNode> caught = s.page().appendHtml(s.page().getBody(), OVERLAY);
        classifier.runPass(caught);
        assertTrue(s.engine().isProcessed(caught.get(0)));
    }

    @Test
    void heuristicsSkipOverlaysWithText() {
        PageSession s = TestVeilguard.advancedPage("", "news.example.com").start();
        List<HostNode> added = s.page().appendHtml(s.page().getBody(),
                "<div style=\"position: fixed; z-index: 999; width: 1280px; height: 800px\">Accept cookies</div>");

        s.engine().getClassifier().runPass(added);

        assertFalse(s.engine().isProcessed(added.get(0)));
    }

    @Test
    void closeIconFingerprintHidesItsFixedContainer() {
        PageSession s = TestVeilguard.advancedPage("", "news.example.com").start();
        List<HostNode> added = s.page().appendHtml(s.page().getBody(),
                "<div id=\"box\" style=\"position: fixed; bottom: 0px\"><span><svg viewBox=\"0 0 8 8\"></svg></span>Deals</div>");

        s.engine().getClassifier().runPass(added);

        assertTrue(s.engine().isProcessed(added.get(0)));
    }

    private static String container(int children) {
        StringBuilder sb = new StringBuilder("<section>");
        for (int i = 0; i < children - 1; i++) {
            sb.append("<p>row</p>");
        }
        sb.append("<div class=\"ad-box\"></div></section>");
        return sb.toString();
    }

    private static String nested(int depth) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < depth; i++) {
            sb.append("<section>");
        }
        sb.append("<div class=\"ad-box\"></div>");
        for (int i = 0; i < depth; i++) {
            sb.append("</section>");
        }
        return sb.toString();
    }
}
