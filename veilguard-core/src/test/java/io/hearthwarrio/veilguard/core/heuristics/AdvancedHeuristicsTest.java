package io.hearthwarrio.veilguard.core.heuristics;

import io.hearthwarrio.veilguard.core.HeuristicContext;
import io.hearthwarrio.veilguard.core.StubNode;
import io.hearthwarrio.veilguard.core.host.ComputedStyle;
import io.hearthwarrio.veilguard.core.host.HostAccessException;
import io.hearthwarrio.veilguard.core.host.Rect;
import io.hearthwarrio.veilguard.core.host.Viewport;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class AdvancedHeuristicsTest {

    private static final HeuristicContext CONTEXT = new HeuristicContext(new Viewport(1000, 800));
    private static final String OBFUSCATED = "Xk29aLmQpZr7TtYw_ Hh3JkLmNoPqRsTuV9 Qq_aBcDeFgHiJkLmN";

    private final ObfuscatedClassClusterHeuristic cluster = new ObfuscatedClassClusterHeuristic();
    private final FullBleedOverlayHeuristic fullBleed = new FullBleedOverlayHeuristic();
    private final CloseIconFingerprintHeuristic closeIcon = new CloseIconFingerprintHeuristic();

    private static ComputedStyle positioned(String position, String zIndex) {
        return new ComputedStyle(position, zIndex, "block", "visible");
    }

    @Test
    void obfuscatedClusterNeedsPositionedElement() {
        StubNode fixed = new StubNode("div").attr("class", OBFUSCATED).style(positioned("fixed", "auto"));
        StubNode inFlow = new StubNode("div").attr("class", OBFUSCATED).style(positioned("static", "auto"));

        assertSame(fixed, cluster.match(fixed, CONTEXT));
        assertNull(cluster.match(inFlow, CONTEXT));
    }

    @Test
    void obfuscatedClusterNeedsThreeLongMixedTokens() {
        String twoLong = "Xk29aLmQpZr7TtYw_ Hh3JkLmNoPqRsTuV9 short";
        String noDigits = "XkaaLmQpZrTTtYwab HhaJkLmNoPqRsTuVa QqaaBcDeFgHiJkLmN";
        StubNode a = new StubNode("div").attr("class", twoLong).style(positioned("absolute", "auto"));
        StubNode b = new StubNode("div").attr("class", noDigits).style(positioned("absolute", "auto"));

        assertNull(cluster.match(a, CONTEXT));
        assertNull(cluster.match(b, CONTEXT));
    }

    @Test
    void tokenOfExactlyFifteenCharactersIsNotObfuscated() {
        assertFalse(ObfuscatedClassClusterHeuristic.isObfuscated("Abcdefghijklm_1"));
        assertTrue(ObfuscatedClassClusterHeuristic.isObfuscated("Abcdefghijklmn_1"));
    }

    @Test
    void fullBleedOverlayWithoutTextMatches() {
        StubNode overlay = new StubNode("div")
                .style(positioned("fixed", "101"))
                .rect(new Rect(0, 0, 700, 560));

        assertSame(overlay, fullBleed.match(overlay, CONTEXT));
    }

    @Test
    void fullBleedOverlayWithTextNeedsMarker() {
        StubNode modal = new StubNode("div")
                .style(positioned("fixed", "5000"))
                .rect(new Rect(0, 0, 1000, 800))
                .text("Accept cookies");

        assertNull(fullBleed.match(modal, CONTEXT));

        modal.attr("data-izone", "1");
        assertSame(modal, fullBleed.match(modal, CONTEXT));
    }

    @Test
    void fullBleedOverlayRejectsLowStackingOrSmallBox() {
        StubNode low = new StubNode("div").style(positioned("fixed", "100")).rect(new Rect(0, 0, 1000, 800));
        StubNode narrow = new StubNode("div").style(positioned("fixed", "999")).rect(new Rect(0, 0, 699, 800));

        assertNull(fullBleed.match(low, CONTEXT));
        assertNull(fullBleed.match(narrow, CONTEXT));
    }

    @Test
    void fullBleedStyleFailurePropagatesToCaller() {
        StubNode broken = new StubNode("div").failReads(new HostAccessException("gone"));

        assertThrows(HostAccessException.class, () -> fullBleed.match(broken, CONTEXT));
    }

    @Test
    void closeIconHidesNearestFixedDiv() {
        StubNode widget = new StubNode("div").attr("style", "position: fixed; bottom: 0");
        StubNode button = new StubNode("div");
        StubNode svg = new StubNode("svg").attr("viewBox", "0 0 87 16");
        widget.child(button);
        button.child(svg);

        assertSame(widget, closeIcon.match(button, CONTEXT));
        assertSame(widget, closeIcon.match(svg, CONTEXT));
    }

    @Test
    void closeIconIgnoresUnknownViewBoxOrMissingContainer() {
        StubNode widget = new StubNode("div").attr("style", "position: fixed");
        StubNode svg = new StubNode("svg").attr("viewBox", "0 0 24 24");
        widget.child(svg);

        assertNull(closeIcon.match(widget, CONTEXT));

        StubNode plain = new StubNode("div");
        plain.child(new StubNode("svg").attr("viewBox", "0 0 8 8"));
        assertNull(closeIcon.match(plain, CONTEXT));
    }
}
