package io.hearthwarrio.veilguard.core;

import io.hearthwarrio.veilguard.core.host.HostNode;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ElementHeuristicsTest {

    private static ElementHeuristic heuristic(String id, int order) {
        return new ElementHeuristic() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public int order() {
                return order;
            }

            @Override
            public HideReason reason() {
                return HideReason.OBFUSCATED_CLUSTER;
            }

            @Override
            public HostNode match(HostNode candidate, HeuristicContext context) {
                return null;
            }
        };
    }

    @Test
    void normalizeSortsDropsNullsAndDeduplicates() {
        ElementHeuristic late = heuristic("late", 50);
        ElementHeuristic early = heuristic("early", 1);
        ElementHeuristic dup = heuristic("early", 99);

        List<ElementHeuristic> out = ElementHeuristics.normalize(Arrays.asList(late, null, dup, early));

        assertEquals(2, out.size());
        assertSame(early, out.get(0));
        assertSame(late, out.get(1));
    }

    @Test
    void builtInsRunInDeclaredOrder() {
        List<ElementHeuristic> builtIn = ElementHeuristics.builtIn();

        assertEquals(3, builtIn.size());
        assertEquals(HideReason.OBFUSCATED_CLUSTER, builtIn.get(0).reason());
        assertEquals(HideReason.FULL_BLEED_OVERLAY, builtIn.get(1).reason());
        assertEquals(HideReason.CLOSE_ICON, builtIn.get(2).reason());
    }

    @Test
    void normalizeOfNullIsEmpty() {
        assertTrue(ElementHeuristics.normalize(null).isEmpty());
    }
}
