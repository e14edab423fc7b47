package io.hearthwarrio.veilguard.testkit;

import io.hearthwarrio.veilguard.core.ElementSnapshot;
import io.hearthwarrio.veilguard.core.HideEventLogger;
import io.hearthwarrio.veilguard.core.HideReason;
import io.hearthwarrio.veilguard.core.MediaGuard;
import io.hearthwarrio.veilguard.core.host.HostNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FailingLoggerTest {

    private static final String PAGE =
            "<div id=\"story\"><p>Article text</p></div>" +
                    "<div id=\"a1\" class=\"ad-container\">one</div>" +
                    "<div id=\"a2\" class=\"sponsored-post\">two</div>";

    private static final String VIDEO =
            "<div id=\"frame\" style=\"position: relative; width: 640px; height: 360px\">" +
                    "<video id=\"v\" style=\"left: 0px; top: 0px; width: 640px; height: 360px\"></video></div>";

    private static String overlay(String id) {
        return "<div id=\"" + id + "\" style=\"position: absolute; z-index: 99; left: 100px; top: 100px;"
                + " width: 200px; height: 100px\">Skip</div>";
    }

    private static final class BrokenLogger implements HideEventLogger {
        final List<HideReason> seen = new ArrayList<>();

        @Override
        public void logHidden(HideReason reason, ElementSnapshot snapshot) {
            seen.add(reason);
            throw new IllegalStateException("log sink is down");
        }

        @Override
        public void logSuppressedError(String operation, Throwable error) {
            throw new IllegalStateException("log sink is down");
        }
    }

    @Test
    void hidesCompleteAndQueueStillDrains() {
        BrokenLogger logger = new BrokenLogger();
        PageSession s = TestVeilguard.standardPage(PAGE, "news.example.com").withLogger(logger);
        s.engine().start();
        s.loop().runDueTasks();
        SimulatedNode a1 = s.page().node("#a1");
        SimulatedNode a2 = s.page().node("#a2");

        assertEquals("none", a1.inlineStyle("display"));
        assertEquals("none", a2.inlineStyle("display"));
        assertEquals(2, s.engine().getCounters().getHides());
        assertEquals(2, logger.seen.size());
        assertEquals(2, s.engine().getRemovalQueue().size());

        s.settle();

        assertFalse(a1.isConnected());
        assertFalse(a2.isConnected());
        assertEquals(2, s.engine().getRemovalQueue().getDetachedCount());
        assertEquals(2, s.engine().getCounters().getLoggerFailures());
        assertEquals(0, s.loop().getFailedTaskCount());
    }

    @Test
    void alertWindowRunsAllSweeps() {
        BrokenLogger logger = new BrokenLogger();
        PageSession s = TestVeilguard.advancedPage(VIDEO, "tube.example.com").withLogger(logger).start();
        MediaGuard guard = s.engine().getMediaGuard();
        HostNode video = s.page().node("#v");
        s.page().dispatch(video, "play");

        int repetitions = s.engine().getTuning().getAlertRepetitions();
        for (int tick = 1; tick <= repetitions; tick++) {
            s.page().appendHtml(s.page().getBody(), overlay("o" + tick));
            s.loop().advance(150);
            assertEquals(tick, Collections.frequency(logger.seen, HideReason.MEDIA_OVERLAY), "sweep " + tick);
        }

        assertEquals(13, repetitions);
        assertFalse(guard.isAlertActive(video));
        assertEquals(0, s.loop().getFailedTaskCount());
        assertTrue(s.engine().getCounters().getLoggerFailures() >= repetitions);
    }

    @Test
    void taskFailuresReachTheEngineLogger() {
        List<String> operations = new ArrayList<>();
        PageSession s = TestVeilguard.standardPage(PAGE, "news.example.com").withLogger(new HideEventLogger() {
            @Override
            public void logHidden(HideReason reason, ElementSnapshot snapshot) {
            }

            @Override
            public void logSuppressedError(String operation, Throwable error) {
                operations.add(operation + ": " + error.getMessage());
            }
        }).start();
        int[] ran = new int[1];

        s.loop().schedule(() -> {
            throw new IllegalStateException("page script broke");
        }, 10);
        s.loop().schedule(() -> ran[0]++, 10);
        s.loop().advance(10);

        assertEquals(1, ran[0]);
        assertEquals(1, s.loop().getFailedTaskCount());
        assertEquals(List.of("scheduled task: page script broke"), operations);
    }
}
