package com.novaware.catalog.service.pipeline;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class ProgressTrackerTest {

    @Test
    void etaFollowsRecentThroughput() {
        AtomicLong clock = new AtomicLong();
        ProgressTracker t = new ProgressTracker("variants", 100, 10, 5, clock::get, null);

        assertEquals(-1, t.etaSeconds());
        for (int i = 0; i < 10; i++) {
            clock.addAndGet(2_000_000_000L); // two seconds per item
            t.advance();
        }
        // 90 left at 2s each
        assertEquals(180, t.etaSeconds());
        assertEquals("00:03:00", ProgressTracker.formatEta(t.etaSeconds()));
    }

    @Test
    void mirrorsLinesAndProgressToContext() {
        List<String> lines = new ArrayList<>();
        List<Integer> done = new ArrayList<>();
        PipelineContext ctx = new PipelineContext("r1", new Random(1), 5, lines::add, (d, total) -> done.add(d));
        ProgressTracker t = new ProgressTracker("features", 3, 2, 5, System::nanoTime, ctx);

        t.advance();
        t.advance();
        t.advance();

        assertEquals(List.of(1, 2, 3), done);
        assertEquals(2, lines.size(), "logged at every second item and at the last one");
        assertTrue(lines.get(1).startsWith("features progress: 3/3 (100%)"));
    }

    @Test
    void unknownEtaFormatsAsQuestionMark() {
        assertEquals("?", ProgressTracker.formatEta(-1));
        assertEquals("01:01:01", ProgressTracker.formatEta(3661));
    }
}
