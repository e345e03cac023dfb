package com.novaware.catalog.service.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.LongSupplier;

/**
 * Per-item progress with an ETA estimated from the throughput of the most recent items.
 */
public class ProgressTracker {
    private static final Logger log = LoggerFactory.getLogger(ProgressTracker.class);

    private final String stage;
    private final int total;
    private final int logEvery;
    private final int window;
    private final LongSupplier nanoClock;
    private final PipelineContext ctx;
    private final Deque<Long> recent = new ArrayDeque<>();
    private int done;

    public ProgressTracker(String stage, int total, int logEvery, int window, LongSupplier nanoClock, PipelineContext ctx) {
        this.stage = stage;
        this.total = total;
        this.logEvery = Math.max(1, logEvery);
        this.window = Math.max(2, window);
        this.nanoClock = nanoClock;
        this.ctx = ctx;
    }

    public void advance() {
        done++;
        recent.addLast(nanoClock.getAsLong());
        if (recent.size() > window) recent.removeFirst();
        if (done % logEvery == 0 || done == total) {
            String line = String.format("%s progress: %d/%d (%d%%) eta=%s",
                    stage, done, total, total > 0 ? Math.min(100, done * 100 / total) : 100, formatEta(etaSeconds()));
            log.info(line);
            if (ctx != null) ctx.mirror(line);
        }
        if (ctx != null) ctx.progress(done, total);
    }

    public int getDone() { return done; }
    public int getTotal() { return total; }

    /** Seconds left at the rolling throughput, or -1 while fewer than two samples exist. */
    public long etaSeconds() {
        if (recent.size() < 2) return -1;
        long span = recent.peekLast() - recent.peekFirst();
        if (span <= 0) return 0;
        double perItemNanos = (double) span / (recent.size() - 1);
        int remaining = Math.max(0, total - done);
        return Math.round(remaining * perItemNanos / 1_000_000_000d);
    }

    static String formatEta(long seconds) {
        if (seconds < 0) return "?";
        return String.format("%02d:%02d:%02d", seconds / 3600, (seconds % 3600) / 60, seconds % 60);
    }
}
