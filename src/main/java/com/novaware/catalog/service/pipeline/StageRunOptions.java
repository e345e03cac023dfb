package com.novaware.catalog.service.pipeline;

/** Where a stage run starts: an explicit cursor, the stored checkpoint, or the beginning. */
public class StageRunOptions {
    private final Long cursor;
    private final boolean restart;

    public StageRunOptions(Long cursor, boolean restart) {
        this.cursor = cursor;
        this.restart = restart;
    }

    public static StageRunOptions fromCheckpoint() {
        return new StageRunOptions(null, false);
    }

    public static StageRunOptions fromStart() {
        return new StageRunOptions(null, true);
    }

    public static StageRunOptions after(long cursor) {
        return new StageRunOptions(cursor, false);
    }

    public Long getCursor() { return cursor; }
    public boolean isRestart() { return restart; }

    @Override
    public String toString() {
        return cursor != null ? "cursor=" + cursor : (restart ? "restart" : "checkpoint");
    }
}
