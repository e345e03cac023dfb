package com.novaware.catalog.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of an unordered, continue-on-error bulk write.
 *
 * <p>{@code skipped} counts records the store deliberately left alone: duplicates on insert
 * or updates whose guard did not match.
 */
public class BulkWriteResult {
    private int written;
    private int skipped;
    private final List<String> failedIds = new ArrayList<>();

    public static BulkWriteResult empty() {
        return new BulkWriteResult();
    }

    public BulkWriteResult recordWritten() { written++; return this; }
    public BulkWriteResult recordSkipped() { skipped++; return this; }
    public BulkWriteResult recordFailed(String id) { failedIds.add(id); return this; }

    public BulkWriteResult merge(BulkWriteResult other) {
        written += other.written;
        skipped += other.skipped;
        failedIds.addAll(other.failedIds);
        return this;
    }

    public int getWritten() { return written; }
    public int getSkipped() { return skipped; }
    public int getFailed() { return failedIds.size(); }
    public List<String> getFailedIds() { return Collections.unmodifiableList(failedIds); }

    @Override
    public String toString() {
        return "written=" + written + " skipped=" + skipped + " failed=" + failedIds.size();
    }
}
