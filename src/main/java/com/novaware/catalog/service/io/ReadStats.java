package com.novaware.catalog.service.io;

import java.util.concurrent.atomic.AtomicLong;

/** Line counters of one pass over an input file. */
public class ReadStats {
    private final AtomicLong lines = new AtomicLong();
    private final AtomicLong records = new AtomicLong();
    private final AtomicLong blank = new AtomicLong();
    private final AtomicLong malformed = new AtomicLong();

    long nextLine() { return lines.incrementAndGet(); }
    void record() { records.incrementAndGet(); }
    void blank() { blank.incrementAndGet(); }
    void malformed() { malformed.incrementAndGet(); }

    public long getLines() { return lines.get(); }
    public long getRecords() { return records.get(); }
    public long getBlank() { return blank.get(); }
    public long getMalformed() { return malformed.get(); }

    @Override
    public String toString() {
        return "lines=" + getLines() + " records=" + getRecords() + " blank=" + getBlank() + " malformed=" + getMalformed();
    }
}
