package com.novaware.catalog.service.pipeline;

import com.novaware.catalog.service.index.MetadataIndex;
import com.novaware.catalog.service.io.ReadStats;

import java.util.Random;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;

import reactor.core.publisher.Mono;

/**
 * State scoped to one pipeline invocation and passed through every stage: the reviewer
 * identity budget, the shared random source, the lazily loaded metadata index and the sinks
 * that mirror progress to the admin surface.
 */
public class PipelineContext {
    private final String runId;
    private final Random random;
    private final int identityQuota;
    private final Consumer<String> logSink;
    private final BiConsumer<Integer, Integer> progressSink;

    private long identityCount = -1;
    private final ReadStats metadataStats = new ReadStats();
    private Mono<MetadataIndex> metadataIndex;

    public PipelineContext(String runId, Random random, int identityQuota,
                           Consumer<String> logSink, BiConsumer<Integer, Integer> progressSink) {
        this.runId = runId;
        this.random = random;
        this.identityQuota = identityQuota;
        this.logSink = logSink != null ? logSink : line -> { };
        this.progressSink = progressSink != null ? progressSink : (done, total) -> { };
    }

    public String getRunId() { return runId; }
    public Random getRandom() { return random; }
    public int getIdentityQuota() { return identityQuota; }

    /** Seeds the identity counter with the number of identities already persisted. */
    public void initIdentityCount(long persisted) {
        this.identityCount = persisted;
    }

    public boolean isIdentityCountLoaded() {
        return identityCount >= 0;
    }

    public long getIdentityCount() {
        if (identityCount < 0) throw new IllegalStateException("identity count not initialized for run " + runId);
        return identityCount;
    }

    public long remainingIdentityQuota() {
        return Math.max(0, identityQuota - getIdentityCount());
    }

    /** Claims one identity slot; false once the quota is exhausted. */
    public boolean tryReserveIdentity() {
        if (remainingIdentityQuota() <= 0) return false;
        identityCount++;
        return true;
    }

    /** Gives back a slot claimed for an identity that was not persisted. */
    public void releaseIdentity() {
        if (identityCount > 0) identityCount--;
    }

    /** Metadata index shared by all stages of the run; loaded on first use. */
    public synchronized Mono<MetadataIndex> metadataIndex(Function<ReadStats, Mono<MetadataIndex>> loader) {
        if (metadataIndex == null) {
            metadataIndex = loader.apply(metadataStats).cache();
        }
        return metadataIndex;
    }

    public ReadStats getMetadataStats() { return metadataStats; }

    public void mirror(String line) {
        logSink.accept(line);
    }

    public void progress(int done, int total) {
        progressSink.accept(done, total);
    }
}
