package com.novaware.catalog.service.pipeline;

import com.novaware.catalog.config.PipelineProperties;
import com.novaware.catalog.dto.PipelineDtos;
import com.novaware.catalog.model.CatalogItem;
import com.novaware.catalog.store.CatalogStore;
import com.novaware.catalog.store.CheckpointStore;
import com.novaware.catalog.store.ItemFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * Walks the catalog in batches keyed on the monotonic {@code seq} cursor.
 *
 * <p>Each batch is "the next N items after the cursor", so items inserted or deleted between
 * runs never shift what a resumed run sees. The stage checkpoint is saved after every batch
 * and reset once the walk reaches the end, so only an interrupted run resumes mid-catalog.
 */
@Component
public class CursorBatcher {
    private static final Logger log = LoggerFactory.getLogger(CursorBatcher.class);

    /** Processes one batch; implementations advance the tracker once per item. */
    @FunctionalInterface
    public interface BatchHandler {
        Mono<Void> handle(List<CatalogItem> batch, ProgressTracker progress);
    }

    private final CatalogStore catalogStore;
    private final CheckpointStore checkpointStore;
    private final PipelineProperties props;

    public CursorBatcher(CatalogStore catalogStore, CheckpointStore checkpointStore, PipelineProperties props) {
        this.catalogStore = catalogStore;
        this.checkpointStore = checkpointStore;
        this.props = props;
    }

    public Mono<Long> startCursor(String stage, StageRunOptions options) {
        if (options.getCursor() != null) return Mono.just(Math.max(0L, options.getCursor()));
        if (options.isRestart()) return Mono.just(0L);
        return checkpointStore.load(stage).defaultIfEmpty(0L);
    }

    public Mono<PipelineDtos.StageReport> walk(String stage, ItemFilter filter, StageRunOptions options,
                                               PipelineContext ctx, PipelineDtos.StageReport report,
                                               BatchHandler handler) {
        int batchSize = Math.max(1, props.getBatchSize());
        return startCursor(stage, options)
                .flatMap(start -> catalogStore.count(filter, start)
                        .flatMap(total -> {
                            report.setStart_cursor(start);
                            report.setLast_cursor(start);
                            if (report.getStarted_at() == null) report.setStarted_at(Instant.now().toString());
                            String line = String.format("%s: starting after cursor %d, %d items to process", stage, start, total);
                            log.info(line);
                            ctx.mirror(line);
                            ProgressTracker progress = new ProgressTracker(stage, total.intValue(),
                                    props.getItemProgressEvery(), props.getEtaWindow(), System::nanoTime, ctx);
                            return Mono.just(start)
                                    .expand(cursor -> nextBatch(stage, filter, cursor, batchSize, ctx, report, progress, handler))
                                    .then(checkpointStore.save(stage, 0L));
                        }))
                .then(Mono.fromCallable(() -> {
                    report.setEnded_at(Instant.now().toString());
                    log.info("{} finished: {}", stage, report);
                    ctx.mirror(stage + " finished: " + report);
                    return report;
                }));
    }

    private Mono<Long> nextBatch(String stage, ItemFilter filter, long cursor, int batchSize, PipelineContext ctx,
                                 PipelineDtos.StageReport report, ProgressTracker progress, BatchHandler handler) {
        return catalogStore.findBatchAfter(filter, cursor, batchSize)
                .collectList()
                .flatMap(batch -> {
                    if (batch.isEmpty()) return Mono.<Long>empty();
                    long last = batch.get(batch.size() - 1).getSeq();
                    return handler.handle(batch, progress)
                            .then(checkpointStore.save(stage, last))
                            .then(Mono.fromCallable(() -> {
                                report.setLast_cursor(last);
                                report.setBatches(report.getBatches() + 1);
                                String line = String.format("%s batch %d (cursor %d): %s", stage, report.getBatches(), last, report);
                                log.info(line);
                                ctx.mirror(line);
                                return last;
                            }));
                });
    }
}
