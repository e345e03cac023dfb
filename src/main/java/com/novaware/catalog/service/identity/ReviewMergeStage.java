package com.novaware.catalog.service.identity;

import com.novaware.catalog.config.PipelineProperties;
import com.novaware.catalog.dto.PipelineDtos;
import com.novaware.catalog.model.CatalogItem;
import com.novaware.catalog.model.ExternalReview;
import com.novaware.catalog.service.index.ExternalDataLoader;
import com.novaware.catalog.service.index.GroupedIndex;
import com.novaware.catalog.service.io.ReadStats;
import com.novaware.catalog.service.pipeline.CursorBatcher;
import com.novaware.catalog.service.pipeline.PipelineContext;
import com.novaware.catalog.service.pipeline.PipelineStage;
import com.novaware.catalog.service.pipeline.ProgressTracker;
import com.novaware.catalog.service.pipeline.StageRunOptions;
import com.novaware.catalog.store.CatalogField;
import com.novaware.catalog.store.CatalogStore;
import com.novaware.catalog.store.ItemFilter;
import com.novaware.catalog.store.ItemPatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Merges external reviews into resolved catalog items.
 *
 * <p>Only reviews of resolved items are kept in memory. Each cursor batch synthesizes the
 * reviewer identities it needs, appends deduplicated reviews and rewrites rating and review
 * count from the full list of every item it changed.
 */
@Component
public class ReviewMergeStage implements PipelineStage {
    private static final Logger log = LoggerFactory.getLogger(ReviewMergeStage.class);
    public static final String NAME = "reviews";

    private final CatalogStore catalogStore;
    private final CursorBatcher batcher;
    private final ExternalDataLoader loader;
    private final ReviewerIdentityService identityService;
    private final ReviewMerger merger;
    private final PipelineProperties props;

    public ReviewMergeStage(CatalogStore catalogStore, CursorBatcher batcher, ExternalDataLoader loader,
                            ReviewerIdentityService identityService, ReviewMerger merger, PipelineProperties props) {
        this.catalogStore = catalogStore;
        this.batcher = batcher;
        this.loader = loader;
        this.identityService = identityService;
        this.merger = merger;
        this.props = props;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<PipelineDtos.StageReport> run(PipelineContext ctx, StageRunOptions options) {
        PipelineDtos.StageReport report = new PipelineDtos.StageReport(NAME);
        report.addReviewsAdded(0);
        report.addDuplicateReviews(0);
        report.addQuotaDroppedReviews(0);
        report.addUnmappedReviews(0);
        report.addIdentitiesCreated(0);
        ReadStats stats = new ReadStats();
        return Mono.fromCallable(loader::reviewsPath)
                .then(identityService.initCounter(ctx))
                .then(batcher.startCursor(NAME, options))
                .flatMap(start -> resolvedKeysAfter(start, new LinkedHashSet<>()))
                .flatMap(keys -> loader.loadReviews(keys, stats))
                .flatMap(reviews -> {
                    report.setMalformed_lines(stats.getMalformed());
                    return batcher.walk(NAME, ItemFilter.RESOLVED, options, ctx, report,
                            (batch, progress) -> mergeBatch(batch, reviews, ctx, report, progress));
                });
    }

    /** External keys of resolved items after the cursor, gathered by walking the catalog. */
    private Mono<Set<String>> resolvedKeysAfter(long cursor, Set<String> acc) {
        int batchSize = Math.max(1, props.getBatchSize());
        return Mono.just(cursor)
                .expand(c -> catalogStore.findBatchAfter(ItemFilter.RESOLVED, c, batchSize)
                        .collectList()
                        .flatMap(batch -> {
                            if (batch.isEmpty()) return Mono.<Long>empty();
                            for (CatalogItem item : batch) acc.add(item.getExternal_key());
                            return Mono.just(batch.get(batch.size() - 1).getSeq());
                        }))
                .then(Mono.fromCallable(() -> acc));
    }

    private Mono<Void> mergeBatch(List<CatalogItem> batch, GroupedIndex<ExternalReview> reviews, PipelineContext ctx,
                                  PipelineDtos.StageReport report, ProgressTracker progress) {
        Set<String> reviewerKeys = new LinkedHashSet<>();
        for (CatalogItem item : batch) {
            for (ExternalReview r : reviews.get(item.getExternal_key())) reviewerKeys.add(r.getReviewer_key());
        }
        return identityService.resolve(reviewerKeys, ctx)
                .flatMap(identities -> {
                    report.addIdentitiesCreated(identities.getCreated());
                    List<ItemPatch> patches = new ArrayList<>();
                    for (CatalogItem item : batch) {
                        report.incProcessed();
                        List<ExternalReview> incoming = reviews.get(item.getExternal_key());
                        if (incoming.isEmpty()) {
                            report.incNotFound();
                            progress.advance();
                            continue;
                        }
                        ReviewMerger.Outcome outcome = merger.merge(item.getReviews(), incoming, identities);
                        report.addReviewsAdded(outcome.getAdded());
                        report.addDuplicateReviews(outcome.getDuplicates());
                        report.addQuotaDroppedReviews(outcome.getQuotaDropped());
                        report.addUnmappedReviews(outcome.getUnmapped());
                        ReviewAggregates agg = ReviewAggregates.of(outcome.getReviews());
                        if (outcome.getAdded() == 0 && aggregatesMatch(item, agg)) {
                            report.incSkipped();
                        } else {
                            patches.add(new ItemPatch(item.getId())
                                    .set(CatalogField.REVIEWS, outcome.getReviews())
                                    .set(CatalogField.RATING, agg.getRating())
                                    .set(CatalogField.NUM_REVIEWS, agg.getNumReviews()));
                        }
                        progress.advance();
                    }
                    return catalogStore.applyPatches(patches)
                            .doOnNext(result -> {
                                report.addUpdated(result.getWritten());
                                report.addSkipped(result.getSkipped());
                                report.addFailed(result.getFailed());
                                if (result.getFailed() > 0) log.warn("reviews: {} item writes failed: {}", result.getFailed(), result.getFailedIds());
                            })
                            .then();
                });
    }

    static boolean aggregatesMatch(CatalogItem item, ReviewAggregates agg) {
        int stored = item.getNum_reviews() != null ? item.getNum_reviews() : 0;
        double rating = item.getRating() != null ? item.getRating() : 0.0;
        return stored == agg.getNumReviews() && Double.compare(rating, agg.getRating()) == 0;
    }
}
