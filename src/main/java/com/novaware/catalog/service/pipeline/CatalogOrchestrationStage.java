package com.novaware.catalog.service.pipeline;

import com.novaware.catalog.dto.PipelineDtos;
import com.novaware.catalog.model.CatalogItem;
import com.novaware.catalog.service.identity.ReviewTopUp;
import com.novaware.catalog.service.identity.ReviewerIdentityService;
import com.novaware.catalog.service.variants.VariantGenerator;
import com.novaware.catalog.store.CatalogField;
import com.novaware.catalog.store.CatalogStore;
import com.novaware.catalog.store.ItemFilter;
import com.novaware.catalog.store.ItemPatch;
import com.novaware.catalog.store.StoreErrors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Objects;

/**
 * Regenerates every item's variant grid, then tops its reviews up to the declared count.
 * Items are handled one at a time in cursor order; each batch is written as one unordered
 * bulk update.
 */
@Component
public class CatalogOrchestrationStage implements PipelineStage {
    private static final Logger log = LoggerFactory.getLogger(CatalogOrchestrationStage.class);
    public static final String NAME = "variants";

    private final CatalogStore catalogStore;
    private final CursorBatcher batcher;
    private final VariantGenerator variantGenerator;
    private final ReviewTopUp reviewTopUp;
    private final ReviewerIdentityService identityService;

    public CatalogOrchestrationStage(CatalogStore catalogStore, CursorBatcher batcher, VariantGenerator variantGenerator,
                                     ReviewTopUp reviewTopUp, ReviewerIdentityService identityService) {
        this.catalogStore = catalogStore;
        this.batcher = batcher;
        this.variantGenerator = variantGenerator;
        this.reviewTopUp = reviewTopUp;
        this.identityService = identityService;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<PipelineDtos.StageReport> run(PipelineContext ctx, StageRunOptions options) {
        PipelineDtos.StageReport report = new PipelineDtos.StageReport(NAME);
        report.addReviewsAdded(0);
        return identityService.initCounter(ctx)
                .then(batcher.walk(NAME, ItemFilter.ALL, options, ctx, report, (batch, progress) ->
                        Flux.fromIterable(batch)
                                .concatMap(item -> process(item, ctx, report)
                                        .doOnNext(p -> progress.advance()))
                                .filter(p -> !p.isEmpty())
                                .collectList()
                                .flatMap(catalogStore::applyPatches)
                                .doOnNext(r -> {
                                    report.addUpdated(r.getWritten());
                                    report.addSkipped(r.getSkipped());
                                    report.addFailed(r.getFailed());
                                    if (r.getFailed() > 0) log.warn("variants: item writes failed: {}", r.getFailedIds());
                                })
                                .then()));
    }

    Mono<ItemPatch> process(CatalogItem item, PipelineContext ctx, PipelineDtos.StageReport report) {
        report.incProcessed();
        ItemPatch patch = new ItemPatch(item.getId());
        VariantGenerator.Result variants = variantGenerator.generate(item, ctx.getRandom());
        patch.set(CatalogField.VARIANTS, variants.getVariants());
        patch.set(CatalogField.COUNT_IN_STOCK, variants.getCountInStock());
        if (!sameHexes(item, variants)) {
            patch.set(CatalogField.COLORS, variants.getColors());
        }
        return reviewTopUp.topUp(item, ctx.getRandom())
                .map(topUp -> {
                    report.addReviewsAdded(topUp.getAdded());
                    int storedCount = item.getNum_reviews() != null ? item.getNum_reviews() : 0;
                    double storedRating = item.getRating() != null ? item.getRating() : 0.0;
                    boolean aggregatesStale = storedCount != topUp.getAggregates().getNumReviews()
                            || Double.compare(storedRating, topUp.getAggregates().getRating()) != 0;
                    if (topUp.getAdded() > 0 || aggregatesStale) {
                        patch.set(CatalogField.REVIEWS, topUp.getReviews());
                        patch.set(CatalogField.RATING, topUp.getAggregates().getRating());
                        patch.set(CatalogField.NUM_REVIEWS, topUp.getAggregates().getNumReviews());
                    }
                    return patch;
                })
                .onErrorResume(e -> {
                    if (StoreErrors.isConnectionFailure(e)) return Mono.error(StoreErrors.translate(e));
                    log.warn("review top-up failed id={}: {}", item.getId(), e.toString());
                    report.incFailed();
                    return Mono.just(patch);
                });
    }

    private static boolean sameHexes(CatalogItem item, VariantGenerator.Result result) {
        if (item.getColors() == null) return false;
        if (item.getColors().size() != result.getColors().size()) return false;
        for (int i = 0; i < item.getColors().size(); i++) {
            if (!Objects.equals(item.getColors().get(i).getHex(), result.getColors().get(i).getHex())) return false;
        }
        return true;
    }
}
