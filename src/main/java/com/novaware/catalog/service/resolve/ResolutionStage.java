package com.novaware.catalog.service.resolve;

import com.novaware.catalog.config.PipelineProperties;
import com.novaware.catalog.dto.PipelineDtos;
import com.novaware.catalog.model.CatalogItem;
import com.novaware.catalog.service.index.ExternalDataLoader;
import com.novaware.catalog.service.pipeline.CursorBatcher;
import com.novaware.catalog.service.pipeline.PipelineContext;
import com.novaware.catalog.service.pipeline.PipelineStage;
import com.novaware.catalog.service.pipeline.StageRunOptions;
import com.novaware.catalog.store.BulkWriteResult;
import com.novaware.catalog.store.CatalogField;
import com.novaware.catalog.store.CatalogStore;
import com.novaware.catalog.store.ItemFilter;
import com.novaware.catalog.store.ItemPatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Assigns an external key to every unresolved catalog item that matches a metadata title.
 * Resolved items are never revisited; unmatched ones stay unresolved and are only counted.
 */
@Component
public class ResolutionStage implements PipelineStage {
    private static final Logger log = LoggerFactory.getLogger(ResolutionStage.class);
    public static final String NAME = "resolve";

    private final CatalogStore catalogStore;
    private final CursorBatcher batcher;
    private final ExternalDataLoader loader;
    private final PipelineProperties props;

    public ResolutionStage(CatalogStore catalogStore, CursorBatcher batcher, ExternalDataLoader loader,
                           PipelineProperties props) {
        this.catalogStore = catalogStore;
        this.batcher = batcher;
        this.loader = loader;
        this.props = props;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<PipelineDtos.StageReport> run(PipelineContext ctx, StageRunOptions options) {
        PipelineDtos.StageReport report = new PipelineDtos.StageReport(NAME);
        report.setMatched(0);
        report.setUnmatched(0);
        report.refreshMatchRate();
        return ctx.metadataIndex(loader::loadMetadataIndex)
                .flatMap(index -> {
                    report.setMalformed_lines(ctx.getMetadataStats().getMalformed());
                    SimilarityResolver resolver = new SimilarityResolver(index, props);
                    return batcher.walk(NAME, ItemFilter.UNRESOLVED, options, ctx, report, (batch, progress) -> {
                        List<ItemPatch> patches = new ArrayList<>();
                        for (CatalogItem item : batch) {
                            report.incProcessed();
                            if (!item.isResolved()) {
                                Optional<MatchResult> match = resolver.resolve(item.getName());
                                if (match.isPresent()) {
                                    report.incMatched();
                                    log.debug("resolved id={} name='{}' -> {}", item.getId(), item.getName(), match.get());
                                    patches.add(new ItemPatch(item.getId()).set(CatalogField.EXTERNAL_KEY, match.get().getExternalKey()));
                                } else {
                                    report.incUnmatched();
                                }
                            }
                            progress.advance();
                        }
                        report.refreshMatchRate();
                        return catalogStore.applyPatches(patches).doOnNext(r -> record(report, r)).then();
                    });
                });
    }

    static void record(PipelineDtos.StageReport report, BulkWriteResult result) {
        report.addUpdated(result.getWritten());
        report.addSkipped(result.getSkipped());
        report.addFailed(result.getFailed());
    }
}
