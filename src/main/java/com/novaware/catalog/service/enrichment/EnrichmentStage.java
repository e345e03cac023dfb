package com.novaware.catalog.service.enrichment;

import com.novaware.catalog.dto.PipelineDtos;
import com.novaware.catalog.model.CatalogItem;
import com.novaware.catalog.model.ExternalMetadata;
import com.novaware.catalog.service.index.ExternalDataLoader;
import com.novaware.catalog.service.pipeline.CursorBatcher;
import com.novaware.catalog.service.pipeline.PipelineContext;
import com.novaware.catalog.service.pipeline.PipelineStage;
import com.novaware.catalog.service.pipeline.StageRunOptions;
import com.novaware.catalog.store.BulkWriteResult;
import com.novaware.catalog.store.CatalogStore;
import com.novaware.catalog.store.ItemFilter;
import com.novaware.catalog.store.ItemPatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/** Fills resolved catalog items from their external metadata record. */
@Component
public class EnrichmentStage implements PipelineStage {
    private static final Logger log = LoggerFactory.getLogger(EnrichmentStage.class);
    public static final String NAME = "enrich";

    private final CatalogStore catalogStore;
    private final CursorBatcher batcher;
    private final ExternalDataLoader loader;
    private final EnrichmentMerger merger;

    public EnrichmentStage(CatalogStore catalogStore, CursorBatcher batcher, ExternalDataLoader loader,
                           EnrichmentMerger merger) {
        this.catalogStore = catalogStore;
        this.batcher = batcher;
        this.loader = loader;
        this.merger = merger;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<PipelineDtos.StageReport> run(PipelineContext ctx, StageRunOptions options) {
        PipelineDtos.StageReport report = new PipelineDtos.StageReport(NAME);
        return ctx.metadataIndex(loader::loadMetadataIndex)
                .flatMap(index -> {
                    report.setMalformed_lines(ctx.getMetadataStats().getMalformed());
                    return batcher.walk(NAME, ItemFilter.RESOLVED, options, ctx, report, (batch, progress) -> {
                        List<ItemPatch> patches = new ArrayList<>();
                        for (CatalogItem item : batch) {
                            report.incProcessed();
                            ExternalMetadata metadata = index.first(item.getExternal_key());
                            if (metadata == null) {
                                report.incNotFound();
                            } else {
                                FieldPatch patch = merger.merge(item, metadata);
                                if (patch.isEmpty()) {
                                    report.incSkipped();
                                } else {
                                    log.debug("enrich id={} fields={}", item.getId(), patch.getSources());
                                    patches.add(patch.toItemPatch(item.getId()));
                                }
                            }
                            progress.advance();
                        }
                        return catalogStore.applyPatches(patches).doOnNext(r -> record(report, r)).then();
                    });
                });
    }

    private static void record(PipelineDtos.StageReport report, BulkWriteResult result) {
        report.addUpdated(result.getWritten());
        report.addSkipped(result.getSkipped());
        report.addFailed(result.getFailed());
    }
}
