package com.novaware.catalog.service.features;

import com.novaware.catalog.config.PipelineProperties;
import com.novaware.catalog.dto.PipelineDtos;
import com.novaware.catalog.model.CatalogItem;
import com.novaware.catalog.service.pipeline.CursorBatcher;
import com.novaware.catalog.service.pipeline.PipelineContext;
import com.novaware.catalog.service.pipeline.PipelineStage;
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Writes content vectors, category labels and compatible-item sets.
 *
 * <p>The vocabulary is fitted on the first documents of the catalog, then every item gets a
 * vector over it. Categories are only replaced where missing or the legacy default, and
 * compatible items are only sampled for items whose set is empty.
 */
@Component
public class FeatureStage implements PipelineStage {
    private static final Logger log = LoggerFactory.getLogger(FeatureStage.class);
    public static final String NAME = "features";

    private final CatalogStore catalogStore;
    private final CursorBatcher batcher;
    private final CategoryClassifier classifier;
    private final PipelineProperties props;

    public FeatureStage(CatalogStore catalogStore, CursorBatcher batcher, CategoryClassifier classifier,
                        PipelineProperties props) {
        this.catalogStore = catalogStore;
        this.batcher = batcher;
        this.classifier = classifier;
        this.props = props;
    }

    @Override
    public String name() {
        return NAME;
    }

    /** Text the vectorizer sees for an item. */
    public static String document(CatalogItem item) {
        StringBuilder sb = new StringBuilder();
        for (String part : new String[]{item.getName(), item.getDescription(), item.getBrand(), item.getCategory()}) {
            if (part != null && !part.isBlank()) {
                if (sb.length() > 0) sb.append(' ');
                sb.append(part);
            }
        }
        return sb.toString();
    }

    @Override
    public Mono<PipelineDtos.StageReport> run(PipelineContext ctx, StageRunOptions options) {
        PipelineDtos.StageReport report = new PipelineDtos.StageReport(NAME);
        return catalogStore.findBatchAfter(ItemFilter.ALL, 0L, Math.max(1, props.getVocabularySample()))
                .map(FeatureStage::document)
                .collectList()
                .map(TfIdfVectorizer::fit)
                .doOnNext(v -> log.info("features: vocabulary fitted, {} terms", v.vocabularySize()))
                .zipWith(peersByCategory())
                .flatMap(t -> {
                    TfIdfVectorizer vectorizer = t.getT1();
                    Map<String, List<String>> peers = t.getT2();
                    return batcher.walk(NAME, ItemFilter.ALL, options, ctx, report, (batch, progress) -> {
                        List<ItemPatch> patches = new ArrayList<>();
                        for (CatalogItem item : batch) {
                            report.incProcessed();
                            ItemPatch patch = featurePatch(item, vectorizer, peers, ctx);
                            if (patch.isEmpty()) report.incSkipped();
                            else patches.add(patch);
                            progress.advance();
                        }
                        return catalogStore.applyPatches(patches)
                                .doOnNext(r -> {
                                    report.addUpdated(r.getWritten());
                                    report.addSkipped(r.getSkipped());
                                    report.addFailed(r.getFailed());
                                })
                                .then();
                    });
                });
    }

    ItemPatch featurePatch(CatalogItem item, TfIdfVectorizer vectorizer, Map<String, List<String>> peers,
                           PipelineContext ctx) {
        ItemPatch patch = new ItemPatch(item.getId());
        List<Double> vector = vectorizer.transform(document(item));
        if (!Objects.equals(vector, item.getFeature_vector())) {
            patch.set(CatalogField.FEATURE_VECTOR, vector);
        }
        String category = classifier.effectiveCategory(item.getCategory(), item.getName());
        if (!category.equals(item.getCategory())) {
            patch.set(CatalogField.CATEGORY, category);
        }
        if (item.getCompatible_items() == null || item.getCompatible_items().isEmpty()) {
            List<String> sample = CompatibleItemSampler.sample(peers.get(category), item.getId(),
                    props.getCompatibleCount(), ctx.getRandom());
            if (!sample.isEmpty()) patch.set(CatalogField.COMPATIBLE_ITEMS, sample);
        }
        return patch;
    }

    /** Item ids grouped by the category each item will carry after this stage. */
    private Mono<Map<String, List<String>>> peersByCategory() {
        int batchSize = Math.max(1, props.getBatchSize());
        Map<String, List<String>> peers = new LinkedHashMap<>();
        return Mono.just(0L)
                .expand(cursor -> catalogStore.findBatchAfter(ItemFilter.ALL, cursor, batchSize)
                        .collectList()
                        .flatMap(batch -> {
                            if (batch.isEmpty()) return Mono.<Long>empty();
                            for (CatalogItem item : batch) {
                                String c = classifier.effectiveCategory(item.getCategory(), item.getName());
                                peers.computeIfAbsent(c, k -> new ArrayList<>()).add(item.getId());
                            }
                            return Mono.just(batch.get(batch.size() - 1).getSeq());
                        }))
                .then(Mono.fromCallable(() -> peers));
    }
}
