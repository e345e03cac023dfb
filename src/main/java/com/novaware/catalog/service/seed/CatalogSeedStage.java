package com.novaware.catalog.service.seed;

import com.novaware.catalog.config.PipelineProperties;
import com.novaware.catalog.dto.PipelineDtos;
import com.novaware.catalog.model.CatalogItem;
import com.novaware.catalog.model.ColorOption;
import com.novaware.catalog.model.ExternalMetadata;
import com.novaware.catalog.service.index.ExternalDataLoader;
import com.novaware.catalog.service.io.ReadStats;
import com.novaware.catalog.service.pipeline.PipelineContext;
import com.novaware.catalog.service.pipeline.PipelineStage;
import com.novaware.catalog.service.pipeline.StageRunOptions;
import com.novaware.catalog.service.variants.ColorPalette;
import com.novaware.catalog.service.variants.VariantGenerator;
import com.novaware.catalog.store.CatalogStore;
import com.novaware.catalog.util.TextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.UUID;

/**
 * Bootstraps catalog items from the metadata stream.
 *
 * <p>Item ids derive from the external key, so seeding again only produces duplicates that
 * the store skips. Seeded items are left unresolved; the resolve stage links them back to
 * their record through the exact title index. This stage ignores cursors: it walks the input
 * file, not the catalog.
 */
@Component
public class CatalogSeedStage implements PipelineStage {
    private static final Logger log = LoggerFactory.getLogger(CatalogSeedStage.class);
    public static final String NAME = "seed";
    private static final String UNKNOWN_COLOR_HEX = "#000000";
    private static final int MAX_SEED_STOCK_PER_SIZE = 20;

    private final CatalogStore catalogStore;
    private final ExternalDataLoader loader;
    private final PipelineProperties props;
    private final ColorPalette palette;

    public CatalogSeedStage(CatalogStore catalogStore, ExternalDataLoader loader, PipelineProperties props) {
        this.catalogStore = catalogStore;
        this.loader = loader;
        this.props = props;
        this.palette = ColorPalette.from(props);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<PipelineDtos.StageReport> run(PipelineContext ctx, StageRunOptions options) {
        PipelineDtos.StageReport report = new PipelineDtos.StageReport(NAME);
        report.setStarted_at(Instant.now().toString());
        ReadStats stats = new ReadStats();
        int batchSize = Math.max(1, props.getBatchSize());
        return Mono.fromCallable(loader::metadataPath)
                .thenMany(loader.streamMetadata(stats))
                .filter(m -> m.getParent_key() != null && !TextUtils.isBlank(m.getTitle()))
                .map(m -> toItem(m, ctx.getRandom()))
                .buffer(batchSize)
                .concatMap(batch -> catalogStore.insertMany(batch)
                        .doOnNext(r -> {
                            report.setProcessed(report.getProcessed() + batch.size());
                            report.addCreated(r.getWritten());
                            report.addSkipped(r.getSkipped());
                            report.addFailed(r.getFailed());
                            report.setBatches(report.getBatches() + 1);
                            String line = String.format("seed batch %d: %s", report.getBatches(), r);
                            log.info(line);
                            ctx.mirror(line);
                        }))
                .then(Mono.fromCallable(() -> {
                    report.setMalformed_lines(stats.getMalformed());
                    report.setEnded_at(Instant.now().toString());
                    log.info("seed finished: {}", report);
                    ctx.mirror("seed finished: " + report);
                    return report;
                }));
    }

    CatalogItem toItem(ExternalMetadata m, Random random) {
        CatalogItem item = new CatalogItem();
        item.setId(UUID.nameUUIDFromBytes(("item:" + m.getParent_key()).getBytes(StandardCharsets.UTF_8)).toString());
        item.setName(TextUtils.sanitizeTitle(m.getTitle()));
        item.setDescription(TextUtils.joinParagraphs(m.getDescription()));
        item.setBrand(m.getStore());
        List<String> categories = m.getCategories();
        item.setCategory(categories != null && categories.size() > 1
                ? categories.get(1).toLowerCase(Locale.ROOT) : "other");
        item.setImages(m.getImages() != null ? new ArrayList<>(m.getImages()) : new ArrayList<>());
        item.setPrice(m.getPrice() != null && m.getPrice() > 0 ? m.getPrice() : null);
        item.setRating(m.getAverage_rating() != null ? m.getAverage_rating() : 0.0);
        item.setNum_reviews(m.getRating_number() != null ? m.getRating_number() : 0);
        item.setReviews(new ArrayList<>());

        Map<String, Integer> sizeStock = new LinkedHashMap<>();
        int total = 0;
        for (String size : VariantGenerator.SIZES) {
            int n = random.nextInt(MAX_SEED_STOCK_PER_SIZE + 1);
            sizeStock.put(size, n);
            total += n;
        }
        item.setSize_stock(sizeStock);
        item.setCount_in_stock(total);

        List<ColorOption> colors = new ArrayList<>();
        if (m.getColor_names() != null) {
            for (String name : m.getColor_names()) {
                String hex = palette.hexForName(name);
                colors.add(new ColorOption(name, hex != null ? hex : UNKNOWN_COLOR_HEX));
            }
        }
        item.setColors(colors);
        return item;
    }
}
