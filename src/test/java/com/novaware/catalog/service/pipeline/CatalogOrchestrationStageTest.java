package com.novaware.catalog.service.pipeline;

import com.novaware.catalog.PipelineFixtures;
import com.novaware.catalog.config.PipelineProperties;
import com.novaware.catalog.dto.PipelineDtos;
import com.novaware.catalog.model.CatalogItem;
import com.novaware.catalog.model.ColorOption;
import com.novaware.catalog.model.ReviewerIdentity;
import com.novaware.catalog.model.Variant;
import com.novaware.catalog.service.identity.ReviewTextGenerator;
import com.novaware.catalog.service.identity.ReviewTopUp;
import com.novaware.catalog.service.identity.ReviewerIdentityService;
import com.novaware.catalog.service.variants.VariantGenerator;
import com.novaware.catalog.store.CatalogConnectionException;
import com.novaware.catalog.store.InMemoryCatalogStore;
import com.novaware.catalog.store.InMemoryCheckpointStore;
import com.novaware.catalog.store.InMemoryReviewerIdentityStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class CatalogOrchestrationStageTest {

    private InMemoryCatalogStore store;
    private InMemoryCheckpointStore checkpoints;
    private CatalogOrchestrationStage stage;

    @BeforeEach
    void setUp() {
        PipelineProperties props = PipelineFixtures.props();
        store = new InMemoryCatalogStore();
        checkpoints = new InMemoryCheckpointStore();
        InMemoryReviewerIdentityStore identities = new InMemoryReviewerIdentityStore();
        for (int i = 1; i <= 5; i++) {
            identities.add(new ReviewerIdentity("id" + i, "U" + i, "Reviewer U" + i, "u" + i + "@x", 0L));
        }
        stage = new CatalogOrchestrationStage(store, new CursorBatcher(store, checkpoints, props),
                new VariantGenerator(props), new ReviewTopUp(identities, new ReviewTextGenerator()),
                new ReviewerIdentityService(identities, props));

        store.add(item("i1", 3));
        store.add(item("i2", 0));
        store.add(item("i3", 2));
    }

    private static CatalogItem item(String id, int declaredReviews) {
        CatalogItem item = PipelineFixtures.item(id, "Tee " + id);
        item.setPrice(20.0);
        Map<String, Integer> stock = new LinkedHashMap<>();
        stock.put("s", 10);
        stock.put("m", 0);
        stock.put("l", 5);
        stock.put("xl", 0);
        item.setSize_stock(stock);
        item.setColors(new ArrayList<>(List.of(new ColorOption("Red", "#FF0000"))));
        item.setNum_reviews(declaredReviews);
        return item;
    }

    @Test
    public void buildsVariantGridAndTopsUpReviews() {
        PipelineDtos.StageReport report = stage.run(PipelineFixtures.context(10), StageRunOptions.fromStart()).block();

        assertNotNull(report);
        assertEquals(3, report.getProcessed());
        assertEquals(3, report.getUpdated());
        assertEquals(5, report.getReviews_added());

        CatalogItem i1 = store.get("i1");
        assertEquals(3, i1.getColors().size(), "padded to the minimum");
        assertEquals(12, i1.getVariants().size());
        assertEquals(15, i1.getCount_in_stock());
        int sum = 0;
        for (Variant v : i1.getVariants()) sum += v.getStock();
        assertEquals(15, sum);
        assertEquals(3, i1.getReviews().size());
        assertEquals(3, i1.getNum_reviews());
        assertTrue(i1.getRating() >= 1.0 && i1.getRating() <= 5.0);
        assertTrue(store.get("i2").getReviews().isEmpty());
    }

    @Test
    public void secondRunKeepsStockAndReviews() {
        stage.run(PipelineFixtures.context(10), StageRunOptions.fromStart()).block();
        List<String> firstReviewers = new ArrayList<>();
        store.get("i1").getReviews().forEach(r -> firstReviewers.add(r.getReviewer_id()));

        PipelineDtos.StageReport again = stage.run(PipelineFixtures.context(10), StageRunOptions.fromStart()).block();

        assertNotNull(again);
        assertEquals(0, again.getReviews_added());
        CatalogItem i1 = store.get("i1");
        assertEquals(15, i1.getCount_in_stock());
        List<String> reviewers = new ArrayList<>();
        i1.getReviews().forEach(r -> reviewers.add(r.getReviewer_id()));
        assertEquals(firstReviewers, reviewers);
    }

    @Test
    public void failedWriteIsCountedAndOthersProceed() {
        store.failWritesFor("i2");

        PipelineDtos.StageReport report = stage.run(PipelineFixtures.context(10), StageRunOptions.fromStart()).block();

        assertNotNull(report);
        assertEquals(1, report.getFailed());
        assertEquals(2, report.getUpdated());
        assertNull(store.get("i2").getVariants());
        assertNotNull(store.get("i3").getVariants());
    }

    @Test
    public void lostConnectionAbortsTheRun() {
        store.takeConnectionDown();
        assertThrows(CatalogConnectionException.class,
                () -> stage.run(PipelineFixtures.context(10), StageRunOptions.fromStart()).block());
    }
}
