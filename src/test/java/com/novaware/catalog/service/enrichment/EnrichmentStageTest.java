package com.novaware.catalog.service.enrichment;

import com.novaware.catalog.PipelineFixtures;
import com.novaware.catalog.config.PipelineProperties;
import com.novaware.catalog.dto.PipelineDtos;
import com.novaware.catalog.model.CatalogItem;
import com.novaware.catalog.service.pipeline.CursorBatcher;
import com.novaware.catalog.service.pipeline.StageRunOptions;
import com.novaware.catalog.store.InMemoryCatalogStore;
import com.novaware.catalog.store.InMemoryCheckpointStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class EnrichmentStageTest {

    @TempDir
    Path dir;

    private InMemoryCatalogStore store;
    private EnrichmentStage stage;

    @BeforeEach
    void setUp() throws Exception {
        Path meta = PipelineFixtures.writeLines(dir, "meta.jsonl",
                "{\"parent_asin\":\"B1\",\"title\":\"Wrap Dress\",\"store\":\"Acme\",\"images\":[\"x.jpg\"],\"average_rating\":4.0,\"rating_number\":3}");
        PipelineProperties props = PipelineFixtures.props();
        props.setMetadataFile(meta.toString());
        store = new InMemoryCatalogStore();
        stage = new EnrichmentStage(store, new CursorBatcher(store, new InMemoryCheckpointStore(), props),
                PipelineFixtures.loader(props), new EnrichmentMerger());

        store.add(PipelineFixtures.resolvedItem("i1", "Wrap Dress", "B1"));
        store.add(PipelineFixtures.resolvedItem("i2", "Lost Item", "B-GONE"));
        store.add(PipelineFixtures.item("i3", "Unresolved"));
    }

    @Test
    public void enrichesResolvedItemsAndCountsMissingRecords() {
        PipelineDtos.StageReport report = stage.run(PipelineFixtures.context(10), StageRunOptions.fromStart()).block();

        assertNotNull(report);
        CatalogItem i1 = store.get("i1");
        assertEquals("Acme", i1.getBrand());
        assertEquals(List.of("x.jpg"), i1.getImages());
        assertEquals(3, i1.getNum_reviews());
        assertNull(store.get("i3").getBrand());
        assertEquals(2, report.getProcessed());
        assertEquals(1, report.getUpdated());
        assertEquals(1, report.getNot_found());
    }

    @Test
    public void rerunChangesNothing() {
        stage.run(PipelineFixtures.context(10), StageRunOptions.fromStart()).block();
        PipelineDtos.StageReport again = stage.run(PipelineFixtures.context(10), StageRunOptions.fromStart()).block();

        assertNotNull(again);
        assertEquals(0, again.getUpdated());
        assertEquals(1, again.getSkipped());
        assertEquals(1, again.getNot_found());
    }
}
