package com.novaware.catalog.service.seed;

import com.novaware.catalog.PipelineFixtures;
import com.novaware.catalog.config.PipelineProperties;
import com.novaware.catalog.dto.PipelineDtos;
import com.novaware.catalog.model.CatalogItem;
import com.novaware.catalog.service.pipeline.CursorBatcher;
import com.novaware.catalog.service.pipeline.StageRunOptions;
import com.novaware.catalog.service.resolve.ResolutionStage;
import com.novaware.catalog.store.InMemoryCatalogStore;
import com.novaware.catalog.store.InMemoryCheckpointStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CatalogSeedStageTest {

    @TempDir
    Path dir;

    private PipelineProperties props;
    private InMemoryCatalogStore store;
    private CatalogSeedStage stage;

    @BeforeEach
    void setUp() throws Exception {
        Path meta = PipelineFixtures.writeLines(dir, "meta.jsonl",
                "{\"parent_asin\":\"B1\",\"title\":\"Ribbed Tank Top\",\"categories\":[\"Clothing\",\"Women\",\"Tops\"],"
                        + "\"price\":12.5,\"store\":\"Acme\",\"details\":{\"Color\":\"Navy\"},\"rating_number\":4}",
                "{\"parent_asin\":\"B2\",\"title\":\"Cargo Shorts\",\"details\":{\"Color\":\"Olive\"}}",
                "{\"parent_asin\":\"B3\"}");
        props = PipelineFixtures.props();
        props.setMetadataFile(meta.toString());
        store = new InMemoryCatalogStore();
        stage = new CatalogSeedStage(store, PipelineFixtures.loader(props), props);
    }

    @Test
    public void createsItemsFromTitledRecords() {
        PipelineDtos.StageReport report = stage.run(PipelineFixtures.context(10), StageRunOptions.fromStart()).block();

        assertNotNull(report);
        assertEquals(2, report.getCreated());
        List<CatalogItem> items = store.all();
        assertEquals(2, items.size());

        CatalogItem tank = items.get(0);
        assertEquals("Ribbed Tank Top", tank.getName());
        assertEquals("women", tank.getCategory());
        assertEquals(12.5, tank.getPrice());
        assertEquals(4, tank.getNum_reviews());
        assertEquals("#001F3F", tank.getColors().get(0).getHex());
        assertNull(tank.getExternal_key());
        int sum = tank.getSize_stock().values().stream().mapToInt(Integer::intValue).sum();
        assertEquals(sum, tank.getCount_in_stock());

        CatalogItem shorts = items.get(1);
        assertEquals("other", shorts.getCategory());
        assertEquals("#000000", shorts.getColors().get(0).getHex());
    }

    @Test
    public void reseedingSkipsExistingItems() {
        stage.run(PipelineFixtures.context(10), StageRunOptions.fromStart()).block();
        PipelineDtos.StageReport again = stage.run(PipelineFixtures.context(10), StageRunOptions.fromStart()).block();

        assertNotNull(again);
        assertEquals(0, again.getCreated());
        assertEquals(2, again.getSkipped());
        assertEquals(2, store.all().size());
    }

    @Test
    public void seededItemsResolveByExactTitle() {
        stage.run(PipelineFixtures.context(10), StageRunOptions.fromStart()).block();
        ResolutionStage resolve = new ResolutionStage(store, new CursorBatcher(store, new InMemoryCheckpointStore(), props),
                PipelineFixtures.loader(props), props);

        PipelineDtos.StageReport report = resolve.run(PipelineFixtures.context(10), StageRunOptions.fromStart()).block();

        assertNotNull(report);
        assertEquals(2, report.getMatched());
        List<CatalogItem> items = store.all();
        assertEquals("B1", items.get(0).getExternal_key());
        assertEquals("B2", items.get(1).getExternal_key());
    }
}
