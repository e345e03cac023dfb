package com.novaware.catalog.service.features;

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

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class FeatureStageTest {

    private InMemoryCatalogStore store;
    private FeatureStage stage;

    @BeforeEach
    void setUp() {
        PipelineProperties props = PipelineFixtures.props();
        store = new InMemoryCatalogStore();
        stage = new FeatureStage(store, new CursorBatcher(store, new InMemoryCheckpointStore(), props),
                new CategoryClassifier(), props);
    }

    private void add(String id, String name, String category, List<String> compatible) {
        CatalogItem item = PipelineFixtures.item(id, name);
        item.setCategory(category);
        item.setCompatible_items(compatible);
        store.add(item);
    }

    @Test
    public void writesVectorsCategoriesAndCompatibleItems() {
        add("i1", "Linen Shirt", "other", null);
        add("i2", "Cotton Tee", null, null);
        add("i3", "Denim Jeans", "Bottoms", null);
        add("i4", "Silk Blouse", "Tops", List.of("kept"));

        PipelineDtos.StageReport report = stage.run(PipelineFixtures.context(10), StageRunOptions.fromStart()).block();

        assertNotNull(report);
        assertEquals(4, report.getProcessed());
        CatalogItem i1 = store.get("i1");
        assertEquals("Tops", i1.getCategory());
        assertEquals("Tops", store.get("i2").getCategory());
        assertEquals(Set.of("i2", "i4"), Set.copyOf(i1.getCompatible_items()));
        assertNull(store.get("i3").getCompatible_items(), "a lone category has nothing to sample");
        assertEquals(List.of("kept"), store.get("i4").getCompatible_items());

        int length = i1.getFeature_vector().size();
        assertTrue(length > 0);
        for (CatalogItem item : store.all()) {
            assertEquals(length, item.getFeature_vector().size());
        }
        assertTrue(store.get("i3").getFeature_vector().stream().anyMatch(d -> d > 0));
    }

    @Test
    public void rerunOnSettledCatalogIsANoOp() {
        add("i1", "Linen Shirt", "Tops", null);
        add("i2", "Cotton Tee", "Tops", null);
        add("i3", "Denim Jeans", "Bottoms", null);
        stage.run(PipelineFixtures.context(10), StageRunOptions.fromStart()).block();
        List<String> compatible = store.get("i1").getCompatible_items();

        PipelineDtos.StageReport again = stage.run(PipelineFixtures.context(10), StageRunOptions.fromStart()).block();

        assertNotNull(again);
        assertEquals(0, again.getUpdated());
        assertEquals(3, again.getSkipped());
        assertEquals(compatible, store.get("i1").getCompatible_items());
    }

    @Test
    public void documentJoinsNonEmptyFields() {
        CatalogItem item = PipelineFixtures.item("i1", "Tee");
        item.setBrand("Acme");
        item.setDescription(" ");
        assertEquals("Tee Acme", FeatureStage.document(item));
    }
}
