package com.novaware.catalog.service.index;

import com.novaware.catalog.model.ExternalMetadata;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class MetadataIndexTest {

    static ExternalMetadata meta(String key, String title) {
        ExternalMetadata m = new ExternalMetadata();
        m.setParent_key(key);
        m.setTitle(title);
        return m;
    }

    @Test
    public void firstKeyWinsForDuplicateTitles() {
        MetadataIndex idx = MetadataIndex.builder(5, 500)
                .add(meta("K1", "Classic Oxford Shirt"))
                .add(meta("K2", "  classic oxford shirt "))
                .add(meta("K1", "Classic Oxford Shirt v2"))
                .build();

        assertEquals("K1", idx.keyForExactTitle("classic oxford shirt"));
        assertEquals(List.of("K1", "K2"), idx.keys());
        assertEquals(2, idx.get("K1").size());
        assertEquals("Classic Oxford Shirt", idx.titleOf("K1"));
    }

    @Test
    public void indexesOnlyLongTokensUpToTheLimit() {
        MetadataIndex idx = MetadataIndex.builder(2, 500)
                .add(meta("K1", "Red Wool Beanie Winter Knitted Warm"))
                .build();

        // "beanie" and "winter" are the first two tokens longer than four characters
        assertEquals(Set.of("K1"), idx.keysForKeyword("beanie"));
        assertEquals(Set.of("K1"), idx.keysForKeyword("winter"));
        assertTrue(idx.keysForKeyword("knitted").isEmpty());
        assertTrue(idx.keysForKeyword("wool").isEmpty());
    }

    @Test
    public void keywordBucketsAreCapped() {
        MetadataIndex.Builder b = MetadataIndex.builder(5, 3);
        for (int i = 0; i < 10; i++) b.add(meta("K" + i, "Denim Jacket " + i));
        MetadataIndex idx = b.build();
        assertEquals(Set.of("K0", "K1", "K2"), idx.keysForKeyword("denim"));
        assertEquals(10, idx.size());
    }

    @Test
    public void groupedIndexKeepsOnlyAcceptedKeys() {
        GroupedIndex<String[]> idx = GroupedIndex.collect(
                Flux.just(new String[]{"A", "1"}, new String[]{"B", "2"}, new String[]{"A", "3"}, new String[]{null, "4"}),
                r -> r[0], k -> !k.equals("B")).block();

        assertNotNull(idx);
        assertEquals(Set.of("A"), idx.keys());
        assertEquals(2, idx.get("A").size());
        assertEquals("1", idx.first("A")[1]);
        assertTrue(idx.get("B").isEmpty());
        assertNull(idx.first("missing"));
    }
}
