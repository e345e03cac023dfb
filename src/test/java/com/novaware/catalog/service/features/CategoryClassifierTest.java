package com.novaware.catalog.service.features;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class CategoryClassifierTest {

    private final CategoryClassifier classifier = new CategoryClassifier();

    @Test
    public void firstMatchingRuleWins() {
        assertEquals("Tops", classifier.classify("Oversized Polo Shirt"));
        assertEquals("Bottoms", classifier.classify("High Rise JEANS"));
        assertEquals("Dresses", classifier.classify("Evening gown"));
        assertEquals("Shoes", classifier.classify("Trail Sneakers"));
        assertEquals("Accessories", classifier.classify("Canvas tote bag"));
        assertEquals("Other", classifier.classify("Ceramic mug"));
        assertEquals("Other", classifier.classify(null));
    }

    @Test
    public void curatedCategoryIsKept() {
        assertEquals("Outerwear", classifier.effectiveCategory("Outerwear", "Rain Jacket"));
        assertEquals("Tops", classifier.effectiveCategory("other", "Linen Shirt"));
        assertEquals("Tops", classifier.effectiveCategory(" ", "Linen Shirt"));
        assertEquals("Tops", classifier.effectiveCategory(null, "Linen Shirt"));
    }

    @Test
    public void samplerExcludesSelfAndCapsAtK() {
        List<String> peers = List.of("a", "b", "c", "d", "e");
        for (int seed = 0; seed < 20; seed++) {
            List<String> s = CompatibleItemSampler.sample(peers, "c", 3, new Random(seed));
            assertEquals(3, s.size());
            assertFalse(s.contains("c"));
            assertEquals(3, new HashSet<>(s).size());
        }
    }

    @Test
    public void samplerReturnsFewerWhenPeersRunOut() {
        assertEquals(List.of("b"), CompatibleItemSampler.sample(List.of("a", "b"), "a", 3, new Random(1)));
        assertTrue(CompatibleItemSampler.sample(List.of("a"), "a", 3, new Random(1)).isEmpty());
        assertTrue(CompatibleItemSampler.sample(null, "a", 3, new Random(1)).isEmpty());
    }

    @Test
    public void samplerCoversAllPeersOverManyDraws() {
        Set<String> seen = new HashSet<>();
        Random random = new Random(9);
        for (int i = 0; i < 200; i++) seen.addAll(CompatibleItemSampler.sample(List.of("a", "b", "c", "d"), "x", 1, random));
        assertEquals(Set.of("a", "b", "c", "d"), seen);
    }
}
