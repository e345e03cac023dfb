package com.novaware.catalog.service.resolve;

import com.novaware.catalog.PipelineFixtures;
import com.novaware.catalog.model.ExternalMetadata;
import com.novaware.catalog.service.index.MetadataIndex;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class SimilarityResolverTest {

    static ExternalMetadata meta(String key, String title) {
        ExternalMetadata m = new ExternalMetadata();
        m.setParent_key(key);
        m.setTitle(title);
        return m;
    }

    private SimilarityResolver resolver(ExternalMetadata... records) {
        MetadataIndex.Builder b = MetadataIndex.builder(5, 500);
        for (ExternalMetadata m : records) b.add(m);
        return new SimilarityResolver(b.build(), PipelineFixtures.props());
    }

    @Test
    public void acceptsReorderedTitleThroughKeywordCandidates() {
        SimilarityResolver r = resolver(meta("B-TEE", "Men's Cotton Classic Tee"), meta("B-SOCK", "Wool Hiking Socks"));

        Optional<MatchResult> match = r.resolve("Men's Classic Cotton T-Shirt");

        assertTrue(match.isPresent());
        assertEquals("B-TEE", match.get().getExternalKey());
        assertEquals(MatchResult.Method.KEYWORD, match.get().getMethod());
        assertEquals(0.6, match.get().getScore(), 1e-9);
    }

    @Test
    public void exactTitleWinsWithFullScore() {
        SimilarityResolver r = resolver(meta("B1", "Linen Summer Dress"), meta("B2", "Linen Summer Dress Long"));
        MatchResult match = r.resolve("  LINEN summer dress ").orElseThrow();
        assertEquals("B1", match.getExternalKey());
        assertEquals(1.0, match.getScore());
        assertEquals(MatchResult.Method.EXACT_TITLE, match.getMethod());
    }

    @Test
    public void weakOverlapIsRejected() {
        SimilarityResolver r = resolver(meta("B1", "Leather Ankle Boots Brown"));
        assertTrue(r.resolve("Brown Canvas Backpack Large").isEmpty());
    }

    @Test
    public void fallsBackToLeadingKeysWhenNoKeywordMatches() {
        // "tee" and "red" are too short for the keyword index
        SimilarityResolver r = resolver(meta("B1", "big red tee"));
        MatchResult match = r.resolve("red tee").orElseThrow();
        assertEquals(MatchResult.Method.FALLBACK_SAMPLE, match.getMethod());
        assertEquals(0.8, match.getScore(), 1e-9, "containment scores the fixed value");
    }

    @Test
    public void emptyNameNeverMatches() {
        SimilarityResolver r = resolver(meta("B1", "Anything"));
        assertTrue(r.resolve(null).isEmpty());
        assertTrue(r.resolve("   ").isEmpty());
    }

    @Test
    public void scorerUsesJaccardOverTokensLongerThanTwo() {
        SimilarityScorer scorer = new SimilarityScorer(0.8);
        assertEquals(0.8, scorer.score("blue jeans", "slim blue jeans"), 1e-9);
        // {slim, fit, jeans} vs {relaxed, fit, jeans}: 2 shared of 4
        assertEquals(0.5, scorer.score("slim fit jeans", "relaxed fit jeans"), 1e-9);
        assertEquals(0.0, scorer.score("", "anything"));
    }
}
