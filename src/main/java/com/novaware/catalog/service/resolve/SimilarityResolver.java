package com.novaware.catalog.service.resolve;

import com.novaware.catalog.config.PipelineProperties;
import com.novaware.catalog.service.index.MetadataIndex;
import com.novaware.catalog.service.index.TitleTokens;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Finds the external key that best matches a catalog item name.
 *
 * <p>An exact normalized title hit wins outright. Otherwise candidates come from the keyword
 * index (capped), or from the first keys of the index when no keyword matches, and the best
 * candidate is accepted if its score exceeds the acceptance threshold. Scanning stops early
 * once a candidate scores above the early-accept threshold.
 */
public class SimilarityResolver {
    private final MetadataIndex index;
    private final SimilarityScorer scorer;
    private final double acceptThreshold;
    private final double earlyAcceptThreshold;
    private final int candidateCap;
    private final int fallbackSampleSize;

    public SimilarityResolver(MetadataIndex index, PipelineProperties props) {
        this.index = index;
        this.scorer = new SimilarityScorer(props.getContainmentScore());
        this.acceptThreshold = props.getAcceptThreshold();
        this.earlyAcceptThreshold = props.getEarlyAcceptThreshold();
        this.candidateCap = props.getCandidateCap();
        this.fallbackSampleSize = props.getFallbackSampleSize();
    }

    public Optional<MatchResult> resolve(String name) {
        String normalized = TitleTokens.normalize(name);
        if (normalized.isEmpty()) return Optional.empty();

        String exact = index.keyForExactTitle(normalized);
        if (exact != null) {
            return Optional.of(new MatchResult(exact, 1.0, MatchResult.Method.EXACT_TITLE));
        }

        Set<String> candidates = keywordCandidates(normalized);
        MatchResult.Method method = MatchResult.Method.KEYWORD;
        Collection<String> pool = candidates;
        if (candidates.isEmpty()) {
            List<String> keys = index.keys();
            pool = keys.subList(0, Math.min(fallbackSampleSize, keys.size()));
            method = MatchResult.Method.FALLBACK_SAMPLE;
        }

        String bestKey = null;
        double bestScore = 0.0;
        for (String key : pool) {
            double score = scorer.score(normalized, index.titleOf(key));
            if (score > bestScore) {
                bestScore = score;
                bestKey = key;
                if (score > earlyAcceptThreshold) break;
            }
        }
        if (bestKey != null && bestScore > acceptThreshold) {
            return Optional.of(new MatchResult(bestKey, bestScore, method));
        }
        return Optional.empty();
    }

    private Set<String> keywordCandidates(String normalized) {
        Set<String> candidates = new LinkedHashSet<>();
        for (String token : TitleTokens.tokensLongerThan(normalized, MetadataIndex.KEYWORD_MIN_EXCLUSIVE)) {
            for (String key : index.keysForKeyword(token)) {
                if (candidates.size() >= candidateCap) return candidates;
                candidates.add(key);
            }
        }
        return candidates;
    }
}
