package com.novaware.catalog.service.resolve;

import com.novaware.catalog.service.index.TitleTokens;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Title similarity heuristic: containment of one normalized title in the other scores a fixed
 * value, otherwise the Jaccard ratio of tokens longer than two characters.
 */
public class SimilarityScorer {
    private final double containmentScore;

    public SimilarityScorer(double containmentScore) {
        this.containmentScore = containmentScore;
    }

    public double score(String a, String b) {
        String s1 = TitleTokens.normalize(a);
        String s2 = TitleTokens.normalize(b);
        if (s1.isEmpty() || s2.isEmpty()) return 0.0;
        if (s1.contains(s2) || s2.contains(s1)) return containmentScore;

        List<String> t1 = TitleTokens.tokensLongerThan(s1, 2);
        List<String> t2 = TitleTokens.tokensLongerThan(s2, 2);
        Set<String> union = new HashSet<>(t1);
        union.addAll(t2);
        if (union.isEmpty()) return 0.0;
        Set<String> shared = new HashSet<>(t1);
        shared.retainAll(new HashSet<>(t2));
        return (double) shared.size() / union.size();
    }
}
