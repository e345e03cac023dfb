package com.novaware.catalog.service.features;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lowercases text and splits it on runs of non-letters into ASCII alphabetic terms longer
 * than two characters, dropping English stop words. Possessives split at the apostrophe,
 * so "women's" yields "women".
 */
public final class TextTokenizer {
    private static final Pattern SPLIT = Pattern.compile("[^\\p{L}]+");
    private static final Pattern ALPHA = Pattern.compile("[a-z]+");

    // The common English list used by the natural NLP toolkit; entries of two characters or
    // fewer are omitted since the length filter removes them anyway.
    static final Set<String> STOP_WORDS = Set.of(
            "about", "above", "after", "again", "all", "also", "and", "another", "any", "are",
            "because", "been", "before", "being", "below", "between", "both", "but", "came", "can",
            "cannot", "come", "could", "did", "does", "doing", "during", "each", "few", "for",
            "from", "further", "get", "got", "has", "had", "have", "her", "here", "him",
            "himself", "his", "how", "into", "its", "itself", "like", "make", "many", "might",
            "more", "most", "much", "must", "myself", "never", "now", "only", "other", "our",
            "ours", "ourselves", "out", "over", "own", "said", "same", "see", "should", "since",
            "some", "still", "such", "take", "than", "that", "the", "their", "theirs", "them",
            "themselves", "then", "there", "these", "they", "this", "those", "through", "too", "under",
            "until", "very", "was", "way", "well", "were", "what", "where", "when", "which",
            "while", "who", "whom", "with", "would", "why", "you", "your", "yours", "yourself");

    private TextTokenizer() {}

    public static List<String> tokenize(String text) {
        List<String> out = new ArrayList<>();
        if (text == null || text.isBlank()) return out;
        for (String raw : SPLIT.split(text.toLowerCase(Locale.ROOT))) {
            if (raw.length() <= 2) continue;
            if (!ALPHA.matcher(raw).matches()) continue;
            if (STOP_WORDS.contains(raw)) continue;
            out.add(raw);
        }
        return out;
    }
}
