package com.novaware.catalog.service.index;

import com.novaware.catalog.model.ExternalMetadata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lookup structures over the metadata stream: records by key, exact normalized title to key
 * (first key wins), and an inverted keyword index from title tokens to keys.
 *
 * <p>Only the first {@code keywordsPerTitle} tokens longer than four characters of each title
 * are indexed, and each token keeps at most {@code fanOutCap} keys.
 */
public final class MetadataIndex {
    public static final int KEYWORD_MIN_EXCLUSIVE = 4;

    private final Map<String, List<ExternalMetadata>> byKey;
    private final Map<String, String> titleToKey;
    private final Map<String, Set<String>> keywordToKeys;
    private final List<String> keys;

    private MetadataIndex(Builder b) {
        Map<String, List<ExternalMetadata>> frozen = new LinkedHashMap<>();
        b.byKey.forEach((k, v) -> frozen.put(k, Collections.unmodifiableList(v)));
        this.byKey = Collections.unmodifiableMap(frozen);
        this.titleToKey = Collections.unmodifiableMap(b.titleToKey);
        Map<String, Set<String>> kw = new LinkedHashMap<>();
        b.keywordToKeys.forEach((k, v) -> kw.put(k, Collections.unmodifiableSet(v)));
        this.keywordToKeys = Collections.unmodifiableMap(kw);
        this.keys = Collections.unmodifiableList(new ArrayList<>(b.byKey.keySet()));
    }

    public static Builder builder(int keywordsPerTitle, int fanOutCap) {
        return new Builder(keywordsPerTitle, fanOutCap);
    }

    public ExternalMetadata first(String key) {
        List<ExternalMetadata> list = key == null ? null : byKey.get(key);
        return list == null || list.isEmpty() ? null : list.get(0);
    }

    public List<ExternalMetadata> get(String key) {
        List<ExternalMetadata> list = key == null ? null : byKey.get(key);
        return list != null ? list : Collections.emptyList();
    }

    /** Title of the first record under the key, or null. */
    public String titleOf(String key) {
        ExternalMetadata m = first(key);
        return m != null ? m.getTitle() : null;
    }

    public String keyForExactTitle(String normalizedTitle) {
        return titleToKey.get(normalizedTitle);
    }

    public Set<String> keysForKeyword(String token) {
        Set<String> s = keywordToKeys.get(token);
        return s != null ? s : Collections.emptySet();
    }

    /** All keys in first-seen order. */
    public List<String> keys() {
        return keys;
    }

    public int size() {
        return keys.size();
    }

    public static final class Builder {
        private final int keywordsPerTitle;
        private final int fanOutCap;
        private final Map<String, List<ExternalMetadata>> byKey = new LinkedHashMap<>();
        private final Map<String, String> titleToKey = new LinkedHashMap<>();
        private final Map<String, Set<String>> keywordToKeys = new LinkedHashMap<>();

        private Builder(int keywordsPerTitle, int fanOutCap) {
            this.keywordsPerTitle = keywordsPerTitle;
            this.fanOutCap = fanOutCap;
        }

        public Builder add(ExternalMetadata m) {
            String key = m.getParent_key();
            if (key == null) return this;
            byKey.computeIfAbsent(key, k -> new ArrayList<>()).add(m);
            String title = TitleTokens.normalize(m.getTitle());
            if (title.isEmpty()) return this;
            titleToKey.putIfAbsent(title, key);
            List<String> tokens = TitleTokens.tokensLongerThan(title, KEYWORD_MIN_EXCLUSIVE);
            for (int i = 0; i < tokens.size() && i < keywordsPerTitle; i++) {
                Set<String> bucket = keywordToKeys.computeIfAbsent(tokens.get(i), t -> new LinkedHashSet<>());
                if (bucket.size() < fanOutCap) bucket.add(key);
            }
            return this;
        }

        public MetadataIndex build() {
            return new MetadataIndex(this);
        }
    }
}
