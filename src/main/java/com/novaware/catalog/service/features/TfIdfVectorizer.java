package com.novaware.catalog.service.features;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * TF-IDF vectorizer with a vocabulary fitted once and then frozen.
 *
 * <p>Vocabulary order is the order in which terms were first seen while fitting. Every
 * transformed vector has one entry per vocabulary term, zero-filled when the text shares no
 * term with the vocabulary. Term frequency is divided by the document's full token count,
 * out-of-vocabulary tokens included.
 */
public final class TfIdfVectorizer {
    private final Map<String, Integer> vocabulary;
    private final double[] idf;

    private TfIdfVectorizer(Map<String, Integer> vocabulary, double[] idf) {
        this.vocabulary = vocabulary;
        this.idf = idf;
    }

    public static TfIdfVectorizer fit(List<String> documents) {
        Map<String, Integer> vocab = new LinkedHashMap<>();
        Map<String, Integer> docFreq = new HashMap<>();
        for (String doc : documents) {
            Set<String> seen = new HashSet<>();
            for (String term : TextTokenizer.tokenize(doc)) {
                vocab.putIfAbsent(term, vocab.size());
                if (seen.add(term)) docFreq.merge(term, 1, Integer::sum);
            }
        }
        double[] idf = new double[vocab.size()];
        int n = documents.size();
        for (Map.Entry<String, Integer> e : vocab.entrySet()) {
            idf[e.getValue()] = Math.log((double) n / docFreq.get(e.getKey()));
        }
        return new TfIdfVectorizer(Collections.unmodifiableMap(vocab), idf);
    }

    public int vocabularySize() {
        return vocabulary.size();
    }

    /** Vocabulary terms in vector order. */
    public List<String> terms() {
        return new ArrayList<>(vocabulary.keySet());
    }

    public double idf(String term) {
        Integer i = vocabulary.get(term);
        return i == null ? 0.0 : idf[i];
    }

    public List<Double> transform(String text) {
        double[] v = new double[vocabulary.size()];
        List<String> tokens = TextTokenizer.tokenize(text);
        if (!tokens.isEmpty()) {
            Map<Integer, Integer> counts = new HashMap<>();
            for (String t : tokens) {
                Integer i = vocabulary.get(t);
                if (i != null) counts.merge(i, 1, Integer::sum);
            }
            double total = tokens.size();
            for (Map.Entry<Integer, Integer> e : counts.entrySet()) {
                v[e.getKey()] = (e.getValue() / total) * idf[e.getKey()];
            }
        }
        List<Double> out = new ArrayList<>(v.length);
        for (double d : v) out.add(d);
        return out;
    }
}
