package com.novaware.catalog.service.resolve;

/** Accepted match of a catalog item to an external key. */
public class MatchResult {
    public enum Method { EXACT_TITLE, KEYWORD, FALLBACK_SAMPLE }

    private final String externalKey;
    private final double score;
    private final Method method;

    public MatchResult(String externalKey, double score, Method method) {
        this.externalKey = externalKey;
        this.score = score;
        this.method = method;
    }

    public String getExternalKey() { return externalKey; }
    public double getScore() { return score; }
    public Method getMethod() { return method; }

    @Override
    public String toString() {
        return externalKey + " (" + method + ", score=" + String.format("%.3f", score) + ")";
    }
}
