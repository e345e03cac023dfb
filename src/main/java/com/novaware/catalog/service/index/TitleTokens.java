package com.novaware.catalog.service.index;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Title normalization shared by the indexes and the similarity scorer. */
public final class TitleTokens {
    private TitleTokens() {}

    public static String normalize(String title) {
        return title == null ? "" : title.toLowerCase(Locale.ROOT).trim();
    }

    /** Whitespace tokens of a normalized title longer than {@code minExclusive} characters. */
    public static List<String> tokensLongerThan(String normalized, int minExclusive) {
        List<String> out = new ArrayList<>();
        if (normalized == null || normalized.isEmpty()) return out;
        for (String t : normalized.split("\\s+")) {
            if (t.length() > minExclusive) out.add(t);
        }
        return out;
    }
}
