package com.novaware.catalog.util;

import org.jsoup.Jsoup;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Cleanup of free text coming from external datasets.
 */
public final class TextUtils {
    /** Description stored by earlier imports when the source had none. */
    public static final String DESCRIPTION_PLACEHOLDER = "No description";

    private TextUtils() {}

    /**
     * Trims a product title, turning non-breaking spaces into spaces, collapsing whitespace
     * runs and dropping separator debris ("-", "|", ":", bullets) at either end.
     * Falls back to the trimmed input when nothing else would remain.
     */
    public static String sanitizeTitle(String input) {
        if (input == null) return null;
        String s = input.replace('\u00A0', ' ').replaceAll("\\s+", " ").trim();
        s = s.replaceAll("^(?:\\s*[\\-–—|:;·•]+\\s*)+", "");
        s = s.replaceAll("(?:\\s*[\\-–—|:;·•]+\\s*)+$", "");
        s = s.trim();
        return s.isEmpty() ? input.trim() : s;
    }

    /** Text content of an HTML fragment, markup removed and whitespace collapsed. */
    public static String stripMarkup(String html) {
        if (html == null) return null;
        return Jsoup.parse(html).text().trim();
    }

    /** Joins description paragraphs with newlines after stripping markup from each. */
    public static String joinParagraphs(List<String> paragraphs) {
        if (paragraphs == null) return null;
        String joined = paragraphs.stream()
                .map(TextUtils::stripMarkup)
                .filter(p -> p != null && !p.isEmpty())
                .collect(Collectors.joining("\n"));
        return joined.isEmpty() ? null : joined;
    }

    public static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
