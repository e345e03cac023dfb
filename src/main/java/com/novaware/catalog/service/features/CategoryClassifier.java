package com.novaware.catalog.service.features;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Keyword rules over the item name; the first rule with a keyword contained in the name wins.
 */
@Component
public class CategoryClassifier {
    public static final String DEFAULT = "Other";
    /** Category earlier imports stored when nothing better was known. */
    public static final String LEGACY_DEFAULT = "other";

    private static final class Rule {
        final String category;
        final List<String> keywords;

        Rule(String category, List<String> keywords) {
            this.category = category;
            this.keywords = keywords;
        }
    }

    private static final List<Rule> RULES = List.of(
            new Rule("Tops", List.of("shirt", "tee", "t-shirt", "blouse", "top", "polo")),
            new Rule("Bottoms", List.of("pant", "jean", "short", "trouser", "legging", "skirt")),
            new Rule("Dresses", List.of("dress", "gown", "jumpsuit")),
            new Rule("Shoes", List.of("shoe", "sock", "sneaker", "boot", "sandal", "heel")),
            new Rule("Accessories", List.of("bag", "hat", "belt", "watch", "jewelry", "scarf", "glove", "sunglass")));

    public String classify(String name) {
        if (name == null) return DEFAULT;
        String n = name.toLowerCase(Locale.ROOT);
        for (Rule r : RULES) {
            for (String k : r.keywords) {
                if (n.contains(k)) return r.category;
            }
        }
        return DEFAULT;
    }

    /** Whether a stored category may be replaced by the classified one. */
    public static boolean isReplaceable(String stored) {
        return stored == null || stored.isBlank() || LEGACY_DEFAULT.equalsIgnoreCase(stored.trim());
    }

    /** Stored category when curated, otherwise the classified one. */
    public String effectiveCategory(String stored, String name) {
        return isReplaceable(stored) ? classify(name) : stored;
    }
}
