package com.novaware.catalog.service.enrichment;

import com.novaware.catalog.model.CatalogItem;
import com.novaware.catalog.model.ExternalMetadata;
import com.novaware.catalog.store.CatalogField;
import com.novaware.catalog.util.TextUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Computes the patch that fills a catalog item from its matched external metadata.
 *
 * <p>Rules are evaluated in declaration order. Curated values are never overwritten by
 * {@link FillRule#FILL_IF_EMPTY} fields, existing images are never dropped, and a value equal
 * to the current one is never emitted, so merging the same record twice yields an empty patch.
 * Rating and review count are left alone on items that already carry reviews.
 */
@Component
public class EnrichmentMerger {

    /** One (field, rule) pair with its readers on both sides. */
    private static final class FieldRule {
        private final CatalogField field;
        private final FillRule rule;
        private final String source;
        private final Function<CatalogItem, Object> current;
        private final Function<ExternalMetadata, Object> external;

        FieldRule(CatalogField field, FillRule rule, String source,
                  Function<CatalogItem, Object> current, Function<ExternalMetadata, Object> external) {
            this.field = field;
            this.rule = rule;
            this.source = source;
            this.current = current;
            this.external = external;
        }
    }

    private static final List<FieldRule> RULES = List.of(
            new FieldRule(CatalogField.NAME, FillRule.FILL_IF_EMPTY, "title",
                    CatalogItem::getName, m -> TextUtils.sanitizeTitle(m.getTitle())),
            new FieldRule(CatalogField.DESCRIPTION, FillRule.FILL_IF_EMPTY, "description",
                    CatalogItem::getDescription, m -> TextUtils.joinParagraphs(m.getDescription())),
            new FieldRule(CatalogField.BRAND, FillRule.FILL_IF_EMPTY, "store",
                    CatalogItem::getBrand, ExternalMetadata::getStore),
            new FieldRule(CatalogField.CATEGORY, FillRule.FILL_IF_EMPTY, "main_category",
                    CatalogItem::getCategory, ExternalMetadata::getMain_category),
            new FieldRule(CatalogField.RATING, FillRule.AUTHORITATIVE, "average_rating",
                    CatalogItem::getRating, ExternalMetadata::getAverage_rating),
            new FieldRule(CatalogField.NUM_REVIEWS, FillRule.AUTHORITATIVE, "rating_number",
                    CatalogItem::getNum_reviews, ExternalMetadata::getRating_number),
            new FieldRule(CatalogField.PRICE, FillRule.AUTHORITATIVE, "price",
                    CatalogItem::getPrice, m -> m.getPrice() != null && m.getPrice() > 0 ? m.getPrice() : null),
            new FieldRule(CatalogField.IMAGES, FillRule.UNION, "images",
                    CatalogItem::getImages, ExternalMetadata::getImages));

    public FieldPatch merge(CatalogItem item, ExternalMetadata metadata) {
        FieldPatch patch = new FieldPatch();
        if (item == null || metadata == null) return patch;
        for (FieldRule r : RULES) {
            Object cur = r.current.apply(item);
            Object ext = r.external.apply(metadata);
            if (isEmpty(ext)) continue;
            switch (r.rule) {
                case FILL_IF_EMPTY:
                    if (isEmptyOrPlaceholder(r.field, cur)) patch.put(r.field, ext, r.source);
                    break;
                case AUTHORITATIVE:
                    if (isReviewDerived(r.field) && hasReviews(item)) break;
                    if (!sameValue(cur, ext)) patch.put(r.field, ext, r.source);
                    break;
                case UNION:
                    List<Object> union = union(cur, ext);
                    int before = cur instanceof Collection ? ((Collection<?>) cur).size() : 0;
                    if (union.size() > before) patch.put(r.field, union, r.source);
                    break;
                default:
                    throw new IllegalStateException("unknown fill rule " + r.rule);
            }
        }
        return patch;
    }

    /** Rating and review count follow the review list once an item carries reviews. */
    static boolean isReviewDerived(CatalogField field) {
        return field == CatalogField.RATING || field == CatalogField.NUM_REVIEWS;
    }

    private static boolean hasReviews(CatalogItem item) {
        return item.getReviews() != null && !item.getReviews().isEmpty();
    }

    private static List<Object> union(Object current, Object external) {
        LinkedHashSet<Object> set = new LinkedHashSet<>();
        if (current instanceof Collection) set.addAll((Collection<?>) current);
        if (external instanceof Collection) set.addAll((Collection<?>) external);
        return new ArrayList<>(set);
    }

    static boolean isEmptyOrPlaceholder(CatalogField field, Object value) {
        if (isEmpty(value)) return true;
        if (field == CatalogField.DESCRIPTION && TextUtils.DESCRIPTION_PLACEHOLDER.equals(String.valueOf(value).trim())) return true;
        return false;
    }

    static boolean isEmpty(Object value) {
        if (value == null) return true;
        if (value instanceof String) return ((String) value).isBlank();
        if (value instanceof Collection) return ((Collection<?>) value).isEmpty();
        return false;
    }

    private static boolean sameValue(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue()) == 0;
        }
        return Objects.equals(a, b);
    }
}
