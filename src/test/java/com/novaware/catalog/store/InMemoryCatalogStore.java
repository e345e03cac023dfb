package com.novaware.catalog.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.novaware.catalog.config.JacksonConfig;
import com.novaware.catalog.model.CatalogItem;
import com.novaware.catalog.model.ColorOption;
import com.novaware.catalog.model.Review;
import com.novaware.catalog.model.Variant;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.net.ConnectException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Catalog store kept in a map. Items are copied on the way in and out, like rows of a database,
 * so callers never share instances with the store.
 */
public class InMemoryCatalogStore implements CatalogStore {
    private final ObjectMapper mapper = new JacksonConfig().objectMapper();
    private final Map<String, CatalogItem> items = new LinkedHashMap<>();
    private final Set<String> failingIds = new HashSet<>();
    private final List<Long> requestedCursors = new ArrayList<>();
    private long nextSeq = 1;
    private boolean connectionDown;

    /** Stores a copy of the item with the next seq and returns that copy. */
    public synchronized CatalogItem add(CatalogItem item) {
        CatalogItem stored = copy(item);
        stored.setSeq(nextSeq++);
        items.put(stored.getId(), stored);
        return copy(stored);
    }

    public synchronized void delete(String id) {
        items.remove(id);
    }

    public synchronized CatalogItem get(String id) {
        CatalogItem item = items.get(id);
        return item != null ? copy(item) : null;
    }

    public synchronized List<CatalogItem> all() {
        return items.values().stream()
                .sorted(Comparator.comparing(CatalogItem::getSeq))
                .map(this::copy)
                .collect(Collectors.toList());
    }

    /** Writes of this id fail with a per-record error. */
    public void failWritesFor(String id) {
        failingIds.add(id);
    }

    /** Every later call fails as if the database went away. */
    public void takeConnectionDown() {
        connectionDown = true;
    }

    public synchronized List<Long> getRequestedCursors() {
        return new ArrayList<>(requestedCursors);
    }

    @Override
    public Mono<Void> init() {
        return Mono.empty();
    }

    @Override
    public Flux<CatalogItem> findBatchAfter(ItemFilter filter, long cursor, int limit) {
        return Flux.defer(() -> {
            if (connectionDown) return Flux.error(connectionError());
            synchronized (this) {
                requestedCursors.add(cursor);
                List<CatalogItem> batch = items.values().stream()
                        .filter(i -> i.getSeq() > cursor && matches(filter, i))
                        .sorted(Comparator.comparing(CatalogItem::getSeq))
                        .limit(limit)
                        .map(this::copy)
                        .collect(Collectors.toList());
                return Flux.fromIterable(batch);
            }
        });
    }

    @Override
    public Mono<CatalogItem> findById(String id) {
        return Mono.defer(() -> Mono.justOrEmpty(get(id)));
    }

    @Override
    public Mono<Long> count(ItemFilter filter, long afterCursor) {
        return Mono.defer(() -> {
            if (connectionDown) return Mono.error(connectionError());
            synchronized (this) {
                return Mono.just(items.values().stream().filter(i -> i.getSeq() > afterCursor && matches(filter, i)).count());
            }
        });
    }

    @Override
    public Mono<BulkWriteResult> applyPatches(List<ItemPatch> patches) {
        return Mono.defer(() -> {
            if (connectionDown) return Mono.error(connectionError());
            BulkWriteResult result = BulkWriteResult.empty();
            synchronized (this) {
                for (ItemPatch patch : patches) {
                    CatalogItem stored = items.get(patch.getId());
                    if (failingIds.contains(patch.getId())) {
                        result.recordFailed(patch.getId());
                    } else if (stored == null || patch.isEmpty()) {
                        result.recordSkipped();
                    } else if (apply(patch, stored)) {
                        items.put(stored.getId(), copy(stored));
                        result.recordWritten();
                    } else {
                        result.recordSkipped();
                    }
                }
            }
            return Mono.just(result);
        });
    }

    @Override
    public Mono<BulkWriteResult> insertMany(List<CatalogItem> toInsert) {
        return Mono.defer(() -> {
            if (connectionDown) return Mono.error(connectionError());
            BulkWriteResult result = BulkWriteResult.empty();
            for (CatalogItem item : toInsert) {
                if (failingIds.contains(item.getId())) {
                    result.recordFailed(item.getId());
                } else if (get(item.getId()) != null) {
                    result.recordSkipped();
                } else {
                    add(item);
                    result.recordWritten();
                }
            }
            return Mono.just(result);
        });
    }

    private CatalogItem copy(CatalogItem item) {
        try {
            return mapper.readValue(mapper.writeValueAsBytes(item), CatalogItem.class);
        } catch (IOException e) {
            throw new IllegalStateException("cannot copy item " + item.getId(), e);
        }
    }

    private static CatalogConnectionException connectionError() {
        return new CatalogConnectionException(new ConnectException("Connection refused"));
    }

    public static boolean matches(ItemFilter filter, CatalogItem item) {
        switch (filter) {
            case UNRESOLVED: return !item.isResolved();
            case RESOLVED: return item.isResolved();
            default: return true;
        }
    }

    /**
     * Applies a patch the way the database update does.
     *
     * @return false when the patch was refused because the item is already resolved
     */
    @SuppressWarnings("unchecked")
    public static boolean apply(ItemPatch patch, CatalogItem item) {
        if (patch.setsExternalKey() && item.isResolved()) return false;
        for (Map.Entry<CatalogField, Object> e : patch.getFields().entrySet()) {
            Object v = e.getValue();
            switch (e.getKey()) {
                case NAME: item.setName((String) v); break;
                case CATEGORY: item.setCategory((String) v); break;
                case BRAND: item.setBrand((String) v); break;
                case DESCRIPTION: item.setDescription((String) v); break;
                case IMAGES: item.setImages((List<String>) v); break;
                case PRICE: item.setPrice((Double) v); break;
                case RATING: item.setRating((Double) v); break;
                case NUM_REVIEWS: item.setNum_reviews((Integer) v); break;
                case REVIEWS: item.setReviews((List<Review>) v); break;
                case VARIANTS: item.setVariants((List<Variant>) v); break;
                case COLORS: item.setColors((List<ColorOption>) v); break;
                case COUNT_IN_STOCK: item.setCount_in_stock((Integer) v); break;
                case EXTERNAL_KEY: item.setExternal_key((String) v); break;
                case FEATURE_VECTOR: item.setFeature_vector((List<Double>) v); break;
                case COMPATIBLE_ITEMS: item.setCompatible_items((List<String>) v); break;
                default: throw new IllegalArgumentException("Unsupported field " + e.getKey());
            }
        }
        return true;
    }
}
