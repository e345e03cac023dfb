package com.novaware.catalog.store;

import com.novaware.catalog.model.CatalogItem;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Persistence of catalog items, addressed by cursor rather than offset.
 *
 * <p>Implementations must surface an unreachable database as {@link CatalogConnectionException}
 * and treat every other per-record failure of a bulk write as a counted failure.
 */
public interface CatalogStore {

    /** Creates the backing schema if it is absent. */
    Mono<Void> init();

    /** Next {@code limit} items with {@code seq > cursor} matching the filter, in seq order. */
    Flux<CatalogItem> findBatchAfter(ItemFilter filter, long cursor, int limit);

    Mono<CatalogItem> findById(String id);

    Mono<Long> count(ItemFilter filter, long afterCursor);

    /** Applies each patch independently; a failing patch never aborts the others. */
    Mono<BulkWriteResult> applyPatches(List<ItemPatch> patches);

    /** Inserts items, skipping ids that already exist; a failing insert never aborts the others. */
    Mono<BulkWriteResult> insertMany(List<CatalogItem> items);
}
