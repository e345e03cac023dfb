package com.novaware.catalog.store;

import com.novaware.catalog.model.ReviewerIdentity;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.List;

public interface ReviewerIdentityStore {

    Mono<Void> init();

    Mono<Long> count();

    Flux<ReviewerIdentity> findByExternalKeys(Collection<String> externalKeys);

    Mono<Boolean> existsByExternalKeyOrEmail(String externalKey, String email);

    /** Inserts identities; duplicates on external key or email are skipped, not failed. */
    Mono<BulkWriteResult> insertMany(List<ReviewerIdentity> identities);

    /** Up to {@code n} random identities whose id is not in {@code excludeIds}. */
    Flux<ReviewerIdentity> sample(int n, Collection<String> excludeIds);
}
