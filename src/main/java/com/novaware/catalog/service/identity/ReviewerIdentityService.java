package com.novaware.catalog.service.identity;

import com.novaware.catalog.config.PipelineProperties;
import com.novaware.catalog.model.ReviewerIdentity;
import com.novaware.catalog.service.pipeline.PipelineContext;
import com.novaware.catalog.store.ReviewerIdentityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Maps external reviewer keys to internal identities, synthesizing missing ones within the
 * run's identity quota.
 *
 * <p>Existing identities are always reused. A missing reviewer gets a deterministic identity
 * while quota remains; once it is exhausted the reviewer stays unmapped for the run. Conflicts
 * with identities created concurrently are skipped, never fatal.
 */
@Service
public class ReviewerIdentityService {
    private static final Logger log = LoggerFactory.getLogger(ReviewerIdentityService.class);

    private final ReviewerIdentityStore store;
    private final PipelineProperties props;

    public ReviewerIdentityService(ReviewerIdentityStore store, PipelineProperties props) {
        this.store = store;
        this.props = props;
    }

    public ReviewerIdentity synthesize(String externalKey, long now) {
        String id = UUID.nameUUIDFromBytes(("reviewer:" + externalKey).getBytes(StandardCharsets.UTF_8)).toString();
        String shortKey = externalKey.length() > 8 ? externalKey.substring(0, 8) : externalKey;
        String email = "reviewer_" + externalKey.toLowerCase(Locale.ROOT) + "@" + props.getIdentityEmailDomain();
        return new ReviewerIdentity(id, externalKey, "Reviewer " + shortKey, email, now);
    }

    /** Loads the persisted identity count into the context unless already done. */
    public Mono<Void> initCounter(PipelineContext ctx) {
        if (ctx.isIdentityCountLoaded()) return Mono.empty();
        return store.count()
                .doOnNext(n -> {
                    ctx.initIdentityCount(n);
                    log.info("reviewer identities: {} persisted, quota {}, {} left", n, ctx.getIdentityQuota(),
                            ctx.remainingIdentityQuota());
                })
                .then();
    }

    public Mono<IdentityResolution> resolve(Collection<String> externalKeys, PipelineContext ctx) {
        Set<String> wanted = new LinkedHashSet<>();
        for (String k : externalKeys) {
            if (k != null && !k.isBlank()) wanted.add(k);
        }
        if (wanted.isEmpty()) return Mono.just(new IdentityResolution(Map.of(), Set.of(), 0));

        return initCounter(ctx)
                .then(store.findByExternalKeys(wanted).collectMap(ReviewerIdentity::getExternal_key))
                .flatMap(existing -> {
                    Map<String, ReviewerIdentity> found = new LinkedHashMap<>(existing);
                    Set<String> dropped = new LinkedHashSet<>();
                    List<ReviewerIdentity> candidates = new ArrayList<>();
                    long now = System.currentTimeMillis();
                    for (String key : wanted) {
                        if (found.containsKey(key)) continue;
                        if (ctx.tryReserveIdentity()) {
                            candidates.add(synthesize(key, now));
                        } else {
                            dropped.add(key);
                        }
                    }
                    if (candidates.isEmpty()) {
                        return Mono.just(new IdentityResolution(found, dropped, 0));
                    }
                    return Flux.fromIterable(candidates)
                            .concatMap(c -> store.existsByExternalKeyOrEmail(c.getExternal_key(), c.getEmail())
                                    .flatMap(exists -> {
                                        if (exists) {
                                            log.debug("identity for {} already exists, skipping creation", c.getExternal_key());
                                            ctx.releaseIdentity();
                                            return Mono.<ReviewerIdentity>empty();
                                        }
                                        return Mono.just(c);
                                    }))
                            .collectList()
                            .flatMap(fresh -> store.insertMany(fresh)
                                    .flatMap(result -> {
                                        int notWritten = fresh.size() - result.getWritten();
                                        for (int i = 0; i < notWritten; i++) ctx.releaseIdentity();
                                        if (result.getFailed() > 0 || result.getSkipped() > 0) {
                                            log.warn("identity insert: {}", result);
                                        }
                                        List<String> keys = new ArrayList<>();
                                        for (ReviewerIdentity c : candidates) keys.add(c.getExternal_key());
                                        return store.findByExternalKeys(keys).collectList()
                                                .map(persisted -> {
                                                    for (ReviewerIdentity p : persisted) found.put(p.getExternal_key(), p);
                                                    return new IdentityResolution(found, dropped, result.getWritten());
                                                });
                                    }));
                });
    }
}
