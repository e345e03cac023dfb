package com.novaware.catalog.store.r2dbc;

import com.novaware.catalog.model.ReviewerIdentity;
import com.novaware.catalog.store.BulkWriteResult;
import com.novaware.catalog.store.ReviewerIdentityStore;
import com.novaware.catalog.store.StoreErrors;
import io.r2dbc.spi.Readable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public class R2dbcReviewerIdentityStore implements ReviewerIdentityStore {
    private static final Logger log = LoggerFactory.getLogger(R2dbcReviewerIdentityStore.class);

    private final DatabaseClient db;
    private final Mono<Void> schema;

    public R2dbcReviewerIdentityStore(DatabaseClient db) {
        this.db = db;
        this.schema = ensureSchema().cache();
    }

    private Mono<Void> ensureSchema() {
        String ddl = "CREATE TABLE IF NOT EXISTS reviewer_identities (" +
                "id TEXT PRIMARY KEY, " +
                "external_key TEXT NOT NULL UNIQUE, " +
                "name TEXT, " +
                "email TEXT NOT NULL UNIQUE, " +
                "created_at TIMESTAMPTZ DEFAULT NOW()" +
                ")";
        return db.sql(ddl).fetch().rowsUpdated().then().onErrorMap(StoreErrors::translate);
    }

    @Override
    public Mono<Void> init() {
        return schema;
    }

    @Override
    public Mono<Long> count() {
        return db.sql("SELECT COUNT(*) AS n FROM reviewer_identities")
                .map(row -> row.get("n", Long.class))
                .one()
                .defaultIfEmpty(0L)
                .onErrorMap(StoreErrors::translate);
    }

    @Override
    public Flux<ReviewerIdentity> findByExternalKeys(Collection<String> externalKeys) {
        if (externalKeys == null || externalKeys.isEmpty()) return Flux.empty();
        return db.sql("SELECT id, external_key, name, email, created_at FROM reviewer_identities " +
                        "WHERE external_key = ANY(:keys)")
                .bind("keys", externalKeys.toArray(new String[0]))
                .map(this::toIdentity)
                .all()
                .onErrorMap(StoreErrors::translate);
    }

    @Override
    public Mono<Boolean> existsByExternalKeyOrEmail(String externalKey, String email) {
        return db.sql("SELECT 1 FROM reviewer_identities WHERE external_key = :key OR email = :email LIMIT 1")
                .bind("key", externalKey)
                .bind("email", email)
                .fetch().first()
                .map(m -> true)
                .defaultIfEmpty(false)
                .onErrorMap(StoreErrors::translate);
    }

    @Override
    public Mono<BulkWriteResult> insertMany(List<ReviewerIdentity> identities) {
        if (identities == null || identities.isEmpty()) return Mono.just(BulkWriteResult.empty());
        return Flux.fromIterable(identities)
                .concatMap(i -> db.sql("INSERT INTO reviewer_identities(id, external_key, name, email, created_at) " +
                                "VALUES (:id, :key, :name, :email, :created_at) ON CONFLICT DO NOTHING")
                        .bind("id", i.getId())
                        .bind("key", i.getExternal_key())
                        .bind("name", i.getName())
                        .bind("email", i.getEmail())
                        .bind("created_at", Instant.ofEpochMilli(i.getCreated_at()))
                        .fetch().rowsUpdated()
                        .map(rows -> rows > 0 ? BulkWriteResult.empty().recordWritten() : BulkWriteResult.empty().recordSkipped())
                        .onErrorResume(e -> {
                            if (StoreErrors.isConnectionFailure(e)) return Mono.error(StoreErrors.translate(e));
                            log.warn("identity insert failed key={}: {}", i.getExternal_key(), e.toString());
                            return Mono.just(BulkWriteResult.empty().recordFailed(i.getId()));
                        }))
                .reduce(BulkWriteResult.empty(), BulkWriteResult::merge);
    }

    @Override
    public Flux<ReviewerIdentity> sample(int n, Collection<String> excludeIds) {
        if (n <= 0) return Flux.empty();
        String[] exclude = excludeIds == null ? new String[0] : excludeIds.toArray(new String[0]);
        return db.sql("SELECT id, external_key, name, email, created_at FROM reviewer_identities " +
                        "WHERE NOT (id = ANY(:exclude)) ORDER BY random() LIMIT :n")
                .bind("exclude", exclude)
                .bind("n", n)
                .map(this::toIdentity)
                .all()
                .onErrorMap(StoreErrors::translate);
    }

    private ReviewerIdentity toIdentity(Readable row) {
        Instant created = row.get("created_at", Instant.class);
        return new ReviewerIdentity(
                row.get("id", String.class),
                row.get("external_key", String.class),
                row.get("name", String.class),
                row.get("email", String.class),
                created != null ? created.toEpochMilli() : 0L);
    }
}
