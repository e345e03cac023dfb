package com.novaware.catalog.store.r2dbc;

import com.novaware.catalog.store.CheckpointStore;
import com.novaware.catalog.store.StoreErrors;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public class R2dbcCheckpointStore implements CheckpointStore {
    private final DatabaseClient db;
    private final Mono<Void> schema;

    public R2dbcCheckpointStore(DatabaseClient db) {
        this.db = db;
        this.schema = ensureSchema().cache();
    }

    private Mono<Void> ensureSchema() {
        String ddl = "CREATE TABLE IF NOT EXISTS pipeline_checkpoints (" +
                "stage TEXT PRIMARY KEY, " +
                "cursor_seq BIGINT NOT NULL, " +
                "updated_at TIMESTAMPTZ DEFAULT NOW()" +
                ")";
        return db.sql(ddl).fetch().rowsUpdated().then().onErrorMap(StoreErrors::translate);
    }

    @Override
    public Mono<Void> init() {
        return schema;
    }

    @Override
    public Mono<Long> load(String stage) {
        return db.sql("SELECT cursor_seq FROM pipeline_checkpoints WHERE stage = :stage")
                .bind("stage", stage)
                .map(row -> row.get("cursor_seq", Long.class))
                .one()
                .onErrorMap(StoreErrors::translate);
    }

    @Override
    public Mono<Void> save(String stage, long cursor) {
        return db.sql("INSERT INTO pipeline_checkpoints(stage, cursor_seq, updated_at) VALUES (:stage, :cursor, NOW()) " +
                        "ON CONFLICT (stage) DO UPDATE SET cursor_seq = EXCLUDED.cursor_seq, updated_at = NOW()")
                .bind("stage", stage)
                .bind("cursor", cursor)
                .fetch().rowsUpdated()
                .then()
                .onErrorMap(StoreErrors::translate);
    }
}
