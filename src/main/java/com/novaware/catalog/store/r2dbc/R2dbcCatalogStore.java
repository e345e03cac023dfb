package com.novaware.catalog.store.r2dbc;

import com.fasterxml.jackson.core.type.TypeReference;
import com.novaware.catalog.model.CatalogItem;
import com.novaware.catalog.model.ColorOption;
import com.novaware.catalog.model.Review;
import com.novaware.catalog.model.Variant;
import com.novaware.catalog.store.BulkWriteResult;
import com.novaware.catalog.store.CatalogField;
import com.novaware.catalog.store.CatalogStore;
import com.novaware.catalog.store.ItemFilter;
import com.novaware.catalog.store.ItemPatch;
import com.novaware.catalog.store.StoreErrors;
import io.r2dbc.spi.Readable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

@Repository
public class R2dbcCatalogStore implements CatalogStore {
    private static final Logger log = LoggerFactory.getLogger(R2dbcCatalogStore.class);

    private static final TypeReference<List<String>> STRINGS = new TypeReference<>() {};
    private static final TypeReference<List<Double>> DOUBLES = new TypeReference<>() {};
    private static final TypeReference<List<Review>> REVIEWS = new TypeReference<>() {};
    private static final TypeReference<List<Variant>> VARIANTS = new TypeReference<>() {};
    private static final TypeReference<List<ColorOption>> COLORS = new TypeReference<>() {};
    private static final TypeReference<Map<String, Integer>> SIZE_STOCK = new TypeReference<>() {};

    private static final String COLUMNS = "id, seq, name, category, brand, description, price, rating, " +
            "num_reviews, count_in_stock, external_key, " +
            "images::text AS images, reviews::text AS reviews, variants::text AS variants, " +
            "size_stock::text AS size_stock, colors::text AS colors, " +
            "feature_vector::text AS feature_vector, compatible_items::text AS compatible_items";

    private final DatabaseClient db;
    private final JsonColumns json;
    private final Mono<Void> schema;

    public R2dbcCatalogStore(DatabaseClient db, JsonColumns json) {
        this.db = db;
        this.json = json;
        this.schema = ensureSchema().cache();
    }

    private Mono<Void> ensureSchema() {
        String ddl = "CREATE TABLE IF NOT EXISTS catalog_items (" +
                "id TEXT PRIMARY KEY, " +
                "seq BIGSERIAL UNIQUE, " +
                "name TEXT, " +
                "category TEXT, " +
                "brand TEXT, " +
                "description TEXT, " +
                "images JSONB, " +
                "price DOUBLE PRECISION, " +
                "rating DOUBLE PRECISION, " +
                "num_reviews INTEGER, " +
                "reviews JSONB, " +
                "variants JSONB, " +
                "size_stock JSONB, " +
                "colors JSONB, " +
                "count_in_stock INTEGER, " +
                "external_key TEXT, " +
                "feature_vector JSONB, " +
                "compatible_items JSONB" +
                ")";
        return db.sql(ddl).fetch().rowsUpdated()
                .then(db.sql("CREATE INDEX IF NOT EXISTS catalog_items_external_key_idx ON catalog_items(external_key)")
                        .fetch().rowsUpdated())
                .then()
                .onErrorMap(StoreErrors::translate);
    }

    @Override
    public Mono<Void> init() {
        return schema;
    }

    @Override
    public Flux<CatalogItem> findBatchAfter(ItemFilter filter, long cursor, int limit) {
        return db.sql("SELECT " + COLUMNS + " FROM catalog_items WHERE seq > :cursor" + filter.sqlPredicate() +
                        " ORDER BY seq LIMIT :limit")
                .bind("cursor", cursor)
                .bind("limit", limit)
                .map(this::toItem)
                .all()
                .onErrorMap(StoreErrors::translate);
    }

    @Override
    public Mono<CatalogItem> findById(String id) {
        return db.sql("SELECT " + COLUMNS + " FROM catalog_items WHERE id = :id")
                .bind("id", id)
                .map(this::toItem)
                .one()
                .onErrorMap(StoreErrors::translate);
    }

    @Override
    public Mono<Long> count(ItemFilter filter, long afterCursor) {
        return db.sql("SELECT COUNT(*) AS n FROM catalog_items WHERE seq > :cursor" + filter.sqlPredicate())
                .bind("cursor", afterCursor)
                .map(row -> row.get("n", Long.class))
                .one()
                .defaultIfEmpty(0L)
                .onErrorMap(StoreErrors::translate);
    }

    @Override
    public Mono<BulkWriteResult> applyPatches(List<ItemPatch> patches) {
        if (patches == null || patches.isEmpty()) return Mono.just(BulkWriteResult.empty());
        return Flux.fromIterable(patches)
                .concatMap(p -> update(p)
                        .map(rows -> rows > 0 ? BulkWriteResult.empty().recordWritten() : BulkWriteResult.empty().recordSkipped())
                        .onErrorResume(e -> perRecordFailure(p.getId(), "update", e)))
                .reduce(BulkWriteResult.empty(), BulkWriteResult::merge);
    }

    private Mono<Long> update(ItemPatch patch) {
        if (patch.isEmpty()) return Mono.just(0L);
        StringBuilder sql = new StringBuilder("UPDATE catalog_items SET ");
        boolean first = true;
        for (CatalogField f : patch.getFields().keySet()) {
            if (!first) sql.append(", ");
            first = false;
            sql.append(f.column()).append(" = ");
            if (f.type() == CatalogField.ColumnType.JSONB) {
                sql.append("CAST(:").append(f.column()).append(" AS JSONB)");
            } else {
                sql.append(':').append(f.column());
            }
        }
        sql.append(" WHERE id = :id");
        if (patch.setsExternalKey()) {
            sql.append(" AND (external_key IS NULL OR external_key = '')");
        }
        DatabaseClient.GenericExecuteSpec spec = db.sql(sql.toString()).bind("id", patch.getId());
        for (Map.Entry<CatalogField, Object> e : patch.getFields().entrySet()) {
            CatalogField f = e.getKey();
            Object value = f.type() == CatalogField.ColumnType.JSONB ? json.write(e.getValue()) : e.getValue();
            spec = bindNullable(spec, f.column(), value, f.javaType());
        }
        return spec.fetch().rowsUpdated();
    }

    @Override
    public Mono<BulkWriteResult> insertMany(List<CatalogItem> items) {
        if (items == null || items.isEmpty()) return Mono.just(BulkWriteResult.empty());
        return Flux.fromIterable(items)
                .concatMap(item -> insert(item)
                        .map(rows -> rows > 0 ? BulkWriteResult.empty().recordWritten() : BulkWriteResult.empty().recordSkipped())
                        .onErrorResume(e -> perRecordFailure(item.getId(), "insert", e)))
                .reduce(BulkWriteResult.empty(), BulkWriteResult::merge);
    }

    private Mono<Long> insert(CatalogItem item) {
        String sql = "INSERT INTO catalog_items(id, name, category, brand, description, images, price, rating, " +
                "num_reviews, reviews, variants, size_stock, colors, count_in_stock, external_key, feature_vector, compatible_items) " +
                "VALUES (:id, :name, :category, :brand, :description, CAST(:images AS JSONB), :price, :rating, " +
                ":num_reviews, CAST(:reviews AS JSONB), CAST(:variants AS JSONB), CAST(:size_stock AS JSONB), " +
                "CAST(:colors AS JSONB), :count_in_stock, :external_key, CAST(:feature_vector AS JSONB), " +
                "CAST(:compatible_items AS JSONB)) ON CONFLICT (id) DO NOTHING";
        DatabaseClient.GenericExecuteSpec spec = db.sql(sql).bind("id", item.getId());
        spec = bindNullable(spec, "name", item.getName(), String.class);
        spec = bindNullable(spec, "category", item.getCategory(), String.class);
        spec = bindNullable(spec, "brand", item.getBrand(), String.class);
        spec = bindNullable(spec, "description", item.getDescription(), String.class);
        spec = bindNullable(spec, "images", json.write(item.getImages()), String.class);
        spec = bindNullable(spec, "price", item.getPrice(), Double.class);
        spec = bindNullable(spec, "rating", item.getRating(), Double.class);
        spec = bindNullable(spec, "num_reviews", item.getNum_reviews(), Integer.class);
        spec = bindNullable(spec, "reviews", json.write(item.getReviews()), String.class);
        spec = bindNullable(spec, "variants", json.write(item.getVariants()), String.class);
        spec = bindNullable(spec, "size_stock", json.write(item.getSize_stock()), String.class);
        spec = bindNullable(spec, "colors", json.write(item.getColors()), String.class);
        spec = bindNullable(spec, "count_in_stock", item.getCount_in_stock(), Integer.class);
        spec = bindNullable(spec, "external_key", item.getExternal_key(), String.class);
        spec = bindNullable(spec, "feature_vector", json.write(item.getFeature_vector()), String.class);
        spec = bindNullable(spec, "compatible_items", json.write(item.getCompatible_items()), String.class);
        return spec.fetch().rowsUpdated();
    }

    private Mono<BulkWriteResult> perRecordFailure(String id, String op, Throwable e) {
        if (StoreErrors.isConnectionFailure(e)) {
            return Mono.error(StoreErrors.translate(e));
        }
        log.warn("catalog {} failed id={}: {}", op, id, e.toString());
        return Mono.just(BulkWriteResult.empty().recordFailed(id));
    }

    static DatabaseClient.GenericExecuteSpec bindNullable(DatabaseClient.GenericExecuteSpec spec, String name,
                                                          Object value, Class<?> type) {
        return value == null ? spec.bindNull(name, type) : spec.bind(name, value);
    }

    private CatalogItem toItem(Readable row) {
        CatalogItem item = new CatalogItem();
        item.setId(row.get("id", String.class));
        item.setSeq(row.get("seq", Long.class));
        item.setName(row.get("name", String.class));
        item.setCategory(row.get("category", String.class));
        item.setBrand(row.get("brand", String.class));
        item.setDescription(row.get("description", String.class));
        item.setPrice(row.get("price", Double.class));
        item.setRating(row.get("rating", Double.class));
        item.setNum_reviews(row.get("num_reviews", Integer.class));
        item.setCount_in_stock(row.get("count_in_stock", Integer.class));
        item.setExternal_key(row.get("external_key", String.class));
        item.setImages(json.read(row.get("images", String.class), STRINGS));
        item.setReviews(json.read(row.get("reviews", String.class), REVIEWS));
        item.setVariants(json.read(row.get("variants", String.class), VARIANTS));
        item.setSize_stock(json.read(row.get("size_stock", String.class), SIZE_STOCK));
        item.setColors(json.read(row.get("colors", String.class), COLORS));
        item.setFeature_vector(json.read(row.get("feature_vector", String.class), DOUBLES));
        item.setCompatible_items(json.read(row.get("compatible_items", String.class), STRINGS));
        return item;
    }
}
