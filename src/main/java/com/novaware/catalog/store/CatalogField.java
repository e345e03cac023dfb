package com.novaware.catalog.store;

/**
 * Patchable catalog item fields with the column each one is persisted in.
 */
public enum CatalogField {
    NAME("name", ColumnType.TEXT),
    CATEGORY("category", ColumnType.TEXT),
    BRAND("brand", ColumnType.TEXT),
    DESCRIPTION("description", ColumnType.TEXT),
    IMAGES("images", ColumnType.JSONB),
    PRICE("price", ColumnType.DOUBLE),
    RATING("rating", ColumnType.DOUBLE),
    NUM_REVIEWS("num_reviews", ColumnType.INTEGER),
    REVIEWS("reviews", ColumnType.JSONB),
    VARIANTS("variants", ColumnType.JSONB),
    COLORS("colors", ColumnType.JSONB),
    COUNT_IN_STOCK("count_in_stock", ColumnType.INTEGER),
    EXTERNAL_KEY("external_key", ColumnType.TEXT),
    FEATURE_VECTOR("feature_vector", ColumnType.JSONB),
    COMPATIBLE_ITEMS("compatible_items", ColumnType.JSONB);

    public enum ColumnType { TEXT, DOUBLE, INTEGER, JSONB }

    private final String column;
    private final ColumnType type;

    CatalogField(String column, ColumnType type) {
        this.column = column;
        this.type = type;
    }

    public String column() { return column; }
    public ColumnType type() { return type; }

    public Class<?> javaType() {
        switch (type) {
            case DOUBLE: return Double.class;
            case INTEGER: return Integer.class;
            default: return String.class;
        }
    }
}
