package com.novaware.catalog.store;

/** Subsets of the catalog a batch stage walks through. */
public enum ItemFilter {
    ALL(""),
    UNRESOLVED(" AND (external_key IS NULL OR external_key = '')"),
    RESOLVED(" AND external_key IS NOT NULL AND external_key <> ''");

    private final String sqlPredicate;

    ItemFilter(String sqlPredicate) {
        this.sqlPredicate = sqlPredicate;
    }

    /** Predicate appended to a WHERE clause that already has a condition. */
    public String sqlPredicate() {
        return sqlPredicate;
    }
}
