package com.novaware.catalog.service.enrichment;

/** How an external value is merged into an existing catalog field. */
public enum FillRule {
    /** Written only when the catalog value is empty or a known placeholder. */
    FILL_IF_EMPTY,
    /** External value wins whenever it is present and differs. */
    AUTHORITATIVE,
    /** Existing values first, then new external values, without duplicates. */
    UNION
}
