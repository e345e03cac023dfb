package com.novaware.catalog.service.enrichment;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.novaware.catalog.store.CatalogField;
import com.novaware.catalog.store.ItemPatch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Field updates computed for one item, with the external source of each value.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FieldPatch {
    private final Map<CatalogField, Object> updates = new LinkedHashMap<>();
    private final Map<CatalogField, String> sources = new LinkedHashMap<>();

    public void put(CatalogField field, Object value, String source) {
        updates.put(field, value);
        sources.put(field, source);
    }

    public boolean isEmpty() {
        return updates.isEmpty();
    }

    public Map<CatalogField, Object> getUpdates() {
        return Collections.unmodifiableMap(updates);
    }

    public Map<CatalogField, String> getSources() {
        return Collections.unmodifiableMap(sources);
    }

    public ItemPatch toItemPatch(String itemId) {
        ItemPatch patch = new ItemPatch(itemId);
        updates.forEach(patch::set);
        return patch;
    }
}
