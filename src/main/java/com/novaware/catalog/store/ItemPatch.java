package com.novaware.catalog.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Field-level update of one catalog item. Fields not present are left untouched.
 *
 * <p>A patch that sets {@link CatalogField#EXTERNAL_KEY} only takes effect on items whose
 * external key is still empty.
 */
public class ItemPatch {
    private final String id;
    private final Map<CatalogField, Object> fields = new LinkedHashMap<>();

    public ItemPatch(String id) {
        this.id = id;
    }

    public ItemPatch set(CatalogField field, Object value) {
        fields.put(field, value);
        return this;
    }

    public String getId() { return id; }

    public Map<CatalogField, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public boolean setsExternalKey() {
        return fields.containsKey(CatalogField.EXTERNAL_KEY);
    }

    @Override
    public String toString() {
        return "ItemPatch{id=" + id + ", fields=" + fields.keySet() + "}";
    }
}
