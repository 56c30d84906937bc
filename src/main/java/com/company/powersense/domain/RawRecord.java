package com.company.powersense.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Loosely structured upstream row: field name to scalar, in arrival order.
 * Only the ingestion boundary handles these; normalization turns them into {@link Measurement}s.
 */
public final class RawRecord {

    private final Map<String, Object> fields;

    public RawRecord(Map<String, ?> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static RawRecord of(Map<String, ?> fields) {
        return new RawRecord(fields);
    }

    public Object get(String name) {
        return fields.get(name);
    }

    public String getString(String name) {
        Object value = fields.get(name);
        return value == null ? null : value.toString();
    }

    public boolean has(String name) {
        return fields.get(name) != null;
    }

    public Set<Map.Entry<String, Object>> entries() {
        return fields.entrySet();
    }

    public int size() {
        return fields.size();
    }

    @Override
    public String toString() {
        return "RawRecord" + fields;
    }
}
