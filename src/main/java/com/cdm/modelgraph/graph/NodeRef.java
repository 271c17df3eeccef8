package com.cdm.modelgraph.graph;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshot of a node as read from the store. {@code elementId} is the
 * store's own identity; {@code id} and {@code name} are domain properties.
 */
@Value
public class NodeRef {

    String elementId;
    String label;
    Map<String, Object> properties;

    public NodeRef(String elementId, String label, Map<String, Object> properties) {
        this.elementId = elementId;
        this.label = label;
        this.properties = properties == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public String getString(String key) {
        Object value = properties.get(key);
        return value == null ? null : value.toString();
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        return value == null ? fallback : value;
    }

    public Integer getInt(String key) {
        Object value = properties.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return value == null ? null : Integer.valueOf(value.toString());
    }

    public String getId() {
        return getString("id");
    }

    public String getName() {
        return getString("name");
    }
}
