package com.cdm.modelgraph.graph;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Value
public class EdgeRef {

    String elementId;
    String type;
    NodeRef from;
    NodeRef to;
    Map<String, Object> properties;

    public EdgeRef(String elementId, String type, NodeRef from, NodeRef to, Map<String, Object> properties) {
        this.elementId = elementId;
        this.type = type;
        this.from = from;
        this.to = to;
        this.properties = properties == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public String getString(String key) {
        Object value = properties.get(key);
        return value == null ? null : value.toString();
    }
}
