package com.stream.capacity.topograph.dto.graph;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * A vertex to be created. The key identifies it inside one {@link GraphDelta} only; it is not stored.
 */
@Value
@Builder
public class VertexRecord {

    String key;

    VertexLabel label;

    @Singular("property")
    Map<String, Object> properties;

    public Object property(String name) {
        return properties.get(name);
    }
}
