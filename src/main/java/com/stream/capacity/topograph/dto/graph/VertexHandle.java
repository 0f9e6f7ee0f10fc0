package com.stream.capacity.topograph.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * A vertex as it exists in the graph store.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VertexHandle {

    private String id;          // store-assigned element id
    private VertexLabel label;

    @Builder.Default
    private Map<String, Object> properties = new HashMap<>();

    public Object property(String name) {
        return properties.get(name);
    }
}
