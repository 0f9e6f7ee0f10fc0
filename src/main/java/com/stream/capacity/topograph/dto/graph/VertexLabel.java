package com.stream.capacity.topograph.dto.graph;

import lombok.Getter;

/**
 * Vertex kinds of the topology graph, with the label each one carries in the store.
 */
@Getter
public enum VertexLabel {
    BROKER("Broker"),
    CONTAINER("Container"),
    SPOUT("Spout"),
    BOLT("Bolt");

    private final String value;

    VertexLabel(String value) {
        this.value = value;
    }

    public boolean isInstance() {
        return this == SPOUT || this == BOLT;
    }

    /**
     * Get the enum value from a store label or constant name, case-insensitive.
     */
    public static VertexLabel fromString(String value) {
        if (value == null) return null;
        for (VertexLabel label : values()) {
            if (label.value.equalsIgnoreCase(value) || label.name().equalsIgnoreCase(value)) {
                return label;
            }
        }
        return null;
    }
}
