package com.stream.capacity.topograph.dto.graph;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Conjunctive equality filter over vertex properties, optionally restricted to one label.
 */
@Getter
public class VertexQuery {

    private final VertexLabel label;
    private final Map<String, Object> equalities;

    private VertexQuery(VertexLabel label, Map<String, Object> equalities) {
        this.label = label;
        this.equalities = Collections.unmodifiableMap(equalities);
    }

    public static VertexQuery inSnapshot(String topologyId, String snapshotRef) {
        Map<String, Object> equalities = new LinkedHashMap<>();
        equalities.put(GraphProperty.TOPOLOGY_ID, topologyId);
        equalities.put(GraphProperty.SNAPSHOT_REF, snapshotRef);
        return new VertexQuery(null, equalities);
    }

    public VertexQuery withLabel(VertexLabel newLabel) {
        return new VertexQuery(newLabel, new LinkedHashMap<>(equalities));
    }

    public VertexQuery where(String property, Object value) {
        Map<String, Object> next = new LinkedHashMap<>(equalities);
        next.put(property, value);
        return new VertexQuery(label, next);
    }

    public boolean matches(VertexLabel candidateLabel, Map<String, Object> properties) {
        if (label != null && label != candidateLabel) {
            return false;
        }
        for (Map.Entry<String, Object> e : equalities.entrySet()) {
            Object actual = properties.get(e.getKey());
            if (!valueEquals(e.getValue(), actual)) {
                return false;
            }
        }
        return true;
    }

    // Stores widen integers to long; compare numbers by value
    private static boolean valueEquals(Object expected, Object actual) {
        if (expected instanceof Number && actual instanceof Number) {
            return ((Number) expected).longValue() == ((Number) actual).longValue();
        }
        return expected == null ? actual == null : expected.equals(actual);
    }

    @Override
    public String toString() {
        return "VertexQuery{label=" + label + ", " + equalities + "}";
    }
}
