package com.stream.capacity.topograph.dto.graph;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Every vertex and edge of one topology snapshot, in creation order.
 * Edges reference vertices through {@link VertexRecord#getKey()}.
 */
@Value
@Builder
public class GraphDelta {

    String topologyId;

    String snapshotRef;

    @Singular("vertex")
    List<VertexRecord> vertices;

    @Singular("edge")
    List<EdgeRecord> edges;

    public long countVertices(VertexLabel label) {
        return vertices.stream().filter(v -> v.getLabel() == label).count();
    }

    public long countEdges(EdgeLabel label) {
        return edges.stream().filter(e -> e.getLabel() == label).count();
    }

    public Map<VertexLabel, Long> vertexCounts() {
        Map<VertexLabel, Long> counts = new EnumMap<>(VertexLabel.class);
        for (VertexLabel label : VertexLabel.values()) {
            counts.put(label, countVertices(label));
        }
        return counts;
    }

    public Map<EdgeLabel, Long> edgeCounts() {
        Map<EdgeLabel, Long> counts = new EnumMap<>(EdgeLabel.class);
        for (EdgeLabel label : EdgeLabel.values()) {
            counts.put(label, countEdges(label));
        }
        return counts;
    }
}
