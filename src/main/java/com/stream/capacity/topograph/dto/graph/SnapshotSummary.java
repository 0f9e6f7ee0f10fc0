package com.stream.capacity.topograph.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Vertex and edge counts of one (topologyId, snapshotRef) graph.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SnapshotSummary {

    private String topologyId;
    private String snapshotRef;

    private Map<VertexLabel, Long> vertexCounts;   // BROKER: 3, CONTAINER: 3, ...
    private Map<EdgeLabel, Long> edgeCounts;

    public static SnapshotSummary of(GraphDelta delta) {
        return SnapshotSummary.builder()
                .topologyId(delta.getTopologyId())
                .snapshotRef(delta.getSnapshotRef())
                .vertexCounts(delta.vertexCounts())
                .edgeCounts(delta.edgeCounts())
                .build();
    }
}
