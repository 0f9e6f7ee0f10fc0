package com.stream.capacity.topograph.service.graph;

import com.stream.capacity.topograph.dto.graph.EdgeLabel;
import com.stream.capacity.topograph.dto.graph.GraphProperty;
import com.stream.capacity.topograph.dto.graph.SnapshotSummary;
import com.stream.capacity.topograph.dto.graph.VertexHandle;
import com.stream.capacity.topograph.dto.graph.VertexLabel;
import com.stream.capacity.topograph.dto.graph.VertexQuery;
import com.stream.capacity.topograph.exception.VertexLookupException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Read and housekeeping operations over stored snapshots. Every query is scoped by topologyId and snapshotRef.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TopologyGraphQueryService {

    private final GraphStore graphStore;

    /**
     * Count vertices per label and edges per label of a stored snapshot.
     */
    public SnapshotSummary getSnapshotSummary(String topologyId, String snapshotRef) {
        Map<VertexLabel, Long> vertexCounts = new EnumMap<>(VertexLabel.class);
        for (VertexLabel label : VertexLabel.values()) {
            vertexCounts.put(label, graphStore.countVertices(topologyId, snapshotRef, label));
        }

        if (vertexCounts.values().stream().allMatch(count -> count == 0)) {
            throw new VertexLookupException(String.format(
                    "No vertices stored for topology=%s snapshot=%s", topologyId, snapshotRef));
        }

        Map<EdgeLabel, Long> edgeCounts = new EnumMap<>(EdgeLabel.class);
        for (EdgeLabel label : EdgeLabel.values()) {
            edgeCounts.put(label, graphStore.countEdges(topologyId, snapshotRef, label));
        }

        return SnapshotSummary.builder()
                .topologyId(topologyId)
                .snapshotRef(snapshotRef)
                .vertexCounts(vertexCounts)
                .edgeCounts(edgeCounts)
                .build();
    }

    /**
     * Vertices of a snapshot, optionally narrowed to one label and/or one component.
     */
    public List<VertexHandle> findVertices(String topologyId, String snapshotRef,
                                           VertexLabel label, String component) {
        VertexQuery query = VertexQuery.inSnapshot(topologyId, snapshotRef);
        if (label != null) {
            query = query.withLabel(label);
        }
        if (component != null && !component.isBlank()) {
            query = query.where(GraphProperty.COMPONENT, component);
        }
        log.debug("[graph-query] {}", query);
        return graphStore.findVertices(query);
    }

    public long deleteSnapshot(String topologyId, String snapshotRef) {
        log.info("[graph-query] Deleting topology {} snapshot {}", topologyId, snapshotRef);
        return graphStore.deleteSnapshot(topologyId, snapshotRef);
    }
}
