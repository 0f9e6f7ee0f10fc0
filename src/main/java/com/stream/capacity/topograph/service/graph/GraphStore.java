package com.stream.capacity.topograph.service.graph;

import com.stream.capacity.topograph.dto.graph.EdgeLabel;
import com.stream.capacity.topograph.dto.graph.GraphDelta;
import com.stream.capacity.topograph.dto.graph.VertexHandle;
import com.stream.capacity.topograph.dto.graph.VertexLabel;
import com.stream.capacity.topograph.dto.graph.VertexQuery;

import java.util.List;
import java.util.Map;

/**
 * Property-graph database holding topology snapshots.
 * Every operation blocks until the store has acknowledged it; failures surface as
 * {@link com.stream.capacity.topograph.exception.GraphStoreException}.
 */
public interface GraphStore {

    VertexHandle addVertex(VertexLabel label, Map<String, Object> properties);

    void addEdge(VertexHandle from, EdgeLabel label, VertexHandle to, Map<String, Object> properties);

    List<VertexHandle> findVertices(VertexQuery query);

    /**
     * Number of vertices with the given label in the snapshot.
     */
    long countVertices(String topologyId, String snapshotRef, VertexLabel label);

    /**
     * Number of edges with the given label leaving vertices of the snapshot.
     */
    long countEdges(String topologyId, String snapshotRef, EdgeLabel label);

    /**
     * Atomically replaces whatever is stored for the delta's (topologyId, snapshotRef) with the delta.
     * Either the whole delta becomes visible or nothing changes.
     */
    void replaceSnapshot(GraphDelta delta);

    /**
     * Removes every vertex of the snapshot together with its edges.
     *
     * @return number of vertices removed
     */
    long deleteSnapshot(String topologyId, String snapshotRef);
}
