package com.stream.capacity.topograph.service.graph;

import com.stream.capacity.topograph.dto.graph.EdgeLabel;
import com.stream.capacity.topograph.dto.graph.EdgeRecord;
import com.stream.capacity.topograph.dto.graph.GraphDelta;
import com.stream.capacity.topograph.dto.graph.GraphProperty;
import com.stream.capacity.topograph.dto.graph.VertexHandle;
import com.stream.capacity.topograph.dto.graph.VertexLabel;
import com.stream.capacity.topograph.dto.graph.VertexQuery;
import com.stream.capacity.topograph.dto.graph.VertexRecord;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link GraphStore} kept in memory, for tests that need to query what a build wrote.
 */
public class InMemoryGraphStore implements GraphStore {

    private final List<VertexHandle> vertices = new ArrayList<>();
    private final List<StoredEdge> edges = new ArrayList<>();
    private int nextId = 1;

    @Override
    public VertexHandle addVertex(VertexLabel label, Map<String, Object> properties) {
        VertexHandle handle = VertexHandle.builder()
                .id(String.valueOf(nextId++))
                .label(label)
                .properties(new HashMap<>(properties))
                .build();
        vertices.add(handle);
        return handle;
    }

    @Override
    public void addEdge(VertexHandle from, EdgeLabel label, VertexHandle to, Map<String, Object> properties) {
        edges.add(new StoredEdge(from.getId(), label, to.getId(), new HashMap<>(properties)));
    }

    @Override
    public List<VertexHandle> findVertices(VertexQuery query) {
        return vertices.stream()
                .filter(v -> query.matches(v.getLabel(), v.getProperties()))
                .collect(Collectors.toList());
    }

    @Override
    public long countVertices(String topologyId, String snapshotRef, VertexLabel label) {
        return findVertices(VertexQuery.inSnapshot(topologyId, snapshotRef).withLabel(label)).size();
    }

    @Override
    public long countEdges(String topologyId, String snapshotRef, EdgeLabel label) {
        return edgesOf(topologyId, snapshotRef, label).size();
    }

    @Override
    public void replaceSnapshot(GraphDelta delta) {
        Set<String> keys = delta.getVertices().stream().map(VertexRecord::getKey).collect(Collectors.toSet());
        for (EdgeRecord edge : delta.getEdges()) {
            if (!keys.contains(edge.getFromKey()) || !keys.contains(edge.getToKey())) {
                throw new IllegalStateException("Edge references a vertex outside the delta: " + edge);
            }
        }

        deleteSnapshot(delta.getTopologyId(), delta.getSnapshotRef());

        Map<String, VertexHandle> created = new HashMap<>();
        for (VertexRecord vertex : delta.getVertices()) {
            created.put(vertex.getKey(), addVertex(vertex.getLabel(), vertex.getProperties()));
        }
        for (EdgeRecord edge : delta.getEdges()) {
            addEdge(created.get(edge.getFromKey()), edge.getLabel(), created.get(edge.getToKey()),
                    edge.getProperties());
        }
    }

    @Override
    public long deleteSnapshot(String topologyId, String snapshotRef) {
        Set<String> ids = findVertices(VertexQuery.inSnapshot(topologyId, snapshotRef)).stream()
                .map(VertexHandle::getId)
                .collect(Collectors.toSet());
        vertices.removeIf(v -> ids.contains(v.getId()));
        edges.removeIf(e -> ids.contains(e.fromId) || ids.contains(e.toId));
        return ids.size();
    }

    public List<StoredEdge> edgesOf(String topologyId, String snapshotRef, EdgeLabel label) {
        Set<String> ids = findVertices(VertexQuery.inSnapshot(topologyId, snapshotRef)).stream()
                .map(VertexHandle::getId)
                .collect(Collectors.toSet());
        return edges.stream()
                .filter(e -> e.label == label && ids.contains(e.fromId))
                .collect(Collectors.toList());
    }

    public VertexHandle vertex(String id) {
        return vertices.stream().filter(v -> v.getId().equals(id)).findFirst().orElseThrow();
    }

    public int vertexCount() {
        return vertices.size();
    }

    public static final class StoredEdge {

        public final String fromId;
        public final EdgeLabel label;
        public final String toId;
        public final Map<String, Object> properties;

        StoredEdge(String fromId, EdgeLabel label, String toId, Map<String, Object> properties) {
            this.fromId = fromId;
            this.label = label;
            this.toId = toId;
            this.properties = properties;
        }

        public Object property(String name) {
            return properties.get(name);
        }

        public boolean isTagged(String topologyId, String snapshotRef) {
            return topologyId.equals(properties.get(GraphProperty.TOPOLOGY_ID))
                    && snapshotRef.equals(properties.get(GraphProperty.SNAPSHOT_REF));
        }
    }
}
