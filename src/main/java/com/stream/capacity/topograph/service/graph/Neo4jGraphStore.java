package com.stream.capacity.topograph.service.graph;

import com.stream.capacity.topograph.dto.graph.EdgeLabel;
import com.stream.capacity.topograph.dto.graph.EdgeRecord;
import com.stream.capacity.topograph.dto.graph.GraphDelta;
import com.stream.capacity.topograph.dto.graph.VertexHandle;
import com.stream.capacity.topograph.dto.graph.VertexLabel;
import com.stream.capacity.topograph.dto.graph.VertexQuery;
import com.stream.capacity.topograph.dto.graph.VertexRecord;
import com.stream.capacity.topograph.exception.GraphStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.neo4j.driver.TransactionContext;
import org.neo4j.driver.exceptions.Neo4jException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * {@link GraphStore} backed by Neo4j, speaking Cypher over the shared Bolt {@link Driver}.
 *
 * Labels come from {@link VertexLabel}/{@link EdgeLabel}; property keys used in query predicates
 * are restricted to identifiers since they are inlined into the Cypher text.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class Neo4jGraphStore implements GraphStore {

    private static final Pattern PROPERTY_KEY = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final Driver neo4jDriver;

    @Override
    public VertexHandle addVertex(VertexLabel label, Map<String, Object> properties) {
        String cypher = "CREATE (v:" + label.getValue() + ") SET v = $props RETURN elementId(v) AS id";
        String id = write(tx -> tx.run(cypher, Map.of("props", storable(properties)))
                .single().get("id").asString());
        log.debug("[graph-store] Created {} vertex {}", label.getValue(), id);
        return VertexHandle.builder()
                .id(id)
                .label(label)
                .properties(new HashMap<>(properties))
                .build();
    }

    @Override
    public void addEdge(VertexHandle from, EdgeLabel label, VertexHandle to, Map<String, Object> properties) {
        String cypher = "MATCH (a) WHERE elementId(a) = $from "
                + "MATCH (b) WHERE elementId(b) = $to "
                + "CREATE (a)-[r:" + label.getValue() + "]->(b) SET r = $props";
        write(tx -> tx.run(cypher, Map.of(
                "from", from.getId(),
                "to", to.getId(),
                "props", storable(properties))).consume());
        log.debug("[graph-store] Created {} edge {} -> {}", label.getValue(), from.getId(), to.getId());
    }

    @Override
    public List<VertexHandle> findVertices(VertexQuery query) {
        StringBuilder cypher = new StringBuilder("MATCH (v");
        if (query.getLabel() != null) {
            cypher.append(':').append(query.getLabel().getValue());
        }
        cypher.append(')');

        Map<String, Object> parameters = new HashMap<>();
        StringJoiner predicates = new StringJoiner(" AND ", " WHERE ", "");
        predicates.setEmptyValue("");
        int index = 0;
        for (Map.Entry<String, Object> e : query.getEqualities().entrySet()) {
            String parameter = "p" + index++;
            predicates.add("v." + propertyKey(e.getKey()) + " = $" + parameter);
            parameters.put(parameter, e.getValue());
        }
        cypher.append(predicates)
                .append(" RETURN elementId(v) AS id, labels(v) AS labels, properties(v) AS props");

        return read(tx -> tx.run(cypher.toString(), parameters).list(Neo4jGraphStore::toHandle));
    }

    @Override
    public long countVertices(String topologyId, String snapshotRef, VertexLabel label) {
        String cypher = "MATCH (v:" + label.getValue() + " {topologyId: $topologyId, snapshotRef: $snapshotRef}) "
                + "RETURN count(v) AS total";
        return read(tx -> tx.run(cypher, Map.of("topologyId", topologyId, "snapshotRef", snapshotRef))
                .single().get("total").asLong());
    }

    @Override
    public long countEdges(String topologyId, String snapshotRef, EdgeLabel label) {
        String cypher = "MATCH (a {topologyId: $topologyId, snapshotRef: $snapshotRef})-[r:"
                + label.getValue() + "]->() RETURN count(r) AS total";
        return read(tx -> tx.run(cypher, Map.of("topologyId", topologyId, "snapshotRef", snapshotRef))
                .single().get("total").asLong());
    }

    @Override
    public void replaceSnapshot(GraphDelta delta) {
        log.info("[graph-store] Replacing snapshot topology={} snapshot={} vertices={} edges={}",
                delta.getTopologyId(), delta.getSnapshotRef(),
                delta.getVertices().size(), delta.getEdges().size());

        write(tx -> {
            long removed = deleteSnapshot(tx, delta.getTopologyId(), delta.getSnapshotRef());
            if (removed > 0) {
                log.info("[graph-store] Removed {} vertices of previous snapshot {}", removed, delta.getSnapshotRef());
            }

            Map<String, String> elementIds = createVertices(tx, delta.getVertices());
            createEdges(tx, delta.getEdges(), elementIds);
            return null;
        });

        log.info("[graph-store] Snapshot {} committed", delta.getSnapshotRef());
    }

    @Override
    public long deleteSnapshot(String topologyId, String snapshotRef) {
        long removed = write(tx -> deleteSnapshot(tx, topologyId, snapshotRef));
        log.info("[graph-store] Deleted {} vertices of topology={} snapshot={}", removed, topologyId, snapshotRef);
        return removed;
    }

    // ========================= Batch Helpers =========================

    private long deleteSnapshot(TransactionContext tx, String topologyId, String snapshotRef) {
        return tx.run("MATCH (v {topologyId: $topologyId, snapshotRef: $snapshotRef}) "
                                + "DETACH DELETE v RETURN count(v) AS removed",
                        Map.of("topologyId", topologyId, "snapshotRef", snapshotRef))
                .single().get("removed").asLong();
    }

    // One UNWIND per label, preserving creation order within the label
    private Map<String, String> createVertices(TransactionContext tx, List<VertexRecord> vertices) {
        Map<VertexLabel, List<Map<String, Object>>> rowsByLabel = new LinkedHashMap<>();
        for (VertexRecord vertex : vertices) {
            Map<String, Object> row = new HashMap<>();
            row.put("key", vertex.getKey());
            row.put("props", storable(vertex.getProperties()));
            rowsByLabel.computeIfAbsent(vertex.getLabel(), l -> new ArrayList<>()).add(row);
        }

        Map<String, String> elementIds = new HashMap<>();
        for (Map.Entry<VertexLabel, List<Map<String, Object>>> e : rowsByLabel.entrySet()) {
            String cypher = "UNWIND $rows AS row CREATE (v:" + e.getKey().getValue() + ") SET v = row.props "
                    + "RETURN row.key AS key, elementId(v) AS id";
            tx.run(cypher, Map.of("rows", e.getValue()))
                    .forEachRemaining(r -> elementIds.put(r.get("key").asString(), r.get("id").asString()));
        }
        return elementIds;
    }

    private void createEdges(TransactionContext tx, List<EdgeRecord> edges, Map<String, String> elementIds) {
        Map<EdgeLabel, List<Map<String, Object>>> rowsByLabel = new LinkedHashMap<>();
        for (EdgeRecord edge : edges) {
            Map<String, Object> row = new HashMap<>();
            row.put("from", resolve(elementIds, edge.getFromKey()));
            row.put("to", resolve(elementIds, edge.getToKey()));
            row.put("props", storable(edge.getProperties()));
            rowsByLabel.computeIfAbsent(edge.getLabel(), l -> new ArrayList<>()).add(row);
        }

        for (Map.Entry<EdgeLabel, List<Map<String, Object>>> e : rowsByLabel.entrySet()) {
            String cypher = "UNWIND $rows AS row "
                    + "MATCH (a) WHERE elementId(a) = row.from "
                    + "MATCH (b) WHERE elementId(b) = row.to "
                    + "CREATE (a)-[r:" + e.getKey().getValue() + "]->(b) SET r = row.props";
            tx.run(cypher, Map.of("rows", e.getValue())).consume();
        }
    }

    private static String resolve(Map<String, String> elementIds, String key) {
        String id = elementIds.get(key);
        if (id == null) {
            throw new IllegalStateException("Edge references vertex " + key + " which is not part of the delta");
        }
        return id;
    }

    // ========================= Session Handling =========================

    private <T> T write(Function<TransactionContext, T> work) {
        try (Session session = neo4jDriver.session()) {
            return session.executeWrite(work::apply);
        } catch (Neo4jException e) {
            log.error("[graph-store] Write failed: {}", e.getMessage());
            throw new GraphStoreException("Graph store write failed: " + e.getMessage(), e);
        }
    }

    private <T> T read(Function<TransactionContext, T> work) {
        try (Session session = neo4jDriver.session()) {
            return session.executeRead(work::apply);
        } catch (Neo4jException e) {
            log.error("[graph-store] Read failed: {}", e.getMessage());
            throw new GraphStoreException("Graph store read failed: " + e.getMessage(), e);
        }
    }

    private static VertexHandle toHandle(Record record) {
        List<String> labels = record.get("labels").asList(v -> v.asString());
        VertexLabel label = labels.isEmpty() ? null : VertexLabel.fromString(labels.get(0));
        return VertexHandle.builder()
                .id(record.get("id").asString())
                .label(label)
                .properties(new HashMap<>(record.get("props").asMap()))
                .build();
    }

    // Absent values are left unset rather than written as null
    private static Map<String, Object> storable(Map<String, Object> properties) {
        Map<String, Object> result = new HashMap<>();
        properties.forEach((k, v) -> {
            if (v != null) {
                result.put(k, v);
            }
        });
        return result;
    }

    private static String propertyKey(String key) {
        if (!PROPERTY_KEY.matcher(key).matches()) {
            throw new IllegalArgumentException("Unsupported property key: " + key);
        }
        return key;
    }
}
