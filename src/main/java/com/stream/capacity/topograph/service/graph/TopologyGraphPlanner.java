package com.stream.capacity.topograph.service.graph;

import com.stream.capacity.topograph.dto.graph.EdgeLabel;
import com.stream.capacity.topograph.dto.graph.EdgeRecord;
import com.stream.capacity.topograph.dto.graph.GraphDelta;
import com.stream.capacity.topograph.dto.graph.GraphProperty;
import com.stream.capacity.topograph.dto.graph.InstanceName;
import com.stream.capacity.topograph.dto.graph.VertexLabel;
import com.stream.capacity.topograph.dto.graph.VertexRecord;
import com.stream.capacity.topograph.dto.plan.LogicalPlan;
import com.stream.capacity.topograph.dto.plan.PhysicalPlan;
import com.stream.capacity.topograph.exception.PlanFetchException;
import com.stream.capacity.topograph.exception.VertexLookupException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a logical plan and a physical plan into the complete vertex/edge set of one topology snapshot.
 *
 * Steps, in order:
 *   1. Brokers and containers (one of each per broker entry, Broker -IsWithin-> Container)
 *   2. Spout instances (Spout -IsWithin-> Container)
 *   3. Bolt instances (Bolt -IsWithin-> Container)
 *   4. Logical edges: every source instance x every destination instance, per declared bolt input
 *   5. Data-flow paths: PhysicallyConnected hops along the broker path of each logical pair
 *
 * Planning touches no store. Every vertex and edge is tagged with topologyId and snapshotRef.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TopologyGraphPlanner {

    private final InstanceNameParser instanceNameParser;
    private final PhysicalPathResolver physicalPathResolver;

    public GraphDelta plan(String topologyId, String snapshotRef,
                           LogicalPlan logicalPlan, PhysicalPlan physicalPlan) {
        log.info("[graph-plan] Planning topology={} snapshot={} brokers={} spouts={} bolts={}",
                topologyId, snapshotRef,
                physicalPlan.getBrokers().size(), logicalPlan.getSpouts().size(), logicalPlan.getBolts().size());

        SnapshotDraft draft = new SnapshotDraft(topologyId, snapshotRef);

        createBrokersAndContainers(draft, physicalPlan);
        createSpouts(draft, physicalPlan, logicalPlan);
        createBolts(draft, physicalPlan, logicalPlan);
        createLogicalEdges(draft, logicalPlan);
        createDataFlowPaths(draft);

        GraphDelta delta = draft.toDelta();
        log.info("[graph-plan] Planned topology={} snapshot={} vertices={} edges={}",
                topologyId, snapshotRef, delta.getVertices().size(), delta.getEdges().size());
        return delta;
    }

    // ========================= Brokers and Containers =========================

    private void createBrokersAndContainers(SnapshotDraft draft, PhysicalPlan physicalPlan) {
        log.info("[graph-plan] Creating broker and container vertices");

        for (Map.Entry<String, PhysicalPlan.BrokerInfo> entry : physicalPlan.getBrokers().entrySet()) {
            PhysicalPlan.BrokerInfo broker = entry.getValue();
            String brokerId = broker.getId() != null ? broker.getId() : entry.getKey();
            int container = instanceNameParser.parseBrokerContainer(brokerId);

            if (draft.containerKeys.containsKey(container)) {
                throw new VertexLookupException(String.format(
                        "Container %d is claimed by more than one broker (%s)", container, brokerId));
            }

            log.debug("[graph-plan] Broker {} in container {}", brokerId, container);

            String brokerKey = brokerKey(brokerId);
            draft.addVertex(VertexRecord.builder()
                    .key(brokerKey)
                    .label(VertexLabel.BROKER)
                    .property(GraphProperty.ID, brokerId)
                    .property(GraphProperty.HOST, broker.getHost())
                    .property(GraphProperty.PORT, broker.getPort())
                    .property(GraphProperty.SHELL_PORT, broker.getShellPort())
                    .property(GraphProperty.TOPOLOGY_ID, draft.topologyId)
                    .property(GraphProperty.SNAPSHOT_REF, draft.snapshotRef)
                    .build());
            draft.brokerKeys.put(brokerId, brokerKey);

            String containerKey = containerKey(container);
            draft.addVertex(VertexRecord.builder()
                    .key(containerKey)
                    .label(VertexLabel.CONTAINER)
                    .property(GraphProperty.ID, container)
                    .property(GraphProperty.TOPOLOGY_ID, draft.topologyId)
                    .property(GraphProperty.SNAPSHOT_REF, draft.snapshotRef)
                    .build());
            draft.containerKeys.put(container, containerKey);

            draft.addEdge(brokerKey, EdgeLabel.IS_WITHIN, containerKey, Map.of());
        }
    }

    // ========================= Instances =========================

    private void createSpouts(SnapshotDraft draft, PhysicalPlan physicalPlan, LogicalPlan logicalPlan) {
        for (Map.Entry<String, LogicalPlan.SpoutComponent> entry : logicalPlan.getSpouts().entrySet()) {
            String spoutName = entry.getKey();
            LogicalPlan.SpoutComponent spout = entry.getValue();
            log.debug("[graph-plan] Creating vertices for instances of spout component: {}", spoutName);

            for (String token : instanceTokens(physicalPlan.getSpouts(), spoutName)) {
                Map<String, Object> extra = new LinkedHashMap<>();
                extra.put(GraphProperty.SPOUT_TYPE, spout != null ? spout.getSpoutType() : null);
                extra.put(GraphProperty.SPOUT_SOURCE, spout != null ? spout.getSpoutSource() : null);
                createInstance(draft, physicalPlan, VertexLabel.SPOUT, spoutName, token, extra);
            }
        }
    }

    private void createBolts(SnapshotDraft draft, PhysicalPlan physicalPlan, LogicalPlan logicalPlan) {
        for (String boltName : logicalPlan.getBolts().keySet()) {
            log.debug("[graph-plan] Creating vertices for instances of bolt component: {}", boltName);

            for (String token : instanceTokens(physicalPlan.getBolts(), boltName)) {
                createInstance(draft, physicalPlan, VertexLabel.BOLT, boltName, token, Map.of());
            }
        }
    }

    private void createInstance(SnapshotDraft draft, PhysicalPlan physicalPlan, VertexLabel label,
                                String component, String token, Map<String, Object> extraProperties) {
        InstanceName instance = instanceNameParser.parseInstanceName(token);

        PhysicalPlan.InstanceAssignment assignment = physicalPlan.getInstances().get(token);
        if (assignment == null || assignment.getBrokerId() == null) {
            throw new PlanFetchException("Physical plan has no broker assignment for instance " + token, false);
        }

        String containerKey = draft.containerKeys.get(instance.getContainer());
        if (containerKey == null) {
            throw new VertexLookupException(String.format(
                    "No container vertex %d for topology=%s snapshot=%s (instance %s)",
                    instance.getContainer(), draft.topologyId, draft.snapshotRef, token));
        }

        log.debug("[graph-plan] Creating {} vertex for instance: {}", label.getValue(), token);

        VertexRecord vertex = VertexRecord.builder()
                .key(instanceKey(token))
                .label(label)
                .property(GraphProperty.CONTAINER, instance.getContainer())
                .property(GraphProperty.TASK_ID, instance.getTaskId())
                .property(GraphProperty.COMPONENT, component)
                .property(GraphProperty.BROKER_ID, assignment.getBrokerId())
                .properties(extraProperties)
                .property(GraphProperty.TOPOLOGY_ID, draft.topologyId)
                .property(GraphProperty.SNAPSHOT_REF, draft.snapshotRef)
                .build();
        draft.addVertex(vertex);
        draft.instancesByComponent.computeIfAbsent(component, c -> new ArrayList<>()).add(vertex);

        draft.addEdge(vertex.getKey(), EdgeLabel.IS_WITHIN, containerKey, Map.of());
    }

    private List<String> instanceTokens(Map<String, List<String>> physicalComponents, String component) {
        List<String> tokens = physicalComponents.get(component);
        if (tokens == null) {
            throw new PlanFetchException("Physical plan has no instances for component " + component, false);
        }
        return tokens;
    }

    // ========================= Logical Connections =========================

    private void createLogicalEdges(SnapshotDraft draft, LogicalPlan logicalPlan) {
        log.info("[graph-plan] Adding logical connections to topology {} instances", draft.topologyId);

        for (Map.Entry<String, LogicalPlan.BoltComponent> entry : logicalPlan.getBolts().entrySet()) {
            String boltName = entry.getKey();
            List<LogicalPlan.StreamInput> inputs = entry.getValue() != null
                    ? entry.getValue().getInputs() : Collections.emptyList();
            if (inputs == null) continue;

            log.debug("[graph-plan] Adding logical connections for instances of bolt: {}", boltName);
            List<VertexRecord> destinations = draft.instancesOf(boltName);

            for (LogicalPlan.StreamInput input : inputs) {
                List<VertexRecord> sources = draft.instancesOf(input.getComponentName());
                if (sources.isEmpty()) {
                    log.warn("[graph-plan] Bolt {} declares input from {} which has no instances",
                            boltName, input.getComponentName());
                }

                Map<String, Object> streamProperties = new LinkedHashMap<>();
                streamProperties.put(GraphProperty.STREAM_NAME, input.getStreamName());
                streamProperties.put(GraphProperty.GROUPING, input.getGrouping());

                for (VertexRecord destination : destinations) {
                    for (VertexRecord source : sources) {
                        draft.addEdge(source.getKey(), EdgeLabel.LOGICALLY_CONNECTED,
                                destination.getKey(), streamProperties);
                        draft.logicalPairs.add(new LogicalPair(source, destination));
                    }
                }
            }
        }
    }

    // ========================= Physical Connections =========================

    private void createDataFlowPaths(SnapshotDraft draft) {
        log.info("[graph-plan] Adding physical connections for {} logical pairs", draft.logicalPairs.size());

        Set<String> recordedHops = new HashSet<>();
        for (LogicalPair pair : draft.logicalPairs) {
            VertexRecord source = pair.source;
            VertexRecord destination = pair.destination;

            String sourceBrokerKey = draft.brokerKeyOf(source);
            String destinationBrokerKey = draft.brokerKeyOf(destination);

            List<String> path = physicalPathResolver.resolvePath(
                    source.getKey(), sourceBrokerKey, destinationBrokerKey, destination.getKey());

            for (int i = 0; i + 1 < path.size(); i++) {
                String from = path.get(i);
                String to = path.get(i + 1);
                if (recordedHops.add(from + "->" + to)) {
                    draft.addEdge(from, EdgeLabel.PHYSICALLY_CONNECTED, to, Map.of());
                }
            }
        }
    }

    // ========================= Keys =========================

    static String brokerKey(String brokerId) {
        return "broker:" + brokerId;
    }

    static String containerKey(int container) {
        return "container:" + container;
    }

    static String instanceKey(String token) {
        return "instance:" + token;
    }

    private static final class LogicalPair {

        private final VertexRecord source;
        private final VertexRecord destination;

        private LogicalPair(VertexRecord source, VertexRecord destination) {
            this.source = source;
            this.destination = destination;
        }
    }

    /**
     * Mutable working state of one planning run.
     */
    private static final class SnapshotDraft {

        private final String topologyId;
        private final String snapshotRef;
        private final GraphDelta.GraphDeltaBuilder delta;

        private final Map<String, String> brokerKeys = new HashMap<>();
        private final Map<Integer, String> containerKeys = new HashMap<>();
        private final Map<String, List<VertexRecord>> instancesByComponent = new LinkedHashMap<>();
        private final Set<String> vertexKeys = new HashSet<>();
        private final List<LogicalPair> logicalPairs = new ArrayList<>();

        private SnapshotDraft(String topologyId, String snapshotRef) {
            this.topologyId = topologyId;
            this.snapshotRef = snapshotRef;
            this.delta = GraphDelta.builder().topologyId(topologyId).snapshotRef(snapshotRef);
        }

        private void addVertex(VertexRecord vertex) {
            if (!vertexKeys.add(vertex.getKey())) {
                throw new PlanFetchException("Physical plan lists " + vertex.getKey() + " more than once", false);
            }
            delta.vertex(vertex);
        }

        private void addEdge(String fromKey, EdgeLabel label, String toKey, Map<String, Object> properties) {
            delta.edge(EdgeRecord.builder()
                    .fromKey(fromKey)
                    .label(label)
                    .toKey(toKey)
                    .properties(properties)
                    .property(GraphProperty.TOPOLOGY_ID, topologyId)
                    .property(GraphProperty.SNAPSHOT_REF, snapshotRef)
                    .build());
        }

        private List<VertexRecord> instancesOf(String component) {
            return instancesByComponent.getOrDefault(component, Collections.emptyList());
        }

        private String brokerKeyOf(VertexRecord instance) {
            String brokerId = (String) instance.property(GraphProperty.BROKER_ID);
            String key = brokerKeys.get(brokerId);
            if (key == null) {
                throw new VertexLookupException(String.format(
                        "No broker vertex %s for topology=%s snapshot=%s (instance %s)",
                        brokerId, topologyId, snapshotRef, instance.getKey()));
            }
            return key;
        }

        private GraphDelta toDelta() {
            return delta.build();
        }
    }
}
