package com.stream.capacity.topograph;

import com.stream.capacity.topograph.dto.plan.LogicalPlan;
import com.stream.capacity.topograph.dto.plan.PhysicalPlan;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Plan documents shared by the graph tests.
 */
public final class TopologyFixtures {

    private TopologyFixtures() {
    }

    /**
     * One spout S1 with two instances feeding one bolt B1 with one instance, all in container 1.
     */
    public static LogicalPlan singleContainerLogicalPlan() {
        Map<String, LogicalPlan.SpoutComponent> spouts = new LinkedHashMap<>();
        spouts.put("S1", LogicalPlan.SpoutComponent.builder().spoutType("default").spoutSource("kafka").build());

        Map<String, LogicalPlan.BoltComponent> bolts = new LinkedHashMap<>();
        bolts.put("B1", LogicalPlan.BoltComponent.builder()
                .inputs(List.of(input("S1", "default", "shuffle")))
                .build());

        return LogicalPlan.builder().spouts(spouts).bolts(bolts).build();
    }

    public static PhysicalPlan singleContainerPhysicalPlan() {
        Map<String, PhysicalPlan.BrokerInfo> brokers = new LinkedHashMap<>();
        brokers.put("stmgr-1", broker("stmgr-1", "host-1"));

        Map<String, List<String>> spouts = new LinkedHashMap<>();
        spouts.put("S1", List.of("container_1_S1_1", "container_1_S1_2"));

        Map<String, List<String>> bolts = new LinkedHashMap<>();
        bolts.put("B1", List.of("container_1_B1_3"));

        Map<String, PhysicalPlan.InstanceAssignment> instances = new LinkedHashMap<>();
        assign(instances, "container_1_S1_1", "stmgr-1");
        assign(instances, "container_1_S1_2", "stmgr-1");
        assign(instances, "container_1_B1_3", "stmgr-1");

        return PhysicalPlan.builder().brokers(brokers).spouts(spouts).bolts(bolts).instances(instances).build();
    }

    /**
     * word (3 instances) -> count (2 instances) -> sink_writer (1 instance, two input streams),
     * spread over stmgr-1/container 1 and stmgr-2/container 2.
     */
    public static LogicalPlan wordCountLogicalPlan() {
        Map<String, LogicalPlan.SpoutComponent> spouts = new LinkedHashMap<>();
        spouts.put("word", LogicalPlan.SpoutComponent.builder().spoutType("default").spoutSource("NA").build());

        Map<String, LogicalPlan.BoltComponent> bolts = new LinkedHashMap<>();
        bolts.put("count", LogicalPlan.BoltComponent.builder()
                .inputs(List.of(input("word", "default", "FIELDS")))
                .build());
        bolts.put("sink_writer", LogicalPlan.BoltComponent.builder()
                .inputs(List.of(
                        input("count", "default", "SHUFFLE"),
                        input("count", "errors", "ALL")))
                .build());

        return LogicalPlan.builder().spouts(spouts).bolts(bolts).build();
    }

    public static PhysicalPlan wordCountPhysicalPlan() {
        Map<String, PhysicalPlan.BrokerInfo> brokers = new LinkedHashMap<>();
        brokers.put("stmgr-1", broker("stmgr-1", "host-1"));
        brokers.put("stmgr-2", broker("stmgr-2", "host-2"));

        Map<String, List<String>> spouts = new LinkedHashMap<>();
        spouts.put("word", List.of("container_1_word_1", "container_2_word_2", "container_1_word_3"));

        Map<String, List<String>> bolts = new LinkedHashMap<>();
        bolts.put("count", List.of("container_1_count_4", "container_2_count_5"));
        bolts.put("sink_writer", List.of("container_2_sink_writer_6"));

        Map<String, PhysicalPlan.InstanceAssignment> instances = new LinkedHashMap<>();
        assign(instances, "container_1_word_1", "stmgr-1");
        assign(instances, "container_2_word_2", "stmgr-2");
        assign(instances, "container_1_word_3", "stmgr-1");
        assign(instances, "container_1_count_4", "stmgr-1");
        assign(instances, "container_2_count_5", "stmgr-2");
        assign(instances, "container_2_sink_writer_6", "stmgr-2");

        return PhysicalPlan.builder().brokers(brokers).spouts(spouts).bolts(bolts).instances(instances).build();
    }

    public static LogicalPlan.StreamInput input(String component, String stream, String grouping) {
        return LogicalPlan.StreamInput.builder()
                .componentName(component)
                .streamName(stream)
                .grouping(grouping)
                .build();
    }

    public static PhysicalPlan.BrokerInfo broker(String id, String host) {
        return PhysicalPlan.BrokerInfo.builder().id(id).host(host).port(5000).shellPort(5001).build();
    }

    public static void assign(Map<String, PhysicalPlan.InstanceAssignment> instances, String token, String brokerId) {
        instances.put(token, PhysicalPlan.InstanceAssignment.builder().id(token).brokerId(brokerId).build());
    }
}
