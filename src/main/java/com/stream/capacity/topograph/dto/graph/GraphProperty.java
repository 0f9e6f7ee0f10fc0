package com.stream.capacity.topograph.dto.graph;

/**
 * Property keys written on vertices and edges.
 */
public final class GraphProperty {

    // Snapshot tags, present on every vertex
    public static final String TOPOLOGY_ID = "topologyId";
    public static final String SNAPSHOT_REF = "snapshotRef";

    // Broker / Container
    public static final String ID = "id";
    public static final String HOST = "host";
    public static final String PORT = "port";
    public static final String SHELL_PORT = "shellPort";

    // Spout / Bolt
    public static final String CONTAINER = "container";
    public static final String TASK_ID = "taskId";
    public static final String COMPONENT = "component";
    public static final String BROKER_ID = "brokerId";
    public static final String SPOUT_TYPE = "spoutType";
    public static final String SPOUT_SOURCE = "spoutSource";

    // LogicallyConnected
    public static final String STREAM_NAME = "streamName";
    public static final String GROUPING = "grouping";

    private GraphProperty() {
    }
}
