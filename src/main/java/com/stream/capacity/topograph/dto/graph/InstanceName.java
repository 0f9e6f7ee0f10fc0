package com.stream.capacity.topograph.dto.graph;

import lombok.Value;

/**
 * Placement decoded from an instance-name token.
 */
@Value
public class InstanceName {

    String token;
    int container;
    String component;
    int taskId;
}
