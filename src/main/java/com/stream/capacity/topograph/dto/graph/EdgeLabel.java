package com.stream.capacity.topograph.dto.graph;

import lombok.Getter;

@Getter
public enum EdgeLabel {
    IS_WITHIN("IsWithin"),
    LOGICALLY_CONNECTED("LogicallyConnected"),
    PHYSICALLY_CONNECTED("PhysicallyConnected");

    private final String value;

    EdgeLabel(String value) {
        this.value = value;
    }
}
