package com.stream.capacity.topograph.dto.graph;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class EdgeRecord {

    String fromKey;

    EdgeLabel label;

    String toKey;

    @Singular("property")
    Map<String, Object> properties;
}
