package com.stream.capacity.topograph.dto.metrics;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * One metric of one running instance over a time window.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InstanceTimeSeries {

    private String topologyId;
    private String component;
    private String instance;     // instance-name token, e.g. container_1_split_3
    private Integer container;
    private Integer taskId;
    private String source;       // upstream component of execute metrics, null otherwise
    private String stream;       // null for metrics not split by stream
    private String metric;

    @Builder.Default
    private SortedMap<Instant, Double> values = new TreeMap<>();
}
