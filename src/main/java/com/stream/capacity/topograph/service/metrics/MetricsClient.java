package com.stream.capacity.topograph.service.metrics;

import com.stream.capacity.topograph.dto.metrics.InstanceTimeSeries;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Time series of per-instance performance metrics for a running topology.
 * Backends differ in which options they need; unknown options are ignored.
 */
public interface MetricsClient {

    /**
     * Service (execute latency) times of each bolt instance.
     */
    List<InstanceTimeSeries> getServiceTimes(String topologyId, Instant start, Instant end,
                                             Map<String, Object> options);

    /**
     * Tuples received by each bolt instance.
     */
    List<InstanceTimeSeries> getReceiveCounts(String topologyId, Instant start, Instant end,
                                              Map<String, Object> options);

    /**
     * Tuples emitted by each instance.
     */
    List<InstanceTimeSeries> getEmitCounts(String topologyId, Instant start, Instant end,
                                           Map<String, Object> options);

    /**
     * Tuples executed by each bolt instance.
     */
    List<InstanceTimeSeries> getExecuteCounts(String topologyId, Instant start, Instant end,
                                              Map<String, Object> options);
}
