package com.stream.capacity.topograph.controller;

import com.stream.capacity.topograph.dto.metrics.InstanceTimeSeries;
import com.stream.capacity.topograph.service.metrics.MetricsClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Exposes the per-instance metric time series used by the performance models.
 */
@RestController
@RequestMapping("/api/topologies/{topologyId}/metrics")
@RequiredArgsConstructor
@Slf4j
public class TopologyMetricsController {

    private final MetricsClient metricsClient;

    /**
     * @param kind One of service-times, receive-counts, emit-counts, execute-counts
     */
    @GetMapping("/{kind}")
    public ResponseEntity<List<InstanceTimeSeries>> getMetrics(
            @PathVariable String topologyId,
            @PathVariable String kind,
            @RequestParam String cluster,
            @RequestParam String environ,
            @RequestParam String component,
            @RequestParam(required = false) String stream,
            @RequestParam(required = false) String source,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end) {
        log.info("Getting {} for topology {} component {}", kind, topologyId, component);

        Map<String, Object> options = new HashMap<>();
        options.put("cluster", cluster);
        options.put("environ", environ);
        options.put("component", component);
        if (stream != null) {
            options.put("stream", stream);
        }
        if (source != null) {
            options.put("source", source);
        }

        List<InstanceTimeSeries> series;
        switch (kind) {
            case "service-times" -> series = metricsClient.getServiceTimes(topologyId, start, end, options);
            case "receive-counts" -> series = metricsClient.getReceiveCounts(topologyId, start, end, options);
            case "emit-counts" -> series = metricsClient.getEmitCounts(topologyId, start, end, options);
            case "execute-counts" -> series = metricsClient.getExecuteCounts(topologyId, start, end, options);
            default -> throw new IllegalArgumentException("Unknown metric kind: " + kind);
        }
        return ResponseEntity.ok(series);
    }
}
