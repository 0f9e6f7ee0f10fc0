package com.stream.capacity.topograph.service.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.stream.capacity.topograph.dto.graph.InstanceName;
import com.stream.capacity.topograph.dto.metrics.InstanceTimeSeries;
import com.stream.capacity.topograph.dto.plan.LogicalPlan;
import com.stream.capacity.topograph.exception.PlanFetchException;
import com.stream.capacity.topograph.service.graph.InstanceNameParser;
import com.stream.capacity.topograph.service.plan.PlanSource;
import com.stream.capacity.topograph.service.plan.TrackerClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link MetricsClient} reading the tracker's metrics timeline.
 *
 * Metric names:
 * - emit counts: __emit-count/{stream}
 * - execute counts and latencies: __execute-count/{source}/{stream}, __execute-latency/{source}/{stream},
 *   where source is the upstream component the bolt consumes from
 *
 * Options:
 * - cluster, environ, component: required
 * - stream: stream the metrics are read for, default "default"
 * - source: upstream component of the execute metrics; when absent, every input the bolt declares
 *   in the logical plan is read (narrowed to "stream" when that is given)
 * - instance: restrict to one instance-name token
 *
 * The tracker has no dedicated receive metric; receive counts are read from the execute counts.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrackerMetricsClient implements MetricsClient {

    static final String METRICS_TIMELINE_PATH = "/topologies/metricstimeline";

    static final String EXECUTE_LATENCY = "__execute-latency";
    static final String EXECUTE_COUNT = "__execute-count";
    static final String EMIT_COUNT = "__emit-count";

    private static final String DEFAULT_STREAM = "default";

    private final TrackerClient trackerClient;
    private final PlanSource planSource;
    private final InstanceNameParser instanceNameParser;

    @Override
    public List<InstanceTimeSeries> getServiceTimes(String topologyId, Instant start, Instant end,
                                                    Map<String, Object> options) {
        return fetchBoltTimelines(topologyId, EXECUTE_LATENCY, start, end, options);
    }

    @Override
    public List<InstanceTimeSeries> getReceiveCounts(String topologyId, Instant start, Instant end,
                                                     Map<String, Object> options) {
        return fetchBoltTimelines(topologyId, EXECUTE_COUNT, start, end, options);
    }

    @Override
    public List<InstanceTimeSeries> getEmitCounts(String topologyId, Instant start, Instant end,
                                                  Map<String, Object> options) {
        checkWindow(start, end);
        String stream = optionOrDefault(options, "stream", DEFAULT_STREAM);
        return fetchTimeline(topologyId, EMIT_COUNT, null, stream, start, end, options);
    }

    @Override
    public List<InstanceTimeSeries> getExecuteCounts(String topologyId, Instant start, Instant end,
                                                     Map<String, Object> options) {
        return fetchBoltTimelines(topologyId, EXECUTE_COUNT, start, end, options);
    }

    // ========================= Bolt Metrics =========================

    private List<InstanceTimeSeries> fetchBoltTimelines(String topologyId, String metric, Instant start, Instant end,
                                                        Map<String, Object> options) {
        checkWindow(start, end);
        List<LogicalPlan.StreamInput> inputs = boltInputs(topologyId, options);

        List<InstanceTimeSeries> series = new ArrayList<>();
        for (LogicalPlan.StreamInput input : inputs) {
            series.addAll(fetchTimeline(topologyId, metric, input.getComponentName(), input.getStreamName(),
                    start, end, options));
        }
        return series;
    }

    private List<LogicalPlan.StreamInput> boltInputs(String topologyId, Map<String, Object> options) {
        Object source = options.get("source");
        if (source != null && !source.toString().isBlank()) {
            return List.of(LogicalPlan.StreamInput.builder()
                    .componentName(source.toString())
                    .streamName(optionOrDefault(options, "stream", DEFAULT_STREAM))
                    .build());
        }

        String component = requireOption(options, "component");
        LogicalPlan logicalPlan = planSource.getLogicalPlan(
                requireOption(options, "cluster"), requireOption(options, "environ"), topologyId);
        LogicalPlan.BoltComponent bolt = logicalPlan.getBolts().get(component);
        if (bolt == null) {
            throw new IllegalArgumentException("Component '" + component + "' is not a bolt of topology " + topologyId);
        }

        Object stream = options.get("stream");
        List<LogicalPlan.StreamInput> inputs = new ArrayList<>();
        for (LogicalPlan.StreamInput input : bolt.getInputs()) {
            if (stream == null || stream.toString().equals(input.getStreamName())) {
                inputs.add(input);
            }
        }
        log.debug("[metrics] Bolt {} reads {} input streams", component, inputs.size());
        return inputs;
    }

    // ========================= Timeline =========================

    private List<InstanceTimeSeries> fetchTimeline(String topologyId, String metric, String source, String stream,
                                                   Instant start, Instant end, Map<String, Object> options) {
        String component = requireOption(options, "component");
        String metricName = source == null
                ? metric + "/" + stream
                : metric + "/" + source + "/" + stream;

        Map<String, Object> query = new LinkedHashMap<>();
        query.put("cluster", requireOption(options, "cluster"));
        query.put("environ", requireOption(options, "environ"));
        query.put("topology", topologyId);
        query.put("component", component);
        query.put("metricname", metricName);
        query.put("starttime", start.getEpochSecond());
        query.put("endtime", end.getEpochSecond());
        if (options.get("instance") != null) {
            query.put("instance", options.get("instance"));
        }

        log.info("[metrics] Fetching {} for topology={} component={} window=[{}, {}]",
                metricName, topologyId, component, start, end);

        JsonNode result = trackerClient.get(METRICS_TIMELINE_PATH, query);
        JsonNode instances = result.path("timeline").path(metricName);

        List<InstanceTimeSeries> series = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> it = instances.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            InstanceName instance = instanceNameParser.parseInstanceName(entry.getKey());

            InstanceTimeSeries row = InstanceTimeSeries.builder()
                    .topologyId(topologyId)
                    .component(component)
                    .instance(entry.getKey())
                    .container(instance.getContainer())
                    .taskId(instance.getTaskId())
                    .source(source)
                    .stream(stream)
                    .metric(metric)
                    .build();

            Iterator<Map.Entry<String, JsonNode>> points = entry.getValue().fields();
            while (points.hasNext()) {
                Map.Entry<String, JsonNode> point = points.next();
                try {
                    row.getValues().put(Instant.ofEpochSecond(Long.parseLong(point.getKey())),
                            Double.parseDouble(point.getValue().asText()));
                } catch (NumberFormatException e) {
                    throw new PlanFetchException(String.format(
                            "Malformed metrics timeline for %s of %s: point %s=%s",
                            metricName, entry.getKey(), point.getKey(), point.getValue()), e);
                }
            }
            series.add(row);
        }

        log.debug("[metrics] {} returned {} instance series", metricName, series.size());
        return series;
    }

    private static void checkWindow(Instant start, Instant end) {
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Metrics window ends before it starts: " + start + " > " + end);
        }
    }

    private static String optionOrDefault(Map<String, Object> options, String name, String defaultValue) {
        Object value = options.get(name);
        return value == null || value.toString().isBlank() ? defaultValue : value.toString();
    }

    private static String requireOption(Map<String, Object> options, String name) {
        Object value = options.get(name);
        if (value == null || value.toString().isBlank()) {
            throw new IllegalArgumentException("Metrics option '" + name + "' is required");
        }
        return value.toString();
    }
}
