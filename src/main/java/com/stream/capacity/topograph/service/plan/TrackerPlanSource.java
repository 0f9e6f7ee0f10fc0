package com.stream.capacity.topograph.service.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stream.capacity.topograph.dto.plan.LogicalPlan;
import com.stream.capacity.topograph.dto.plan.PhysicalPlan;
import com.stream.capacity.topograph.exception.PlanFetchException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Reads logical and physical plans from the topology tracker.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrackerPlanSource implements PlanSource {

    static final String LOGICAL_PLAN_PATH = "/topologies/logicalplan";
    static final String PHYSICAL_PLAN_PATH = "/topologies/physicalplan";

    private final TrackerClient trackerClient;
    private final ObjectMapper objectMapper;

    @Override
    public LogicalPlan getLogicalPlan(String cluster, String environ, String topologyId) {
        log.info("[tracker] Fetching logical plan for topology={} cluster={} environ={}", topologyId, cluster, environ);
        JsonNode result = trackerClient.get(LOGICAL_PLAN_PATH, topologyQuery(cluster, environ, topologyId));
        return convert(result, LogicalPlan.class, topologyId);
    }

    @Override
    public PhysicalPlan getPhysicalPlan(String cluster, String environ, String topologyId) {
        log.info("[tracker] Fetching physical plan for topology={} cluster={} environ={}", topologyId, cluster, environ);
        JsonNode result = trackerClient.get(PHYSICAL_PLAN_PATH, topologyQuery(cluster, environ, topologyId));
        return convert(result, PhysicalPlan.class, topologyId);
    }

    private static Map<String, String> topologyQuery(String cluster, String environ, String topologyId) {
        return Map.of("cluster", cluster, "environ", environ, "topology", topologyId);
    }

    private <T> T convert(JsonNode result, Class<T> type, String topologyId) {
        try {
            return objectMapper.treeToValue(result, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new PlanFetchException(String.format("Malformed %s for topology %s: %s",
                    type.getSimpleName(), topologyId, e.getMessage()), e);
        }
    }
}
