package com.stream.capacity.topograph.service.graph;

import com.stream.capacity.topograph.dto.graph.GraphDelta;
import com.stream.capacity.topograph.dto.graph.SnapshotSummary;
import com.stream.capacity.topograph.dto.plan.LogicalPlan;
import com.stream.capacity.topograph.dto.plan.PhysicalPlan;
import com.stream.capacity.topograph.service.plan.PlanSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Materializes one observed deployment of a topology as a property graph.
 *
 * Flow:
 * 1. Fetch the logical and physical plans from the tracker
 * 2. Plan the full vertex/edge set (brokers, containers, spouts, bolts, logical and physical edges)
 * 3. Replace the (topologyId, snapshotRef) graph in the store with the plan, atomically
 *
 * Builds run synchronously on the caller's thread. Every failure propagates unchanged; because the
 * store write is a single transaction, a failed build leaves any previous graph for the snapshot intact.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TopologyGraphBuilder {

    private final PlanSource planSource;
    private final TopologyGraphPlanner topologyGraphPlanner;
    private final GraphStore graphStore;

    public SnapshotSummary buildSnapshot(String topologyId, String snapshotRef, String cluster, String environ) {
        log.info("[graph-build] Building topology {} snapshot {} from cluster {}, environ {}",
                topologyId, snapshotRef, cluster, environ);
        long startTime = System.currentTimeMillis();

        LogicalPlan logicalPlan = planSource.getLogicalPlan(cluster, environ, topologyId);
        PhysicalPlan physicalPlan = planSource.getPhysicalPlan(cluster, environ, topologyId);

        GraphDelta delta = topologyGraphPlanner.plan(topologyId, snapshotRef, logicalPlan, physicalPlan);
        graphStore.replaceSnapshot(delta);

        SnapshotSummary summary = SnapshotSummary.of(delta);
        log.info("[graph-build] Built topology {} snapshot {} in {} ms: vertices={} edges={}",
                topologyId, snapshotRef, System.currentTimeMillis() - startTime,
                summary.getVertexCounts(), summary.getEdgeCounts());
        return summary;
    }
}
