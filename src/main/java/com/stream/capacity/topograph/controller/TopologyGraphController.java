package com.stream.capacity.topograph.controller;

import com.stream.capacity.topograph.dto.graph.BuildSnapshotRequest;
import com.stream.capacity.topograph.dto.graph.BuildSnapshotResponse;
import com.stream.capacity.topograph.dto.graph.SnapshotSummary;
import com.stream.capacity.topograph.dto.graph.VertexHandle;
import com.stream.capacity.topograph.dto.graph.VertexLabel;
import com.stream.capacity.topograph.service.graph.TopologyGraphBuilder;
import com.stream.capacity.topograph.service.graph.TopologyGraphQueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * REST controller for topology snapshot graphs.
 * A snapshot is one observed deployment of a topology, identified by (topologyId, snapshotRef).
 */
@RestController
@RequestMapping("/api/topologies/{topologyId}/snapshots")
@RequiredArgsConstructor
@Slf4j
public class TopologyGraphController {

    private final TopologyGraphBuilder topologyGraphBuilder;
    private final TopologyGraphQueryService topologyGraphQueryService;

    /**
     * Build (or rebuild) the graph of a topology snapshot from the tracker's current plans.
     * A snapshotRef is generated when the request does not carry one.
     */
    @PostMapping
    public ResponseEntity<BuildSnapshotResponse> buildSnapshot(
            @PathVariable String topologyId,
            @Valid @RequestBody BuildSnapshotRequest request) {
        String snapshotRef = request.getSnapshotRef() != null && !request.getSnapshotRef().isBlank()
                ? request.getSnapshotRef()
                : UUID.randomUUID().toString();
        log.info("Building snapshot {} of topology {}", snapshotRef, topologyId);

        SnapshotSummary summary = topologyGraphBuilder.buildSnapshot(
                topologyId, snapshotRef, request.getCluster(), request.getEnviron());

        BuildSnapshotResponse response = BuildSnapshotResponse.builder()
                .topologyId(topologyId)
                .snapshotRef(snapshotRef)
                .cluster(request.getCluster())
                .environ(request.getEnviron())
                .builtAt(LocalDateTime.now())
                .summary(summary)
                .build();
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * Vertex and edge counts of a stored snapshot.
     */
    @GetMapping("/{snapshotRef}")
    public ResponseEntity<SnapshotSummary> getSnapshot(
            @PathVariable String topologyId,
            @PathVariable String snapshotRef) {
        return ResponseEntity.ok(topologyGraphQueryService.getSnapshotSummary(topologyId, snapshotRef));
    }

    /**
     * Vertices of a snapshot.
     *
     * @param label Optional vertex label (Broker, Container, Spout, Bolt)
     * @param component Optional component name, matches Spout and Bolt vertices only
     */
    @GetMapping("/{snapshotRef}/vertices")
    public ResponseEntity<List<VertexHandle>> getVertices(
            @PathVariable String topologyId,
            @PathVariable String snapshotRef,
            @RequestParam(required = false) String label,
            @RequestParam(required = false) String component) {
        VertexLabel vertexLabel = null;
        if (label != null) {
            vertexLabel = VertexLabel.fromString(label);
            if (vertexLabel == null) {
                throw new IllegalArgumentException("Unknown vertex label: " + label);
            }
        }
        return ResponseEntity.ok(topologyGraphQueryService.findVertices(
                topologyId, snapshotRef, vertexLabel, component));
    }

    @DeleteMapping("/{snapshotRef}")
    public ResponseEntity<Void> deleteSnapshot(
            @PathVariable String topologyId,
            @PathVariable String snapshotRef) {
        log.info("Deleting snapshot {} of topology {}", snapshotRef, topologyId);
        topologyGraphQueryService.deleteSnapshot(topologyId, snapshotRef);
        return ResponseEntity.noContent().build();
    }
}
