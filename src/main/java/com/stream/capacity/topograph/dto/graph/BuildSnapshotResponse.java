package com.stream.capacity.topograph.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuildSnapshotResponse {

    private String topologyId;
    private String snapshotRef;
    private String cluster;
    private String environ;
    private LocalDateTime builtAt;
    private SnapshotSummary summary;
}
