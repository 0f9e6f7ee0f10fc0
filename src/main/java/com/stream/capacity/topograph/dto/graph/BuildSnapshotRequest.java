package com.stream.capacity.topograph.dto.graph;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuildSnapshotRequest {

    @NotBlank(message = "Cluster is required")
    private String cluster;

    @NotBlank(message = "Environ is required")
    private String environ;

    // Generated when absent
    private String snapshotRef;
}
