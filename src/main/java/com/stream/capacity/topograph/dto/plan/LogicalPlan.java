package com.stream.capacity.topograph.dto.plan;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Component-level dataflow of a topology as reported by the tracker.
 * Maps keep the document order so graph construction is deterministic.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LogicalPlan {

    @Builder.Default
    private Map<String, SpoutComponent> spouts = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, BoltComponent> bolts = new LinkedHashMap<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SpoutComponent {

        @JsonProperty("spout_type")
        private String spoutType;

        @JsonProperty("spout_source")
        private String spoutSource;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BoltComponent {

        @Builder.Default
        private List<StreamInput> inputs = new ArrayList<>();
    }

    /**
     * One declared input of a bolt: the upstream component, the stream it emits on and how tuples are routed.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StreamInput {

        @JsonProperty("component_name")
        private String componentName;

        @JsonProperty("stream_name")
        private String streamName;

        private String grouping;
    }
}
