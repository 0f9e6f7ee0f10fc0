package com.stream.capacity.topograph.dto.plan;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deployment of a topology: brokers (stream managers), the instance tokens of each component
 * and the broker each instance is attached to.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PhysicalPlan {

    @JsonProperty("stmgrs")
    @Builder.Default
    private Map<String, BrokerInfo> brokers = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, List<String>> spouts = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, List<String>> bolts = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, InstanceAssignment> instances = new LinkedHashMap<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BrokerInfo {

        private String id;

        private String host;

        private Integer port;

        @JsonProperty("shell_port")
        private Integer shellPort;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class InstanceAssignment {

        private String id;

        private String name;

        @JsonProperty("stmgrId")
        private String brokerId;
    }
}
