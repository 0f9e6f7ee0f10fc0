package com.stream.capacity.topograph.dto.plan;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Envelope wrapped around every tracker answer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TrackerResponse {

    public static final String STATUS_SUCCESS = "success";

    private String status;

    private String message;

    private JsonNode result;

    public boolean isSuccess() {
        return STATUS_SUCCESS.equalsIgnoreCase(status);
    }
}
