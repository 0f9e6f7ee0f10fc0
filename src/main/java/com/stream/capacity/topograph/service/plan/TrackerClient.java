package com.stream.capacity.topograph.service.plan;

import com.fasterxml.jackson.databind.JsonNode;
import com.stream.capacity.topograph.dto.plan.TrackerResponse;
import com.stream.capacity.topograph.exception.PlanFetchException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.codec.CodecException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.Map;

/**
 * Blocking access to the topology tracker REST API.
 * Unwraps the {status, message, result} envelope and turns every failure into a {@link PlanFetchException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrackerClient {

    private final WebClient trackerWebClient;

    /**
     * GET a tracker resource and return its result node.
     * Query values are passed as URI variables so they are encoded in full.
     */
    public JsonNode get(String path, Map<String, ?> query) {
        log.debug("[tracker] GET {} {}", path, query);

        TrackerResponse response;
        try {
            response = trackerWebClient.get()
                    .uri(builder -> {
                        builder.path(path);
                        query.keySet().forEach(name -> builder.queryParam(name, "{" + name + "}"));
                        return builder.build(query);
                    })
                    .retrieve()
                    .bodyToMono(TrackerResponse.class)
                    .block();
        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            if (status == HttpStatus.NOT_FOUND.value() || status == HttpStatus.BAD_REQUEST.value()) {
                throw PlanFetchException.notFound(String.format("Tracker has no %s for %s (HTTP %d)",
                        path, query, status));
            }
            throw new PlanFetchException(String.format("Tracker answered %s with HTTP %d", path, status), e);
        } catch (WebClientException | CodecException e) {
            log.error("[tracker] Request to {} failed: {}", path, e.getMessage());
            throw new PlanFetchException("Tracker request to " + path + " failed: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new PlanFetchException("Tracker returned an empty body for " + path, false);
        }
        if (!response.isSuccess()) {
            throw PlanFetchException.notFound(String.format("Tracker rejected %s for %s: %s",
                    path, query, response.getMessage()));
        }
        if (response.getResult() == null || response.getResult().isNull()) {
            throw new PlanFetchException("Tracker response for " + path + " has no result", false);
        }
        return response.getResult();
    }
}
