package com.stream.capacity.topograph.exception;

import lombok.Getter;

/**
 * The tracker could not be reached, did not know the topology, or returned a plan that could not be decoded.
 */
@Getter
public class PlanFetchException extends TopologyGraphException {

    private final boolean notFound;

    public PlanFetchException(String message, boolean notFound) {
        super(message);
        this.notFound = notFound;
    }

    public PlanFetchException(String message, Throwable cause) {
        super(message, cause);
        this.notFound = false;
    }

    public static PlanFetchException notFound(String message) {
        return new PlanFetchException(message, true);
    }
}
