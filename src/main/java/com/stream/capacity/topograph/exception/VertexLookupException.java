package com.stream.capacity.topograph.exception;

/**
 * A vertex that an earlier build step should have produced is missing.
 */
public class VertexLookupException extends TopologyGraphException {

    public VertexLookupException(String message) {
        super(message);
    }
}
