package com.stream.capacity.topograph.exception;

public class GraphStoreException extends TopologyGraphException {

    public GraphStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
