package com.stream.capacity.topograph.exception;

/**
 * Base type for every failure raised while materializing a topology snapshot.
 * Subclasses map one-to-one onto the error kinds callers are expected to distinguish.
 */
public abstract class TopologyGraphException extends RuntimeException {

    protected TopologyGraphException(String message) {
        super(message);
    }

    protected TopologyGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
