package com.stream.capacity.topograph.exception;

public class ConfigurationException extends TopologyGraphException {

    public ConfigurationException(String message) {
        super(message);
    }
}
