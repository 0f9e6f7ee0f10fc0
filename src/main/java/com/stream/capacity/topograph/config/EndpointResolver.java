package com.stream.capacity.topograph.config;

import com.stream.capacity.topograph.exception.ConfigurationException;

/**
 * Shared check for the service addresses the application cannot start without.
 */
final class EndpointResolver {

    private EndpointResolver() {
    }

    static String require(String propertyName, String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Required endpoint '" + propertyName + "' is not configured");
        }
        return value.trim();
    }
}
