package com.stream.capacity.topograph.exception;

import lombok.Getter;

@Getter
public class InstanceNameParseException extends TopologyGraphException {

    private final String token;

    public InstanceNameParseException(String token, String reason) {
        super("Cannot parse '" + token + "': " + reason);
        this.token = token;
    }

    public InstanceNameParseException(String token, String reason, Throwable cause) {
        super("Cannot parse '" + token + "': " + reason, cause);
        this.token = token;
    }
}
