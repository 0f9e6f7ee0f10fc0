package com.stream.capacity.topograph.service.graph;

import com.stream.capacity.topograph.dto.graph.InstanceName;
import com.stream.capacity.topograph.exception.InstanceNameParseException;
import org.springframework.stereotype.Service;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes the identifiers the tracker hands out for physical instances and brokers.
 *
 * Format Rules:
 * - Instance: container_{container}_{component}_{taskId}  (component may itself contain '_')
 * - Broker:   {prefix}-{container}  (container is the numeric suffix after the first '-')
 *
 * Parsing is pure; malformed tokens raise {@link InstanceNameParseException}.
 */
@Service
public class InstanceNameParser {

    private static final Pattern INSTANCE_PATTERN = Pattern.compile("^container_([0-9]+)_(.+)_([0-9]+)$");

    private static final char BROKER_SEPARATOR = '-';

    public InstanceName parseInstanceName(String token) {
        if (token == null || token.isBlank()) {
            throw new InstanceNameParseException(String.valueOf(token), "instance name is empty");
        }
        Matcher matcher = INSTANCE_PATTERN.matcher(token);
        if (!matcher.matches()) {
            throw new InstanceNameParseException(token,
                    "expected container_<container>_<component>_<task>");
        }
        return new InstanceName(token,
                toIndex(token, matcher.group(1)),
                matcher.group(2),
                toIndex(token, matcher.group(3)));
    }

    /**
     * Container index of a broker id, e.g. "stmgr-3" -> 3.
     */
    public int parseBrokerContainer(String brokerId) {
        if (brokerId == null || brokerId.isBlank()) {
            throw new InstanceNameParseException(String.valueOf(brokerId), "broker id is empty");
        }
        int separator = brokerId.indexOf(BROKER_SEPARATOR);
        if (separator < 0) {
            throw new InstanceNameParseException(brokerId, "no '" + BROKER_SEPARATOR + "' separator");
        }
        String suffix = brokerId.substring(separator + 1);
        if (suffix.isEmpty() || !suffix.chars().allMatch(c -> c >= '0' && c <= '9')) {
            throw new InstanceNameParseException(brokerId, "container suffix '" + suffix + "' is not numeric");
        }
        return toIndex(brokerId, suffix);
    }

    private int toIndex(String token, String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new InstanceNameParseException(token, "index '" + digits + "' out of range", e);
        }
    }
}
