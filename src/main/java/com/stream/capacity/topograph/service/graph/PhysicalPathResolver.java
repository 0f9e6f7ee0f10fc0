package com.stream.capacity.topograph.service.graph;

import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Derives the message-routing path between two logically connected instances.
 *
 * Policy "broker mesh": all brokers of one deployment are directly connected to each other,
 * and an instance only talks to its own broker. The path therefore is
 * - source -> broker -> destination, when both instances share a broker
 * - source -> source broker -> destination broker -> destination, otherwise
 *
 * Elements are vertex keys of the snapshot being planned.
 */
@Service
public class PhysicalPathResolver {

    public List<String> resolvePath(String sourceKey, String sourceBrokerKey,
                                    String destinationBrokerKey, String destinationKey) {
        if (sourceBrokerKey.equals(destinationBrokerKey)) {
            return List.of(sourceKey, sourceBrokerKey, destinationKey);
        }
        return List.of(sourceKey, sourceBrokerKey, destinationBrokerKey, destinationKey);
    }
}
