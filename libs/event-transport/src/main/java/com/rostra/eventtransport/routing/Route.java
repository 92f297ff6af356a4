package com.rostra.eventtransport.routing;

/**
 * Destination of one envelope.
 *
 * @param topic logical topic
 * @param key partition key; envelopes with equal keys keep their relative order
 */
public record Route(StreamTopic topic, String key) {

    public Route {
        if (topic == null) {
            throw new IllegalArgumentException("topic must not be null");
        }
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("key must not be null or empty");
        }
    }
}
