package com.give.payout.domain.messaging;

import java.util.Map;

/**
 * Abstraction for message producers.
 */
public interface MessageProducer {

    /**
     * Send a message to a topic
     * @param topic The topic name
     * @param key The message key (for partitioning/ordering)
     * @param message The message payload
     */
    void send(String topic, String key, Object message);

    /**
     * Send a message carrying metadata headers (actor, correlation id)
     */
    default void send(String topic, String key, Object message, Map<String, String> headers) {
        send(topic, key, message);
    }

    default void send(String topic, Object message) {
        send(topic, null, message);
    }
}
