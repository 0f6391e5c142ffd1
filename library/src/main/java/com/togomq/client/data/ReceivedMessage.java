package com.togomq.client.data;

import java.util.Map;

/**
 * A message delivered to a subscriber.
 *
 * @param topic     the topic the message was published to
 * @param uuid      server assigned identifier
 * @param body      the payload
 * @param variables key/value pairs published with the message, never null
 */
public record ReceivedMessage(String topic, String uuid, byte[] body, Map<String, String> variables) {

    public ReceivedMessage {
        variables = variables == null ? Map.of() : variables;
    }
}
