package com.togomq.client.data;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * An outbound message. Fluent setters return the same instance:
 *
 * <pre>{@code
 * Message m = Message.of("orders", body)
 *         .withVariables(Map.of("priority", "high"))
 *         .withPostpone(60)
 *         .withRetention(3600);
 * }</pre>
 *
 * The topic is checked when the message is published, not here.
 */
public class Message {

    private final String topic;
    private final byte[] body;
    private Map<String, String> variables = new HashMap<>();
    private long postpone;
    private long retention;

    public Message(String topic, byte[] body) {
        this.topic = topic;
        this.body = body;
    }

    public static Message of(String topic, byte[] body) {
        return new Message(topic, body);
    }

    /**
     * Replaces the variables with a copy of {@code variables}. Earlier
     * variables are discarded, not merged.
     *
     * @param variables the new variables; null stores an empty map
     * @return this message
     */
    public Message withVariables(Map<String, String> variables) {
        this.variables = variables == null ? new HashMap<>() : new HashMap<>(variables);
        return this;
    }

    /**
     * @param postpone seconds before the message becomes visible to subscribers
     * @return this message
     */
    public Message withPostpone(long postpone) {
        this.postpone = postpone;
        return this;
    }

    /**
     * @param retention seconds the server keeps the message
     * @return this message
     */
    public Message withRetention(long retention) {
        this.retention = retention;
        return this;
    }

    public String topic() {
        return topic;
    }

    public byte[] body() {
        return body;
    }

    /**
     * @return a read-only view of the variables, never null
     */
    public Map<String, String> variables() {
        return Collections.unmodifiableMap(variables);
    }

    public long postpone() {
        return postpone;
    }

    public long retention() {
        return retention;
    }

    @Override
    public String toString() {
        return "Message[topic=" + topic
                + ", bodyLength=" + (body == null ? 0 : body.length)
                + ", variables=" + variables
                + ", postpone=" + postpone
                + ", retention=" + retention + "]";
    }
}
