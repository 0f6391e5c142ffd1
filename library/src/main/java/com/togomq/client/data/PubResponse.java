package com.togomq.client.data;

/**
 * Result of a publish call.
 *
 * @param messagesReceived number of messages the server acknowledged
 */
public record PubResponse(long messagesReceived) {
}
