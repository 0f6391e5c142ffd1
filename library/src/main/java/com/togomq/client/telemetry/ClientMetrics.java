package com.togomq.client.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongUpDownCounter;
import io.opentelemetry.api.metrics.Meter;

/**
 * OpenTelemetry instruments for client operations.
 *
 * <ul>
 * <li>messages_published: messages handed to the transport, per topic</li>
 * <li>messages_received: messages delivered to subscribers, per topic</li>
 * <li>active_subscriptions: subscriptions whose pump is running, per topic
 * pattern</li>
 * </ul>
 */
public class ClientMetrics {
        private static final AttributeKey<String> TOPIC = AttributeKey.stringKey("topic");

        private final LongCounter publishedMessages;
        private final LongCounter receivedMessages;
        private final LongUpDownCounter activeSubscriptions;

        public ClientMetrics(Meter meter) {
                publishedMessages = meter.counterBuilder("messages_published")
                                .setDescription("Number of messages sent to the server")
                                .build();

                receivedMessages = meter.counterBuilder("messages_received")
                                .setDescription("Number of messages delivered to subscribers")
                                .build();

                activeSubscriptions = meter.upDownCounterBuilder("active_subscriptions")
                                .setDescription("Number of running subscriptions")
                                .build();
        }

        public void recordPublished(String topic) {
                publishedMessages.add(1, Attributes.of(TOPIC, topic));
        }

        public void recordReceived(String topic) {
                receivedMessages.add(1, Attributes.of(TOPIC, topic));
        }

        public void recordSubscriptionStarted(String topic) {
                activeSubscriptions.add(1, Attributes.of(TOPIC, topic));
        }

        public void recordSubscriptionEnded(String topic) {
                activeSubscriptions.add(-1, Attributes.of(TOPIC, topic));
        }
}
