package com.togomq.client.data;

/**
 * Parameters of a subscription. The topic may be an exact name, a prefix
 * pattern such as {@code orders.*} or {@code *} for every topic; patterns are
 * matched by the server.
 */
public class SubscribeOptions {

    private final String topic;
    private long batch;
    private long speedPerSec;

    public SubscribeOptions(String topic) {
        this.topic = topic;
    }

    public static SubscribeOptions of(String topic) {
        return new SubscribeOptions(topic);
    }

    /**
     * @param batch how many messages the server may push at once, 0 for the
     *              server default
     * @return these options
     */
    public SubscribeOptions withBatch(long batch) {
        this.batch = batch;
        return this;
    }

    /**
     * @param speedPerSec delivery rate cap, 0 for unlimited
     * @return these options
     */
    public SubscribeOptions withSpeedPerSec(long speedPerSec) {
        this.speedPerSec = speedPerSec;
        return this;
    }

    public String topic() {
        return topic;
    }

    public long batch() {
        return batch;
    }

    public long speedPerSec() {
        return speedPerSec;
    }

    @Override
    public String toString() {
        return "SubscribeOptions[topic=" + topic + ", batch=" + batch + ", speedPerSec=" + speedPerSec + "]";
    }
}
