package com.togomq.client.grpc;

import com.google.protobuf.ByteString;
import com.togomq.client.data.Message;
import com.togomq.client.data.ReceivedMessage;
import com.togomq.client.data.SubscribeOptions;
import com.togomq.grpc.mq.v1.PubMessageRequest;
import com.togomq.grpc.mq.v1.SubMessageRequest;
import com.togomq.grpc.mq.v1.SubMessageResponse;

/**
 * Field for field projection between the client's types and the wire
 * messages.
 */
public final class MessageConverter {

    private MessageConverter() {
    }

    public static PubMessageRequest toPubRequest(Message message) {
        PubMessageRequest.Builder builder = PubMessageRequest.newBuilder()
                .setTopic(message.topic())
                .putAllVariables(message.variables())
                .setPostpone(message.postpone())
                .setRetention(message.retention());

        if (message.body() != null) {
            builder.setBody(ByteString.copyFrom(message.body()));
        }
        return builder.build();
    }

    public static SubMessageRequest toSubRequest(SubscribeOptions options) {
        return SubMessageRequest.newBuilder()
                .setTopic(options.topic())
                .setBatch(options.batch())
                .setSpeedPerSec(options.speedPerSec())
                .build();
    }

    public static ReceivedMessage fromSubResponse(SubMessageResponse response) {
        return new ReceivedMessage(
                response.getTopic(),
                response.getUuid(),
                response.getBody().toByteArray(),
                response.getVariablesMap());
    }
}
