package com.togomq.client.grpc;

import java.util.concurrent.TimeUnit;

import com.togomq.client.config.ClientConfig;

import io.grpc.ManagedChannel;
import io.grpc.netty.shaded.io.grpc.netty.NettyChannelBuilder;
import io.grpc.netty.shaded.io.netty.channel.ChannelOption;

/**
 * Builds the long lived transport connection described by a
 * {@link ClientConfig}.
 */
public final class GrpcChannels {

    private GrpcChannels() {
    }

    /**
     * Creates a Netty channel to {@link ClientConfig#address()} with the
     * configured TLS mode, message size limit, flow-control window, socket
     * buffers and keepalive.
     *
     * <p>
     * The Netty transport grows the connection window together with the
     * stream window, so {@link ClientConfig#initialConnWindowSize()} acts as a
     * lower bound on the window handed to the builder.
     * </p>
     *
     * @param config a validated configuration
     * @return the new channel; connecting happens lazily on first use
     */
    public static ManagedChannel create(ClientConfig config) {
        NettyChannelBuilder builder = NettyChannelBuilder.forAddress(config.host(), config.port())
                .maxInboundMessageSize(config.maxMessageSize())
                .flowControlWindow(Math.max(config.initialWindowSize(), config.initialConnWindowSize()))
                .withOption(ChannelOption.SO_SNDBUF, config.writeBufferSize())
                .withOption(ChannelOption.SO_RCVBUF, config.readBufferSize())
                .keepAliveTime(config.keepaliveTime().toMillis(), TimeUnit.MILLISECONDS)
                .keepAliveTimeout(config.keepaliveTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .keepAliveWithoutCalls(false);

        if (config.useTls()) {
            builder.useTransportSecurity();
        } else {
            builder.usePlaintext();
        }
        return builder.build();
    }
}
