package com.togomq.client;

import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.slf4j.spi.LoggingEventBuilder;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.togomq.client.config.ClientConfig;
import com.togomq.client.config.ConfigValidationException;
import com.togomq.client.config.LogLevel;
import com.togomq.client.data.Message;
import com.togomq.client.data.PubResponse;
import com.togomq.client.data.ReceivedMessage;
import com.togomq.client.data.SubscribeOptions;
import com.togomq.client.errors.ErrorCode;
import com.togomq.client.errors.GrpcErrors;
import com.togomq.client.errors.TogoMQException;
import com.togomq.client.grpc.GrpcChannels;
import com.togomq.client.grpc.MessageConverter;
import com.togomq.client.telemetry.ClientMetrics;
import com.togomq.grpc.mq.v1.CountMessagesRequest;
import com.togomq.grpc.mq.v1.CountMessagesResponse;
import com.togomq.grpc.mq.v1.MqServiceGrpc;
import com.togomq.grpc.mq.v1.PubMessageRequest;
import com.togomq.grpc.mq.v1.PubMessageResponse;
import com.togomq.grpc.mq.v1.SubMessageResponse;

import io.grpc.ClientInterceptor;
import io.grpc.Context;
import io.grpc.ManagedChannel;
import io.grpc.Metadata;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.MetadataUtils;
import io.grpc.stub.StreamObserver;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

import static com.togomq.client.telemetry.OpenTelemetryFunctions.processWithTelemetry;

/**
 * Client for a TogoMQ server. Owns one gRPC channel and exposes publishing,
 * subscribing and counting on top of it.
 *
 * <p>
 * Key features:
 * </p>
 * <ul>
 * <li>Streaming and batch publishing over a client-streaming call</li>
 * <li>Subscriptions with one-at-a-time delivery and cancellation</li>
 * <li>Token authentication attached to every call</li>
 * <li>Transport failures translated into {@link TogoMQException}s</li>
 * </ul>
 *
 * <p>
 * Operations run in the caller's {@link Context}. To cancel an operation or
 * give it a deadline, run it inside a cancellable context:
 * </p>
 *
 * <pre>{@code
 * try (TogoMQClient client = new TogoMQClient(ClientConfig.newConfig(withToken("my-token")))) {
 *     client.pubBatch(List.of(Message.of("orders", body)));
 *
 *     Context.CancellableContext ctx = Context.current()
 *             .withDeadlineAfter(30, TimeUnit.SECONDS, scheduler);
 *     long count = ctx.call(() -> client.countMessages("orders.*"));
 * }
 * }</pre>
 *
 * <p>
 * Instances are safe for concurrent use; every call opens its own stream.
 * </p>
 */
public class TogoMQClient implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(TogoMQClient.class);

    /** Metadata header carrying the token. */
    public static final Metadata.Key<String> AUTHORIZATION = Metadata.Key.of("authorization",
            Metadata.ASCII_STRING_MARSHALLER);

    private static final String SCOPE_NAME = "togomq_client";

    private final ClientConfig config;
    private final LogLevel logLevel;
    private final ManagedChannel channel;
    private final MqServiceGrpc.MqServiceStub asyncStub;
    private final MqServiceGrpc.MqServiceBlockingStub blockingStub;
    private final ExecutorService subscriberExecutor;
    private final Set<Subscription> subscriptions = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final ClientMetrics metrics;
    private final Tracer tracer;

    /**
     * Creates a client connected to the server described by {@code config}.
     *
     * @param config the client configuration
     * @throws TogoMQException if the configuration is missing or invalid, or
     *                         the connection cannot be created
     */
    public TogoMQClient(ClientConfig config) {
        this(config, OpenTelemetry.noop());
    }

    /**
     * Creates a client that reports metrics and spans to {@code ot}.
     *
     * @param config the client configuration
     * @param ot     OpenTelemetry instance for monitoring
     */
    public TogoMQClient(ClientConfig config, OpenTelemetry ot) {
        this(config, null, ot);
    }

    /**
     * Creates a client over a pre-configured channel. The client takes
     * ownership of the channel and shuts it down on {@link #close()}.
     *
     * @param config  the client configuration, still validated
     * @param channel the channel to use, or null to connect as configured
     * @param ot      OpenTelemetry instance for monitoring
     */
    public TogoMQClient(ClientConfig config, ManagedChannel channel, OpenTelemetry ot) {
        if (config == null) {
            throw new TogoMQException(ErrorCode.CONFIGURATION, "config cannot be null");
        }
        try {
            config.requireValid();
        } catch (ConfigValidationException e) {
            throw new TogoMQException(ErrorCode.VALIDATION, "invalid configuration", e);
        }
        this.config = config;
        this.logLevel = config.logLevel();

        at(Level.INFO).log("Creating TogoMQ client for {}", config.address());

        this.channel = channel != null ? channel : openChannel(config);

        ClientInterceptor auth = MetadataUtils.newAttachHeadersInterceptor(authHeaders(config.token()));
        this.asyncStub = MqServiceGrpc.newStub(this.channel)
                .withInterceptors(auth)
                .withMaxInboundMessageSize(config.maxMessageSize())
                .withMaxOutboundMessageSize(config.maxMessageSize());
        this.blockingStub = MqServiceGrpc.newBlockingStub(this.channel)
                .withInterceptors(auth)
                .withMaxInboundMessageSize(config.maxMessageSize())
                .withMaxOutboundMessageSize(config.maxMessageSize());

        this.subscriberExecutor = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                .setNameFormat("togomq-subscriber-%d")
                .setDaemon(true)
                .build());
        this.metrics = new ClientMetrics(ot.getMeter(SCOPE_NAME));
        this.tracer = ot.getTracer(SCOPE_NAME);

        at(Level.INFO).log("TogoMQ client created successfully");
    }

    /**
     * @return the configuration this client was created with
     */
    public ClientConfig config() {
        return config;
    }

    /**
     * Publishes messages drawn from {@code messages} over a single stream, in
     * iteration order. The call returns once the iterator is exhausted and the
     * server has acknowledged the stream.
     *
     * <p>
     * Each message's topic is checked as it is drawn. A message without a
     * topic aborts the stream; messages drawn before it have already been
     * sent. There is no retry: the first failure ends the call.
     * </p>
     *
     * <p>
     * Each send waits until the transport's flow control admits another
     * message, so the iterator is drained no faster than the server reads.
     * </p>
     *
     * @param messages the messages to send; {@code hasNext()} may block, see
     *                 {@link MessageChannel}
     * @return the number of messages the server registered
     * @throws TogoMQException on a missing topic or any read or transport failure
     */
    public PubResponse pub(Iterator<? extends Message> messages) {
        ensureOpen();
        return processWithTelemetry(tracer, "pub_messages", null, () -> doPub(messages));
    }

    /**
     * Publishes a fixed list of messages. Equivalent to {@link #pub(Iterator)}
     * over a channel pre-filled with the list and already closed.
     *
     * @param messages the messages to send
     * @return the number of messages the server registered
     */
    public PubResponse pubBatch(List<? extends Message> messages) {
        at(Level.DEBUG).log("Publishing batch of {} messages", messages.size());

        MessageChannel batch = new MessageChannel(Math.max(1, messages.size()));
        try {
            for (Message message : messages) {
                batch.send(message);
            }
        } catch (InterruptedException e) {
            // the channel is sized to the list, so send never waits
            Thread.currentThread().interrupt();
            throw new TogoMQException(ErrorCode.PUBLISH, "interrupted while preparing batch", e);
        }
        batch.close();
        return pub(batch);
    }

    /**
     * Starts a subscription. Returns as soon as the stream is open; messages
     * are read in the background and handed over through the returned
     * {@link Subscription}. The subscription runs in a cancellable child of
     * the current context, so cancelling the caller's context ends it too.
     *
     * @param options subscription parameters; the topic is required
     * @return the running subscription
     * @throws TogoMQException if the topic is empty or the stream cannot be
     *                         opened
     */
    public Subscription subscribe(SubscribeOptions options) {
        if (options == null || isEmpty(options.topic())) {
            throw new TogoMQException(ErrorCode.VALIDATION, "topic is required for subscription");
        }
        ensureOpen();
        String topic = options.topic();
        at(Level.DEBUG).log("Starting Sub operation for topic: {}", topic);

        Context.CancellableContext context = Context.current().withCancellation();
        Iterator<SubMessageResponse> responses;
        Context previous = context.attach();
        try {
            responses = blockingStub.subMessage(MessageConverter.toSubRequest(options));
        } catch (StatusRuntimeException e) {
            at(Level.ERROR).log("Failed to create sub stream: {}", e.getStatus());
            context.cancel(e);
            throw GrpcErrors.wrap(e, "failed to create subscribe stream");
        } finally {
            context.detach(previous);
        }

        Subscription subscription = new Subscription(topic, context);
        subscriptions.add(subscription);
        metrics.recordSubscriptionStarted(topic);
        try {
            subscriberExecutor.execute(() -> pump(subscription, responses));
        } catch (RejectedExecutionException e) {
            subscriptions.remove(subscription);
            metrics.recordSubscriptionEnded(topic);
            context.cancel(e);
            throw new TogoMQException(ErrorCode.CONNECTION, "client is closed", e);
        }

        if ("*".equals(topic)) {
            at(Level.INFO).log("Subscribe stream started for all topics (wildcard)");
        } else {
            at(Level.INFO).log("Subscribe stream started for topic: {}", topic);
        }
        return subscription;
    }

    /**
     * Counts stored messages whose topic matches {@code topic}, which may be a
     * pattern such as {@code orders.*} or {@code *}.
     *
     * @param topic the topic or pattern; required
     * @return the number of matching messages
     * @throws TogoMQException if the topic is empty or the call fails
     */
    public long countMessages(String topic) {
        if (isEmpty(topic)) {
            throw new TogoMQException(ErrorCode.VALIDATION, "topic is required for counting messages");
        }
        ensureOpen();
        at(Level.DEBUG).log("Counting messages for topic: {}", topic);

        return processWithTelemetry(tracer, "count_messages", topic, () -> {
            CountMessagesResponse response;
            try {
                response = blockingStub.countMessages(CountMessagesRequest.newBuilder()
                        .setTopic(topic)
                        .build());
            } catch (StatusRuntimeException e) {
                at(Level.ERROR).log("Failed to count messages: {}", e.getStatus());
                throw GrpcErrors.wrap(e, "failed to count messages");
            }
            at(Level.INFO).log("Counted {} messages for topic: {}", response.getMessagesCount(), topic);
            return response.getMessagesCount();
        });
    }

    /**
     * Shuts the channel down, waiting up to 5 seconds for it to terminate, and
     * stops the subscription readers. Running subscriptions end with a
     * {@link ErrorCode#CONNECTION} error; later calls fail with one.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        at(Level.INFO).log("Closing TogoMQ client with {} active subscriptions", subscriptions.size());
        channel.shutdownNow();
        try {
            if (!channel.awaitTermination(5, TimeUnit.SECONDS)) {
                at(Level.WARN).log("Channel did not terminate within 5 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            at(Level.ERROR).setCause(e).log("Interrupted while closing channel");
        }
        subscriberExecutor.shutdownNow();
    }

    private PubResponse doPub(Iterator<? extends Message> messages) {
        at(Level.DEBUG).log("Starting Pub operation");

        PublishStream stream = new PublishStream();
        StreamObserver<PubMessageRequest> requests;
        try {
            requests = asyncStub.pubMessage(stream);
        } catch (RuntimeException e) {
            at(Level.ERROR).log("Failed to create pub stream: {}", e.getMessage());
            throw GrpcErrors.wrap(e, "failed to create publish stream");
        }

        int messageCount = 0;
        try {
            while (true) {
                Message message;
                try {
                    if (!messages.hasNext()) {
                        break;
                    }
                    message = messages.next();
                } catch (RuntimeException e) {
                    at(Level.ERROR).log("Failed to read next message: {}", e.getMessage());
                    throw new TogoMQException(ErrorCode.STREAM, "failed to read next message", e);
                }
                if (message == null || isEmpty(message.topic())) {
                    at(Level.ERROR).log("Message topic is required");
                    throw new TogoMQException(ErrorCode.VALIDATION, "message topic is required");
                }

                stream.awaitReady();
                Throwable failure = stream.failure();
                if (failure != null) {
                    at(Level.ERROR).log("Failed to send message: {}", failure.getMessage());
                    throw GrpcErrors.wrap(failure, "failed to send message");
                }

                at(Level.DEBUG).log("Publishing message to topic: {}", message.topic());
                requests.onNext(MessageConverter.toPubRequest(message));
                metrics.recordPublished(message.topic());
                messageCount++;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abort(requests, e);
            throw new TogoMQException(ErrorCode.STREAM, "interrupted while waiting to send message", e);
        } catch (TogoMQException e) {
            abort(requests, e);
            throw e;
        } catch (RuntimeException e) {
            abort(requests, e);
            throw GrpcErrors.wrap(e, "failed to send message");
        }

        at(Level.INFO).log("Sent {} messages, waiting for response", messageCount);
        requests.onCompleted();

        PubMessageResponse response;
        try {
            response = stream.response();
        } catch (ExecutionException e) {
            at(Level.ERROR).log("Failed to receive pub response: {}", e.getCause().getMessage());
            throw GrpcErrors.wrap(e.getCause(), "failed to receive publish response");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abort(requests, e);
            throw new TogoMQException(ErrorCode.STREAM, "interrupted while waiting for publish response", e);
        }

        at(Level.INFO).log("Publish completed: {} messages received by server", response.getMessagesReceived());
        return new PubResponse(response.getMessagesReceived());
    }

    private static void abort(StreamObserver<PubMessageRequest> requests, Throwable cause) {
        requests.onError(Status.CANCELLED
                .withDescription("publish aborted by client")
                .withCause(cause)
                .asRuntimeException());
    }

    private void pump(Subscription subscription, Iterator<SubMessageResponse> responses) {
        TogoMQException failure = null;
        int messageCount = 0;
        try {
            while (true) {
                SubMessageResponse response;
                try {
                    if (!responses.hasNext()) {
                        at(Level.INFO).log("Subscribe stream ended, received {} messages", messageCount);
                        return;
                    }
                    response = responses.next();
                } catch (RuntimeException e) {
                    if (subscription.isCancelled()) {
                        at(Level.INFO).log("Context cancelled, stopping subscription");
                    } else if (closed.get()) {
                        failure = connectionClosed(e);
                    } else {
                        at(Level.ERROR).log("Failed to receive message: {}", e.getMessage());
                        failure = GrpcErrors.wrap(e, "failed to receive message");
                    }
                    return;
                }

                at(Level.DEBUG).log("Received message from topic: {}, UUID: {}", response.getTopic(),
                        response.getUuid());
                messageCount++;

                ReceivedMessage message = MessageConverter.fromSubResponse(response);
                if (!subscription.offer(message)) {
                    if (closed.get() && !subscription.isCancelled()) {
                        failure = connectionClosed(null);
                    } else {
                        at(Level.INFO).log("Context cancelled, stopping subscription");
                    }
                    return;
                }
                metrics.recordReceived(message.topic());
            }
        } finally {
            subscriptions.remove(subscription);
            metrics.recordSubscriptionEnded(subscription.topic());
            subscription.complete(failure);
        }
    }

    private TogoMQException connectionClosed(Throwable cause) {
        at(Level.WARN).log("Client closed while receiving messages");
        return new TogoMQException(ErrorCode.CONNECTION, "connection closed while receiving messages", cause);
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new TogoMQException(ErrorCode.CONNECTION, "client is closed");
        }
    }

    private LoggingEventBuilder at(Level level) {
        return logLevel.at(logger, level);
    }

    private ManagedChannel openChannel(ClientConfig config) {
        try {
            return GrpcChannels.create(config);
        } catch (RuntimeException e) {
            at(Level.ERROR).setCause(e).log("Failed to connect to TogoMQ");
            throw new TogoMQException(ErrorCode.CONNECTION, "failed to create gRPC connection", e);
        }
    }

    private static Metadata authHeaders(String token) {
        Metadata headers = new Metadata();
        headers.put(AUTHORIZATION, token);
        return headers;
    }

    private static boolean isEmpty(String s) {
        return s == null || s.isEmpty();
    }
}
