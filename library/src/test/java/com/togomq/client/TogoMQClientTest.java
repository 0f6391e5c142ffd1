package com.togomq.client;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import com.togomq.client.config.ClientConfig;
import com.togomq.client.config.ConfigValidationException;
import com.togomq.client.config.ConfigViolation;
import com.togomq.client.config.LogLevel;
import com.togomq.client.data.Message;
import com.togomq.client.data.PubResponse;
import com.togomq.client.data.ReceivedMessage;
import com.togomq.client.data.SubscribeOptions;
import com.togomq.client.errors.ErrorCode;
import com.togomq.client.errors.TogoMQException;
import com.togomq.grpc.mq.v1.PubMessageRequest;

import io.grpc.Context;
import io.grpc.ManagedChannel;
import io.grpc.Server;
import io.grpc.ServerInterceptors;
import io.grpc.Status;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import io.opentelemetry.api.OpenTelemetry;

import static com.togomq.client.config.ConfigOption.withLogLevel;
import static com.togomq.client.config.ConfigOption.withToken;
import static org.junit.jupiter.api.Assertions.*;

@Timeout(value = 10, unit = TimeUnit.SECONDS)
class TogoMQClientTest {

    private static final String TOKEN = "test-token";

    private FakeMqService service;
    private String serverName;
    private Server server;
    private TogoMQClient client;

    @BeforeEach
    void setUp() throws IOException {
        service = new FakeMqService();
        serverName = InProcessServerBuilder.generateName();
        server = InProcessServerBuilder.forName(serverName)
                .addService(ServerInterceptors.intercept(service, service.tokenCapture()))
                .build()
                .start();

        ManagedChannel channel = InProcessChannelBuilder.forName(serverName).build();
        client = new TogoMQClient(ClientConfig.newConfig(withToken(TOKEN), withLogLevel("debug")),
                channel, OpenTelemetry.noop());
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        if (client != null) {
            client.close();
        }
        if (server != null) {
            server.shutdownNow().awaitTermination(5, TimeUnit.SECONDS);
        }
    }

    @Test
    void shouldRejectNullConfig() {
        TogoMQException e = assertThrows(TogoMQException.class, () -> new TogoMQClient(null));
        assertEquals(ErrorCode.CONFIGURATION, e.code());
    }

    @Test
    void shouldRejectInvalidConfigBeforeConnecting() {
        TogoMQException e = assertThrows(TogoMQException.class,
                () -> new TogoMQClient(ClientConfig.defaultConfig()));

        assertEquals(ErrorCode.VALIDATION, e.code());
        assertEquals("invalid configuration", e.detail());
        ConfigValidationException cause = assertInstanceOf(ConfigValidationException.class, e.getCause());
        assertEquals(ConfigViolation.MISSING_TOKEN, cause.violation());
    }

    @Test
    void shouldCreateClientWithNettyTransport() {
        try (TogoMQClient netty = new TogoMQClient(ClientConfig.newConfig(withToken(TOKEN)))) {
            assertEquals("q.togomq.io:5123", netty.config().address());
        }
    }

    @Test
    void shouldPublishBatchAndReportServerCount() {
        List<Message> messages = List.of(
                Message.of("orders", "first".getBytes(StandardCharsets.UTF_8)),
                Message.of("orders", "second".getBytes(StandardCharsets.UTF_8))
                        .withVariables(Map.of("priority", "high")),
                Message.of("orders", "third".getBytes(StandardCharsets.UTF_8))
                        .withPostpone(60)
                        .withRetention(3600));

        PubResponse response = client.pubBatch(messages);

        assertEquals(new PubResponse(3), response);
        assertEquals(3, service.published.size());
        PubMessageRequest second = service.published.get(1);
        assertEquals("high", second.getVariablesMap().get("priority"));
        PubMessageRequest third = service.published.get(2);
        assertEquals(60, third.getPostpone());
        assertEquals(3600, third.getRetention());
        assertEquals(TOKEN, service.lastToken.get());
    }

    @Test
    void shouldPublishEmptyBatch() {
        assertEquals(0, client.pubBatch(List.of()).messagesReceived());
    }

    @Test
    void shouldPublishMessagesFromChannelInOrder() throws Exception {
        MessageChannel channel = new MessageChannel(2);
        ExecutorService producer = Executors.newSingleThreadExecutor();
        try {
            producer.submit(() -> {
                for (int i = 0; i < 5; i++) {
                    channel.send(Message.of("events", ("m" + i).getBytes(StandardCharsets.UTF_8)));
                }
                channel.close();
                return null;
            });

            PubResponse response = client.pub(channel);

            assertEquals(5, response.messagesReceived());
            for (int i = 0; i < 5; i++) {
                assertEquals("m" + i, service.published.get(i).getBody().toStringUtf8());
            }
        } finally {
            producer.shutdownNow();
        }
    }

    @Test
    void shouldAbortPublishOnEmptyTopic() throws InterruptedException {
        List<Message> messages = List.of(
                Message.of("orders", "ok".getBytes(StandardCharsets.UTF_8)),
                Message.of("", "bad".getBytes(StandardCharsets.UTF_8)));

        TogoMQException e = assertThrows(TogoMQException.class, () -> client.pubBatch(messages));

        assertEquals(ErrorCode.VALIDATION, e.code());
        assertEquals("message topic is required", e.detail());
        Thread.sleep(200);
        assertEquals(0, service.pubCompleted.get(), "Stream must not be half-closed");
    }

    @Test
    void shouldWaitForFlowControlBeforeDrawingMoreMessages() throws Exception {
        service.pubManualFlowControl = true;
        AtomicInteger drawn = new AtomicInteger();
        Iterator<Message> messages = new Iterator<>() {
            @Override
            public boolean hasNext() {
                return drawn.get() < 100;
            }

            @Override
            public Message next() {
                drawn.incrementAndGet();
                return Message.of("orders", new byte[64 * 1024]);
            }
        };

        Context.CancellableContext context = Context.current().withCancellation();
        ExecutorService publisher = Executors.newSingleThreadExecutor();
        try {
            Future<PubResponse> outcome = publisher.submit(() -> context.call(() -> client.pub(messages)));
            Thread.sleep(300);

            assertEquals(1, drawn.get(), "Only the message waiting for the transport may be drawn");

            context.cancel(null);
            ExecutionException e = assertThrows(ExecutionException.class, () -> outcome.get(5, TimeUnit.SECONDS));
            TogoMQException failure = assertInstanceOf(TogoMQException.class, e.getCause());
            assertEquals(ErrorCode.STREAM, failure.code());
            assertEquals(1, drawn.get());
            assertTrue(service.published.isEmpty());
        } finally {
            publisher.shutdownNow();
        }
    }

    @Test
    void shouldReportStreamErrorWhenPublisherIsInterrupted() throws InterruptedException {
        MessageChannel channel = new MessageChannel();
        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread publisher = new Thread(() -> {
            try {
                client.pub(channel);
            } catch (Throwable t) {
                failure.set(t);
            }
        });
        publisher.start();
        Thread.sleep(200);

        publisher.interrupt();
        publisher.join(5000);

        TogoMQException e = assertInstanceOf(TogoMQException.class, failure.get());
        assertEquals(ErrorCode.STREAM, e.code());
        assertEquals("failed to read next message", e.detail());
        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertEquals(0, service.pubCompleted.get());
    }

    @Test
    void shouldReportStreamErrorWhenIteratorFails() {
        Iterator<Message> broken = new Iterator<>() {
            @Override
            public boolean hasNext() {
                return true;
            }

            @Override
            public Message next() {
                throw new IllegalArgumentException("source unavailable");
            }
        };

        TogoMQException e = assertThrows(TogoMQException.class, () -> client.pub(broken));

        assertEquals(ErrorCode.STREAM, e.code());
        assertEquals("[STREAM_ERROR] failed to read next message: source unavailable", e.getMessage());
    }

    @Test
    void shouldReportConnectionErrorWhenPublishResponseFails() {
        service.pubFailureOnComplete.set(Status.UNAVAILABLE.withDescription("broker down"));

        TogoMQException e = assertThrows(TogoMQException.class, () -> client.pubBatch(List.of(
                Message.of("orders", "a".getBytes(StandardCharsets.UTF_8)),
                Message.of("orders", "b".getBytes(StandardCharsets.UTF_8)))));

        assertEquals(ErrorCode.CONNECTION, e.code());
        assertEquals("failed to receive publish response: broker down", e.detail());
    }

    @Test
    void shouldReportConnectionErrorWhenSendingAfterServerFailed() throws Exception {
        service.pubFailureOnMessage.set(Status.UNAVAILABLE.withDescription("broker down"));
        MessageChannel channel = new MessageChannel();
        ExecutorService publisher = Executors.newSingleThreadExecutor();
        try {
            Future<PubResponse> outcome = publisher.submit(() -> client.pub(channel));

            channel.send(Message.of("orders", "first".getBytes(StandardCharsets.UTF_8)));
            assertTrue(service.pubFailed.await(5, TimeUnit.SECONDS));
            Thread.sleep(300);
            channel.send(Message.of("orders", "second".getBytes(StandardCharsets.UTF_8)));
            channel.close();

            ExecutionException e = assertThrows(ExecutionException.class, () -> outcome.get(5, TimeUnit.SECONDS));
            TogoMQException failure = assertInstanceOf(TogoMQException.class, e.getCause());
            assertEquals(ErrorCode.CONNECTION, failure.code());
            assertEquals("failed to send message: broker down", failure.detail());
            assertEquals(1, service.published.size());
        } finally {
            publisher.shutdownNow();
        }
    }

    @Test
    void shouldCreateClientWithoutExplicitLogLevel() {
        ManagedChannel channel = InProcessChannelBuilder.forName(serverName).build();
        service.countResult.set(7);

        try (TogoMQClient defaults = new TogoMQClient(
                ClientConfig.newConfig(withToken(TOKEN), withLogLevel((LogLevel) null)),
                channel, OpenTelemetry.noop())) {
            assertEquals(LogLevel.INFO, defaults.config().logLevel());
            assertEquals(7, defaults.countMessages("orders"));
        }
    }

    @Test
    void shouldRejectSubscribeWithEmptyTopicBeforeOpeningStream() {
        TogoMQException e = assertThrows(TogoMQException.class,
                () -> client.subscribe(SubscribeOptions.of("")));

        assertEquals(ErrorCode.VALIDATION, e.code());
        assertEquals(0, service.subCalls.get());
    }

    @Test
    void shouldDeliverMessagesUntilStreamEnds() throws InterruptedException {
        service.subHandler = (request, observer) -> {
            observer.onNext(FakeMqService.frame(request.getTopic(), "uuid-1", "one"));
            observer.onNext(FakeMqService.frame(request.getTopic(), "uuid-2", "two"));
            observer.onCompleted();
        };

        Subscription subscription = client.subscribe(SubscribeOptions.of("orders.*").withBatch(10));

        ReceivedMessage first = subscription.receive().orElseThrow();
        ReceivedMessage second = subscription.receive().orElseThrow();
        assertEquals("uuid-1", first.uuid());
        assertEquals("two", new String(second.body(), StandardCharsets.UTF_8));
        assertEquals(Optional.empty(), subscription.receive());
        assertTrue(subscription.awaitTermination(5, TimeUnit.SECONDS));
        assertTrue(subscription.error().isEmpty());
    }

    @Test
    void shouldReportSingleErrorWhenStreamFails() throws InterruptedException {
        service.subHandler = (request, observer) -> {
            observer.onNext(FakeMqService.frame("orders", "uuid-1", "one"));
            observer.onError(Status.UNAVAILABLE.withDescription("server going away").asRuntimeException());
        };

        Subscription subscription = client.subscribe(SubscribeOptions.of("orders"));

        assertTrue(subscription.receive().isPresent());
        assertEquals(Optional.empty(), subscription.receive());
        assertTrue(subscription.awaitTermination(5, TimeUnit.SECONDS));
        TogoMQException error = subscription.error().orElseThrow();
        assertEquals(ErrorCode.CONNECTION, error.code());
        assertEquals("failed to receive message: server going away", error.detail());
    }

    @Test
    void shouldStopWithoutErrorWhenCancelledWithPendingMessage() throws InterruptedException {
        CountDownLatch sent = new CountDownLatch(1);
        service.subHandler = (request, observer) -> {
            observer.onNext(FakeMqService.frame("orders", "uuid-1", "pending"));
            sent.countDown();
        };

        Subscription subscription = client.subscribe(SubscribeOptions.of("orders"));
        assertTrue(sent.await(5, TimeUnit.SECONDS));
        Thread.sleep(200);

        subscription.cancel();

        assertTrue(subscription.awaitTermination(5, TimeUnit.SECONDS));
        assertEquals(Optional.empty(), subscription.receive());
        assertTrue(subscription.error().isEmpty());
    }

    @Test
    void shouldStopWhenCallerContextIsCancelled() throws Exception {
        service.subHandler = (request, observer) -> {
            // stream stays open until the client cancels it
        };

        Context.CancellableContext context = Context.current().withCancellation();
        Subscription subscription = context.call(() -> client.subscribe(SubscribeOptions.of("*")));

        context.cancel(null);

        assertTrue(subscription.awaitTermination(5, TimeUnit.SECONDS));
        assertTrue(subscription.error().isEmpty());
    }

    @Test
    void shouldCountMessagesWithToken() {
        service.countResult.set(42);

        assertEquals(42, client.countMessages("orders.*"));
        assertEquals(TOKEN, service.lastToken.get());
    }

    @Test
    void shouldRejectCountWithEmptyTopicWithoutCallingServer() {
        TogoMQException e = assertThrows(TogoMQException.class, () -> client.countMessages(""));

        assertEquals(ErrorCode.VALIDATION, e.code());
        assertEquals(0, service.countCalls.get());
    }

    @Test
    void shouldMapUnauthenticatedCountToAuthError() {
        service.countFailure.set(Status.UNAUTHENTICATED.withDescription("bad token"));

        TogoMQException e = assertThrows(TogoMQException.class, () -> client.countMessages("orders"));

        assertEquals(ErrorCode.AUTH, e.code());
        assertEquals("failed to count messages: bad token", e.detail());
        assertEquals("[AUTH_ERROR] failed to count messages: bad token: UNAUTHENTICATED: bad token",
                e.getMessage());
    }

    @Test
    void shouldEndSubscriptionsWithConnectionErrorOnClose() throws InterruptedException {
        CountDownLatch opened = new CountDownLatch(1);
        service.subHandler = (request, observer) -> opened.countDown();

        Subscription subscription = client.subscribe(SubscribeOptions.of("orders"));
        assertTrue(opened.await(5, TimeUnit.SECONDS));

        client.close();

        assertTrue(subscription.awaitTermination(5, TimeUnit.SECONDS));
        assertEquals(ErrorCode.CONNECTION, subscription.error().orElseThrow().code());
    }

    @Test
    void shouldFailOperationsAfterClose() {
        client.close();

        TogoMQException count = assertThrows(TogoMQException.class, () -> client.countMessages("orders"));
        TogoMQException sub = assertThrows(TogoMQException.class,
                () -> client.subscribe(SubscribeOptions.of("orders")));
        TogoMQException pub = assertThrows(TogoMQException.class,
                () -> client.pubBatch(List.of(Message.of("orders", new byte[0]))));

        assertEquals(ErrorCode.CONNECTION, count.code());
        assertEquals(ErrorCode.CONNECTION, sub.code());
        assertEquals(ErrorCode.CONNECTION, pub.code());
        assertEquals("client is closed", count.detail());
    }
}
