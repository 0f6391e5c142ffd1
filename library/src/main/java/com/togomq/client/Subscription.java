package com.togomq.client;

import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import com.google.common.util.concurrent.MoreExecutors;
import com.togomq.client.data.ReceivedMessage;
import com.togomq.client.errors.TogoMQException;

import io.grpc.Context;

/**
 * A running subscription returned by {@link TogoMQClient#subscribe}.
 *
 * <p>
 * Messages are handed over one at a time: the background reader waits until
 * the consumer takes a message before it reads the next one from the
 * stream, so a slow consumer slows the stream down. The subscription ends in
 * exactly one of three ways:
 * </p>
 * <ul>
 * <li>the server ends the stream: {@link #receive()} returns empty and
 * {@link #error()} is empty</li>
 * <li>the stream fails: {@link #receive()} returns empty and {@link #error()}
 * holds the failure</li>
 * <li>the subscription or the context it was started in is cancelled: any
 * message waiting for the consumer is dropped and {@link #error()} is
 * empty</li>
 * </ul>
 *
 * <pre>{@code
 * try (Subscription sub = client.subscribe(SubscribeOptions.of("orders.*"))) {
 *     Optional<ReceivedMessage> next;
 *     while ((next = sub.receive()).isPresent()) {
 *         handle(next.get());
 *     }
 *     sub.error().ifPresent(e -> logger.atError().setCause(e).log("Subscription failed"));
 * }
 * }</pre>
 */
public class Subscription implements AutoCloseable {

    private final String topic;
    private final Context.CancellableContext context;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    private ReceivedMessage pending;
    private boolean cancelled;
    private boolean done;
    private TogoMQException error;

    Subscription(String topic, Context.CancellableContext context) {
        this.topic = topic;
        this.context = context;
        context.addListener(c -> markCancelled(), MoreExecutors.directExecutor());
    }

    /**
     * @return the topic pattern this subscription was started with
     */
    public String topic() {
        return topic;
    }

    /**
     * Waits for the next message.
     *
     * @return the message, or empty once the subscription has ended or been
     *         cancelled
     * @throws InterruptedException if interrupted while waiting
     */
    public Optional<ReceivedMessage> receive() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (pending == null && !done && !cancelled) {
                changed.await();
            }
            return take();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits up to {@code timeout} for the next message.
     *
     * @return the message, or empty on timeout, end or cancellation
     * @throws InterruptedException if interrupted while waiting
     */
    public Optional<ReceivedMessage> receive(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (pending == null && !done && !cancelled) {
                if (nanos <= 0) {
                    return Optional.empty();
                }
                nanos = changed.awaitNanos(nanos);
            }
            return take();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the failure that ended the subscription; empty while it is
     *         running and after a clean end or a cancellation
     */
    public Optional<TogoMQException> error() {
        lock.lock();
        try {
            return Optional.ofNullable(error);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return true once the background reader has stopped
     */
    public boolean isDone() {
        lock.lock();
        try {
            return done;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits for the background reader to stop.
     *
     * @return true if it stopped within the timeout
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (!done) {
                if (nanos <= 0) {
                    return false;
                }
                nanos = changed.awaitNanos(nanos);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancels the subscription and its stream.
     */
    public void cancel() {
        context.cancel(null);
    }

    @Override
    public void close() {
        cancel();
    }

    /**
     * Offers a message to the consumer and waits until it is taken.
     *
     * @return false if the subscription was cancelled, or the reader
     *         interrupted, before the consumer took the message
     */
    boolean offer(ReceivedMessage message) {
        lock.lock();
        try {
            if (cancelled || done) {
                return false;
            }
            pending = message;
            changed.signalAll();
            while (pending == message && !cancelled) {
                changed.await();
            }
            if (pending == message) {
                pending = null;
                return false;
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pending = null;
            return false;
        } finally {
            lock.unlock();
        }
    }

    boolean isCancelled() {
        lock.lock();
        try {
            return cancelled;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ends the subscription, recording {@code failure} if there is one, and
     * releases the stream's context.
     */
    void complete(TogoMQException failure) {
        lock.lock();
        try {
            if (done) {
                return;
            }
            done = true;
            error = failure;
            pending = null;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        context.cancel(null);
    }

    private Optional<ReceivedMessage> take() {
        if (pending == null || cancelled) {
            return Optional.empty();
        }
        ReceivedMessage message = pending;
        pending = null;
        changed.signalAll();
        return Optional.of(message);
    }

    private void markCancelled() {
        lock.lock();
        try {
            cancelled = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }
}
