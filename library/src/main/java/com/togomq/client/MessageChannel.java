package com.togomq.client;

import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import com.togomq.client.data.Message;

/**
 * Blocking hand-off between a producer of messages and
 * {@link TogoMQClient#pub(Iterator)}.
 *
 * <p>
 * The producer calls {@link #send(Message)} for each message and
 * {@link #close()} when there are no more; the publisher drains the channel
 * through its iterator, blocking while it is empty and open. Messages sent
 * before {@code close()} are still delivered.
 * </p>
 *
 * <pre>{@code
 * MessageChannel channel = new MessageChannel(100);
 * executor.submit(() -> {
 *     for (Order o : orders) {
 *         channel.send(Message.of("orders", o.toBytes()));
 *     }
 *     channel.close();
 * });
 * PubResponse response = client.pub(channel);
 * }</pre>
 */
public class MessageChannel implements Iterator<Message>, AutoCloseable {

    private final int capacity;
    private final ArrayDeque<Message> buffer = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();
    private boolean closed;

    /**
     * Creates an unbounded channel.
     */
    public MessageChannel() {
        this(Integer.MAX_VALUE);
    }

    /**
     * @param capacity the number of messages buffered before {@link #send}
     *                 blocks
     */
    public MessageChannel(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be greater than 0");
        }
        this.capacity = capacity;
    }

    /**
     * Appends a message, waiting while the channel is full.
     *
     * @throws IllegalStateException if the channel is closed
     * @throws InterruptedException  if interrupted while waiting for space
     */
    public void send(Message message) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (!closed && buffer.size() >= capacity) {
                notFull.await();
            }
            if (closed) {
                throw new IllegalStateException("Channel is closed");
            }
            buffer.addLast(message);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the end of the messages. Calling it more than once has no effect.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits until a message is available or the channel is closed and
     * drained.
     *
     * @throws IllegalStateException if the waiting thread is interrupted; the
     *                               interrupt flag is restored
     */
    @Override
    public boolean hasNext() {
        lock.lock();
        try {
            while (buffer.isEmpty() && !closed) {
                notEmpty.await();
            }
            return !buffer.isEmpty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the next message", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Message next() {
        lock.lock();
        try {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Message message = buffer.pollFirst();
            notFull.signal();
            return message;
        } finally {
            lock.unlock();
        }
    }
}
