package com.togomq.client;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import com.togomq.grpc.mq.v1.PubMessageRequest;
import com.togomq.grpc.mq.v1.PubMessageResponse;

import io.grpc.Status;
import io.grpc.stub.ClientCallStreamObserver;
import io.grpc.stub.ClientResponseObserver;

/**
 * Response side of a publish call. Also follows the call's flow control so
 * the sender can wait for the transport to accept more messages instead of
 * buffering them without bound.
 */
class PublishStream implements ClientResponseObserver<PubMessageRequest, PubMessageResponse> {

    private final CompletableFuture<PubMessageResponse> result = new CompletableFuture<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private volatile ClientCallStreamObserver<PubMessageRequest> call;

    @Override
    public void beforeStart(ClientCallStreamObserver<PubMessageRequest> requestStream) {
        this.call = requestStream;
        requestStream.setOnReadyHandler(this::signal);
    }

    @Override
    public void onNext(PubMessageResponse response) {
        result.complete(response);
        signal();
    }

    @Override
    public void onError(Throwable t) {
        result.completeExceptionally(t);
        signal();
    }

    @Override
    public void onCompleted() {
        result.completeExceptionally(Status.INTERNAL
                .withDescription("publish stream completed without a response")
                .asRuntimeException());
        signal();
    }

    /**
     * Waits until the transport can take another message or the call has
     * ended.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    void awaitReady() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (!result.isDone() && !call.isReady()) {
                changed.await();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the error that ended the call, or null if it has not failed
     */
    Throwable failure() {
        if (!result.isCompletedExceptionally()) {
            return null;
        }
        try {
            result.getNow(null);
            return null;
        } catch (CompletionException e) {
            return e.getCause();
        }
    }

    /**
     * Waits for the server's acknowledgement.
     */
    PubMessageResponse response() throws InterruptedException, ExecutionException {
        return result.get();
    }

    private void signal() {
        lock.lock();
        try {
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }
}
