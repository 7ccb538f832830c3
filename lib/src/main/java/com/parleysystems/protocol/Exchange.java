package com.parleysystems.protocol;

import com.parleysystems.core.CancelledException;
import com.parleysystems.core.ReplyTimeoutException;
import com.parleysystems.core.Result;
import com.parleysystems.message.Message;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One outstanding request and the slot its reply is delivered into.
 * <p>
 * An exchange is resolved exactly once: by a matching reply, by its deadline, or by
 * cancellation. The resolution is also exposed as a {@link CompletableFuture} for callers
 * that compose asynchronously.
 */
public final class Exchange {

    private final Message request;
    private final RequestReply owner;
    private final String conversationId;
    private final CompletableFuture<Message> completion = new CompletableFuture<>();
    private ExchangeState state = ExchangeState.IDLE;

    Exchange(Message request, RequestReply owner) {
        this.request = request;
        this.owner = owner;
        this.conversationId = request.conversationId()
            .orElseThrow(() -> new IllegalArgumentException("Request has no conversation id"));
    }

    public Message request() {
        return request;
    }

    public String conversationId() {
        return conversationId;
    }

    RequestReply owner() {
        return owner;
    }

    public synchronized ExchangeState state() {
        return state;
    }

    public synchronized boolean isResolved() {
        return state.isTerminal();
    }

    /**
     * Returns the reply if the exchange was answered.
     */
    public Optional<Message> reply() {
        if (state() != ExchangeState.REPLIED) {
            return Optional.empty();
        }
        return Optional.of(completion.join());
    }

    /**
     * The resolution as a future: completed with the reply, or exceptionally with
     * {@link ReplyTimeoutException} or {@link CancelledException}.
     */
    public CompletableFuture<Message> completion() {
        return completion.copy();
    }

    // ========== TRANSITIONS ==========

    synchronized void markSent() {
        // a fast reply may already have resolved it
        if (state == ExchangeState.IDLE) {
            state = ExchangeState.REQUEST_SENT;
        }
    }

    /**
     * @return true if this reply resolved the exchange
     */
    synchronized boolean complete(Message reply) {
        if (state.isTerminal()) {
            return false;
        }
        state = ExchangeState.REPLIED;
        completion.complete(reply);
        return true;
    }

    synchronized boolean timeOut(Duration timeout) {
        if (state != ExchangeState.REQUEST_SENT) {
            return false;
        }
        state = ExchangeState.TIMED_OUT;
        completion.completeExceptionally(new ReplyTimeoutException(conversationId, timeout));
        return true;
    }

    /**
     * Cancels the exchange, including one whose request is still being routed.
     */
    synchronized boolean cancel(Throwable cause) {
        if (state.isTerminal()) {
            return false;
        }
        state = ExchangeState.CANCELLED;
        completion.completeExceptionally(
            new CancelledException("Exchange " + conversationId + " cancelled", cause));
        return true;
    }

    /**
     * Runs the action once the exchange is resolved, immediately if it already is.
     */
    void onResolved(Runnable action) {
        completion.whenComplete((reply, error) -> action.run());
    }

    /**
     * Waits up to the given time for another thread to resolve this exchange.
     *
     * @return true if the exchange is resolved
     */
    boolean awaitResolution(long nanos) throws InterruptedException {
        try {
            completion.get(nanos, TimeUnit.NANOSECONDS);
            return true;
        } catch (ExecutionException e) {
            return true;
        } catch (TimeoutException e) {
            return false;
        }
    }

    /**
     * The outcome of a resolved exchange.
     */
    Result<Message> outcome() {
        try {
            return Result.success(completion.join());
        } catch (RuntimeException e) {
            return Result.failure(e.getCause() != null ? e.getCause() : e);
        }
    }

    @Override
    public String toString() {
        return "Exchange{conversationId=" + conversationId + ", request=" + request.id() + ", state=" + state() + "}";
    }
}
