package com.parleysystems.test;

import com.parleysystems.mailbox.CancellationToken;
import com.parleysystems.mailbox.Mailbox;
import com.parleysystems.mailbox.ReceiveResult;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Consumes a mailbox on a background thread and records everything it receives,
 * optionally handing each message to a delegate.
 *
 * <pre>{@code
 * try (MessageCapture<Message> capture = MessageCapture.start(inbox)) {
 *     router.route(new Message(a, b, Performative.INFORM, "1"));
 *     capture.awaitCount(1, Duration.ofSeconds(1));
 *     assertEquals("1", capture.first().content());
 * }
 * }</pre>
 *
 * @param <T> the message type
 */
public class MessageCapture<T> implements AutoCloseable {

    private final List<T> messages = new CopyOnWriteArrayList<>();
    private final CancellationToken stop = CancellationToken.create();
    private final Thread consumer;

    private MessageCapture(Mailbox<T> mailbox, Consumer<T> delegate) {
        this.consumer = new Thread(() -> consume(mailbox, delegate), "message-capture");
        this.consumer.setDaemon(true);
    }

    public static <T> MessageCapture<T> start(Mailbox<T> mailbox) {
        return start(mailbox, message -> { });
    }

    /**
     * Starts capturing; each message is recorded before the delegate sees it.
     */
    public static <T> MessageCapture<T> start(Mailbox<T> mailbox, Consumer<T> delegate) {
        Objects.requireNonNull(mailbox, "mailbox cannot be null");
        Objects.requireNonNull(delegate, "delegate cannot be null");
        MessageCapture<T> capture = new MessageCapture<>(mailbox, delegate);
        capture.consumer.start();
        return capture;
    }

    private void consume(Mailbox<T> mailbox, Consumer<T> delegate) {
        while (true) {
            ReceiveResult<T> received = mailbox.receive(stop);
            if (!(received instanceof ReceiveResult.Received<T> message)) {
                return;
            }
            messages.add(message.value());
            delegate.accept(message.value());
        }
    }

    public int size() {
        return messages.size();
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }

    public T get(int index) {
        return messages.get(index);
    }

    /**
     * Returns a copy of the captured messages in arrival order.
     */
    public List<T> all() {
        return new ArrayList<>(messages);
    }

    public List<T> filter(Predicate<T> predicate) {
        return messages.stream().filter(predicate).collect(Collectors.toList());
    }

    public T first() {
        if (messages.isEmpty()) {
            throw new IllegalStateException("No messages captured");
        }
        return messages.get(0);
    }

    public T last() {
        if (messages.isEmpty()) {
            throw new IllegalStateException("No messages captured");
        }
        return messages.get(messages.size() - 1);
    }

    /**
     * Waits until at least {@code count} messages were captured.
     *
     * @return the captured messages
     */
    public List<T> awaitCount(int count, Duration timeout) {
        AsyncAssertion.eventually(() -> messages.size() >= count, timeout);
        return all();
    }

    /**
     * Waits until a captured message matches the predicate.
     */
    public T awaitMessage(Predicate<T> predicate, Duration timeout) {
        AsyncAssertion.eventually(() -> messages.stream().anyMatch(predicate), timeout);
        return messages.stream().filter(predicate).findFirst().orElseThrow();
    }

    public void clear() {
        messages.clear();
    }

    /**
     * Stops the consumer thread. Messages already captured remain available.
     */
    @Override
    public void close() {
        stop.cancel();
        try {
            consumer.join(TimeUnit.SECONDS.toMillis(1));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
