package com.parleysystems.message;

import java.util.Objects;

/**
 * Opaque identifier of one message instance, assigned when the message is constructed.
 * Delivery history is keyed by this id.
 */
public record MessageId(String value) implements Comparable<MessageId> {

    public MessageId {
        Objects.requireNonNull(value, "MessageId value cannot be null");
    }

    public static MessageId of(String value) {
        return new MessageId(value);
    }

    public static MessageId random() {
        return new MessageId(IdGenerator.UUID.generate());
    }

    public static MessageId generate(IdGenerator generator) {
        return new MessageId(generator.generate());
    }

    @Override
    public int compareTo(MessageId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
