package com.parleysystems.message;

import java.util.Objects;

/**
 * Opaque identifier of a participant in the fabric.
 * Comparable and hashable; the fabric never interprets its value.
 */
public record AgentId(String value) implements Comparable<AgentId> {

    public AgentId {
        Objects.requireNonNull(value, "AgentId value cannot be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("AgentId value cannot be blank");
        }
    }

    public static AgentId of(String value) {
        return new AgentId(value);
    }

    /**
     * Creates an id using the {@link IdGenerator#UUID} strategy.
     */
    public static AgentId random() {
        return new AgentId(IdGenerator.UUID.generate());
    }

    public static AgentId generate(IdGenerator generator) {
        return new AgentId(generator.generate());
    }

    @Override
    public int compareTo(AgentId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
