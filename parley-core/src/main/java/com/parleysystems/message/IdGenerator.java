package com.parleysystems.message;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Strategy for generating agent and message identifiers.
 * Every strategy must produce values that are unique for the lifetime of the process.
 * <p>
 * Built-in strategies:
 * <ul>
 *   <li>{@link #UUID} - random UUIDs (default)</li>
 *   <li>{@link #SEQUENTIAL} - a process-wide counter</li>
 *   <li>{@link #prefixed(String)} - a fixed prefix followed by its own counter</li>
 * </ul>
 */
@FunctionalInterface
public interface IdGenerator {

    /**
     * Generates a new identifier value.
     *
     * @return a value never returned before by this generator
     */
    String generate();

    /**
     * Random UUID-based ids.
     * <p>
     * Example: {@code "550e8400-e29b-41d4-a716-446655440000"}
     */
    IdGenerator UUID = () -> java.util.UUID.randomUUID().toString();

    /**
     * Global sequential counter.
     * <p>
     * Examples: {@code "1"}, {@code "2"}, {@code "3"}
     */
    IdGenerator SEQUENTIAL = new IdGenerator() {
        private final AtomicLong counter = new AtomicLong(0);

        @Override
        public String generate() {
            return String.valueOf(counter.incrementAndGet());
        }
    };

    /**
     * Prefix + sequential counter. Each call creates an independent counter,
     * so two generators with the same prefix produce colliding values; share one instance.
     * <p>
     * Example: {@code prefixed("agent")} yields {@code "agent:1"}, {@code "agent:2"}
     *
     * @param prefix the prefix
     * @return a new generator
     */
    static IdGenerator prefixed(String prefix) {
        Objects.requireNonNull(prefix, "prefix cannot be null");
        AtomicLong counter = new AtomicLong(0);
        return () -> prefix + ":" + counter.incrementAndGet();
    }
}
