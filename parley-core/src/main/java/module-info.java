/**
 * Parley Core Module
 *
 * Message model and error types shared by every Parley module:
 * the immutable {@code Message} envelope, agent and message identifiers,
 * performatives, and the {@code Result} type used to report delivery outcomes.
 *
 * @since 0.1.0
 */
module com.parleysystems.core {
    exports com.parleysystems.core;
    exports com.parleysystems.message;
}
