/**
 * Parley Mailbox Module
 *
 * Per-agent message queues for the Parley fabric.
 *
 * Implementations:
 * - LinkedMailbox: general-purpose, unbounded or bounded with an explicit overflow policy
 * - MpscMailbox: lock-free enqueue on a JCTools MPSC queue, always unbounded
 *
 * @since 0.1.0
 */
module com.parleysystems.mailbox {
    requires transitive com.parleysystems.core;
    requires org.jctools.core;
    requires org.slf4j;

    exports com.parleysystems.mailbox;
    exports com.parleysystems.mailbox.config;
}
