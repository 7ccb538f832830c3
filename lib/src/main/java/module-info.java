/**
 * Parley - in-process messaging fabric for multi-agent software
 *
 * - Router: agent registry, direct delivery, broadcast and topic publish,
 *   delivery history for idempotent "was this routed" queries
 * - RequestReply: conversation correlation with deadlines over plain mailboxes
 * - MessagingFabric: the context object that owns a router and its protocols
 *
 * @since 0.1.0
 */
module com.parleysystems.parley {
    requires transitive com.parleysystems.core;
    requires transitive com.parleysystems.mailbox;
    requires com.github.benmanes.caffeine;
    requires org.slf4j;

    exports com.parleysystems;
    exports com.parleysystems.routing;
    exports com.parleysystems.protocol;
}
