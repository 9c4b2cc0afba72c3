package com.questrail.simplerpc.observability;

import java.time.Instant;

/**
 * Outcomes of envelope dispatch that do not produce a response and do not
 * constitute errors.
 */
public sealed interface RpcDispatchEvent {

    Instant timestamp();

    /**
     * A routed envelope named a key with no matching trie path.
     */
    record RouteNotFound(Instant timestamp, String routeKey, String id) implements RpcDispatchEvent {
    }

    /**
     * A reply arrived for an id with no pending entry (duplicate, late, or
     * unsolicited). Expected; not an error.
     */
    record UnmatchedReply(Instant timestamp, String id) implements RpcDispatchEvent {
    }

    /**
     * A pending reply expired and its handler received a synthetic timeout.
     */
    record ReplyTimedOut(Instant timestamp, String id) implements RpcDispatchEvent {
    }

    /**
     * A route registration or removal was ignored because of invalid arguments.
     */
    record RouteRejected(Instant timestamp, String routeKey, String reason) implements RpcDispatchEvent {
    }
}
