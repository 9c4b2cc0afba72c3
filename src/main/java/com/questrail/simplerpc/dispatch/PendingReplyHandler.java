package com.questrail.simplerpc.dispatch;

import com.questrail.simplerpc.api.RpcHandler;
import com.questrail.simplerpc.model.Envelope;
import com.questrail.simplerpc.observability.RpcDispatchEvent;
import com.questrail.simplerpc.registry.TimeBoundedRegistry;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * PendingReplyHandler
 * -----------------------------------------------------------------------------
 * Root handler of the route trie: resolves an unrouted envelope against the
 * pending-reply registry.
 *
 * <p>A live continuation registered under the envelope's id is removed and
 * invoked with the envelope; its result becomes this handler's result. No live
 * continuation means a duplicate, late or unsolicited reply, which is reported
 * as {@link RpcDispatchEvent.UnmatchedReply} and dropped.</p>
 */
final class PendingReplyHandler implements RpcHandler {

    private final TimeBoundedRegistry<String, RpcHandler> pending;
    private final RpcDispatcher dispatcher;

    PendingReplyHandler(TimeBoundedRegistry<String, RpcHandler> pending, RpcDispatcher dispatcher) {
        this.pending = Objects.requireNonNull(pending, "pending");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    }

    @Override
    public Optional<Envelope> handle(Envelope reply) {
        Optional<RpcHandler> continuation = pending.take(reply.id());
        if (continuation.isEmpty()) {
            dispatcher.report(new RpcDispatchEvent.UnmatchedReply(Instant.now(), reply.id()));
            return Optional.empty();
        }
        return continuation.get().handle(reply);
    }
}
