package com.questrail.simplerpc.api;

import com.questrail.simplerpc.model.Envelope;

import java.util.Optional;

/**
 * RpcHandler
 * -----------------------------------------------------------------------------
 * Capability bound to a route key or to a pending reply.
 *
 * <p>Handlers are supplied by application code and are referenced, never copied,
 * by the routing trie and the pending-reply registry. A handler may perform
 * arbitrary side effects.</p>
 *
 * <p>Invocations for one connection are serialized by the transport's event loop,
 * except timeout deliveries, which run on the registry sweep thread.</p>
 */
@FunctionalInterface
public interface RpcHandler
{
    /**
     * Handle one inbound envelope.
     *
     * @param request the inbound request, reply, or synthetic timeout envelope
     * @return an envelope to send back over the connection, or
     *         {@link Optional#empty()} if this invocation produces no reply
     */
    Optional<Envelope> handle(Envelope request);
}
