package com.questrail.simplerpc.dispatch;

import com.questrail.simplerpc.api.RpcHandler;
import com.questrail.simplerpc.config.PendingReplyPolicy;
import com.questrail.simplerpc.internal.time.MonotonicClock;
import com.questrail.simplerpc.internal.time.MonotonicScheduler;
import com.questrail.simplerpc.model.Envelope;
import com.questrail.simplerpc.observability.RpcDispatchEvent;
import com.questrail.simplerpc.observability.RpcErrorEvent;
import com.questrail.simplerpc.observability.RpcObservabilitySink;
import com.questrail.simplerpc.registry.TimeBoundedRegistry;
import com.questrail.simplerpc.routing.RouteNode;
import com.questrail.simplerpc.routing.RouteTrie;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * RpcDispatcher
 * =============================================================================
 * Routes inbound envelopes to handlers and correlates replies with the requests
 * that caused them.
 *
 * <h2>Ownership</h2>
 * A dispatcher owns exactly one {@link RouteTrie} and one pending-reply
 * {@link TimeBoundedRegistry} for the lifetime of a connection. The trie's root
 * handler is preset to a {@link PendingReplyHandler}, so an envelope with an
 * empty route key is treated as a reply.
 *
 * <h2>Inbound classification</h2>
 * <pre>
 *   routeKey == ""  → root → PendingReplyHandler → pending[id] → continuation
 *   routeKey != ""  → trie walk → bound handler
 * </pre>
 * Whatever envelope the resolved handler returns is sent back through the
 * {@link EnvelopeSender} using the default representation.
 *
 * <h2>Failure handling</h2>
 * Nothing here throws across the dispatch loop. An unknown route, an unmatched
 * reply, an invalid registration and a failing handler are all reported to the
 * {@link RpcObservabilitySink} and otherwise ignored.
 *
 * <h2>Timeouts</h2>
 * A continuation that is not claimed within the policy TTL is invoked by the
 * registry sweep with {@link Envelope#timeout(String)} (see {@link TimeoutNotifier}).
 */
public final class RpcDispatcher {

    private final RouteTrie trie = new RouteTrie();
    private final EnvelopeSender sender;
    private final boolean binaryFirst;
    private final RpcObservabilitySink observabilitySink;
    private final TimeBoundedRegistry<String, RpcHandler> pending;

    public RpcDispatcher(EnvelopeSender sender,
                         boolean binaryFirst,
                         PendingReplyPolicy policy,
                         MonotonicClock clock,
                         MonotonicScheduler scheduler,
                         RpcObservabilitySink observabilitySink) {
        this.sender = Objects.requireNonNull(sender, "sender");
        this.binaryFirst = binaryFirst;
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        Objects.requireNonNull(policy, "policy");

        this.pending = new TimeBoundedRegistry<>(
                policy.ttl(),
                policy.sweepInterval(),
                clock,
                scheduler,
                new TimeoutNotifier(this)
        );
        trie.bindRootHandler(new PendingReplyHandler(pending, this));
    }

    // -------------------------------------------------------------------------
    // Inbound
    // -------------------------------------------------------------------------

    /**
     * Dispatch one decoded inbound envelope.
     */
    public void onInboundEnvelope(Envelope envelope) {
        Objects.requireNonNull(envelope, "envelope");

        Optional<RouteNode> node = trie.findNode(envelope.routeKey());
        if (node.isEmpty()) {
            report(new RpcDispatchEvent.RouteNotFound(Instant.now(), envelope.routeKey(), envelope.id()));
            return;
        }
        node.get().handler().ifPresent(handler -> invokeAndForward(handler, envelope));
    }

    // -------------------------------------------------------------------------
    // Routes
    // -------------------------------------------------------------------------

    /**
     * Bind {@code handler} under {@code key}. An empty key or a null handler is
     * reported and ignored.
     */
    public void addRoute(String key, RpcHandler handler) {
        if (key == null || key.isEmpty()) {
            report(new RpcDispatchEvent.RouteRejected(Instant.now(), "", "key cannot be empty"));
            return;
        }
        if (handler == null) {
            report(new RpcDispatchEvent.RouteRejected(Instant.now(), key, "handler cannot be null"));
            return;
        }
        trie.insert(key, handler);
    }

    /**
     * Detach the route at {@code key} and everything below it. An empty key is
     * reported and ignored; an unknown key is a no-op.
     */
    public void removeRoute(String key) {
        if (key == null || key.isEmpty()) {
            report(new RpcDispatchEvent.RouteRejected(Instant.now(), "", "key cannot be empty"));
            return;
        }
        trie.remove(key);
    }

    public Optional<RpcHandler> lookupRoute(String key) {
        return trie.lookup(key);
    }

    // -------------------------------------------------------------------------
    // Outbound
    // -------------------------------------------------------------------------

    /**
     * Send using the configured default representation.
     */
    public void send(Envelope envelope) {
        send(envelope, binaryFirst);
    }

    public void send(Envelope envelope, boolean useBinary) {
        Objects.requireNonNull(envelope, "envelope");
        sender.send(envelope, useBinary);
    }

    /**
     * Register {@code handler} as the continuation for {@code envelope.id()} and
     * send the envelope using the default representation.
     */
    public void sendWithCallback(Envelope envelope, RpcHandler handler) {
        sendWithCallback(envelope, handler, binaryFirst);
    }

    /**
     * Register {@code handler} as the continuation for {@code envelope.id()}, then
     * send. The handler later receives either the reply (an inbound envelope with
     * an empty route key and the same id) or a synthetic timeout, at most once.
     */
    public void sendWithCallback(Envelope envelope, RpcHandler handler, boolean useBinary) {
        Objects.requireNonNull(envelope, "envelope");
        addSendCallback(envelope.id(), handler);
        send(envelope, useBinary);
    }

    /**
     * Register a continuation for {@code id} without sending anything. Replaces a
     * continuation already registered under the same id.
     */
    public void addSendCallback(String id, RpcHandler handler) {
        pending.set(Objects.requireNonNull(id, "id"), Objects.requireNonNull(handler, "handler"));
    }

    /**
     * Drop the continuation for {@code id}; neither its reply nor its timeout
     * will be delivered.
     *
     * @return {@code true} if a continuation was registered
     */
    public boolean cancelCallback(String id) {
        return pending.remove(id).isPresent();
    }

    public int pendingCallbackCount() {
        return pending.size();
    }

    public boolean isOpen() {
        return sender.isOpen();
    }

    public boolean binaryFirst() {
        return binaryFirst;
    }

    /**
     * Stop the registry sweep and drop pending continuations without notifying
     * them. Routes are kept.
     */
    public void shutdown() {
        pending.shutdown();
    }

    // -------------------------------------------------------------------------
    // Shared with PendingReplyHandler and TimeoutNotifier
    // -------------------------------------------------------------------------

    void invokeAndForward(RpcHandler handler, Envelope request) {
        final Optional<Envelope> response;
        try {
            response = handler.handle(request);
        } catch (RuntimeException e) {
            observabilitySink.onError(new RpcErrorEvent(
                    Instant.now(),
                    "Handler failed for envelope " + request.id() + " (key='" + request.routeKey() + "')",
                    e
            ));
            return;
        }
        if (response != null && response.isPresent()) {
            send(response.get());
        }
    }

    void report(RpcDispatchEvent event) {
        observabilitySink.onDispatchEvent(event);
    }
}
