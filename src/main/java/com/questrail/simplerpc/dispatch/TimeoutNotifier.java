package com.questrail.simplerpc.dispatch;

import com.questrail.simplerpc.api.RpcHandler;
import com.questrail.simplerpc.model.Envelope;
import com.questrail.simplerpc.observability.RpcDispatchEvent;
import com.questrail.simplerpc.registry.ExpiryListener;

import java.time.Instant;
import java.util.Objects;

/**
 * Expiry listener of the pending-reply registry. Delivers
 * {@link Envelope#timeout(String)} to the continuation of an unanswered request
 * and sends whatever the continuation returns.
 *
 * <p>Runs on the registry sweep thread.</p>
 */
final class TimeoutNotifier implements ExpiryListener<String, RpcHandler> {

    private final RpcDispatcher dispatcher;

    TimeoutNotifier(RpcDispatcher dispatcher) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    }

    @Override
    public void onExpire(String id, RpcHandler continuation) {
        dispatcher.report(new RpcDispatchEvent.ReplyTimedOut(Instant.now(), id));
        dispatcher.invokeAndForward(continuation, Envelope.timeout(id));
    }
}
