package com.questrail.simplerpc.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of RpcObservabilitySink that emits logs via SLF4J.
 *
 * <p>Unmatched replies and dropped sends are logged at debug: both are expected
 * in normal operation.</p>
 */
public final class Slf4jRpcObservabilitySink implements RpcObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jRpcObservabilitySink.class);

    @Override
    public void onDispatchEvent(RpcDispatchEvent event) {
        if (event instanceof RpcDispatchEvent.RouteNotFound e) {
            log.warn("SimpleRPC: No such route '{}' (id={})", e.routeKey(), e.id());
        } else if (event instanceof RpcDispatchEvent.RouteRejected e) {
            log.warn("SimpleRPC: Route '{}' rejected: {}", e.routeKey(), e.reason());
        } else if (event instanceof RpcDispatchEvent.ReplyTimedOut e) {
            log.info("SimpleRPC: Request {} timed out", e.id());
        } else if (event instanceof RpcDispatchEvent.UnmatchedReply e) {
            log.debug("SimpleRPC: No pending request for reply {}", e.id());
        }
    }

    @Override
    public void onTransportEvent(RpcTransportEvent event) {
        if (event instanceof RpcTransportEvent.SendDropped e) {
            log.debug("SimpleRPC: Connection not open, dropped envelope {}", e.id());
        } else if (event instanceof RpcTransportEvent.Closed e && e.cause() != null) {
            log.warn("SimpleRPC: Connection closed", e.cause());
        } else {
            log.info("SimpleRPC Transport Event: {}", event);
        }
    }

    @Override
    public void onError(RpcErrorEvent event) {
        log.error("SimpleRPC Error: {}", event.message(), event.cause());
    }
}
