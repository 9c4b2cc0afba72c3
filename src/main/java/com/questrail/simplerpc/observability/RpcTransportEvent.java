package com.questrail.simplerpc.observability;

import java.time.Instant;

/**
 * Connection lifecycle transitions as seen by the transport adapter.
 */
public sealed interface RpcTransportEvent {

    Instant timestamp();

    record Opened(Instant timestamp) implements RpcTransportEvent {
    }

    /**
     * @param cause diagnostic cause; {@code null} for an orderly close
     */
    record Closed(Instant timestamp, Throwable cause) implements RpcTransportEvent {
    }

    /**
     * An outbound envelope was dropped because the connection was not open.
     */
    record SendDropped(Instant timestamp, String id) implements RpcTransportEvent {
    }
}
