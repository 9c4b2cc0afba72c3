package com.questrail.simplerpc.observability;

import java.time.Instant;

/**
 * Record representing a non-fatal failure in the RPC stack: an undecodable
 * frame, a handler that threw, or a transport error.
 */
public record RpcErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
