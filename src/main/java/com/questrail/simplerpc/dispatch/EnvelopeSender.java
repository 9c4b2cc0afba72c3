package com.questrail.simplerpc.dispatch;

import com.questrail.simplerpc.model.Envelope;

/**
 * EnvelopeSender
 * -----------------------------------------------------------------------------
 * Outbound port used by {@link RpcDispatcher}.
 *
 * <p>Sending is fire-and-forget. When the connection is not open the envelope is
 * dropped: sends are never queued or retried.</p>
 */
public interface EnvelopeSender
{
    /**
     * Encode and transmit {@code envelope}.
     *
     * @param useBinary {@code true} for the binary representation, {@code false}
     *                  for the text representation
     */
    void send(Envelope envelope, boolean useBinary);

    /**
     * Whether the underlying connection is currently open.
     */
    boolean isOpen();
}
