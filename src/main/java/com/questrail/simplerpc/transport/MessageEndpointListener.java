package com.questrail.simplerpc.transport;

/**
 * MessageEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link MessageEndpoint}.
 *
 * <p>All callbacks must be delivered in a <em>serialized</em> manner by the
 * implementation. Netty endpoints serialize callbacks on the channel's event
 * loop.</p>
 */
public interface MessageEndpointListener
{
    /**
     * Called when the connection becomes usable (handshake complete).
     */
    void onTransportUp();

    /**
     * Called when the connection becomes unusable.
     *
     * @param cause diagnostic cause; {@code null} for an orderly close
     */
    void onTransportDown(Throwable cause);

    /**
     * Called for each complete inbound text frame.
     */
    void onTextFrame(String frame);

    /**
     * Called for each complete inbound binary frame. The array is owned by the
     * listener; framework buffers have already been released.
     */
    void onBinaryFrame(byte[] frame);
}
