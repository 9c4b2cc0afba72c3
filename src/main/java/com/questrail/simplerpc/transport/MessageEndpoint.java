package com.questrail.simplerpc.transport;

/**
 * MessageEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a duplexed, message-oriented connection (WebSocket-style).
 *
 * <p>Each frame is either text or binary, and the representation is preserved
 * end to end: the receiving side learns it from which listener callback fires,
 * not from the frame's content.</p>
 *
 * <p>Implementations may be backed by Netty, the JDK WebSocket client, or a test
 * harness. Reconnection is not part of this port.</p>
 */
public interface MessageEndpoint
{
    /**
     * Open the connection asynchronously.
     *
     * <p>Once the connection is usable the endpoint MUST notify its listener via
     * {@link MessageEndpointListener#onTransportUp()}; a failure to connect is
     * reported via {@link MessageEndpointListener#onTransportDown(Throwable)}.</p>
     */
    void start();

    /**
     * Close the connection and release transport resources. The listener is
     * notified via {@link MessageEndpointListener#onTransportDown(Throwable)} at
     * most once per transition.
     */
    void stop();

    /**
     * Whether frames handed to this endpoint can currently be transmitted.
     */
    boolean isOpen();

    /**
     * Transmit a text frame. Silently dropped if the connection is not open.
     */
    void sendText(String frame);

    /**
     * Transmit a binary frame. Silently dropped if the connection is not open.
     */
    void sendBinary(byte[] frame);

    /**
     * Register the listener that receives inbound frames and lifecycle events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(MessageEndpointListener listener);
}
