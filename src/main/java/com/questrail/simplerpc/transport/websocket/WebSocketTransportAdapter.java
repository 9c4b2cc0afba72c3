package com.questrail.simplerpc.transport.websocket;

import com.questrail.simplerpc.codec.EnvelopeCodec;
import com.questrail.simplerpc.codec.EnvelopeDecodeException;
import com.questrail.simplerpc.dispatch.EnvelopeSender;
import com.questrail.simplerpc.dispatch.RpcDispatcher;
import com.questrail.simplerpc.model.Envelope;
import com.questrail.simplerpc.observability.RpcErrorEvent;
import com.questrail.simplerpc.observability.RpcObservabilitySink;
import com.questrail.simplerpc.observability.RpcTransportEvent;
import com.questrail.simplerpc.transport.MessageEndpoint;
import com.questrail.simplerpc.transport.MessageEndpointListener;

import java.time.Instant;
import java.util.Objects;

/**
 * WebSocketTransportAdapter
 * =============================================================================
 * Translation layer between a {@link MessageEndpoint} and the {@link RpcDispatcher}.
 *
 * <h2>Inbound path (decode-before-dispatch)</h2>
 *
 * <pre>
 *   text frame   → textCodec   ─┐
 *                               ├→ Envelope → RpcDispatcher.onInboundEnvelope
 *   binary frame → binaryCodec ─┘
 * </pre>
 *
 * <p>The codec is chosen by the frame's representation, as reported by the
 * endpoint callback. Content is never sniffed, so a peer may mix text and
 * binary frames within one session. A frame that fails to decode is reported
 * via {@link RpcObservabilitySink#onError} and dropped.</p>
 *
 * <h2>Outbound path</h2>
 *
 * <pre>
 *   Envelope → (binary ? binaryCodec : textCodec) → MessageEndpoint.send*
 * </pre>
 *
 * <p>While the connection is not open, outbound envelopes are dropped without
 * encoding. Nothing is queued for a later connection.</p>
 *
 * <h2>Explicit non-responsibilities</h2>
 * This class does not route, correlate replies, schedule timeouts, or reconnect.
 */
public final class WebSocketTransportAdapter implements MessageEndpointListener, EnvelopeSender {

    private final MessageEndpoint endpoint;
    private final EnvelopeCodec<String> textCodec;
    private final EnvelopeCodec<byte[]> binaryCodec;
    private final RpcObservabilitySink observabilitySink;

    private volatile RpcDispatcher dispatcher;
    private volatile boolean open;

    public WebSocketTransportAdapter(MessageEndpoint endpoint,
                                     EnvelopeCodec<String> textCodec,
                                     EnvelopeCodec<byte[]> binaryCodec,
                                     RpcObservabilitySink observabilitySink) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.textCodec = Objects.requireNonNull(textCodec, "textCodec");
        this.binaryCodec = Objects.requireNonNull(binaryCodec, "binaryCodec");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");

        // The endpoint is the raw I/O surface; this adapter is the translation layer.
        this.endpoint.setListener(this);
    }

    /**
     * Attach the dispatcher that receives decoded envelopes. The dispatcher in
     * turn sends through this adapter, so the two are wired after construction.
     * Must be called before {@link #start()}.
     */
    public void bind(RpcDispatcher dispatcher) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    }

    public void start() {
        if (dispatcher == null) {
            throw new IllegalStateException("RpcDispatcher must be bound before start()");
        }
        endpoint.start();
    }

    /**
     * Close the connection. Pending callbacks and routes are untouched.
     */
    public void close() {
        endpoint.stop();
        open = false;
    }

    // -------------------------------------------------------------------------
    // EnvelopeSender
    // -------------------------------------------------------------------------

    @Override
    public boolean isOpen() {
        return open && endpoint.isOpen();
    }

    @Override
    public void send(Envelope envelope, boolean useBinary) {
        Objects.requireNonNull(envelope, "envelope");

        if (!isOpen()) {
            observabilitySink.onTransportEvent(new RpcTransportEvent.SendDropped(Instant.now(), envelope.id()));
            return;
        }

        try {
            if (useBinary) {
                endpoint.sendBinary(binaryCodec.encode(envelope));
            } else {
                endpoint.sendText(textCodec.encode(envelope));
            }
        } catch (IllegalArgumentException e) {
            observabilitySink.onError(new RpcErrorEvent(
                    Instant.now(),
                    "Failed to encode envelope " + envelope.id(),
                    e
            ));
        }
    }

    // -------------------------------------------------------------------------
    // MessageEndpointListener
    // -------------------------------------------------------------------------

    @Override
    public void onTransportUp() {
        open = true;
        observabilitySink.onTransportEvent(new RpcTransportEvent.Opened(Instant.now()));
    }

    @Override
    public void onTransportDown(Throwable cause) {
        boolean wasOpen = open;
        open = false;
        if (wasOpen || cause != null) {
            observabilitySink.onTransportEvent(new RpcTransportEvent.Closed(Instant.now(), cause));
        }
    }

    @Override
    public void onTextFrame(String frame) {
        Objects.requireNonNull(frame, "frame");

        final Envelope envelope;
        try {
            envelope = textCodec.decode(frame);
        } catch (EnvelopeDecodeException e) {
            observabilitySink.onError(new RpcErrorEvent(Instant.now(), "Failed to decode text frame", e));
            return;
        }
        deliver(envelope);
    }

    @Override
    public void onBinaryFrame(byte[] frame) {
        Objects.requireNonNull(frame, "frame");

        final Envelope envelope;
        try {
            envelope = binaryCodec.decode(frame);
        } catch (EnvelopeDecodeException e) {
            observabilitySink.onError(new RpcErrorEvent(Instant.now(), "Failed to decode binary frame", e));
            return;
        }
        deliver(envelope);
    }

    private void deliver(Envelope envelope) {
        RpcDispatcher d = dispatcher;
        if (d == null) {
            return;
        }
        d.onInboundEnvelope(envelope);
    }
}
