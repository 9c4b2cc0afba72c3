package com.questrail.simplerpc.transport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * FakeMessageEndpoint
 * -----------------------------------------------------------------------------
 * Test-only {@link MessageEndpoint} implementation.
 *
 * <p>Contains no envelope semantics: it stores outbound frames in the
 * representation they were sent with and lets tests inject inbound frames and
 * connection transitions.</p>
 */
public final class FakeMessageEndpoint implements MessageEndpoint {

    private MessageEndpointListener listener;
    private boolean open;
    private int startCount;
    private int stopCount;

    private final List<String> sentText = new ArrayList<>();
    private final List<byte[]> sentBinary = new ArrayList<>();

    @Override
    public void setListener(MessageEndpointListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Connects immediately.
     */
    @Override
    public void start() {
        startCount++;
        open = true;
        if (listener != null) {
            listener.onTransportUp();
        }
    }

    @Override
    public void stop() {
        stopCount++;
        boolean wasOpen = open;
        open = false;
        if (wasOpen && listener != null) {
            listener.onTransportDown(null);
        }
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void sendText(String frame) {
        Objects.requireNonNull(frame, "frame");
        if (open) {
            sentText.add(frame);
        }
    }

    @Override
    public void sendBinary(byte[] frame) {
        Objects.requireNonNull(frame, "frame");
        if (open) {
            sentBinary.add(frame.clone());
        }
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public void injectText(String frame) {
        requireListener().onTextFrame(frame);
    }

    public void injectBinary(byte[] frame) {
        requireListener().onBinaryFrame(frame);
    }

    /**
     * Simulate the peer or the network dropping the connection.
     */
    public void drop(Throwable cause) {
        open = false;
        requireListener().onTransportDown(cause);
    }

    public List<String> sentText() {
        return Collections.unmodifiableList(sentText);
    }

    public List<byte[]> sentBinary() {
        return Collections.unmodifiableList(sentBinary);
    }

    public int sentCount() {
        return sentText.size() + sentBinary.size();
    }

    public int startCount() {
        return startCount;
    }

    public int stopCount() {
        return stopCount;
    }

    public void clear() {
        sentText.clear();
        sentBinary.clear();
    }

    private MessageEndpointListener requireListener() {
        if (listener == null) {
            throw new IllegalStateException("No listener installed");
        }
        return listener;
    }
}
