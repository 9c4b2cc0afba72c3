package com.questrail.simplerpc.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Envelope
 * =============================================================================
 * The request/response unit exchanged over the RPC connection.
 *
 * <h2>Fields</h2>
 * <ul>
 *   <li><b>id</b>: opaque identifier correlating a reply with the request that
 *       caused it. Empty is valid. The library never generates identifiers; the
 *       caller sets one before using it for reply correlation.</li>
 *   <li><b>status</b>: HTTP-like status code, {@value #STATUS_OK} by default.</li>
 *   <li><b>message</b>: human-readable status text.</li>
 *   <li><b>routeKey</b>: dot-separated handler path. Empty means "deliver to the
 *       root handler", i.e. the envelope is a reply to a pending request.</li>
 *   <li><b>payload</b>: the body, see {@link Payload}.</li>
 *   <li><b>params</b>: auxiliary side-channel parameters.</li>
 * </ul>
 *
 * <p>Instances are immutable. Handlers answer by building a new envelope,
 * usually through {@link #reply(Envelope)}.</p>
 */
public record Envelope(
        String id,
        int status,
        String message,
        String routeKey,
        Payload payload,
        Map<String, Object> params
) {
    public static final int STATUS_OK = 200;
    public static final int STATUS_TIMEOUT = 408;
    public static final String TIMEOUT_MESSAGE = "Request timeout";

    public Envelope {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(routeKey, "routeKey");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(params, "params");
        params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    /**
     * Synthetic envelope delivered to a pending-reply handler whose request was
     * never answered within the registry TTL.
     */
    public static Envelope timeout(String id) {
        return builder()
                .id(id)
                .status(STATUS_TIMEOUT)
                .message(TIMEOUT_MESSAGE)
                .build();
    }

    /**
     * Starts a response to {@code request}: same id, empty route key so the peer
     * resolves it against its pending replies.
     */
    public static Builder reply(Envelope request) {
        Objects.requireNonNull(request, "request");
        return builder().id(request.id());
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isRouted() {
        return !routeKey.isEmpty();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .status(status)
                .message(message)
                .routeKey(routeKey)
                .payload(payload)
                .params(params);
    }

    public static final class Builder {
        private String id = "";
        private int status = STATUS_OK;
        private String message = "";
        private String routeKey = "";
        private Payload payload = Payload.absent();
        private final Map<String, Object> params = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder status(int status) {
            this.status = status;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder routeKey(String routeKey) {
            this.routeKey = routeKey;
            return this;
        }

        public Builder payload(Payload payload) {
            this.payload = payload;
            return this;
        }

        public Builder structuredPayload(Object value) {
            this.payload = Payload.of(value);
            return this;
        }

        public Builder binaryPayload(byte[] bytes) {
            this.payload = Payload.ofBytes(bytes);
            return this;
        }

        public Builder param(String name, Object value) {
            this.params.put(Objects.requireNonNull(name, "name"), value);
            return this;
        }

        public Builder params(Map<String, Object> params) {
            this.params.clear();
            this.params.putAll(params);
            return this;
        }

        public Envelope build() {
            return new Envelope(id, status, message, routeKey, payload, params);
        }
    }
}
