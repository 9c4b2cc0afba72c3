package com.questrail.simplerpc.config;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Construction parameters for a {@code SimpleRpcClient}.
 *
 * <ul>
 *   <li><b>secure</b>: {@code wss://} instead of {@code ws://}</li>
 *   <li><b>address</b>: {@code host[:port][/path]} of the server</li>
 *   <li><b>token</b>: bearer token passed as the {@code token} query parameter;
 *       empty for none</li>
 *   <li><b>binaryFirst</b>: representation used by sends that do not choose one
 *       explicitly: BSON binary frames when {@code true}, JSON text frames otherwise</li>
 *   <li><b>pendingReplyPolicy</b>: TTL and sweep interval for reply callbacks</li>
 * </ul>
 */
public record RpcClientConfig(
    boolean secure,
    String address,
    String token,
    boolean binaryFirst,
    PendingReplyPolicy pendingReplyPolicy
) {
    public RpcClientConfig {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(pendingReplyPolicy, "pendingReplyPolicy");

        if (address.isBlank()) {
            throw new IllegalArgumentException("address must not be blank");
        }
        if (address.contains("://")) {
            throw new IllegalArgumentException("address must not include a scheme; use secure instead");
        }
    }

    /**
     * The WebSocket URI for this configuration, e.g.
     * {@code wss://rpc.example.com:8443/ws?token=abc}.
     */
    public URI toUri() {
        StringBuilder sb = new StringBuilder()
            .append(secure ? "wss" : "ws")
            .append("://")
            .append(address);
        if (!token.isEmpty()) {
            sb.append(address.contains("?") ? '&' : '?')
                .append("token=")
                .append(URLEncoder.encode(token, StandardCharsets.UTF_8));
        }
        return URI.create(sb.toString());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean secure = false;
        private String address;
        private String token = "";
        private boolean binaryFirst = false;
        private PendingReplyPolicy pendingReplyPolicy = PendingReplyPolicy.defaults();

        public Builder withSecure(boolean secure) {
            this.secure = secure;
            return this;
        }

        public Builder withAddress(String address) {
            this.address = address;
            return this;
        }

        public Builder withToken(String token) {
            this.token = token == null ? "" : token;
            return this;
        }

        public Builder withBinaryFirst(boolean binaryFirst) {
            this.binaryFirst = binaryFirst;
            return this;
        }

        public Builder withPendingReplyPolicy(PendingReplyPolicy policy) {
            this.pendingReplyPolicy = policy;
            return this;
        }

        public RpcClientConfig build() {
            return new RpcClientConfig(secure, address, token, binaryFirst, pendingReplyPolicy);
        }
    }
}
