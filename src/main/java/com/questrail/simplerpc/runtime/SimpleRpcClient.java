package com.questrail.simplerpc.runtime;

import com.questrail.simplerpc.api.RpcHandler;
import com.questrail.simplerpc.codec.EnvelopeCodec;
import com.questrail.simplerpc.codec.impl.BsonEnvelopeBinaryCodec;
import com.questrail.simplerpc.codec.impl.JacksonEnvelopeTextCodec;
import com.questrail.simplerpc.config.RpcClientConfig;
import com.questrail.simplerpc.dispatch.RpcDispatcher;
import com.questrail.simplerpc.internal.time.MonotonicClock;
import com.questrail.simplerpc.internal.time.MonotonicScheduler;
import com.questrail.simplerpc.internal.time.ScheduledExecutorScheduler;
import com.questrail.simplerpc.internal.time.SystemMonotonicClock;
import com.questrail.simplerpc.model.Envelope;
import com.questrail.simplerpc.observability.RpcObservabilitySink;
import com.questrail.simplerpc.observability.Slf4jRpcObservabilitySink;
import com.questrail.simplerpc.transport.MessageEndpoint;
import com.questrail.simplerpc.transport.websocket.WebSocketTransportAdapter;
import com.questrail.simplerpc.transport.websocket.netty.NettyWebSocketEndpoint;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * SimpleRpcClient
 * =============================================================================
 * Composition root and lifecycle owner for one RPC connection.
 *
 * <h2>Topology</h2>
 * <pre>
 *   MessageEndpoint (Netty WebSocket)
 *        ⇅
 *   WebSocketTransportAdapter (JSON text / BSON binary codecs)
 *        ⇅
 *   RpcDispatcher (route trie + pending-reply registry)
 * </pre>
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #start()} opens the connection asynchronously.</li>
 *   <li>{@link #close()} closes the connection only. Routes and pending
 *       callbacks stay registered; callbacks still time out.</li>
 *   <li>{@link #shutdown()} closes the connection, stops the registry sweep and
 *       releases the sweep thread. Pending callbacks are dropped silently.</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * SimpleRpcClient client = SimpleRpcClient.builder()
 *     .withConfig(RpcClientConfig.builder().withAddress("localhost:8080/rpc").build())
 *     .build();
 * client.addRoute("user.get", request -> Optional.of(Envelope.reply(request).structuredPayload(user).build()));
 * client.start();
 * client.sendWithCallback(request, reply -> { ...; return Optional.empty(); });
 * }</pre>
 */
public final class SimpleRpcClient {

    private final RpcClientConfig config;
    private final WebSocketTransportAdapter transport;
    private final RpcDispatcher dispatcher;
    private final ScheduledExecutorService ownedSchedulerExecutor;

    private SimpleRpcClient(RpcClientConfig config,
                            WebSocketTransportAdapter transport,
                            RpcDispatcher dispatcher,
                            ScheduledExecutorService ownedSchedulerExecutor) {
        this.config = config;
        this.transport = transport;
        this.dispatcher = dispatcher;
        this.ownedSchedulerExecutor = ownedSchedulerExecutor;
    }

    public void start() {
        transport.start();
    }

    /**
     * Close the connection. Subsequent sends are dropped; nothing is flushed.
     */
    public void close() {
        transport.close();
    }

    public void shutdown() {
        transport.close();
        dispatcher.shutdown();

        if (ownedSchedulerExecutor != null) {
            ownedSchedulerExecutor.shutdown();
            try {
                if (!ownedSchedulerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    ownedSchedulerExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                ownedSchedulerExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    public boolean isOpen() {
        return dispatcher.isOpen();
    }

    public RpcClientConfig config() {
        return config;
    }

    public void addRoute(String key, RpcHandler handler) {
        dispatcher.addRoute(key, handler);
    }

    public void removeRoute(String key) {
        dispatcher.removeRoute(key);
    }

    public void send(Envelope envelope) {
        dispatcher.send(envelope);
    }

    public void send(Envelope envelope, boolean useBinary) {
        dispatcher.send(envelope, useBinary);
    }

    public void sendWithCallback(Envelope envelope, RpcHandler handler) {
        dispatcher.sendWithCallback(envelope, handler);
    }

    public void sendWithCallback(Envelope envelope, RpcHandler handler, boolean useBinary) {
        dispatcher.sendWithCallback(envelope, handler, useBinary);
    }

    public void addSendCallback(String id, RpcHandler handler) {
        dispatcher.addSendCallback(id, handler);
    }

    public boolean cancelCallback(String id) {
        return dispatcher.cancelCallback(id);
    }

    public int pendingCallbackCount() {
        return dispatcher.pendingCallbackCount();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private RpcClientConfig config;
        private MessageEndpoint endpoint;
        private RpcObservabilitySink observabilitySink = new Slf4jRpcObservabilitySink();
        private EnvelopeCodec<String> textCodec = new JacksonEnvelopeTextCodec();
        private EnvelopeCodec<byte[]> binaryCodec = new BsonEnvelopeBinaryCodec();
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private MonotonicScheduler scheduler;

        public Builder withConfig(RpcClientConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Replace the Netty WebSocket endpoint normally derived from the config.
         */
        public Builder withEndpoint(MessageEndpoint endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder withObservabilitySink(RpcObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withTextCodec(EnvelopeCodec<String> codec) {
            this.textCodec = codec;
            return this;
        }

        public Builder withBinaryCodec(EnvelopeCodec<byte[]> codec) {
            this.binaryCodec = codec;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Use an externally owned scheduler for the registry sweep. When unset,
         * the client creates and owns a single daemon thread.
         */
        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public SimpleRpcClient build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(clock, "clock");

            // 1. Sweep scheduling
            ScheduledExecutorService ownedExecutor = null;
            MonotonicScheduler effectiveScheduler = scheduler;
            if (effectiveScheduler == null) {
                ownedExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "simple-rpc-registry-sweep");
                    t.setDaemon(true);
                    return t;
                });
                effectiveScheduler = new ScheduledExecutorScheduler(ownedExecutor, clock);
            }

            // 2. Transport
            MessageEndpoint effectiveEndpoint = endpoint != null
                ? endpoint
                : new NettyWebSocketEndpoint(config.toUri());
            WebSocketTransportAdapter transport = new WebSocketTransportAdapter(
                effectiveEndpoint,
                textCodec,
                binaryCodec,
                observabilitySink
            );

            // 3. Dispatcher, then close the transport <-> dispatcher cycle
            RpcDispatcher dispatcher = new RpcDispatcher(
                transport,
                config.binaryFirst(),
                config.pendingReplyPolicy(),
                clock,
                effectiveScheduler,
                observabilitySink
            );
            transport.bind(dispatcher);

            return new SimpleRpcClient(config, transport, dispatcher, ownedExecutor);
        }
    }
}
