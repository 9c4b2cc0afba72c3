package com.questrail.simplerpc.runtime;

import com.questrail.simplerpc.codec.impl.BsonEnvelopeBinaryCodec;
import com.questrail.simplerpc.codec.impl.JacksonEnvelopeTextCodec;
import com.questrail.simplerpc.config.PendingReplyPolicy;
import com.questrail.simplerpc.config.RpcClientConfig;
import com.questrail.simplerpc.model.Envelope;
import com.questrail.simplerpc.model.Payload;
import com.questrail.simplerpc.observability.RecordingObservabilitySink;
import com.questrail.simplerpc.time.DeterministicScheduler;
import com.questrail.simplerpc.time.ManualMonotonicClock;
import com.questrail.simplerpc.transport.FakeMessageEndpoint;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SimpleRpcClientTest
 * -----------------------------------------------------------------------------
 * Exercises the composed client over a fake endpoint with manual time. The real
 * Netty endpoint is covered by {@code NettyWebSocketEndpointTest}.
 */
final class SimpleRpcClientTest {

    private final JacksonEnvelopeTextCodec text = new JacksonEnvelopeTextCodec();
    private final BsonEnvelopeBinaryCodec binary = new BsonEnvelopeBinaryCodec();

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private FakeMessageEndpoint endpoint;
    private RecordingObservabilitySink sink;
    private SimpleRpcClient client;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        endpoint = new FakeMessageEndpoint();
        sink = new RecordingObservabilitySink();
        client = newClient(false);
    }

    @AfterEach
    void tearDown() {
        client.shutdown();
    }

    private SimpleRpcClient newClient(boolean binaryFirst) {
        RpcClientConfig config = RpcClientConfig.builder()
            .withAddress("localhost:9000/rpc")
            .withBinaryFirst(binaryFirst)
            .withPendingReplyPolicy(new PendingReplyPolicy(Duration.ofSeconds(10), Duration.ofSeconds(5)))
            .build();
        return SimpleRpcClient.builder()
            .withConfig(config)
            .withEndpoint(endpoint)
            .withClock(clock)
            .withScheduler(scheduler)
            .withObservabilitySink(sink)
            .build();
    }

    @Test
    void requestAndReplyOverTextFrames() {
        client.start();
        assertTrue(client.isOpen());

        List<Envelope> replies = new ArrayList<>();
        client.sendWithCallback(
            Envelope.builder().id("r1").routeKey("user.get").structuredPayload("alice").build(),
            reply -> {
                replies.add(reply);
                return Optional.empty();
            });

        Envelope onWire = text.decode(endpoint.sentText().get(0));
        assertEquals("r1", onWire.id());
        assertEquals("user.get", onWire.routeKey());
        assertEquals(1, client.pendingCallbackCount());

        endpoint.injectText(text.encode(Envelope.builder().id("r1").structuredPayload("ok").build()));

        assertEquals(1, replies.size());
        assertEquals(Payload.of("ok"), replies.get(0).payload());
        assertEquals(0, client.pendingCallbackCount());
    }

    @Test
    void servesInboundRequestsOnRegisteredRoutes() {
        client.addRoute("math.double", request -> {
            int n = ((Number) ((Payload.Structured) request.payload()).value()).intValue();
            return Optional.of(Envelope.reply(request).structuredPayload(n * 2).build());
        });
        client.start();

        endpoint.injectBinary(binary.encode(
            Envelope.builder().id("q").routeKey("math.double").structuredPayload(21).build()));

        // inbound representation does not influence the reply representation
        Envelope response = text.decode(endpoint.sentText().get(0));
        assertEquals("q", response.id());
        assertEquals(Payload.of(42), response.payload());
    }

    @Test
    void binaryFirstSendsBinaryByDefault() {
        client.shutdown();
        client = newClient(true);
        client.start();

        client.send(Envelope.builder().id("b").routeKey("x").build());
        client.send(Envelope.builder().id("t").routeKey("x").build(), false);

        assertEquals("b", binary.decode(endpoint.sentBinary().get(0)).id());
        assertEquals("t", text.decode(endpoint.sentText().get(0)).id());
    }

    @Test
    void removedRouteNoLongerAnswers() {
        client.addRoute("a.b", request -> Optional.of(Envelope.reply(request).build()));
        client.start();
        client.removeRoute("a.b");

        endpoint.injectText(text.encode(Envelope.builder().id("1").routeKey("a.b").build()));

        assertEquals(0, endpoint.sentCount());
    }

    @Test
    void unansweredRequestTimesOutThroughTheRuntime() {
        client.start();
        List<Envelope> replies = new ArrayList<>();
        client.sendWithCallback(Envelope.builder().id("slow").routeKey("x").build(), reply -> {
            replies.add(reply);
            return Optional.empty();
        });

        scheduler.advanceMillis(10_000);

        assertEquals(1, replies.size());
        assertEquals(Envelope.STATUS_TIMEOUT, replies.get(0).status());
        assertEquals("slow", replies.get(0).id());
    }

    @Test
    void cancelCallbackSuppressesDelivery() {
        client.start();
        List<Envelope> replies = new ArrayList<>();
        client.addSendCallback("c", reply -> {
            replies.add(reply);
            return Optional.empty();
        });

        assertTrue(client.cancelCallback("c"));
        endpoint.injectText(text.encode(Envelope.builder().id("c").build()));
        scheduler.advanceMillis(20_000);

        assertTrue(replies.isEmpty());
    }

    @Test
    void closeThenSendDoesNotTransmit() {
        client.start();
        client.close();

        assertFalse(client.isOpen());
        assertDoesNotThrow(() -> client.send(Envelope.builder().id("x").build()));
        assertEquals(0, endpoint.sentCount());
    }

    @Test
    void closeKeepsPendingCallbacksAlive() {
        client.start();
        List<Envelope> replies = new ArrayList<>();
        client.sendWithCallback(Envelope.builder().id("p").routeKey("x").build(), reply -> {
            replies.add(reply);
            return Optional.empty();
        });

        client.close();
        assertEquals(1, client.pendingCallbackCount());

        scheduler.advanceMillis(10_000);
        assertEquals(1, replies.size(), "the timeout is still delivered after close");
    }

    @Test
    void shutdownDropsPendingCallbacksAndStopsTheSweep() {
        client.start();
        client.addSendCallback("p", reply -> Optional.empty());

        client.shutdown();

        assertEquals(0, client.pendingCallbackCount());
        assertEquals(0, scheduler.pendingTaskCount());
        assertFalse(client.isOpen());
    }

    @Test
    void buildRequiresConfig() {
        assertThrows(NullPointerException.class, () -> SimpleRpcClient.builder().build());
    }
}
