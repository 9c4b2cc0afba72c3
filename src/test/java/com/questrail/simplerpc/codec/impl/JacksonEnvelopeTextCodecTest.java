package com.questrail.simplerpc.codec.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.simplerpc.codec.EnvelopeDecodeException;
import com.questrail.simplerpc.model.Envelope;
import com.questrail.simplerpc.model.Payload;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class JacksonEnvelopeTextCodecTest {

    private final JacksonEnvelopeTextCodec codec = new JacksonEnvelopeTextCodec();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void encodesWireFieldNames() throws Exception {
        Envelope envelope = Envelope.builder()
            .id("42")
            .status(201)
            .message("created")
            .routeKey("user.create")
            .structuredPayload(Map.of("name", "alice"))
            .param("trace", "t-1")
            .build();

        JsonNode json = mapper.readTree(codec.encode(envelope));

        assertEquals("42", json.get("UUID").asText());
        assertEquals(201, json.get("status").asInt());
        assertEquals("created", json.get("message").asText());
        assertEquals("user.create", json.get("key").asText());
        assertEquals("alice", json.get("request").get("name").asText());
        assertEquals("t-1", json.get("params").get("trace").asText());
    }

    @Test
    void absentPayloadOmitsRequestField() throws Exception {
        JsonNode json = mapper.readTree(codec.encode(Envelope.builder().id("1").build()));

        assertFalse(json.has("request"));
        assertTrue(json.get("params").isObject());
        assertEquals(0, json.get("params").size());
    }

    @Test
    void roundTripPreservesStructuredPayloadAndParams() {
        Envelope original = Envelope.builder()
            .id("abc")
            .status(500)
            .message("failed")
            .routeKey("a.b")
            .structuredPayload(Map.of("ids", List.of(1, 2, 3), "ok", true, "name", "x"))
            .param("attempt", 2)
            .param("tags", List.of("p", "q"))
            .build();

        assertEquals(original, codec.decode(codec.encode(original)));
    }

    @Test
    void roundTripPreservesBinaryPayload() {
        byte[] bytes = {0, 1, 2, (byte) 0xff};
        Envelope original = Envelope.builder().id("b").binaryPayload(bytes).build();

        String text = codec.encode(original);
        Envelope decoded = codec.decode(text);

        assertTrue(text.contains("\"$binary\":\"AAEC/w==\""), text);
        assertEquals(Payload.ofBytes(bytes), decoded.payload());
    }

    @Test
    void missingFieldsFallBackToDefaults() {
        Envelope decoded = codec.decode("{}");

        assertEquals("", decoded.id());
        assertEquals(200, decoded.status());
        assertEquals("", decoded.message());
        assertEquals("", decoded.routeKey());
        assertTrue(decoded.payload().isAbsent());
        assertTrue(decoded.params().isEmpty());
        assertEquals(Envelope.builder().build(), decoded);
    }

    @Test
    void nullFieldsFallBackToDefaults() {
        Envelope decoded = codec.decode(
            "{\"UUID\":\"1\",\"status\":null,\"message\":null,\"key\":null,\"request\":null,\"params\":null}");

        assertEquals("1", decoded.id());
        assertEquals(200, decoded.status());
        assertTrue(decoded.payload().isAbsent());
        assertTrue(decoded.params().isEmpty());
    }

    @Test
    void scalarPayloadDecodesAsStructuredValue() {
        Envelope decoded = codec.decode("{\"UUID\":\"1\",\"request\":\"hello\"}");

        assertEquals(Payload.of("hello"), decoded.payload());
    }

    @Test
    void malformedInputIsADecodeFailure() {
        assertThrows(EnvelopeDecodeException.class, () -> codec.decode("not json"));
        assertThrows(EnvelopeDecodeException.class, () -> codec.decode("[1,2]"));
        assertThrows(EnvelopeDecodeException.class, () -> codec.decode("{\"status\":\"ok\"}"));
        assertThrows(EnvelopeDecodeException.class, () -> codec.decode("{\"status\":1.5}"));
        assertThrows(EnvelopeDecodeException.class, () -> codec.decode("{\"UUID\":7}"));
        assertThrows(EnvelopeDecodeException.class, () -> codec.decode("{\"params\":[1]}"));
        assertThrows(EnvelopeDecodeException.class, () -> codec.decode("{\"request\":{\"$binary\":\"@@@\"}}"));
    }

    @Test
    void structuredPayloadShapedLikeBinaryIsRefused() {
        Envelope ambiguous = Envelope.builder()
            .id("1")
            .structuredPayload(Map.of("$binary", "hello world!"))
            .build();

        assertThrows(IllegalArgumentException.class, () -> codec.encode(ambiguous));
    }

    @Test
    void binaryKeyAlongsideOtherKeysStaysStructured() {
        Envelope original = Envelope.builder()
            .id("1")
            .structuredPayload(Map.of("$binary", "hello world!", "kind", "note"))
            .build();

        assertEquals(original, codec.decode(codec.encode(original)));
    }

    @Test
    void numbersAreNormalizedOnDecode() {
        Envelope original = Envelope.builder()
            .id("n")
            .structuredPayload(List.of(5L, 1.5f, 5_000_000_000L, new BigInteger("99999999999999999999")))
            .param("n", 5L)
            .build();

        Envelope decoded = codec.decode(codec.encode(original));

        assertEquals(5, decoded.params().get("n"));
        assertEquals(
            Payload.of(List.of(5, 1.5d, 5_000_000_000L, new BigInteger("99999999999999999999"))),
            decoded.payload());
        assertNotEquals(original, decoded, "Java number types do not survive JSON");
    }
}
