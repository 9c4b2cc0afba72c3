package com.questrail.simplerpc.codec.impl;

import com.questrail.simplerpc.codec.EnvelopeDecodeException;
import com.questrail.simplerpc.model.Envelope;
import com.questrail.simplerpc.model.Payload;
import org.bson.BsonBinaryReader;
import org.bson.BsonBinaryWriter;
import org.bson.Document;
import org.bson.codecs.DecoderContext;
import org.bson.codecs.DocumentCodec;
import org.bson.codecs.EncoderContext;
import org.bson.io.BasicOutputBuffer;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class BsonEnvelopeBinaryCodecTest {

    private final BsonEnvelopeBinaryCodec codec = new BsonEnvelopeBinaryCodec();

    private static byte[] bson(Document doc) {
        BasicOutputBuffer buffer = new BasicOutputBuffer();
        try (BsonBinaryWriter writer = new BsonBinaryWriter(buffer)) {
            new DocumentCodec().encode(writer, doc, EncoderContext.builder().build());
        }
        return buffer.toByteArray();
    }

    @Test
    void roundTripPreservesAllFields() {
        Envelope original = Envelope.builder()
            .id("abc")
            .status(404)
            .message("missing")
            .routeKey("user.get")
            .structuredPayload(Map.of("user", Map.of("id", 7, "roles", List.of("a", "b"))))
            .param("trace", "t-1")
            .build();

        assertEquals(original, codec.decode(codec.encode(original)));
    }

    @Test
    void roundTripPreservesBinaryPayload() {
        byte[] bytes = {9, 8, 7, 0, -1};
        Envelope original = Envelope.builder().id("bin").binaryPayload(bytes).build();

        Envelope decoded = codec.decode(codec.encode(original));

        assertInstanceOf(Payload.Binary.class, decoded.payload());
        assertArrayEquals(bytes, ((Payload.Binary) decoded.payload()).bytes());
        assertEquals(original, decoded);
    }

    @Test
    void roundTripWithDefaultsKeepsEmptyParamsAndStatus200() {
        Envelope original = Envelope.builder().build();

        Envelope decoded = codec.decode(codec.encode(original));

        assertEquals(200, decoded.status());
        assertTrue(decoded.params().isEmpty());
        assertTrue(decoded.payload().isAbsent());
        assertEquals(original, decoded);
    }

    @Test
    void writesWireFieldNames() {
        Envelope envelope = Envelope.builder().id("1").routeKey("k").structuredPayload("x").build();

        Document doc = new DocumentCodec().decode(
            new BsonBinaryReader(ByteBuffer.wrap(codec.encode(envelope))),
            DecoderContext.builder().build());

        assertEquals("1", doc.getString("UUID"));
        assertEquals(200, doc.getInteger("status"));
        assertEquals("k", doc.getString("key"));
        assertEquals("x", doc.getString("request"));
        assertEquals(new Document(), doc.get("params"));
    }

    @Test
    void missingFieldsFallBackToDefaults() {
        Envelope decoded = codec.decode(bson(new Document("UUID", "only-id")));

        assertEquals("only-id", decoded.id());
        assertEquals(200, decoded.status());
        assertEquals("", decoded.message());
        assertEquals("", decoded.routeKey());
        assertTrue(decoded.payload().isAbsent());
        assertTrue(decoded.params().isEmpty());
    }

    @Test
    void int64StatusIsAccepted() {
        Envelope decoded = codec.decode(bson(new Document("status", 503L)));

        assertEquals(503, decoded.status());
    }

    @Test
    void malformedInputIsADecodeFailure() {
        assertThrows(EnvelopeDecodeException.class, () -> codec.decode(new byte[]{1, 2, 3}));
        assertThrows(EnvelopeDecodeException.class, () -> codec.decode(bson(new Document("status", "ok"))));
        assertThrows(EnvelopeDecodeException.class, () -> codec.decode(bson(new Document("status", 1L << 40))));
        assertThrows(EnvelopeDecodeException.class, () -> codec.decode(bson(new Document("key", 5))));
        assertThrows(EnvelopeDecodeException.class, () -> codec.decode(bson(new Document("params", List.of(1)))));
    }
}
