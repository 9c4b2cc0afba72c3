package com.questrail.simplerpc.codec.impl;

import com.questrail.simplerpc.codec.EnvelopeCodec;
import com.questrail.simplerpc.codec.EnvelopeDecodeException;
import com.questrail.simplerpc.codec.EnvelopeFields;
import com.questrail.simplerpc.model.Envelope;
import com.questrail.simplerpc.model.Payload;
import org.bson.BsonBinaryReader;
import org.bson.BsonBinaryWriter;
import org.bson.Document;
import org.bson.codecs.DecoderContext;
import org.bson.codecs.DocumentCodec;
import org.bson.codecs.EncoderContext;
import org.bson.io.BasicOutputBuffer;
import org.bson.types.Binary;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * BsonEnvelopeBinaryCodec
 * =============================================================================
 * Compact binary form of an {@link Envelope}: one BSON document per frame.
 *
 * <ul>
 *   <li>A binary payload is written as a native BSON binary (subtype 0).</li>
 *   <li>Maps are written as embedded documents and read back as
 *       {@code LinkedHashMap}, so decoded values compare equal to plain Java maps.</li>
 *   <li>{@code status} accepts int32, or int64 within int range.</li>
 * </ul>
 *
 * <p>Instances are stateless and safe for concurrent use.</p>
 */
public final class BsonEnvelopeBinaryCodec implements EnvelopeCodec<byte[]> {

    private static final DocumentCodec CODEC = new DocumentCodec();

    @Override
    public byte[] encode(Envelope envelope) {
        Objects.requireNonNull(envelope, "envelope");

        Document doc = new Document()
                .append(EnvelopeFields.ID, envelope.id())
                .append(EnvelopeFields.STATUS, envelope.status())
                .append(EnvelopeFields.MESSAGE, envelope.message())
                .append(EnvelopeFields.ROUTE_KEY, envelope.routeKey());

        Payload payload = envelope.payload();
        if (payload instanceof Payload.Structured structured) {
            doc.append(EnvelopeFields.PAYLOAD, toBson(structured.value()));
        } else if (payload instanceof Payload.Binary binary) {
            doc.append(EnvelopeFields.PAYLOAD, new Binary(binary.bytes()));
        }

        doc.append(EnvelopeFields.PARAMS, toBson(envelope.params()));

        BasicOutputBuffer buffer = new BasicOutputBuffer();
        try (BsonBinaryWriter writer = new BsonBinaryWriter(buffer)) {
            CODEC.encode(writer, doc, EncoderContext.builder().build());
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Envelope " + envelope.id() + " is not BSON-serializable", e);
        }
        return buffer.toByteArray();
    }

    @Override
    public Envelope decode(byte[] frame) {
        Objects.requireNonNull(frame, "frame");

        final Document doc;
        try (BsonBinaryReader reader = new BsonBinaryReader(ByteBuffer.wrap(frame))) {
            doc = CODEC.decode(reader, DecoderContext.builder().build());
        } catch (RuntimeException e) {
            throw new EnvelopeDecodeException("Invalid BSON envelope", e);
        }

        return Envelope.builder()
                .id(text(doc, EnvelopeFields.ID))
                .status(status(doc))
                .message(text(doc, EnvelopeFields.MESSAGE))
                .routeKey(text(doc, EnvelopeFields.ROUTE_KEY))
                .payload(payload(doc.get(EnvelopeFields.PAYLOAD)))
                .params(params(doc.get(EnvelopeFields.PARAMS)))
                .build();
    }

    private static String text(Document doc, String field) {
        Object value = doc.get(field);
        if (value == null) {
            return "";
        }
        if (!(value instanceof String)) {
            throw new EnvelopeDecodeException("Field '" + field + "' must be a string");
        }
        return (String) value;
    }

    private static int status(Document doc) {
        Object value = doc.get(EnvelopeFields.STATUS);
        if (value == null) {
            return Envelope.STATUS_OK;
        }
        if (value instanceof Integer) {
            return (Integer) value;
        }
        if (value instanceof Long) {
            long l = (Long) value;
            if (l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) {
                return (int) l;
            }
        }
        throw new EnvelopeDecodeException("Field 'status' must be an integer");
    }

    private static Payload payload(Object value) {
        if (value == null) {
            return Payload.absent();
        }
        if (value instanceof Binary) {
            return Payload.ofBytes(((Binary) value).getData());
        }
        if (value instanceof byte[]) {
            return Payload.ofBytes((byte[]) value);
        }
        return Payload.of(fromBson(value));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> params(Object value) {
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Document)) {
            throw new EnvelopeDecodeException("Field 'params' must be a document");
        }
        return (Map<String, Object>) fromBson(value);
    }

    private static Object toBson(Object value) {
        if (value instanceof Map<?, ?> map) {
            Document doc = new Document();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                doc.append(String.valueOf(e.getKey()), toBson(e.getValue()));
            }
            return doc;
        }
        if (value instanceof Iterable<?> iterable) {
            List<Object> list = new ArrayList<>();
            for (Object element : iterable) {
                list.add(toBson(element));
            }
            return list;
        }
        return value;
    }

    private static Object fromBson(Object value) {
        if (value instanceof Document doc) {
            Map<String, Object> map = new LinkedHashMap<>();
            for (Map.Entry<String, Object> e : doc.entrySet()) {
                map.put(e.getKey(), fromBson(e.getValue()));
            }
            return map;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list) {
                copy.add(fromBson(element));
            }
            return copy;
        }
        if (value instanceof Binary binary) {
            return binary.getData();
        }
        return value;
    }
}
