package com.questrail.simplerpc.codec.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.simplerpc.codec.EnvelopeCodec;
import com.questrail.simplerpc.codec.EnvelopeDecodeException;
import com.questrail.simplerpc.codec.EnvelopeFields;
import com.questrail.simplerpc.model.Envelope;
import com.questrail.simplerpc.model.Payload;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * JacksonEnvelopeTextCodec
 * =============================================================================
 * JSON text form of an {@link Envelope}, built on the Jackson tree model.
 *
 * <pre>
 *   {"UUID":"42","status":200,"message":"","key":"user.get",
 *    "request":{"name":"x"},"params":{}}
 * </pre>
 *
 * <ul>
 *   <li>An absent payload omits {@code request}; {@code null} decodes as absent.</li>
 *   <li>A binary payload is written as {@code {"$binary":"<base64>"}}. A structured
 *       payload of that same shape (an object whose only key is {@code $binary})
 *       cannot be told apart from it and is refused by {@link #encode}.</li>
 *   <li>Structured values decode to {@code String}, {@code Integer}/{@code Long},
 *       {@code Double}, {@code Boolean}, {@code LinkedHashMap} and {@code ArrayList}.</li>
 * </ul>
 *
 * <h2>Numbers</h2>
 * JSON carries no Java number type, so numbers in the payload and params are
 * normalized on decode: an integer takes the narrowest of {@code Integer},
 * {@code Long} and {@code BigInteger} that holds it, and any fraction becomes a
 * {@code Double}. An envelope carrying {@code 5L} or {@code 1.5f} therefore
 * decodes to one carrying {@code 5} or {@code 1.5d}, which is not
 * {@code equals} to the original.
 */
public final class JacksonEnvelopeTextCodec implements EnvelopeCodec<String> {

    private static final TypeReference<LinkedHashMap<String, Object>> PARAMS_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public JacksonEnvelopeTextCodec() {
        this(new ObjectMapper());
    }

    public JacksonEnvelopeTextCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public String encode(Envelope envelope) {
        Objects.requireNonNull(envelope, "envelope");

        ObjectNode root = mapper.createObjectNode();
        root.put(EnvelopeFields.ID, envelope.id());
        root.put(EnvelopeFields.STATUS, envelope.status());
        root.put(EnvelopeFields.MESSAGE, envelope.message());
        root.put(EnvelopeFields.ROUTE_KEY, envelope.routeKey());

        Payload payload = envelope.payload();
        if (payload instanceof Payload.Structured structured) {
            JsonNode tree = mapper.valueToTree(structured.value());
            if (isBinaryMarker(tree)) {
                throw new IllegalArgumentException("Envelope " + envelope.id()
                        + " has a structured payload shaped like a binary payload");
            }
            root.set(EnvelopeFields.PAYLOAD, tree);
        } else if (payload instanceof Payload.Binary binary) {
            root.putObject(EnvelopeFields.PAYLOAD)
                    .put(EnvelopeFields.BINARY_MARKER, Base64.getEncoder().encodeToString(binary.bytes()));
        }

        root.set(EnvelopeFields.PARAMS, mapper.valueToTree(envelope.params()));

        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Envelope " + envelope.id() + " is not JSON-serializable", e);
        }
    }

    @Override
    public Envelope decode(String frame) {
        Objects.requireNonNull(frame, "frame");

        final JsonNode root;
        try {
            root = mapper.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new EnvelopeDecodeException("Invalid JSON envelope", e);
        }
        if (root == null || !root.isObject()) {
            throw new EnvelopeDecodeException("JSON envelope must be an object");
        }

        return Envelope.builder()
                .id(text(root, EnvelopeFields.ID))
                .status(status(root))
                .message(text(root, EnvelopeFields.MESSAGE))
                .routeKey(text(root, EnvelopeFields.ROUTE_KEY))
                .payload(payload(root.get(EnvelopeFields.PAYLOAD)))
                .params(params(root.get(EnvelopeFields.PARAMS)))
                .build();
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (isMissing(node)) {
            return "";
        }
        if (!node.isTextual()) {
            throw new EnvelopeDecodeException("Field '" + field + "' must be a string");
        }
        return node.textValue();
    }

    private static int status(JsonNode root) {
        JsonNode node = root.get(EnvelopeFields.STATUS);
        if (isMissing(node)) {
            return Envelope.STATUS_OK;
        }
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new EnvelopeDecodeException("Field 'status' must be an integer");
        }
        return node.intValue();
    }

    private Payload payload(JsonNode node) {
        if (isMissing(node)) {
            return Payload.absent();
        }
        if (isBinaryMarker(node)) {
            JsonNode encoded = node.get(EnvelopeFields.BINARY_MARKER);
            if (!encoded.isTextual()) {
                throw new EnvelopeDecodeException("Binary payload must be base64 text");
            }
            try {
                return Payload.ofBytes(Base64.getDecoder().decode(encoded.textValue()));
            } catch (IllegalArgumentException e) {
                throw new EnvelopeDecodeException("Binary payload is not valid base64", e);
            }
        }
        return Payload.of(mapper.convertValue(node, Object.class));
    }

    private Map<String, Object> params(JsonNode node) {
        if (isMissing(node)) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw new EnvelopeDecodeException("Field 'params' must be an object");
        }
        return mapper.convertValue(node, PARAMS_TYPE);
    }

    private static boolean isBinaryMarker(JsonNode node) {
        return node.isObject() && node.size() == 1 && node.has(EnvelopeFields.BINARY_MARKER);
    }

    private static boolean isMissing(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }
}
