package com.questrail.simplerpc.model;

import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

/**
 * Request/response body carried by an {@link Envelope}.
 *
 * <p>
 * The body is a tagged union so that both wire forms can carry it without
 * losing the distinction between "nothing", "a structured value" and "raw bytes":
 * </p>
 * <ul>
 *   <li>{@link Absent}: no body</li>
 *   <li>{@link Structured}: a string, number, boolean, list or string-keyed map</li>
 *   <li>{@link Binary}: opaque bytes</li>
 * </ul>
 */
public sealed interface Payload permits Payload.Absent, Payload.Structured, Payload.Binary
{
    static Payload absent()
    {
        return Absent.INSTANCE;
    }

    /**
     * Wraps a structured value. {@code null} maps to {@link Absent}.
     */
    static Payload of(Object value)
    {
        return value == null ? Absent.INSTANCE : new Structured(value);
    }

    static Payload ofBytes(byte[] bytes)
    {
        return new Binary(bytes);
    }

    default boolean isAbsent()
    {
        return this instanceof Absent;
    }

    final class Absent implements Payload
    {
        private static final Absent INSTANCE = new Absent();

        private Absent()
        {
        }

        @Override
        public String toString()
        {
            return "Absent";
        }
    }

    record Structured(Object value) implements Payload
    {
        public Structured
        {
            Objects.requireNonNull(value, "value");
            if (value instanceof byte[]) {
                throw new IllegalArgumentException("raw bytes must use Payload.Binary");
            }
        }
    }

    /**
     * Raw bytes. Copied on the way in and out; compared by content.
     */
    record Binary(byte[] bytes) implements Payload
    {
        public Binary
        {
            bytes = Objects.requireNonNull(bytes, "bytes").clone();
        }

        @Override
        public byte[] bytes()
        {
            return bytes.clone();
        }

        @Override
        public boolean equals(Object o)
        {
            return o instanceof Binary other && Arrays.equals(bytes, other.bytes);
        }

        @Override
        public int hashCode()
        {
            return Arrays.hashCode(bytes);
        }

        @Override
        public String toString()
        {
            return "Binary[" + Base64.getEncoder().encodeToString(bytes) + "]";
        }
    }
}
