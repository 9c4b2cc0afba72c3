package com.questrail.simplerpc.codec;

import com.questrail.simplerpc.model.Envelope;

/**
 * EnvelopeCodec
 * -----------------------------------------------------------------------------
 * Translates an {@link Envelope} to and from one wire representation.
 *
 * <p>The frame type {@code F} is the representation the transport carries for
 * this codec: {@code String} for text frames, {@code byte[]} for binary frames.
 * Which codec handles an inbound frame is decided by the frame's representation,
 * never by inspecting its content.</p>
 *
 * <p>All representations share the field names in {@link EnvelopeFields} and the
 * same decoding defaults: a missing field takes the {@link Envelope.Builder}
 * default.</p>
 */
public interface EnvelopeCodec<F>
{
    /**
     * Encode an envelope into a frame ready for transmission.
     *
     * @throws IllegalArgumentException if the payload or params hold a value the
     *                                  representation cannot express
     */
    F encode(Envelope envelope);

    /**
     * Decode exactly one frame.
     *
     * @throws EnvelopeDecodeException if the frame is malformed or a field has the
     *                                 wrong type
     */
    Envelope decode(F frame);
}
