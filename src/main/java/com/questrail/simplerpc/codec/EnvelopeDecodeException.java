package com.questrail.simplerpc.codec;

/**
 * Indicates that an inbound frame could not be translated into an
 * {@link com.questrail.simplerpc.model.Envelope}.
 *
 * This typically reflects:
 * <ul>
 *   <li>Syntactically invalid JSON or BSON</li>
 *   <li>A root value that is not an object/document</li>
 *   <li>A known field carrying the wrong type (e.g. a textual {@code status})</li>
 * </ul>
 *
 * The transport adapter reports and drops such frames; they never reach dispatch.
 */
public final class EnvelopeDecodeException extends RuntimeException
{
    public EnvelopeDecodeException(String message) {
        super(message);
    }

    public EnvelopeDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
