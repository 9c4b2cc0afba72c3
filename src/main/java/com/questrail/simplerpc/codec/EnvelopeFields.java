package com.questrail.simplerpc.codec;

/**
 * Field names shared by every envelope wire representation.
 */
public final class EnvelopeFields {

    public static final String ID = "UUID";
    public static final String STATUS = "status";
    public static final String MESSAGE = "message";
    public static final String ROUTE_KEY = "key";
    public static final String PAYLOAD = "request";
    public static final String PARAMS = "params";

    /**
     * Marker key for a binary payload in the text form:
     * {@code {"$binary": "<base64>"}}, following MongoDB Extended JSON.
     */
    public static final String BINARY_MARKER = "$binary";

    private EnvelopeFields() {
    }
}
