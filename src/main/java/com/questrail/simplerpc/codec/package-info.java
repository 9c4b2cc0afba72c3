/**
 * Envelope Codecs
 * =============================================================================
 *
 * <p>Wire representations of {@link com.questrail.simplerpc.model.Envelope}.
 * Two representations carry the same schema:</p>
 *
 * <ul>
 *   <li>a textual form (JSON), sent as WebSocket text frames</li>
 *   <li>a compact binary form (BSON), sent as WebSocket binary frames</li>
 * </ul>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   text frame   → EnvelopeCodec&lt;String&gt; ─┐
 *                                          ├→ Envelope → RpcDispatcher
 *   binary frame → EnvelopeCodec&lt;byte[]&gt; ─┘
 * </pre>
 *
 * <p>Codecs are semantics-free: they neither route nor correlate. Any failure
 * results in the frame being dropped by the transport adapter.</p>
 */
package com.questrail.simplerpc.codec;
