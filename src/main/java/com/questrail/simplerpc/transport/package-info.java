/**
 * Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic transport boundary</em>
 * between a concrete networking implementation (Netty WebSocket, a test double)
 * and the RPC dispatch layer.
 *
 * <p>Everything above the transport adapter sees only:</p>
 * <ul>
 *   <li>Inbound frames as {@code String} (text) or {@code byte[]} (binary)</li>
 *   <li>Connection lifecycle notifications (up/down)</li>
 * </ul>
 *
 * <h2>Constraints</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only (no envelope decoding)</li>
 *   <li>Preserve each frame's representation (text vs binary)</li>
 *   <li>Not reconnect, queue, or retry</li>
 * </ul>
 */
package com.questrail.simplerpc.transport;
