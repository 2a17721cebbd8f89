/**
 * Request Channel Transport Ports
 * =============================================================================
 *
 * These types define the <em>framework-agnostic transport boundary</em> between
 * a concrete socket implementation (blocking {@code java.net} sockets, Netty, or
 * a test double) and the code that handles requests.
 *
 * <h2>Why these ports exist</h2>
 * The channel can be served sequentially from one thread or concurrently on
 * Netty event loops. Neither choice may leak into request handling, which only
 * ever sees:
 * <ul>
 *   <li>Completed {@link org.csdt.adinkra.ipc.model.RequestPayload}s</li>
 *   <li>A {@link org.csdt.adinkra.ipc.transport.ClientConnection} handle to
 *       respond through</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Frame bytes only through {@link org.csdt.adinkra.ipc.codec.LineFramer}</li>
 *   <li>Assemble payloads only through the request assembler</li>
 *   <li>Deliver the payloads of one connection in arrival order</li>
 *   <li>Close each connection themselves, after its last payload was handled</li>
 * </ul>
 */
package org.csdt.adinkra.ipc.transport;
