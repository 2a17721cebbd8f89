/**
 * Request Channel Codec: Line Framing
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> of the Adinkra
 * request channel. The codec layer implements the wire-level rules of the
 * channel protocol:</p>
 *
 * <ul>
 *   <li>Lines are terminated by CR immediately followed by LF</li>
 *   <li>A CR that is not immediately followed by LF is dropped</li>
 *   <li>Line bytes are decoded as UTF-8</li>
 * </ul>
 *
 * <h2>Architectural Placement</h2>
 * <p>The codec layer sits <strong>below</strong> request assembly and
 * <strong>above</strong> transport I/O:</p>
 *
 * <pre>
 *   byte stream (socket / ByteBuf)
 *        → LineFramer              (wire rules applied here)
 *            → String line         (terminator stripped)
 *                → RequestAssembler
 *                    → RequestPayload
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>The framer knows nothing about sentinel lines.</li>
 *   <li>The framer never performs I/O; transports push bytes into it.</li>
 *   <li>End-of-stream handling is a transport decision, reported as a
 *       {@link org.csdt.adinkra.ipc.codec.FramingException}.</li>
 * </ul>
 */
package org.csdt.adinkra.ipc.codec;
