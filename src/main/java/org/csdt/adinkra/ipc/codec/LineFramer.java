package org.csdt.adinkra.ipc.codec;

import java.util.Optional;

/**
 * LineFramer
 * -----------------------------------------------------------------------------
 * Byte-level line framer for the request channel.
 *
 * <p>This interface defines the inbound boundary between raw transport bytes
 * and logical protocol lines. It is a pure state machine: it owns no socket,
 * performs no I/O, and can be driven by a blocking stream reader or by an
 * event-loop handler alike.</p>
 *
 * <p>The framer is responsible only for:</p>
 * <ul>
 *   <li>Detecting line terminators</li>
 *   <li>Accumulating the bytes of the current line</li>
 *   <li>Emitting each completed line without its terminator</li>
 * </ul>
 *
 * <p>The framer is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Recognising sentinel lines</li>
 *   <li>Accumulating request payloads</li>
 *   <li>Deciding what an unterminated line at end of stream means</li>
 * </ul>
 *
 * <p>Instances hold per-connection state and are not thread-safe.</p>
 */
public interface LineFramer
{
    /**
     * Consume exactly one octet.
     *
     * @param b the next byte from the transport
     * @return the completed line if {@code b} finished one; otherwise
     *         {@link Optional#empty()}
     * @throws FramingException if the current line exceeds the framer's
     *         maximum line length
     */
    Optional<String> accept(byte b) throws FramingException;

    /**
     * Returns {@code true} if bytes have been consumed since the last completed
     * line, including a pending terminator byte.
     *
     * <p>The framer never emits such a partial line on its own. A caller that
     * reaches end of stream while this is {@code true} has observed a framing
     * error.</p>
     */
    boolean hasPartialLine();

    /**
     * Discard any partial line and pending terminator state.
     */
    void reset();
}
