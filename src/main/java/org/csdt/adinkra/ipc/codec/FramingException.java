package org.csdt.adinkra.ipc.codec;

/**
 * Signals that a connection's byte stream could not be framed into a complete
 * request sequence.
 *
 * This typically reflects:
 * <ul>
 *   <li>End of stream with an unterminated line buffered</li>
 *   <li>End of stream before {@code ENDTRANSMISSION} was received</li>
 * </ul>
 *
 * A framing error aborts the connection it occurred on and nothing else.
 */
public final class FramingException extends Exception
{
    public FramingException(String message) {
        super(message);
    }

    public FramingException(String message, Throwable cause) {
        super(message, cause);
    }
}
