package org.csdt.adinkra.ipc.codec.impl;

import org.csdt.adinkra.ipc.codec.FramingException;
import org.csdt.adinkra.ipc.codec.LineFramer;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;

/**
 * CrLfLineFramer
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link LineFramer} for CRLF-terminated lines.
 *
 * <p>Bytes are scanned one at a time:</p>
 * <ol>
 *   <li>CR is held in a pending-terminator flag and is not buffered.</li>
 *   <li>LF while a CR is pending completes the line. The buffer is emitted
 *       without CR/LF and cleared; the flag is cleared.</li>
 *   <li>Any other byte discards a pending CR, clears the flag, and is
 *       appended to the buffer. This includes LF without a pending CR.</li>
 * </ol>
 *
 * <p>A lone CR is therefore lost: it never appears in any emitted line, so
 * {@code "NEW\rTRANSMISSION\r\n"} frames as the line {@code "NEWTRANSMISSION"}.</p>
 *
 * <p>A line longer than the maximum line length is rejected with a
 * {@link FramingException}; the buffer is cleared and the framer may be
 * reset and reused.</p>
 */
public final class CrLfLineFramer implements LineFramer
{
    static final byte CR = '\r';
    static final byte LF = '\n';

    public static final int DEFAULT_MAX_LINE_LENGTH = 64 * 1024 * 1024;

    private static final int INITIAL_CAPACITY = 256;

    private final int maxLineLength;

    private byte[] buffer = new byte[INITIAL_CAPACITY];
    private int length;
    private boolean carriageReturnPending;

    public CrLfLineFramer()
    {
        this(DEFAULT_MAX_LINE_LENGTH);
    }

    public CrLfLineFramer(int maxLineLength)
    {
        if (maxLineLength < 1) {
            throw new IllegalArgumentException("maxLineLength must be positive");
        }
        this.maxLineLength = maxLineLength;
    }

    @Override
    public Optional<String> accept(byte b) throws FramingException
    {
        if (b == CR) {
            carriageReturnPending = true;
            return Optional.empty();
        }

        if (b == LF && carriageReturnPending) {
            String line = new String(buffer, 0, length, StandardCharsets.UTF_8);
            length = 0;
            carriageReturnPending = false;
            return Optional.of(line);
        }

        // Pending CR (if any) is dropped here, never buffered.
        carriageReturnPending = false;
        append(b);
        return Optional.empty();
    }

    @Override
    public boolean hasPartialLine()
    {
        return length > 0 || carriageReturnPending;
    }

    @Override
    public void reset()
    {
        length = 0;
        carriageReturnPending = false;
    }

    private void append(byte b) throws FramingException
    {
        if (length == maxLineLength) {
            reset();
            throw new FramingException("line exceeds " + maxLineLength + " bytes");
        }
        if (length == buffer.length) {
            int capacity = (int) Math.min((long) buffer.length * 2, maxLineLength);
            buffer = Arrays.copyOf(buffer, capacity);
        }
        buffer[length++] = b;
    }
}
