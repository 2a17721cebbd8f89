package org.csdt.adinkra.ipc.transport;

import org.csdt.adinkra.ipc.codec.FramingException;
import org.csdt.adinkra.ipc.codec.LineFramer;
import org.csdt.adinkra.ipc.internal.assemble.RequestAssembler;
import org.csdt.adinkra.ipc.model.RequestPayload;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Optional;

/**
 * RequestStream
 * =============================================================================
 * Pull-based sequence of request payloads read from one connection.
 *
 * <p>Each call to {@link #next()} reads from the underlying stream only as far
 * as needed to complete the next payload. The caller therefore controls
 * backpressure: nothing is read while a payload is being handled.</p>
 *
 * <h2>Buffering</h2>
 * Reads are batched through an internal buffer. Line boundaries are still
 * decided one byte at a time by the {@link LineFramer}, so batching is not
 * observable on the wire. Bytes following {@code ENDTRANSMISSION} in the same
 * read are ignored.
 *
 * <h2>End of stream</h2>
 * End of stream before {@code ENDTRANSMISSION} is a framing error. The
 * in-progress payload is discarded and {@link FramingException} is raised;
 * payloads returned earlier are unaffected.
 *
 * <p>A stream is consumed once and cannot be restarted. Not thread-safe.</p>
 */
public final class RequestStream
{
    private static final int READ_BUFFER_SIZE = 8192;

    private final InputStream input;
    private final LineFramer framer;
    private final RequestAssembler assembler;

    private final byte[] readBuffer = new byte[READ_BUFFER_SIZE];
    private int readPosition;
    private int readLimit;

    private boolean exhausted;

    public RequestStream(InputStream input, LineFramer framer, RequestAssembler assembler)
    {
        this.input = Objects.requireNonNull(input, "input");
        this.framer = Objects.requireNonNull(framer, "framer");
        this.assembler = Objects.requireNonNull(assembler, "assembler");
    }

    /**
     * Read the next payload.
     *
     * @return the next payload, or {@link Optional#empty()} once the client has
     *         sent {@code ENDTRANSMISSION} and any final payload was returned
     * @throws FramingException if the stream ends before {@code ENDTRANSMISSION}
     *         or a line is longer than the framer accepts
     * @throws IOException if reading fails (including read timeouts)
     */
    public Optional<RequestPayload> next() throws IOException, FramingException
    {
        if (exhausted) {
            return Optional.empty();
        }

        while (!assembler.isTerminated()) {
            if (readPosition == readLimit && !fill()) {
                exhausted = true;
                String reason = framer.hasPartialLine()
                        ? "connection closed with an unterminated line"
                        : "connection closed before ENDTRANSMISSION";
                boolean hadContent = assembler.hasPendingContent();
                assembler.discard();
                framer.reset();
                throw new FramingException(hadContent ? reason + "; partial payload discarded" : reason);
            }

            final Optional<String> line;
            try {
                line = framer.accept(readBuffer[readPosition++]);
            } catch (FramingException e) {
                exhausted = true;
                assembler.discard();
                throw e;
            }
            if (line.isPresent()) {
                Optional<RequestPayload> payload = assembler.onLine(line.get());
                if (payload.isPresent()) {
                    return payload;
                }
            }
        }

        exhausted = true;
        return assembler.finish();
    }

    /** Number of payloads returned so far. */
    public int deliveredCount()
    {
        return assembler.emittedCount();
    }

    private boolean fill() throws IOException
    {
        int n = input.read(readBuffer, 0, readBuffer.length);
        if (n < 0) {
            return false;
        }
        readPosition = 0;
        readLimit = n;
        return true;
    }
}
