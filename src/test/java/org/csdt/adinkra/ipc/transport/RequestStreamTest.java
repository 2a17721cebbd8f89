package org.csdt.adinkra.ipc.transport;

import org.csdt.adinkra.ipc.codec.FramingException;
import org.csdt.adinkra.ipc.codec.impl.CrLfLineFramer;
import org.csdt.adinkra.ipc.internal.assemble.RequestAssembler;
import org.csdt.adinkra.ipc.model.RequestPayload;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RequestStreamTest
 * -----------------------------------------------------------------------------
 * Drives the real framer and assembler over in-memory byte streams.
 *
 * <p>Each scenario is run twice: once with the whole input available in a
 * single read, and once delivering one byte per read, so that read batching
 * can be shown to have no effect on the payloads produced.</p>
 */
final class RequestStreamTest
{
    // ---------------------------------------------------------------------
    // Wire scenarios
    // ---------------------------------------------------------------------

    @Test
    void singleRequest() throws Exception
    {
        String wire = "BEGINTRANSMISSION\r\n{\"a\":1}\r\nNEWTRANSMISSION\r\nENDTRANSMISSION\r\n";

        assertBothWays(wire, List.of("{\"a\":1}"));
    }

    @Test
    void twoRequestsEachWithOwnBegin() throws Exception
    {
        String wire = "BEGINTRANSMISSION\r\nx\r\nNEWTRANSMISSION\r\n"
                + "BEGINTRANSMISSION\r\ny\r\nNEWTRANSMISSION\r\n"
                + "ENDTRANSMISSION\r\n";

        assertBothWays(wire, List.of("x", "y"));
    }

    @Test
    void lastPayloadTerminatedByEnd() throws Exception
    {
        String wire = "BEGINTRANSMISSION\r\nfoo\r\nNEWTRANSMISSION\r\n"
                + "BEGINTRANSMISSION\r\nbar\r\nENDTRANSMISSION\r\n";

        assertBothWays(wire, List.of("foo", "bar"));
    }

    @Test
    void emptyPayloadIsDeliveredNotSkipped() throws Exception
    {
        String wire = "BEGINTRANSMISSION\r\nNEWTRANSMISSION\r\nENDTRANSMISSION\r\n";

        assertBothWays(wire, List.of(""));
    }

    @Test
    void finalPayloadFlushedOnEnd() throws Exception
    {
        String wire = "BEGINTRANSMISSION\r\ntail\r\nENDTRANSMISSION\r\n";

        assertBothWays(wire, List.of("tail"));
    }

    @Test
    void contentBeforeBeginIsIgnored() throws Exception
    {
        String wire = "noise\r\nBEGINTRANSMISSION\r\nkept\r\nNEWTRANSMISSION\r\nENDTRANSMISSION\r\n";

        assertBothWays(wire, List.of("kept"));
    }

    @Test
    void loneCarriageReturnInsideSentinelStillMatches() throws Exception
    {
        String wire = "BEGINTRANSMISSION\r\nx\r\nNEW\rTRANSMISSION\r\nENDTRANSMISSION\r\n";

        assertBothWays(wire, List.of("x"));
    }

    @Test
    void multiLinePayloadIsJoined() throws Exception
    {
        String wire = "BEGINTRANSMISSION\r\n{\"stl\":\r\n\"out.stl\"}\r\nNEWTRANSMISSION\r\nENDTRANSMISSION\r\n";

        assertBothWays(wire, List.of("{\"stl\":\n\"out.stl\"}"));
    }

    @Test
    void bytesAfterEndAreIgnored() throws Exception
    {
        String wire = "ENDTRANSMISSION\r\nBEGINTRANSMISSION\r\nlate\r\nNEWTRANSMISSION\r\n";

        assertBothWays(wire, List.of());
    }

    @Test
    void largePayloadSpanningManyReads() throws Exception
    {
        String big = "z".repeat(50_000);
        String wire = "BEGINTRANSMISSION\r\n" + big + "\r\nNEWTRANSMISSION\r\nENDTRANSMISSION\r\n";

        assertEquals(List.of(big), drain(stream(new ByteArrayInputStream(bytes(wire)))));
    }

    // ---------------------------------------------------------------------
    // End of stream
    // ---------------------------------------------------------------------

    @Test
    void endOfStreamBeforeEndIsFramingError() throws Exception
    {
        RequestStream stream = stream(new ByteArrayInputStream(bytes(
                "BEGINTRANSMISSION\r\na\r\nNEWTRANSMISSION\r\nBEGINTRANSMISSION\r\nhalf\r\n")));

        assertEquals("a", stream.next().orElseThrow().body());

        FramingException e = assertThrows(FramingException.class, stream::next);
        assertTrue(e.getMessage().contains("before ENDTRANSMISSION"));
        assertTrue(e.getMessage().contains("partial payload discarded"));
        assertEquals(1, stream.deliveredCount());
    }

    @Test
    void endOfStreamWithUnterminatedLineIsFramingError()
    {
        RequestStream stream = stream(new ByteArrayInputStream(bytes("BEGINTRANSMISSION\r\n{\"a\":1}")));

        FramingException e = assertThrows(FramingException.class, stream::next);
        assertTrue(e.getMessage().contains("unterminated line"));
    }

    @Test
    void unterminatedEndSentinelIsNotAccepted()
    {
        RequestStream stream = stream(new ByteArrayInputStream(bytes("ENDTRANSMISSION")));

        assertThrows(FramingException.class, stream::next);
    }

    @Test
    void emptyStreamIsFramingError()
    {
        RequestStream stream = stream(new ByteArrayInputStream(new byte[0]));

        FramingException e = assertThrows(FramingException.class, stream::next);
        assertEquals("connection closed before ENDTRANSMISSION", e.getMessage());
    }

    @Test
    void streamIsNotRestartableAfterFailure() throws Exception
    {
        RequestStream stream = stream(new ByteArrayInputStream(new byte[0]));
        assertThrows(FramingException.class, stream::next);

        assertTrue(stream.next().isEmpty());
    }

    @Test
    void readErrorsPropagate()
    {
        InputStream failing = new InputStream() {
            @Override
            public int read() throws IOException
            {
                throw new IOException("boom");
            }
        };

        assertThrows(IOException.class, () -> stream(failing).next());
    }

    @Test
    void oversizedLineEndsTheStream() throws Exception
    {
        String wire = "BEGINTRANSMISSION\r\nfits\r\nNEWTRANSMISSION\r\n"
                + "BEGINTRANSMISSION\r\n" + "z".repeat(40) + "\r\nENDTRANSMISSION\r\n";
        RequestStream stream = new RequestStream(
                new ByteArrayInputStream(bytes(wire)), new CrLfLineFramer(20), new RequestAssembler());

        assertEquals("fits", stream.next().orElseThrow().body());
        FramingException e = assertThrows(FramingException.class, stream::next);
        assertEquals("line exceeds 20 bytes", e.getMessage());

        assertTrue(stream.next().isEmpty());
        assertEquals(1, stream.deliveredCount());
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private static void assertBothWays(String wire, List<String> expected) throws Exception
    {
        assertEquals(expected, drain(stream(new ByteArrayInputStream(bytes(wire)))), "single read");
        assertEquals(expected, drain(stream(new OneByteInputStream(bytes(wire)))), "byte per read");
    }

    private static List<String> drain(RequestStream stream) throws Exception
    {
        List<String> bodies = new ArrayList<>();
        Optional<RequestPayload> next = stream.next();
        while (next.isPresent()) {
            assertEquals(bodies.size() + 1, next.get().sequence());
            bodies.add(next.get().body());
            next = stream.next();
        }
        return bodies;
    }

    private static RequestStream stream(InputStream in)
    {
        return new RequestStream(in, new CrLfLineFramer(), new RequestAssembler());
    }

    private static byte[] bytes(String s)
    {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    /** Returns at most one byte per read call. */
    private static final class OneByteInputStream extends InputStream
    {
        private final byte[] data;
        private int pos;

        OneByteInputStream(byte[] data)
        {
            this.data = data;
        }

        @Override
        public int read()
        {
            return pos < data.length ? data[pos++] & 0xFF : -1;
        }

        @Override
        public int read(byte[] b, int off, int len)
        {
            if (len == 0) {
                return 0;
            }
            int c = read();
            if (c < 0) {
                return -1;
            }
            b[off] = (byte) c;
            return 1;
        }
    }
}
