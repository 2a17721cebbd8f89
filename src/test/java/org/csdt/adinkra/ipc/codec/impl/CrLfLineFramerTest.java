package org.csdt.adinkra.ipc.codec.impl;

import org.csdt.adinkra.ipc.codec.FramingException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CrLfLineFramerTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link CrLfLineFramer}.
 *
 * <p>Bytes are pushed one at a time, exactly as the transports do.</p>
 */
final class CrLfLineFramerTest
{
    private final CrLfLineFramer framer = new CrLfLineFramer();

    @Test
    void crLfCompletesLine() throws Exception
    {
        assertEquals(List.of("hello"), feed("hello\r\n"));
        assertFalse(framer.hasPartialLine());
    }

    @Test
    void emptyLineIsEmitted() throws Exception
    {
        assertEquals(List.of(""), feed("\r\n"));
    }

    @Test
    void multipleLinesInOneChunk() throws Exception
    {
        assertEquals(List.of("a", "bc", ""), feed("a\r\nbc\r\n\r\n"));
    }

    @Test
    void loneCarriageReturnIsDropped() throws Exception
    {
        assertEquals(List.of("NEWTRANSMISSION"), feed("NEW\rTRANSMISSION\r\n"));
    }

    @Test
    void bareLineFeedIsContent() throws Exception
    {
        assertEquals(List.of("a\nb"), feed("a\nb\r\n"));
    }

    @Test
    void repeatedCarriageReturnsBeforeLineFeedTerminateOnce() throws Exception
    {
        // CR CR LF: the second CR keeps the flag set; nothing is buffered.
        assertEquals(List.of("x"), feed("x\r\r\n"));
    }

    @Test
    void unterminatedLineIsHeldAsPartial() throws Exception
    {
        assertTrue(feed("partial").isEmpty());
        assertTrue(framer.hasPartialLine());

        assertEquals(List.of("partial line"), feed(" line\r\n"));
    }

    @Test
    void pendingCarriageReturnCountsAsPartial() throws Exception
    {
        feed("\r");
        assertTrue(framer.hasPartialLine());
    }

    @Test
    void resetDiscardsBufferedBytes() throws Exception
    {
        feed("junk\r");
        framer.reset();

        assertFalse(framer.hasPartialLine());
        assertEquals(List.of("ok"), feed("ok\r\n"));
    }

    @Test
    void utf8IsDecodedAcrossByteBoundaries() throws Exception
    {
        assertEquals(List.of("Gye Nyame ☼"), feed("Gye Nyame ☼\r\n"));
    }

    @Test
    void longLinesGrowTheBuffer() throws Exception
    {
        String longLine = "x".repeat(10_000);
        assertEquals(List.of(longLine), feed(longLine + "\r\n"));
    }

    @Test
    void lineFeedWithoutPendingCarriageReturnDoesNotComplete() throws Exception
    {
        Optional<String> result = framer.accept(CrLfLineFramer.LF);
        assertTrue(result.isEmpty());
        assertTrue(framer.hasPartialLine());
    }

    @Test
    void lineAtMaximumLengthIsAccepted() throws Exception
    {
        CrLfLineFramer bounded = new CrLfLineFramer(300);
        String line = "y".repeat(300);

        List<String> lines = new ArrayList<>();
        for (byte b : (line + "\r\n").getBytes(StandardCharsets.US_ASCII)) {
            bounded.accept(b).ifPresent(lines::add);
        }
        assertEquals(List.of(line), lines);
    }

    @Test
    void lineOverMaximumLengthIsRejected() throws Exception
    {
        CrLfLineFramer bounded = new CrLfLineFramer(4);
        for (byte b : "abcd".getBytes(StandardCharsets.US_ASCII)) {
            bounded.accept(b);
        }

        FramingException e = assertThrows(FramingException.class, () -> bounded.accept((byte) 'e'));
        assertEquals("line exceeds 4 bytes", e.getMessage());
        assertFalse(bounded.hasPartialLine());

        // Usable again once the oversized line is dropped.
        bounded.accept((byte) 'o');
        bounded.accept((byte) 'k');
        bounded.accept(CrLfLineFramer.CR);
        assertEquals(Optional.of("ok"), bounded.accept(CrLfLineFramer.LF));
    }

    @Test
    void nonPositiveMaximumIsRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> new CrLfLineFramer(0));
    }

    private List<String> feed(String text) throws FramingException
    {
        List<String> lines = new ArrayList<>();
        for (byte b : text.getBytes(StandardCharsets.UTF_8)) {
            framer.accept(b).ifPresent(lines::add);
        }
        return lines;
    }
}
