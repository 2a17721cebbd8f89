package org.csdt.adinkra.ipc.internal.assemble;

import org.csdt.adinkra.ipc.model.RequestPayload;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RequestAssemblerTest
 * -----------------------------------------------------------------------------
 * Unit tests for the per-connection request state machine.
 *
 * These tests deliberately:
 * <ul>
 *   <li>do not involve sockets</li>
 *   <li>do not involve byte framing</li>
 *   <li>do not involve threading</li>
 * </ul>
 */
final class RequestAssemblerTest
{
    private final RequestAssembler assembler = new RequestAssembler();

    // ---------------------------------------------------------------------
    // Dispatch rule
    // ---------------------------------------------------------------------

    @Test
    void singlePayloadIsEmittedOnNewTransmission()
    {
        List<RequestPayload> out = apply("BEGINTRANSMISSION", "{\"a\":1}", "NEWTRANSMISSION");

        assertEquals(1, out.size());
        assertEquals(new RequestPayload(1, "{\"a\":1}"), out.get(0));
        assertFalse(assembler.isTransmissionActive());
    }

    @Test
    void contentLinesAreJoinedWithSeparator()
    {
        List<RequestPayload> out = apply("BEGINTRANSMISSION", "{\"a\":", "1}", "NEWTRANSMISSION");

        assertEquals("{\"a\":" + RequestAssembler.CONTENT_SEPARATOR + "1}", out.get(0).body());
    }

    @Test
    void linesBeforeBeginAreDropped()
    {
        List<RequestPayload> out = apply("hello", "BEGINTRANSMISSION", "x", "NEWTRANSMISSION");

        assertEquals(List.of(new RequestPayload(1, "x")), out);
    }

    @Test
    void newTransmissionWithoutContentEmitsEmptyPayload()
    {
        List<RequestPayload> out = apply("NEWTRANSMISSION");

        assertEquals(1, out.size());
        assertTrue(out.get(0).isEmpty());
    }

    @Test
    void newTransmissionReturnsToInactive()
    {
        // Content after NEWTRANSMISSION needs a fresh BEGINTRANSMISSION.
        List<RequestPayload> out = apply(
                "BEGINTRANSMISSION", "first", "NEWTRANSMISSION",
                "dropped",
                "BEGINTRANSMISSION", "second", "NEWTRANSMISSION");

        assertEquals(List.of(new RequestPayload(1, "first"), new RequestPayload(2, "second")), out);
    }

    @Test
    void repeatedBeginDoesNotResetAccumulator()
    {
        List<RequestPayload> out = apply("BEGINTRANSMISSION", "a", "BEGINTRANSMISSION", "b", "NEWTRANSMISSION");

        assertEquals("a\nb", out.get(0).body());
    }

    @Test
    void emptyContentLinesArePreserved()
    {
        List<RequestPayload> out = apply("BEGINTRANSMISSION", "", "x", "", "NEWTRANSMISSION");

        assertEquals("\nx\n", out.get(0).body());
    }

    @Test
    void sentinelsAreNeverPartOfPayload()
    {
        List<RequestPayload> out = apply("BEGINTRANSMISSION", "BEGINTRANSMISSION", "NEWTRANSMISSION");

        assertEquals("", out.get(0).body());
    }

    // ---------------------------------------------------------------------
    // Termination
    // ---------------------------------------------------------------------

    @Test
    void endFlushesNonEmptyAccumulator()
    {
        apply("BEGINTRANSMISSION", "tail", "ENDTRANSMISSION");

        assertTrue(assembler.isTerminated());
        assertEquals(Optional.of(new RequestPayload(1, "tail")), assembler.finish());
    }

    @Test
    void endWithEmptyAccumulatorEmitsNothing()
    {
        apply("BEGINTRANSMISSION", "x", "NEWTRANSMISSION", "ENDTRANSMISSION");

        assertTrue(assembler.finish().isEmpty());
        assertEquals(1, assembler.emittedCount());
    }

    @Test
    void endWithBeginButNoContentEmitsNothing()
    {
        apply("BEGINTRANSMISSION", "ENDTRANSMISSION");

        assertTrue(assembler.finish().isEmpty());
    }

    @Test
    void linesAfterEndAreRejected()
    {
        apply("ENDTRANSMISSION");

        assertThrows(IllegalStateException.class, () -> assembler.onLine("x"));
    }

    @Test
    void finishRequiresTermination()
    {
        assertThrows(IllegalStateException.class, assembler::finish);
    }

    @Test
    void finishMayOnlyBeCalledOnce()
    {
        apply("ENDTRANSMISSION");
        assembler.finish();

        assertThrows(IllegalStateException.class, assembler::finish);
    }

    // ---------------------------------------------------------------------
    // Discard
    // ---------------------------------------------------------------------

    @Test
    void discardDropsPendingContent()
    {
        apply("BEGINTRANSMISSION", "half");
        assertTrue(assembler.hasPendingContent());

        assembler.discard();

        assertFalse(assembler.hasPendingContent());
        assertFalse(assembler.isTransmissionActive());
        assertEquals(0, assembler.emittedCount());
    }

    private List<RequestPayload> apply(String... lines)
    {
        List<RequestPayload> out = new ArrayList<>();
        for (String line : lines) {
            assembler.onLine(line).ifPresent(out::add);
        }
        return out;
    }
}
