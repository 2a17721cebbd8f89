package org.csdt.adinkra.ipc.internal.assemble;

import org.csdt.adinkra.ipc.model.RequestPayload;
import org.csdt.adinkra.ipc.model.TransmissionSignal;

import java.util.Optional;

/**
 * RequestAssembler
 * =============================================================================
 * Per-connection state machine turning framed lines into request payloads.
 *
 * <h2>Dispatch rule</h2>
 * Each completed line is handled by the first matching rule:
 * <ol>
 *   <li>{@code BEGINTRANSMISSION}: transmission becomes active. Nothing is
 *       appended.</li>
 *   <li>{@code NEWTRANSMISSION}: the accumulated payload is emitted, even if
 *       empty. The accumulator is cleared and transmission becomes
 *       inactive.</li>
 *   <li>{@code ENDTRANSMISSION}: the assembler terminates.</li>
 *   <li>Transmission active: the line is appended to the accumulator.</li>
 *   <li>Otherwise the line is dropped.</li>
 * </ol>
 *
 * <p>Because rule 2 returns transmission to inactive, a client must send a
 * fresh {@code BEGINTRANSMISSION} before each payload. Content sent after
 * {@code NEWTRANSMISSION} without a new begin signal is dropped. Deployed
 * clients rely on this bracketing, so it is kept as is.</p>
 *
 * <h2>Termination</h2>
 * After {@code ENDTRANSMISSION}, {@link #finish()} emits whatever was
 * accumulated as one final payload, but only when it is non-empty.
 *
 * <h2>Threading</h2>
 * Not thread-safe. One instance per connection, driven from one thread at a
 * time.
 */
public final class RequestAssembler
{
    /** Separator placed between consecutive content lines of one payload. */
    public static final String CONTENT_SEPARATOR = "\n";

    private final StringBuilder accumulator = new StringBuilder();

    private boolean transmissionActive;
    private boolean lineAppended;
    private boolean terminated;
    private boolean finished;
    private int emitted;

    /**
     * Apply one completed line.
     *
     * @param line a line with its terminator already stripped
     * @return a payload if {@code line} was {@code NEWTRANSMISSION}
     * @throws IllegalStateException if the assembler has already terminated
     */
    public Optional<RequestPayload> onLine(String line)
    {
        if (terminated) {
            throw new IllegalStateException("Line received after ENDTRANSMISSION");
        }

        Optional<TransmissionSignal> signal = TransmissionSignal.match(line);
        if (signal.isPresent()) {
            return switch (signal.get()) {
                case BEGIN -> {
                    transmissionActive = true;
                    yield Optional.empty();
                }
                case NEW -> {
                    RequestPayload payload = emit();
                    transmissionActive = false;
                    yield Optional.of(payload);
                }
                case END -> {
                    terminated = true;
                    yield Optional.empty();
                }
            };
        }

        if (transmissionActive) {
            if (lineAppended) {
                accumulator.append(CONTENT_SEPARATOR);
            }
            accumulator.append(line);
            lineAppended = true;
        }
        return Optional.empty();
    }

    /**
     * Flush the final payload after {@code ENDTRANSMISSION}.
     *
     * <p>May be called once. Returns {@link Optional#empty()} when nothing was
     * accumulated since the last {@code NEWTRANSMISSION}.</p>
     *
     * @throws IllegalStateException if called before termination or twice
     */
    public Optional<RequestPayload> finish()
    {
        if (!terminated) {
            throw new IllegalStateException("finish() requires ENDTRANSMISSION");
        }
        if (finished) {
            throw new IllegalStateException("finish() already called");
        }
        finished = true;

        if (accumulator.length() == 0) {
            return Optional.empty();
        }
        return Optional.of(emit());
    }

    /**
     * Drop the in-progress payload without emitting it.
     */
    public void discard()
    {
        accumulator.setLength(0);
        lineAppended = false;
        transmissionActive = false;
    }

    public boolean isTransmissionActive()
    {
        return transmissionActive;
    }

    public boolean isTerminated()
    {
        return terminated;
    }

    /**
     * Returns {@code true} if content has been accumulated for a payload that
     * has not been emitted yet.
     */
    public boolean hasPendingContent()
    {
        return lineAppended;
    }

    /** Number of payloads emitted so far. */
    public int emittedCount()
    {
        return emitted;
    }

    private RequestPayload emit()
    {
        emitted++;
        RequestPayload payload = new RequestPayload(emitted, accumulator.toString());
        accumulator.setLength(0);
        lineAppended = false;
        return payload;
    }
}
