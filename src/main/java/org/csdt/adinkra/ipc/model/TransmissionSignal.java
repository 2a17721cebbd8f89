package org.csdt.adinkra.ipc.model;

import java.util.Optional;

/**
 * TransmissionSignal
 * -----------------------------------------------------------------------------
 * Sentinel control lines recognised by the request channel.
 *
 * <p>A sentinel is a complete line (terminator already stripped) whose bytes
 * match {@link #wireText()} exactly. Matching is case-sensitive and allows no
 * surrounding whitespace. Sentinel lines are never forwarded as payload
 * content.</p>
 */
public enum TransmissionSignal
{
    /** Start accepting content lines into the active payload. */
    BEGIN("BEGINTRANSMISSION"),

    /** The active payload is complete; emit it and return to inactive. */
    NEW("NEWTRANSMISSION"),

    /** Terminates the request loop for the connection. */
    END("ENDTRANSMISSION");

    private final String wireText;

    TransmissionSignal(String wireText)
    {
        this.wireText = wireText;
    }

    public String wireText()
    {
        return wireText;
    }

    /**
     * Returns the sentinel whose wire text equals {@code line}, if any.
     */
    public static Optional<TransmissionSignal> match(String line)
    {
        if (line == null) {
            return Optional.empty();
        }
        for (TransmissionSignal signal : values()) {
            if (signal.wireText.equals(line)) {
                return Optional.of(signal);
            }
        }
        return Optional.empty();
    }
}
