package org.csdt.adinkra.ipc.observability;

import java.net.SocketAddress;
import java.time.Instant;

/**
 * Record representing a change in the lifetime of one client connection.
 *
 * @param requestsDelivered payloads handed to the request handler so far
 */
public record IpcConnectionEvent(
    Instant timestamp,
    long connectionId,
    SocketAddress remote,
    Kind kind,
    int requestsDelivered
) {
    public enum Kind {
        /** The connection was accepted and is being read. */
        ACCEPTED,
        /** The client sent ENDTRANSMISSION and the connection was closed. */
        CLOSED,
        /** The connection ended without ENDTRANSMISSION, timed out or failed. */
        ABORTED
    }
}
