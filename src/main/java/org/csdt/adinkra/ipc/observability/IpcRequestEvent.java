package org.csdt.adinkra.ipc.observability;

import java.net.SocketAddress;
import java.time.Instant;

/**
 * Record representing one payload handed to the request handler.
 */
public record IpcRequestEvent(
    Instant timestamp,
    long connectionId,
    SocketAddress remote,
    int sequence,
    int length
) {
}
