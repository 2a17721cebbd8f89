package org.csdt.adinkra.ipc.observability;

import java.net.SocketAddress;
import java.time.Instant;

/**
 * Record representing an error or anomaly in the request channel.
 *
 * @param remote the affected client, or {@code null} for channel-wide errors
 * @param cause  underlying exception; may be {@code null}
 */
public record IpcErrorEvent(
    Instant timestamp,
    SocketAddress remote,
    String message,
    Throwable cause
) {
}
