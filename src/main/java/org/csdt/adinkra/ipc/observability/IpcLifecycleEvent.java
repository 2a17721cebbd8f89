package org.csdt.adinkra.ipc.observability;

import java.net.SocketAddress;
import java.time.Instant;

/**
 * Record representing a lifecycle transition of the listening channel.
 */
public record IpcLifecycleEvent(
    Instant timestamp,
    Phase phase,
    SocketAddress address
) {
    public enum Phase {
        LISTENING,
        SHUTDOWN
    }
}
