package org.csdt.adinkra.ipc.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of IpcObservabilitySink that emits logs via SLF4J.
 *
 * <p>Timestamps on the log lines come from the logging backend; the event
 * timestamps are kept for sinks that need the exact moment of occurrence.</p>
 */
public final class Slf4jIpcObservabilitySink implements IpcObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jIpcObservabilitySink.class);

    @Override
    public void onLifecycleEvent(IpcLifecycleEvent event) {
        switch (event.phase()) {
            case LISTENING -> log.info("listening on {}", event.address());
            case SHUTDOWN -> log.info("channel on {} shut down", event.address());
        }
    }

    @Override
    public void onConnectionEvent(IpcConnectionEvent event) {
        switch (event.kind()) {
            case ACCEPTED -> log.info("connected to {} (connection {})",
                event.remote(), event.connectionId());
            case CLOSED -> log.info("connection to {} is closed after {} request(s)",
                event.remote(), event.requestsDelivered());
            case ABORTED -> log.warn("connection to {} aborted after {} request(s)",
                event.remote(), event.requestsDelivered());
        }
    }

    @Override
    public void onRequestEvent(IpcRequestEvent event) {
        log.debug("request {} from {} ({} chars)",
            event.sequence(), event.remote(), event.length());
    }

    @Override
    public void onError(IpcErrorEvent event) {
        if (event.remote() != null) {
            log.error("{} [{}]", event.message(), event.remote(), event.cause());
        } else {
            log.error("{}", event.message(), event.cause());
        }
    }
}
