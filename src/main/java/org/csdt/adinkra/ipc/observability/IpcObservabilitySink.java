package org.csdt.adinkra.ipc.observability;

/**
 * Main interface for receiving request channel observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>In concurrent mode callbacks may arrive from several threads at once.</p>
 */
public interface IpcObservabilitySink {
    /**
     * Called when the listening channel starts listening or shuts down.
     * @param event the lifecycle event
     */
    void onLifecycleEvent(IpcLifecycleEvent event);

    /**
     * Called when a client connection is accepted, closed or aborted.
     * @param event the connection event
     */
    void onConnectionEvent(IpcConnectionEvent event);

    /**
     * Called when a payload is handed to the request handler.
     * @param event the request event
     */
    void onRequestEvent(IpcRequestEvent event);

    /**
     * Called when an error or anomaly occurs in the channel.
     * @param event the error event
     */
    void onError(IpcErrorEvent event);
}
