package org.csdt.adinkra.ipc.observability;

/**
 * No-op implementation of IpcObservabilitySink.
 */
public final class NullObservabilitySink implements IpcObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onLifecycleEvent(IpcLifecycleEvent event) {}

    @Override
    public void onConnectionEvent(IpcConnectionEvent event) {}

    @Override
    public void onRequestEvent(IpcRequestEvent event) {}

    @Override
    public void onError(IpcErrorEvent event) {}
}
