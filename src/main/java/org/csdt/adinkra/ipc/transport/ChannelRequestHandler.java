package org.csdt.adinkra.ipc.transport;

import org.csdt.adinkra.ipc.model.RequestPayload;

/**
 * ChannelRequestHandler
 * -----------------------------------------------------------------------------
 * Callback receiving each completed request payload.
 *
 * <p>Calls for one connection are serialized and arrive in the order the
 * payloads were received. The handler may respond through the connection; it
 * must not retain the connection beyond the call.</p>
 *
 * <p>A {@link RuntimeException} thrown from the handler is reported and the
 * next payload of the same connection is still delivered.</p>
 */
@FunctionalInterface
public interface ChannelRequestHandler
{
    void onRequest(ClientConnection connection, RequestPayload payload);
}
