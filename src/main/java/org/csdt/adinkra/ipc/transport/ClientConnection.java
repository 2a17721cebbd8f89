package org.csdt.adinkra.ipc.transport;

import java.io.IOException;
import java.net.SocketAddress;

/**
 * ClientConnection
 * -----------------------------------------------------------------------------
 * Handle identifying one accepted client connection.
 *
 * <p>Handed to the {@link ChannelRequestHandler} together with every payload so
 * that a response can be addressed back to the originating client. The handle
 * does not expose closing: the {@link ChannelServer} owns the connection and
 * closes it once the client's request sequence ends.</p>
 */
public interface ClientConnection
{
    /**
     * Server-assigned identifier, unique for the lifetime of one server.
     */
    long id();

    /**
     * Remote endpoint of the client.
     */
    SocketAddress remoteAddress();

    /**
     * Write raw bytes to the client and flush them.
     *
     * @throws IOException if the connection is closed or the write fails
     */
    void send(byte[] bytes) throws IOException;

    /**
     * Returns {@code true} while the connection can still be written to.
     */
    boolean isOpen();
}
