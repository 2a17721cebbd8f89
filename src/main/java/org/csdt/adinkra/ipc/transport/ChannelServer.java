package org.csdt.adinkra.ipc.transport;

import java.net.SocketAddress;

/**
 * ChannelServer
 * -----------------------------------------------------------------------------
 * Port for the listening side of the request channel.
 *
 * <p>Implementations own the listening socket and every accepted connection.
 * They frame each connection's byte stream, assemble request payloads and hand
 * them to a {@link ChannelRequestHandler}.</p>
 *
 * <p>Implementations may be backed by blocking sockets, Netty, or a test
 * harness.</p>
 */
public interface ChannelServer extends AutoCloseable
{
    /**
     * Create and bind the listening socket.
     *
     * @throws ChannelSetupException if binding or listening fails
     * @throws IllegalStateException if already bound or closed
     */
    void bind();

    /**
     * The bound local address.
     *
     * @throws IllegalStateException if {@link #bind()} has not succeeded
     */
    SocketAddress localAddress();

    /**
     * Run the accept loop on the calling thread until the server is closed.
     *
     * <p>Every payload is passed to {@code handler} with the connection it
     * arrived on. Failures of a single connection are reported and never end
     * the loop.</p>
     *
     * @throws IllegalStateException if {@link #bind()} has not succeeded
     */
    void serve(ChannelRequestHandler handler);

    /**
     * Close the listening socket and any open connections. Idempotent; never
     * throws.
     */
    @Override
    void close();
}
