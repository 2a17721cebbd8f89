package org.csdt.adinkra.ipc.transport.socket;

import org.csdt.adinkra.ipc.transport.ClientConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link ClientConnection} backed by a blocking {@link Socket}.
 */
final class SocketClientConnection implements ClientConnection
{
    private static final Logger log = LoggerFactory.getLogger(SocketClientConnection.class);

    private final long id;
    private final Socket socket;
    private final SocketAddress remote;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    SocketClientConnection(long id, Socket socket)
    {
        this.id = id;
        this.socket = Objects.requireNonNull(socket, "socket");
        this.remote = socket.getRemoteSocketAddress();
    }

    @Override
    public long id()
    {
        return id;
    }

    @Override
    public SocketAddress remoteAddress()
    {
        return remote;
    }

    @Override
    public void send(byte[] bytes) throws IOException
    {
        Objects.requireNonNull(bytes, "bytes");
        if (closed.get()) {
            throw new IOException("Connection to " + remote + " is closed");
        }
        synchronized (socket) {
            OutputStream out = socket.getOutputStream();
            out.write(bytes);
            out.flush();
        }
    }

    @Override
    public boolean isOpen()
    {
        return !closed.get() && !socket.isClosed();
    }

    InputStream inputStream() throws IOException
    {
        return socket.getInputStream();
    }

    void setReadTimeout(int millis) throws IOException
    {
        socket.setSoTimeout(millis);
    }

    /**
     * Shut the socket down in both directions and close it. Idempotent;
     * failures are logged and swallowed.
     */
    void close()
    {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            if (!socket.isInputShutdown()) {
                socket.shutdownInput();
            }
            if (!socket.isOutputShutdown()) {
                socket.shutdownOutput();
            }
        } catch (IOException e) {
            // Peer already gone.
            log.debug("shutdown of connection to {} failed: {}", remote, e.getMessage());
        }
        try {
            socket.close();
        } catch (IOException e) {
            log.warn("failed to close connection to {}", remote, e);
        }
    }

    @Override
    public String toString()
    {
        return "SocketClientConnection[" + id + ", " + remote + "]";
    }
}
