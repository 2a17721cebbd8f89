package org.csdt.adinkra.ipc.transport.socket;

import org.csdt.adinkra.ipc.codec.FramingException;
import org.csdt.adinkra.ipc.codec.impl.CrLfLineFramer;
import org.csdt.adinkra.ipc.config.IpcChannelConfig;
import org.csdt.adinkra.ipc.internal.assemble.RequestAssembler;
import org.csdt.adinkra.ipc.lifecycle.ShutdownContext;
import org.csdt.adinkra.ipc.model.RequestPayload;
import org.csdt.adinkra.ipc.observability.IpcConnectionEvent;
import org.csdt.adinkra.ipc.observability.IpcErrorEvent;
import org.csdt.adinkra.ipc.observability.IpcLifecycleEvent;
import org.csdt.adinkra.ipc.observability.IpcObservabilitySink;
import org.csdt.adinkra.ipc.observability.IpcRequestEvent;
import org.csdt.adinkra.ipc.observability.NullObservabilitySink;
import org.csdt.adinkra.ipc.transport.ChannelRequestHandler;
import org.csdt.adinkra.ipc.transport.ChannelServer;
import org.csdt.adinkra.ipc.transport.ChannelSetupException;
import org.csdt.adinkra.ipc.transport.RequestStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ServerSocketFactory;
import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketAddress;
import java.net.SocketTimeoutException;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * BlockingChannelServer
 * =============================================================================
 * Sequential {@link ChannelServer} on blocking {@code java.net} sockets.
 *
 * <h2>Execution Model</h2>
 * Everything runs on the thread that calls {@link #serve(ChannelRequestHandler)}:
 * <pre>
 *   accept()
 *     → RequestStream.next()  (CrLfLineFramer → RequestAssembler)
 *         → ChannelRequestHandler.onRequest(...)
 *     → ... until ENDTRANSMISSION
 *   shutdown + close connection
 *   accept() next client
 * </pre>
 * A connection is drained and closed before the next one is accepted, so
 * connections are never interleaved. Pending clients wait in the listen
 * backlog.
 *
 * <h2>Blocking and timeouts</h2>
 * Accept blocks until a client connects. Reads block until data arrives,
 * unless a read timeout is configured; an expired timeout aborts only that
 * connection.
 *
 * <h2>Cancellation</h2>
 * The server registers itself with the {@link ShutdownContext}. Closing the
 * context closes the listening socket and the active connection, which
 * unblocks {@code accept()} or the pending read; the loop then observes the
 * cancellation and returns.
 *
 * <h2>Failures</h2>
 * A failed accept is reported and retried after a short pause. Any failure
 * while serving a connection, checked or not, aborts only that connection.
 */
public final class BlockingChannelServer implements ChannelServer
{
    private static final Logger log = LoggerFactory.getLogger(BlockingChannelServer.class);

    static final long ACCEPT_RETRY_DELAY_MILLIS = 100;

    private final IpcChannelConfig config;
    private final ShutdownContext shutdownContext;
    private final IpcObservabilitySink observabilitySink;
    private final ServerSocketFactory socketFactory;

    private final AtomicLong nextConnectionId = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile ServerSocket serverSocket;
    private volatile SocketClientConnection activeConnection;

    public BlockingChannelServer(IpcChannelConfig config,
                                 ShutdownContext shutdownContext,
                                 IpcObservabilitySink observabilitySink)
    {
        this(config, shutdownContext, observabilitySink, ServerSocketFactory.getDefault());
    }

    BlockingChannelServer(IpcChannelConfig config,
                          ShutdownContext shutdownContext,
                          IpcObservabilitySink observabilitySink,
                          ServerSocketFactory socketFactory)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.shutdownContext = Objects.requireNonNull(shutdownContext, "shutdownContext");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.socketFactory = Objects.requireNonNull(socketFactory, "socketFactory");

        shutdownContext.register("channel server", this);
    }

    @Override
    public synchronized void bind()
    {
        if (closed.get()) {
            throw new IllegalStateException("Server is closed");
        }
        if (serverSocket != null) {
            throw new IllegalStateException("Server is already bound");
        }

        ServerSocket socket = null;
        try {
            socket = socketFactory.createServerSocket();
            socket.bind(config.bindAddress(), config.backlog());
        } catch (IOException | IllegalArgumentException | SecurityException e) {
            closeListening(socket);
            String message = "socket error: cannot listen on " + config.host() + ":" + config.port();
            observabilitySink.onError(new IpcErrorEvent(Instant.now(), null, message, e));
            throw new ChannelSetupException(message, e);
        }

        serverSocket = socket;
        observabilitySink.onLifecycleEvent(new IpcLifecycleEvent(
                Instant.now(), IpcLifecycleEvent.Phase.LISTENING, socket.getLocalSocketAddress()));
    }

    @Override
    public SocketAddress localAddress()
    {
        return requireBound().getLocalSocketAddress();
    }

    @Override
    public void serve(ChannelRequestHandler handler)
    {
        Objects.requireNonNull(handler, "handler");
        ServerSocket listening = requireBound();

        while (!isCancelled()) {
            final Socket socket;
            try {
                socket = listening.accept();
            } catch (IOException e) {
                if (isCancelled() || listening.isClosed()) {
                    break;
                }
                observabilitySink.onError(new IpcErrorEvent(Instant.now(), null, "accept failed", e));
                if (!pauseAfterAcceptFailure()) {
                    break;
                }
                continue;
            }
            serveConnection(socket, handler);
        }
    }

    @Override
    public void close()
    {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        SocketClientConnection active = activeConnection;
        if (active != null) {
            active.close();
        }

        ServerSocket listening = serverSocket;
        if (listening != null) {
            SocketAddress address = listening.getLocalSocketAddress();
            closeListening(listening);
            observabilitySink.onLifecycleEvent(new IpcLifecycleEvent(
                    Instant.now(), IpcLifecycleEvent.Phase.SHUTDOWN, address));
        }
    }

    private void serveConnection(Socket socket, ChannelRequestHandler handler)
    {
        SocketClientConnection connection =
                new SocketClientConnection(nextConnectionId.incrementAndGet(), socket);
        activeConnection = connection;
        if (closed.get()) {
            // close() ran between accept() and publication of the connection
            connection.close();
            activeConnection = null;
            return;
        }

        SocketAddress remote = connection.remoteAddress();
        observabilitySink.onConnectionEvent(new IpcConnectionEvent(
                Instant.now(), connection.id(), remote, IpcConnectionEvent.Kind.ACCEPTED, 0));

        RequestStream stream = null;
        boolean completed = false;
        try {
            if (config.hasReadTimeout()) {
                connection.setReadTimeout(timeoutMillis());
            }
            stream = new RequestStream(
                    connection.inputStream(), new CrLfLineFramer(config.maxLineLength()), new RequestAssembler());

            Optional<RequestPayload> next = stream.next();
            while (next.isPresent()) {
                dispatch(handler, connection, next.get());
                next = stream.next();
            }
            completed = true;
        } catch (FramingException e) {
            if (closed.get()) {
                log.debug("connection to {} interrupted by shutdown", remote);
            } else {
                observabilitySink.onError(new IpcErrorEvent(
                        Instant.now(), remote, "framing error: " + e.getMessage(), null));
            }
        } catch (SocketTimeoutException e) {
            observabilitySink.onError(new IpcErrorEvent(
                    Instant.now(), remote, "read timed out after " + config.readTimeout().toMillis() + " ms", null));
        } catch (IOException e) {
            if (closed.get()) {
                log.debug("connection to {} interrupted by shutdown", remote);
            } else {
                observabilitySink.onError(new IpcErrorEvent(Instant.now(), remote, "connection error", e));
            }
        } catch (RuntimeException e) {
            // Only this connection is lost; the accept loop carries on.
            observabilitySink.onError(new IpcErrorEvent(Instant.now(), remote, "connection failed", e));
        } finally {
            connection.close();
            activeConnection = null;
            int delivered = stream == null ? 0 : stream.deliveredCount();
            observabilitySink.onConnectionEvent(new IpcConnectionEvent(
                    Instant.now(),
                    connection.id(),
                    remote,
                    completed ? IpcConnectionEvent.Kind.CLOSED : IpcConnectionEvent.Kind.ABORTED,
                    delivered));
        }
    }

    private void dispatch(ChannelRequestHandler handler, SocketClientConnection connection, RequestPayload payload)
    {
        observabilitySink.onRequestEvent(new IpcRequestEvent(
                Instant.now(),
                connection.id(),
                connection.remoteAddress(),
                payload.sequence(),
                payload.body().length()));
        try {
            handler.onRequest(connection, payload);
        } catch (RuntimeException e) {
            observabilitySink.onError(new IpcErrorEvent(
                    Instant.now(),
                    connection.remoteAddress(),
                    "request " + payload.sequence() + " failed in handler",
                    e));
        }
    }

    /**
     * Wait before retrying a failed accept.
     *
     * @return {@code false} if the server was cancelled or the thread interrupted
     */
    private boolean pauseAfterAcceptFailure()
    {
        try {
            Thread.sleep(ACCEPT_RETRY_DELAY_MILLIS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        return !isCancelled();
    }

    private boolean isCancelled()
    {
        return closed.get() || shutdownContext.isShutdownRequested();
    }

    private int timeoutMillis()
    {
        long millis = Math.max(1L, config.readTimeout().toMillis());
        return (int) Math.min(Integer.MAX_VALUE, millis);
    }

    private ServerSocket requireBound()
    {
        ServerSocket socket = serverSocket;
        if (socket == null) {
            throw new IllegalStateException("Server is not bound");
        }
        return socket;
    }

    private static void closeListening(ServerSocket socket)
    {
        if (socket == null) {
            return;
        }
        try {
            socket.close();
        } catch (IOException e) {
            log.warn("failed to close listening socket", e);
        }
    }
}
