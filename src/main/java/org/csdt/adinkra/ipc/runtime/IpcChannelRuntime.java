package org.csdt.adinkra.ipc.runtime;

import org.csdt.adinkra.ipc.config.IpcChannelConfig;
import org.csdt.adinkra.ipc.lifecycle.LogDestination;
import org.csdt.adinkra.ipc.lifecycle.ShutdownContext;
import org.csdt.adinkra.ipc.observability.IpcObservabilitySink;
import org.csdt.adinkra.ipc.observability.Slf4jIpcObservabilitySink;
import org.csdt.adinkra.ipc.transport.ChannelRequestHandler;
import org.csdt.adinkra.ipc.transport.ChannelServer;
import org.csdt.adinkra.ipc.transport.netty.NettyChannelServer;
import org.csdt.adinkra.ipc.transport.socket.BlockingChannelServer;

import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * IpcChannelRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the request channel.
 *
 * <pre>
 *   LogDestination        (registered first, closed last)
 *   ChannelServer         (SEQUENTIAL → blocking sockets, CONCURRENT → Netty)
 *   ShutdownContext       (owns both, closes each once)
 * </pre>
 *
 * <p>Typical use:</p>
 * <pre>
 *   IpcChannelRuntime runtime = IpcChannelRuntime.builder()
 *           .withConfig(config)
 *           .withRequestHandler(new ConversionRequestHandler(converter))
 *           .withShutdownHook(true)
 *           .build();
 *   runtime.start();
 *   runtime.run();   // blocks until stop() or a shutdown signal
 * </pre>
 */
public final class IpcChannelRuntime {
    private final IpcChannelConfig config;
    private final ChannelRequestHandler requestHandler;
    private final ShutdownContext shutdownContext;
    private final LogDestination logDestination;
    private final ChannelServer server;
    private final boolean installShutdownHook;

    private final AtomicBoolean started = new AtomicBoolean(false);

    private IpcChannelRuntime(
            IpcChannelConfig config,
            ChannelRequestHandler requestHandler,
            ShutdownContext shutdownContext,
            LogDestination logDestination,
            ChannelServer server,
            boolean installShutdownHook) {
        this.config = config;
        this.requestHandler = requestHandler;
        this.shutdownContext = shutdownContext;
        this.logDestination = logDestination;
        this.server = server;
        this.installShutdownHook = installShutdownHook;
    }

    /**
     * Bind the listening socket and, if requested, install the JVM shutdown
     * hook.
     *
     * @throws org.csdt.adinkra.ipc.transport.ChannelSetupException if the
     *         socket cannot be bound; the runtime is stopped in that case
     * @throws IllegalStateException if already started
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Runtime already started");
        }
        try {
            server.bind();
        } catch (RuntimeException e) {
            shutdownContext.close();
            throw e;
        }
        if (installShutdownHook) {
            shutdownContext.installShutdownHook();
        }
    }

    /**
     * Serve connections on the calling thread until {@link #stop()} is called
     * or the JVM shuts down.
     */
    public void run() {
        if (!started.get()) {
            throw new IllegalStateException("Runtime not started");
        }
        try {
            server.serve(requestHandler);
        } finally {
            shutdownContext.close();
        }
    }

    /**
     * Close the channel server and the log destination. Idempotent.
     */
    public void stop() {
        shutdownContext.close();
    }

    public boolean isStopped() {
        return shutdownContext.isShutdownRequested();
    }

    public SocketAddress localAddress() {
        return server.localAddress();
    }

    public IpcChannelConfig config() {
        return config;
    }

    public LogDestination logDestination() {
        return logDestination;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private IpcChannelConfig config = IpcChannelConfig.defaults();
        private ChannelRequestHandler requestHandler;
        private IpcObservabilitySink observabilitySink;
        private boolean shutdownHook;

        public Builder withConfig(IpcChannelConfig config) {
            this.config = config;
            return this;
        }

        public Builder withRequestHandler(ChannelRequestHandler handler) {
            this.requestHandler = handler;
            return this;
        }

        public Builder withObservabilitySink(IpcObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withShutdownHook(boolean install) {
            this.shutdownHook = install;
            return this;
        }

        public IpcChannelRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(requestHandler, "requestHandler");

            IpcObservabilitySink sink = observabilitySink != null
                    ? observabilitySink
                    : new Slf4jIpcObservabilitySink();

            // 1. Log destination first, so it is closed after the server
            ShutdownContext context = new ShutdownContext();
            LogDestination logDestination = LogDestination.open(config.logFile());
            context.register("log destination", logDestination);

            // 2. Server for the configured mode; registers itself with the context
            ChannelServer server = switch (config.servingMode()) {
                case SEQUENTIAL -> new BlockingChannelServer(config, context, sink);
                case CONCURRENT -> new NettyChannelServer(config, context, sink);
            };

            return new IpcChannelRuntime(config, requestHandler, context, logDestination, server, shutdownHook);
        }
    }
}
