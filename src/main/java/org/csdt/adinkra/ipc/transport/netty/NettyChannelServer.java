package org.csdt.adinkra.ipc.transport.netty;

import org.csdt.adinkra.ipc.config.IpcChannelConfig;
import org.csdt.adinkra.ipc.lifecycle.ShutdownContext;
import org.csdt.adinkra.ipc.observability.IpcErrorEvent;
import org.csdt.adinkra.ipc.observability.IpcLifecycleEvent;
import org.csdt.adinkra.ipc.observability.IpcObservabilitySink;
import org.csdt.adinkra.ipc.observability.NullObservabilitySink;
import org.csdt.adinkra.ipc.transport.ChannelRequestHandler;
import org.csdt.adinkra.ipc.transport.ChannelServer;
import org.csdt.adinkra.ipc.transport.ChannelSetupException;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.timeout.IdleStateHandler;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import io.netty.util.concurrent.GlobalEventExecutor;

import java.net.SocketAddress;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * NettyChannelServer
 * =============================================================================
 * Netty-backed {@link ChannelServer} serving connections concurrently.
 *
 * <h2>Pipeline (per connection)</h2>
 * <pre>
 *   [IdleStateHandler]          (only when a read timeout is configured)
 *     → RequestFramingHandler   (event loop: CrLfLineFramer + RequestAssembler)
 *         → RequestDispatchHandler (request executor: ChannelRequestHandler)
 * </pre>
 *
 * <h2>Ordering</h2>
 * Connections are independent of each other. Within one connection, payloads
 * reach the request handler strictly in arrival order, and the connection is
 * closed only after its last payload was handled.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Request handlers only see
 * {@link org.csdt.adinkra.ipc.transport.ClientConnection}.
 *
 * <h2>Lifecycle</h2>
 * {@link #bind()} binds with accepting paused; {@link #serve(ChannelRequestHandler)}
 * installs the handler, resumes accepting and blocks until the server channel
 * closes. {@link #close()} closes every open channel through a
 * {@link ChannelGroup} and shuts down the event loop and executor groups.
 */
public final class NettyChannelServer implements ChannelServer
{
    /** Pipeline name of the reader-idle handler backing the read timeout. */
    static final String IDLE_HANDLER = "readTimeout";

    private static final int HANDLER_THREADS = 4;

    private final IpcChannelConfig config;
    private final ShutdownContext shutdownContext;
    private final IpcObservabilitySink observabilitySink;

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final EventExecutorGroup handlerGroup;
    private final ChannelGroup allChannels;
    private final ServerBootstrap bootstrap;

    private final AtomicLong nextConnectionId = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile Channel serverChannel;
    private volatile ChannelRequestHandler requestHandler;

    public NettyChannelServer(IpcChannelConfig config,
                              ShutdownContext shutdownContext,
                              IpcObservabilitySink observabilitySink)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.shutdownContext = Objects.requireNonNull(shutdownContext, "shutdownContext");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup();
        this.handlerGroup = new DefaultEventExecutorGroup(HANDLER_THREADS);
        this.allChannels = new DefaultChannelGroup("adinkra-ipc", GlobalEventExecutor.INSTANCE);

        this.bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, config.backlog())
                .option(ChannelOption.AUTO_READ, false)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        initConnection(ch);
                    }
                });

        shutdownContext.register("channel server", this);
    }

    @Override
    public synchronized void bind()
    {
        if (closed.get()) {
            throw new IllegalStateException("Server is closed");
        }
        if (serverChannel != null) {
            throw new IllegalStateException("Server is already bound");
        }

        ChannelFuture f = bootstrap.bind(config.bindAddress()).awaitUninterruptibly();
        if (!f.isSuccess()) {
            String message = "socket error: cannot listen on " + config.host() + ":" + config.port();
            observabilitySink.onError(new IpcErrorEvent(Instant.now(), null, message, f.cause()));
            throw new ChannelSetupException(message, f.cause());
        }

        serverChannel = f.channel();
        allChannels.add(serverChannel);
        observabilitySink.onLifecycleEvent(new IpcLifecycleEvent(
                Instant.now(), IpcLifecycleEvent.Phase.LISTENING, serverChannel.localAddress()));
    }

    @Override
    public SocketAddress localAddress()
    {
        return requireBound().localAddress();
    }

    @Override
    public void serve(ChannelRequestHandler handler)
    {
        Objects.requireNonNull(handler, "handler");
        Channel channel = requireBound();

        requestHandler = handler;
        if (!closed.get() && !shutdownContext.isShutdownRequested()) {
            channel.config().setAutoRead(true);
            channel.closeFuture().awaitUninterruptibly();
        }
    }

    @Override
    public void close()
    {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        Channel channel = serverChannel;
        SocketAddress address = channel == null ? null : channel.localAddress();

        allChannels.close().awaitUninterruptibly();
        handlerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);

        if (channel != null) {
            observabilitySink.onLifecycleEvent(new IpcLifecycleEvent(
                    Instant.now(), IpcLifecycleEvent.Phase.SHUTDOWN, address));
        }
    }

    private void initConnection(SocketChannel ch)
    {
        allChannels.add(ch);

        ConnectionSession session = new ConnectionSession(
                new NettyClientConnection(nextConnectionId.incrementAndGet(), ch));

        ChannelPipeline p = ch.pipeline();
        long timeoutMillis = 0;
        if (config.hasReadTimeout()) {
            timeoutMillis = Math.max(1L, config.readTimeout().toMillis());
            p.addLast(IDLE_HANDLER, new IdleStateHandler(timeoutMillis, 0, 0, TimeUnit.MILLISECONDS));
        }
        p.addLast("framing", new RequestFramingHandler(
                session, observabilitySink, TimeUnit.MILLISECONDS.toNanos(timeoutMillis), config.maxLineLength()));
        p.addLast(handlerGroup, "dispatch", new RequestDispatchHandler(session, requestHandler, observabilitySink));
    }

    private Channel requireBound()
    {
        Channel channel = serverChannel;
        if (channel == null) {
            throw new IllegalStateException("Server is not bound");
        }
        return channel;
    }
}
