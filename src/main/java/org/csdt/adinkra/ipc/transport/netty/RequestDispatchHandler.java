package org.csdt.adinkra.ipc.transport.netty;

import org.csdt.adinkra.ipc.model.RequestPayload;
import org.csdt.adinkra.ipc.observability.IpcConnectionEvent;
import org.csdt.adinkra.ipc.observability.IpcErrorEvent;
import org.csdt.adinkra.ipc.observability.IpcObservabilitySink;
import org.csdt.adinkra.ipc.observability.IpcRequestEvent;
import org.csdt.adinkra.ipc.transport.ChannelRequestHandler;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.SocketChannel;

import java.time.Instant;

/**
 * RequestDispatchHandler
 * -----------------------------------------------------------------------------
 * Hands assembled payloads to the {@link ChannelRequestHandler}.
 *
 * <p>Added to the pipeline with a dedicated executor group, so request handling
 * never blocks the event loop. Netty pins each channel to one executor of the
 * group, which keeps the payloads of one connection in arrival order.</p>
 *
 * <p>On {@link ConnectionSession#END_OF_TRANSMISSION} every earlier payload has
 * been handled; the socket is then shut down in both directions and
 * closed.</p>
 */
final class RequestDispatchHandler extends SimpleChannelInboundHandler<RequestPayload>
{
    private final ConnectionSession session;
    private final ChannelRequestHandler requestHandler;
    private final IpcObservabilitySink observabilitySink;

    RequestDispatchHandler(ConnectionSession session,
                           ChannelRequestHandler requestHandler,
                           IpcObservabilitySink observabilitySink)
    {
        this.session = session;
        this.requestHandler = requestHandler;
        this.observabilitySink = observabilitySink;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx)
    {
        NettyClientConnection connection = session.connection();
        observabilitySink.onConnectionEvent(new IpcConnectionEvent(
                Instant.now(), connection.id(), connection.remoteAddress(), IpcConnectionEvent.Kind.ACCEPTED, 0));
        ctx.fireChannelActive();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, RequestPayload payload)
    {
        NettyClientConnection connection = session.connection();
        session.recordDelivery();
        observabilitySink.onRequestEvent(new IpcRequestEvent(
                Instant.now(),
                connection.id(),
                connection.remoteAddress(),
                payload.sequence(),
                payload.body().length()));
        try {
            requestHandler.onRequest(connection, payload);
        } catch (RuntimeException e) {
            observabilitySink.onError(new IpcErrorEvent(
                    Instant.now(),
                    connection.remoteAddress(),
                    "request " + payload.sequence() + " failed in handler",
                    e));
        } finally {
            session.payloadHandled();
        }
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt)
    {
        if (evt != ConnectionSession.END_OF_TRANSMISSION) {
            ctx.fireUserEventTriggered(evt);
            return;
        }
        if (ctx.channel() instanceof SocketChannel socket) {
            socket.shutdown().addListener((ChannelFutureListener) f -> socket.close());
        } else {
            ctx.close();
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx)
    {
        NettyClientConnection connection = session.connection();
        observabilitySink.onConnectionEvent(new IpcConnectionEvent(
                Instant.now(),
                connection.id(),
                connection.remoteAddress(),
                session.endReceived() ? IpcConnectionEvent.Kind.CLOSED : IpcConnectionEvent.Kind.ABORTED,
                session.delivered()));
        ctx.fireChannelInactive();
    }
}
