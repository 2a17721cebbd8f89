package org.csdt.adinkra.ipc.transport.netty;

import org.csdt.adinkra.ipc.codec.FramingException;
import org.csdt.adinkra.ipc.codec.LineFramer;
import org.csdt.adinkra.ipc.codec.impl.CrLfLineFramer;
import org.csdt.adinkra.ipc.internal.assemble.RequestAssembler;
import org.csdt.adinkra.ipc.model.RequestPayload;
import org.csdt.adinkra.ipc.observability.IpcErrorEvent;
import org.csdt.adinkra.ipc.observability.IpcObservabilitySink;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import io.netty.util.ReferenceCountUtil;

import java.time.Instant;
import java.util.Optional;

/**
 * RequestFramingHandler
 * -----------------------------------------------------------------------------
 * Netty inbound handler driving {@link CrLfLineFramer} and
 * {@link RequestAssembler} for one connection.
 *
 * <p>Runs on the channel's event loop. Completed payloads are passed down the
 * pipeline as {@link RequestPayload} messages; after {@code ENDTRANSMISSION}
 * the final payload (if any) is passed on, reading stops, and
 * {@link ConnectionSession#END_OF_TRANSMISSION} is fired as a user event.
 * Bytes after {@code ENDTRANSMISSION} are discarded.</p>
 *
 * <h2>Read timeout</h2>
 * Reader-idle events from the {@code IdleStateHandler} named
 * {@link NettyChannelServer#IDLE_HANDLER} close the connection only when no
 * payload is being handled and the client has stayed silent for the whole
 * timeout since the last one was handled. Time spent in the request handler
 * therefore never counts against the client. The idle handler is removed once
 * {@code ENDTRANSMISSION} arrives.
 *
 * <p>Not sharable: each connection gets its own instance.</p>
 */
final class RequestFramingHandler extends ChannelInboundHandlerAdapter
{
    private final ConnectionSession session;
    private final IpcObservabilitySink observabilitySink;

    private final LineFramer framer;
    private final RequestAssembler assembler = new RequestAssembler();

    private final long readTimeoutNanos;

    private boolean failureReported;

    /**
     * @param readTimeoutNanos idle read timeout; 0 when none is configured
     * @param maxLineLength    longest accepted line in bytes
     */
    RequestFramingHandler(ConnectionSession session,
                          IpcObservabilitySink observabilitySink,
                          long readTimeoutNanos,
                          int maxLineLength)
    {
        this.session = session;
        this.observabilitySink = observabilitySink;
        this.readTimeoutNanos = readTimeoutNanos;
        this.framer = new CrLfLineFramer(maxLineLength);
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg)
    {
        if (!(msg instanceof ByteBuf in)) {
            ctx.fireChannelRead(msg);
            return;
        }

        try {
            while (in.isReadable() && !assembler.isTerminated()) {
                Optional<String> line = framer.accept(in.readByte());
                if (line.isEmpty()) {
                    continue;
                }
                assembler.onLine(line.get()).ifPresent(payload -> dispatch(ctx, payload));
            }
        } catch (FramingException e) {
            failureReported = true;
            assembler.discard();
            framer.reset();
            observabilitySink.onError(new IpcErrorEvent(
                    Instant.now(), session.connection().remoteAddress(), "framing error: " + e.getMessage(), null));
            ctx.close();
            return;
        } finally {
            ReferenceCountUtil.release(in);
        }

        if (assembler.isTerminated() && !session.endReceived()) {
            session.markEndReceived();
            ctx.channel().config().setAutoRead(false);
            if (ctx.pipeline().get(NettyChannelServer.IDLE_HANDLER) != null) {
                ctx.pipeline().remove(NettyChannelServer.IDLE_HANDLER);
            }
            assembler.finish().ifPresent(payload -> dispatch(ctx, payload));
            ctx.fireUserEventTriggered(ConnectionSession.END_OF_TRANSMISSION);
        }
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt)
    {
        if (!(evt instanceof IdleStateEvent idle) || idle.state() != IdleState.READER_IDLE) {
            ctx.fireUserEventTriggered(evt);
            return;
        }
        if (readTimeoutNanos <= 0 || failureReported || session.endReceived()) {
            return;
        }
        if (!session.idleSinceLastHandled(readTimeoutNanos)) {
            // Client is waiting for a reply, or got one only recently.
            return;
        }
        failureReported = true;
        observabilitySink.onError(new IpcErrorEvent(
                Instant.now(), session.connection().remoteAddress(), "read timed out", null));
        ctx.close();
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx)
    {
        if (!session.endReceived() && !failureReported) {
            String reason = framer.hasPartialLine()
                    ? "connection closed with an unterminated line"
                    : "connection closed before ENDTRANSMISSION";
            if (assembler.hasPendingContent()) {
                reason = reason + "; partial payload discarded";
            }
            assembler.discard();
            framer.reset();
            observabilitySink.onError(new IpcErrorEvent(
                    Instant.now(), session.connection().remoteAddress(), "framing error: " + reason, null));
        }
        ctx.fireChannelInactive();
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
    {
        failureReported = true;
        observabilitySink.onError(new IpcErrorEvent(
                Instant.now(), session.connection().remoteAddress(), "connection error", cause));
        ctx.close();
    }

    private void dispatch(ChannelHandlerContext ctx, RequestPayload payload)
    {
        session.payloadQueued();
        ctx.fireChannelRead(payload);
    }
}
