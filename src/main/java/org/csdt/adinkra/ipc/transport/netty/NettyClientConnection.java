package org.csdt.adinkra.ipc.transport.netty;

import org.csdt.adinkra.ipc.transport.ClientConnection;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;

import java.io.IOException;
import java.net.SocketAddress;
import java.util.Objects;

/**
 * {@link ClientConnection} backed by a Netty {@link Channel}.
 *
 * <p>{@link #send(byte[])} waits for the write to complete, so it must be
 * called from the request handler executor, never from the channel's event
 * loop.</p>
 */
final class NettyClientConnection implements ClientConnection
{
    private final long id;
    private final Channel channel;
    private final SocketAddress remote;

    NettyClientConnection(long id, Channel channel)
    {
        this.id = id;
        this.channel = Objects.requireNonNull(channel, "channel");
        this.remote = channel.remoteAddress();
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
        if (!channel.isActive()) {
            throw new IOException("Connection to " + remote + " is closed");
        }
        ChannelFuture write = channel.writeAndFlush(Unpooled.wrappedBuffer(bytes));
        write.awaitUninterruptibly();
        if (!write.isSuccess()) {
            throw new IOException("Write to " + remote + " failed", write.cause());
        }
    }

    @Override
    public boolean isOpen()
    {
        return channel.isActive();
    }

    @Override
    public String toString()
    {
        return "NettyClientConnection[" + id + ", " + remote + "]";
    }
}
