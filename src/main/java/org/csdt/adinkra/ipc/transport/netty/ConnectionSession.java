package org.csdt.adinkra.ipc.transport.netty;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-connection state shared by the framing handler (event loop) and the
 * dispatch handler (request executor).
 *
 * <p>Also tracks payloads that were framed but not yet handled. While any are
 * outstanding the client is waiting for the server, so the idle read timeout
 * does not apply; once the last one is handled the idle period restarts.</p>
 */
final class ConnectionSession
{
    /** User event fired once ENDTRANSMISSION and the final payload were passed on. */
    static final Object END_OF_TRANSMISSION = new Object() {
        @Override
        public String toString() {
            return "END_OF_TRANSMISSION";
        }
    };

    private final NettyClientConnection connection;
    private final AtomicBoolean endReceived = new AtomicBoolean(false);
    private final AtomicInteger delivered = new AtomicInteger();
    private final AtomicInteger outstanding = new AtomicInteger();
    private volatile long lastHandledNanos = System.nanoTime();

    ConnectionSession(NettyClientConnection connection)
    {
        this.connection = connection;
    }

    NettyClientConnection connection()
    {
        return connection;
    }

    void markEndReceived()
    {
        endReceived.set(true);
    }

    boolean endReceived()
    {
        return endReceived.get();
    }

    void recordDelivery()
    {
        delivered.incrementAndGet();
    }

    int delivered()
    {
        return delivered.get();
    }

    /** Called on the event loop when a payload is passed to the dispatcher. */
    void payloadQueued()
    {
        outstanding.incrementAndGet();
    }

    /** Called on the request executor once the handler returned. */
    void payloadHandled()
    {
        lastHandledNanos = System.nanoTime();
        outstanding.decrementAndGet();
    }

    boolean hasOutstandingPayloads()
    {
        return outstanding.get() > 0;
    }

    /**
     * Returns {@code true} if the client has been silent for the whole
     * {@code timeoutNanos} since the server last finished handling one of its
     * payloads.
     */
    boolean idleSinceLastHandled(long timeoutNanos)
    {
        return !hasOutstandingPayloads() && System.nanoTime() - lastHandledNanos >= timeoutNanos;
    }
}
