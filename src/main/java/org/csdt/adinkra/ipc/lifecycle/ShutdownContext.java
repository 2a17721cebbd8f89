package org.csdt.adinkra.ipc.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * ShutdownContext
 * =============================================================================
 * Explicit shutdown scope shared by the channel server and its resources.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Holds the resources to release (listening socket, log handle) in
 *       registration order</li>
 *   <li>Exposes a cancellation signal that accept loops observe</li>
 *   <li>Runs cleanup exactly once, however many triggers fire</li>
 * </ul>
 *
 * <h2>Triggers</h2>
 * {@link #close()} may be called directly, by a JVM shutdown hook installed
 * through {@link #installShutdownHook()} (normal exit, SIGINT, SIGTERM), or by
 * both. Only the first call does anything. Resources are closed in reverse
 * registration order; a failure to close one resource is logged and the
 * remaining resources are still closed.
 *
 * <h2>Thread Safety</h2>
 * All methods are safe to call from any thread, including the shutdown hook
 * thread.
 */
public final class ShutdownContext implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(ShutdownContext.class);

    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean hookInstalled = new AtomicBoolean(false);
    private final CountDownLatch closedLatch = new CountDownLatch(1);
    private final Deque<NamedResource> resources = new ArrayDeque<>();

    private record NamedResource(String name, AutoCloseable resource) {}

    /**
     * Register a resource to be closed on shutdown.
     *
     * <p>If the context is already closed the resource is closed immediately.</p>
     */
    public void register(String name, AutoCloseable resource)
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(resource, "resource");

        synchronized (resources) {
            if (!closed.get()) {
                resources.push(new NamedResource(name, resource));
                return;
            }
        }
        closeQuietly(new NamedResource(name, resource));
    }

    /**
     * Install a JVM shutdown hook that calls {@link #close()}.
     * Idempotent: only the first call installs a hook.
     */
    public void installShutdownHook()
    {
        if (hookInstalled.compareAndSet(false, true)) {
            Runtime.getRuntime().addShutdownHook(new Thread(this::close, "adinkra-ipc-shutdown"));
        }
    }

    public boolean isShutdownRequested()
    {
        return closed.get();
    }

    /**
     * Block until {@link #close()} has completed or the timeout elapses.
     *
     * @return {@code true} if the context closed within the timeout
     */
    public boolean awaitShutdown(Duration timeout) throws InterruptedException
    {
        return closedLatch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Release all registered resources. The first call performs cleanup;
     * later calls return immediately. Never throws.
     */
    @Override
    public void close()
    {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        log.info("cleaning up...");
        try {
            while (true) {
                NamedResource next;
                synchronized (resources) {
                    next = resources.poll();
                }
                if (next == null) {
                    break;
                }
                closeQuietly(next);
            }
        } finally {
            closedLatch.countDown();
        }
    }

    private static void closeQuietly(NamedResource resource)
    {
        try {
            resource.resource().close();
        } catch (Exception e) {
            log.warn("failed to close {}", resource.name(), e);
        }
    }
}
