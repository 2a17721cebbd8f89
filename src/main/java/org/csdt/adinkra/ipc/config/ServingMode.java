package org.csdt.adinkra.ipc.config;

/**
 * How the channel server schedules client connections.
 */
public enum ServingMode {
    /**
     * One connection at a time: a connection is drained and closed before the
     * next one is accepted. This is the compatible default.
     */
    SEQUENTIAL,

    /**
     * Connections are served in parallel. Requests within one connection are
     * still handled strictly in arrival order.
     */
    CONCURRENT
}
