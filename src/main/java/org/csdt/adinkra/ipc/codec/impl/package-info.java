/**
 * Codec implementations for the request channel.
 *
 * <p>Implementations in this package are pure, per-connection state machines.
 * They are shared verbatim by the blocking socket server and the Netty
 * pipeline.</p>
 */
package org.csdt.adinkra.ipc.codec.impl;
