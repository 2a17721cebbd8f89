package org.csdt.adinkra.ipc.transport;

/**
 * Indicates that the listening channel could not be established, for example
 * because the configured port is already in use.
 *
 * A server that raised this exception never accepts connections.
 */
public final class ChannelSetupException extends RuntimeException
{
    public ChannelSetupException(String message) {
        super(message);
    }

    public ChannelSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
