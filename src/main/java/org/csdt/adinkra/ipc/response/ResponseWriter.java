package org.csdt.adinkra.ipc.response;

import org.csdt.adinkra.ipc.transport.ClientConnection;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * ResponseWriter
 * -----------------------------------------------------------------------------
 * Sends the completion response for a finished request.
 *
 * <p>The response is two CRLF-terminated lines:</p>
 * <pre>
 *   REQUESTCOMPLETE
 *   stl:&lt;result&gt;
 * </pre>
 *
 * <p>The connection is left open; closing it is the channel server's job.</p>
 */
public final class ResponseWriter
{
    public static final String LINE_TERMINATOR = "\r\n";
    public static final String REQUEST_COMPLETE_SIGNAL = "REQUESTCOMPLETE";
    public static final String RESULT_PREFIX = "stl:";

    /**
     * Write the completion marker followed by the result line.
     *
     * @param connection the client that sent the request
     * @param result     result to report, typically the path of the STL file
     * @throws IOException if the connection is closed or the write fails
     */
    public void writeCompletion(ClientConnection connection, String result) throws IOException
    {
        Objects.requireNonNull(connection, "connection");
        Objects.requireNonNull(result, "result");

        connection.send((REQUEST_COMPLETE_SIGNAL + LINE_TERMINATOR).getBytes(StandardCharsets.UTF_8));
        connection.send((RESULT_PREFIX + result + LINE_TERMINATOR).getBytes(StandardCharsets.UTF_8));
    }
}
