package org.csdt.adinkra.convert;

import org.csdt.adinkra.ipc.model.RequestPayload;
import org.csdt.adinkra.ipc.observability.IpcErrorEvent;
import org.csdt.adinkra.ipc.observability.IpcObservabilitySink;
import org.csdt.adinkra.ipc.observability.NullObservabilitySink;
import org.csdt.adinkra.ipc.response.ResponseWriter;
import org.csdt.adinkra.ipc.transport.ChannelRequestHandler;
import org.csdt.adinkra.ipc.transport.ClientConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * ConversionRequestHandler
 * =============================================================================
 * Production {@link ChannelRequestHandler}: decodes each payload, runs the
 * {@link Converter}, and reports completion to the client.
 *
 * <pre>
 *   RequestPayload
 *        → ConversionRequestParser   (JSON + data URI)
 *            → Converter             (image → STL file)
 *                → ResponseWriter    (REQUESTCOMPLETE, stl:&lt;path&gt;)
 * </pre>
 *
 * <p>A request that cannot be decoded or converted is reported to the
 * observability sink and gets no response. The connection stays open for the
 * client's next request.</p>
 */
public final class ConversionRequestHandler implements ChannelRequestHandler
{
    private static final Logger log = LoggerFactory.getLogger(ConversionRequestHandler.class);

    private final ConversionRequestParser parser;
    private final Converter converter;
    private final ResponseWriter responseWriter;
    private final IpcObservabilitySink observabilitySink;

    public ConversionRequestHandler(Converter converter)
    {
        this(new ConversionRequestParser(), converter, new ResponseWriter(), null);
    }

    public ConversionRequestHandler(ConversionRequestParser parser,
                                    Converter converter,
                                    ResponseWriter responseWriter,
                                    IpcObservabilitySink observabilitySink)
    {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.converter = Objects.requireNonNull(converter, "converter");
        this.responseWriter = Objects.requireNonNull(responseWriter, "responseWriter");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    @Override
    public void onRequest(ClientConnection connection, RequestPayload payload)
    {
        final Path result;
        try {
            ConversionRequest request = parser.parse(payload.body());
            log.debug("converting request {} from {} into {}",
                    payload.sequence(), connection.remoteAddress(), request.outputPath());
            result = converter.convert(request);
        } catch (ConversionException e) {
            observabilitySink.onError(new IpcErrorEvent(
                    Instant.now(),
                    connection.remoteAddress(),
                    "request " + payload.sequence() + " rejected: " + e.getMessage(),
                    e.getCause()));
            return;
        }

        try {
            responseWriter.writeCompletion(connection, result.toString());
        } catch (IOException e) {
            observabilitySink.onError(new IpcErrorEvent(
                    Instant.now(),
                    connection.remoteAddress(),
                    "could not send completion of request " + payload.sequence(),
                    e));
        }
    }
}
