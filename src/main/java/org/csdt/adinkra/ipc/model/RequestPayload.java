package org.csdt.adinkra.ipc.model;

import java.util.Objects;

/**
 * One completed request, as delimited by the transmission sentinels.
 *
 * <p>The body is handed on uninterpreted; decoding it (normally as JSON) is the
 * job of whoever handles the request.</p>
 *
 * @param sequence 1-based position of this payload within its connection
 * @param body     concatenated content lines, joined by {@code '\n'}
 */
public record RequestPayload(int sequence, String body)
{
    public RequestPayload {
        if (sequence < 1) {
            throw new IllegalArgumentException("sequence must be >= 1");
        }
        Objects.requireNonNull(body, "body");
    }

    public boolean isEmpty() {
        return body.isEmpty();
    }
}
