package org.csdt.adinkra.convert;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * DataUri
 * -----------------------------------------------------------------------------
 * A parsed {@code data:} URI carrying the source image.
 *
 * <p>Accepted grammar:</p>
 * <pre>
 *   data-uri  = "data:" [ parameter *( ";" parameter ) ] "," data
 *   parameter = attribute "=" value | media-type | "base64"
 * </pre>
 *
 * <p>Only base64 encoding is supported: the last parameter must be
 * {@code base64}. Anything else is rejected.</p>
 *
 * <p>The decoded bytes are copied in and out, and equality compares them by
 * content.</p>
 *
 * @param mediaType  first parameter without {@code '='}, if any
 *                   (e.g. {@code image/png})
 * @param attributes {@code attribute=value} parameters in order of appearance
 * @param data       the decoded bytes
 */
public record DataUri(Optional<String> mediaType, List<Attribute> attributes, byte[] data)
{
    public static final String SCHEME = "data:";
    public static final String BASE64 = "base64";

    public record Attribute(String name, String value) {
        public Attribute {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
        }
    }

    public DataUri {
        Objects.requireNonNull(mediaType, "mediaType");
        attributes = List.copyOf(attributes);
        data = Objects.requireNonNull(data, "data").clone();
    }

    /** A copy of the decoded bytes. */
    @Override
    public byte[] data()
    {
        return data.clone();
    }

    /** Number of decoded bytes, without copying them. */
    public int length()
    {
        return data.length;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DataUri other)) {
            return false;
        }
        return mediaType.equals(other.mediaType)
                && attributes.equals(other.attributes)
                && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode()
    {
        return 31 * Objects.hash(mediaType, attributes) + Arrays.hashCode(data);
    }

    @Override
    public String toString()
    {
        return "DataUri[mediaType=" + mediaType.orElse("") + ", attributes=" + attributes
                + ", length=" + data.length + "]";
    }

    /**
     * Parse and decode a data URI.
     *
     * @throws ConversionException if the URI is malformed or not base64 encoded
     */
    public static DataUri parse(String uri) throws ConversionException
    {
        if (uri == null || !uri.startsWith(SCHEME)) {
            throw new ConversionException("Invalid data uri scheme");
        }

        int dataStart = uri.indexOf(',', SCHEME.length());
        if (dataStart < 0) {
            throw new ConversionException("Data uri has no data section");
        }

        List<String> parameters = new ArrayList<>();
        String header = uri.substring(SCHEME.length(), dataStart);
        if (!header.isEmpty()) {
            Collections.addAll(parameters, header.split(";", -1));
        }

        if (parameters.isEmpty() || !BASE64.equals(parameters.get(parameters.size() - 1))) {
            throw new ConversionException("Unknown data uri encoding");
        }

        String mediaType = null;
        List<Attribute> attributes = new ArrayList<>();
        for (String parameter : parameters.subList(0, parameters.size() - 1)) {
            int eq = parameter.indexOf('=');
            if (eq >= 0) {
                attributes.add(new Attribute(parameter.substring(0, eq), parameter.substring(eq + 1)));
            } else if (mediaType == null && !parameter.isEmpty()) {
                mediaType = parameter;
            }
        }

        byte[] data;
        try {
            data = Base64.getDecoder().decode(uri.substring(dataStart + 1));
        } catch (IllegalArgumentException e) {
            throw new ConversionException("Data uri is not valid base64", e);
        }
        return new DataUri(Optional.ofNullable(mediaType), attributes, data);
    }

    public Optional<String> attribute(String name)
    {
        for (Attribute attribute : attributes) {
            if (attribute.name().equals(name)) {
                return Optional.of(attribute.value());
            }
        }
        return Optional.empty();
    }
}
