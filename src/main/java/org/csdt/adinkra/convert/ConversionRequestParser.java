package org.csdt.adinkra.convert;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * ConversionRequestParser
 * -----------------------------------------------------------------------------
 * Decodes a request payload (a JSON object) into a {@link ConversionRequest}.
 *
 * <p>Recognised fields:</p>
 * <ul>
 *   <li>{@code image}: base64 data URI, required</li>
 *   <li>{@code stl}: output path, required</li>
 *   <li>{@code scale}, {@code size}, {@code border}: numbers, optional</li>
 *   <li>{@code negative}, {@code smooth}, {@code base}: booleans, optional</li>
 * </ul>
 *
 * <p>Missing optional fields take the defaults in {@link ConversionRequest}.
 * Numbers may be sent as JSON strings. Unknown fields are ignored.</p>
 */
public final class ConversionRequestParser
{
    private final ObjectMapper mapper;

    public ConversionRequestParser()
    {
        this(new ObjectMapper());
    }

    public ConversionRequestParser(ObjectMapper mapper)
    {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * @throws ConversionException if the payload is not a valid request
     */
    public ConversionRequest parse(String payload) throws ConversionException
    {
        Objects.requireNonNull(payload, "payload");

        final JsonNode root;
        try {
            root = mapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new ConversionException("json error: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ConversionException("json error: request must be a JSON object");
        }

        DataUri image = DataUri.parse(requiredText(root, "image"));
        Path output = outputPath(requiredText(root, "stl"));

        try {
            return new ConversionRequest(
                    image,
                    output,
                    booleanField(root, "base", ConversionRequest.DEFAULT_INCLUDE_BASE),
                    booleanField(root, "smooth", ConversionRequest.DEFAULT_SMOOTH),
                    booleanField(root, "negative", ConversionRequest.DEFAULT_NEGATIVE),
                    intField(root, "border", ConversionRequest.DEFAULT_BORDER),
                    intField(root, "size", ConversionRequest.DEFAULT_SIZE),
                    doubleField(root, "scale", ConversionRequest.DEFAULT_SCALE));
        } catch (IllegalArgumentException e) {
            throw new ConversionException("invalid request: " + e.getMessage(), e);
        }
    }

    private static String requiredText(JsonNode root, String field) throws ConversionException
    {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            throw new ConversionException("missing required field '" + field + "'");
        }
        if (!node.isTextual()) {
            throw new ConversionException("field '" + field + "' must be a string");
        }
        return node.textValue();
    }

    private static Path outputPath(String value) throws ConversionException
    {
        if (value.isBlank()) {
            throw new ConversionException("field 'stl' must not be empty");
        }
        try {
            return Path.of(value);
        } catch (InvalidPathException e) {
            throw new ConversionException("field 'stl' is not a valid path: " + value, e);
        }
    }

    private static boolean booleanField(JsonNode root, String field, boolean defaultValue)
            throws ConversionException
    {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            return node.asInt() != 0;
        }
        throw new ConversionException("field '" + field + "' must be a boolean");
    }

    private static int intField(JsonNode root, String field, int defaultValue) throws ConversionException
    {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (node.isNumber()) {
            return node.intValue();
        }
        if (node.isTextual()) {
            try {
                return Integer.parseInt(node.textValue().trim());
            } catch (NumberFormatException e) {
                throw new ConversionException("field '" + field + "' must be an integer", e);
            }
        }
        throw new ConversionException("field '" + field + "' must be an integer");
    }

    private static double doubleField(JsonNode root, String field, double defaultValue)
            throws ConversionException
    {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual()) {
            try {
                return Double.parseDouble(node.textValue().trim());
            } catch (NumberFormatException e) {
                throw new ConversionException("field '" + field + "' must be a number", e);
            }
        }
        throw new ConversionException("field '" + field + "' must be a number");
    }
}
