package org.csdt.adinkra.convert;

/**
 * Indicates that a request payload could not be turned into a mesh file.
 *
 * This typically reflects:
 * <ul>
 *   <li>A payload that is not a JSON object</li>
 *   <li>A missing {@code image} or {@code stl} field</li>
 *   <li>An image that is not a base64 data URI</li>
 *   <li>A failure reported by the {@link Converter}</li>
 * </ul>
 */
public final class ConversionException extends Exception
{
    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
