package org.csdt.adinkra.convert;

import java.nio.file.Path;

/**
 * Converter
 * -----------------------------------------------------------------------------
 * Port to the image to mesh conversion.
 *
 * <p>Implementations resize, grayscale, smooth and optionally invert the
 * image, extrude it into a mesh, and write the mesh to
 * {@link ConversionRequest#outputPath()}.</p>
 */
@FunctionalInterface
public interface Converter
{
    /**
     * Perform one conversion.
     *
     * @return path of the written STL file
     * @throws ConversionException if the image cannot be converted or written
     */
    Path convert(ConversionRequest request) throws ConversionException;
}
