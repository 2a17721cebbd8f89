package org.csdt.adinkra.convert;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Parameters of one image to STL conversion.
 *
 * @param image       decoded source image
 * @param outputPath  where the STL file is to be written
 * @param includeBase add a solid base under the relief
 * @param smooth      smooth the image before extrusion
 * @param negative    invert the image before extrusion
 * @param border      border width in pixels around the image
 * @param size        edge length in pixels the image is resized to
 * @param scale       height scale of the extrusion
 */
public record ConversionRequest(
    DataUri image,
    Path outputPath,
    boolean includeBase,
    boolean smooth,
    boolean negative,
    int border,
    int size,
    double scale
) {
    public static final double DEFAULT_SCALE = 0.1;
    public static final int DEFAULT_SIZE = 256;
    public static final int DEFAULT_BORDER = 100;
    public static final boolean DEFAULT_NEGATIVE = false;
    public static final boolean DEFAULT_SMOOTH = true;
    public static final boolean DEFAULT_INCLUDE_BASE = false;

    public ConversionRequest {
        Objects.requireNonNull(image, "image");
        Objects.requireNonNull(outputPath, "outputPath");
        if (size <= 0) {
            throw new IllegalArgumentException("size must be positive");
        }
        if (border < 0) {
            throw new IllegalArgumentException("border must not be negative");
        }
    }
}
