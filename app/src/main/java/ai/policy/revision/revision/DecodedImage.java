package ai.policy.revision.revision;

import ai.policy.revision.model.ImageFormat;
import java.util.Objects;

/**
 * Raster bytes whose format and pixel size have been verified.
 */
public record DecodedImage(byte[] data, ImageFormat format, int widthPx, int heightPx) {

    public DecodedImage {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(format, "format");
        if (widthPx <= 0 || heightPx <= 0) {
            throw new IllegalArgumentException("pixel dimensions must be positive");
        }
    }
}
