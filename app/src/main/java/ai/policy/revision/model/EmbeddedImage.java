package ai.policy.revision.model;

import java.util.Objects;

/**
 * Picture placed inline in a run, sized in English Metric Units.
 */
public record EmbeddedImage(byte[] data, ImageFormat format, String name, long widthEmu, long heightEmu) {

    public EmbeddedImage {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(format, "format");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (widthEmu <= 0 || heightEmu <= 0) {
            throw new IllegalArgumentException("image extent must be positive");
        }
    }
}
