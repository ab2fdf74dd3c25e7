package ai.policy.revision.revision;

import ai.policy.revision.match.MatchSpan;
import ai.policy.revision.model.Document;
import ai.policy.revision.model.EmbeddedImage;
import ai.policy.revision.model.ImageFormat;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import javax.imageio.ImageIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces placeholder text with a picture as a tracked change.
 */
public class ImageSubstitutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(ImageSubstitutor.class);

    private final RevisionWriter revisionWriter;

    public ImageSubstitutor(RevisionWriter revisionWriter) {
        this.revisionWriter = Objects.requireNonNull(revisionWriter, "revisionWriter");
    }

    public DecodedImage decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new ImageDecodeException("image data is empty");
        }
        ImageFormat format = sniff(bytes)
                .orElseThrow(() -> new ImageDecodeException("unsupported image format, expected PNG, JPEG, GIF or BMP"));
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(bytes));
        } catch (IOException | RuntimeException ex) {
            throw new ImageDecodeException("failed to decode " + format + " image", ex);
        }
        if (image == null) {
            throw new ImageDecodeException("no reader could decode the " + format + " image");
        }
        LOGGER.debug("Decoded {} image {}x{}", format, image.getWidth(), image.getHeight());
        return new DecodedImage(bytes, format, image.getWidth(), image.getHeight());
    }

    /**
     * Tracked-deletes the placeholder in {@code span} and tracked-inserts the picture after it.
     */
    public RevisionPair substitute(Document document, MatchSpan span, DecodedImage image, SizeConstraint size, String author) {
        Objects.requireNonNull(image, "image");
        Objects.requireNonNull(size, "size");
        long[] extent = size.toEmu(image.widthPx(), image.heightPx());
        String name = "image" + document.nextRunId() + "." + image.format().extension();
        EmbeddedImage embedded = new EmbeddedImage(image.data(), image.format(), name, extent[0], extent[1]);
        return revisionWriter.applyImage(document, span, embedded, author);
    }

    static Optional<ImageFormat> sniff(byte[] bytes) {
        if (startsWith(bytes, 0x89, 'P', 'N', 'G')) {
            return Optional.of(ImageFormat.PNG);
        }
        if (startsWith(bytes, 0xFF, 0xD8)) {
            return Optional.of(ImageFormat.JPEG);
        }
        if (startsWith(bytes, 'G', 'I', 'F', '8')) {
            return Optional.of(ImageFormat.GIF);
        }
        if (startsWith(bytes, 'B', 'M')) {
            return Optional.of(ImageFormat.BMP);
        }
        return Optional.empty();
    }

    private static boolean startsWith(byte[] bytes, int... prefix) {
        if (bytes.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if ((bytes[i] & 0xFF) != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
