package ai.policy.revision.revision;

/**
 * Raised when image bytes are not a readable PNG, JPEG, GIF or BMP picture.
 */
public class ImageDecodeException extends RuntimeException {

    public ImageDecodeException(String message) {
        super(message);
    }

    public ImageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
