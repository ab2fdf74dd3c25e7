package ai.policy.revision.docx;

/**
 * Raised when a {@code .docx} file cannot be opened or is not a WordprocessingML package.
 */
public class DocumentLoadException extends RuntimeException {

    public DocumentLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
