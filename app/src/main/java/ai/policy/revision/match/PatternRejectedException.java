package ai.policy.revision.match;

/**
 * Raised when a search pattern is refused up front or exhausts its matching budget.
 */
public class PatternRejectedException extends RuntimeException {

    public PatternRejectedException(String message) {
        super(message);
    }

    public PatternRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
