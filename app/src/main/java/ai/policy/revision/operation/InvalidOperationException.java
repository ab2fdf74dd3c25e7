package ai.policy.revision.operation;

/**
 * Raised when an operation record is malformed. The record is reported as invalid and the
 * remaining records still run.
 */
public class InvalidOperationException extends RuntimeException {

    public InvalidOperationException(String message) {
        super(message);
    }

    public InvalidOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
