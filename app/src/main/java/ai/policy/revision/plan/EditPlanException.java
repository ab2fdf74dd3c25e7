package ai.policy.revision.plan;

/**
 * Raised when an operation list cannot be read or has an unknown shape.
 */
public class EditPlanException extends RuntimeException {

    public EditPlanException(String message) {
        super(message);
    }

    public EditPlanException(String message, Throwable cause) {
        super(message, cause);
    }
}
