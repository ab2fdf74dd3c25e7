package ai.policy.revision.grammar;

/**
 * Runtime exception for grammar oracle failures that cannot be degraded to a narrow replacement.
 */
public class GrammarCheckException extends RuntimeException {

    public GrammarCheckException(String message, Throwable cause) {
        super(message, cause);
    }
}
