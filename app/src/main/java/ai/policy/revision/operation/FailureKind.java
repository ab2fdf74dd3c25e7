package ai.policy.revision.operation;

/**
 * Why an operation did not apply.
 */
public enum FailureKind {
    TARGET_NOT_FOUND,
    INVALID_OPERATION,
    PATTERN_REJECTED,
    IMAGE_DECODE_FAILED,
    UNEXPECTED_ERROR
}
