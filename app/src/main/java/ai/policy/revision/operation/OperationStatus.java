package ai.policy.revision.operation;

public enum OperationStatus {
    APPLIED,
    SKIPPED,
    FAILED,
    INVALID
}
