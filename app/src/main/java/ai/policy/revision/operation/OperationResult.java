package ai.policy.revision.operation;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one record of the operation list.
 *
 * @param index position of the record in the list, starting at 0
 * @param action action as written in the record
 * @param occurrences number of places the operation changed
 */
public record OperationResult(
        int index,
        String action,
        String target,
        OperationStatus status,
        Optional<FailureKind> failure,
        String detail,
        int occurrences
) {

    public OperationResult {
        Objects.requireNonNull(status, "status");
        action = action == null ? "" : action;
        target = target == null ? "" : target;
        failure = failure == null ? Optional.empty() : failure;
        detail = detail == null ? "" : detail;
        if (occurrences < 0) {
            throw new IllegalArgumentException("occurrences must not be negative");
        }
    }

    static OperationResult applied(int index, String action, String target, int occurrences, String detail) {
        return new OperationResult(index, action, target, OperationStatus.APPLIED, Optional.empty(), detail, occurrences);
    }

    static OperationResult skipped(int index, String action, String target, String detail) {
        return new OperationResult(index, action, target, OperationStatus.SKIPPED, Optional.of(FailureKind.TARGET_NOT_FOUND), detail, 0);
    }

    static OperationResult failed(int index, String action, String target, FailureKind failure, String detail) {
        return new OperationResult(index, action, target, OperationStatus.FAILED, Optional.of(failure), detail, 0);
    }

    static OperationResult invalid(int index, String action, String target, FailureKind failure, String detail) {
        return new OperationResult(index, action, target, OperationStatus.INVALID, Optional.of(failure), detail, 0);
    }
}
