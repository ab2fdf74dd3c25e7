package ai.policy.revision.operation;

import java.util.List;

/**
 * Outcomes of every record of an operation list, in input order.
 */
public record EditManifest(List<OperationResult> results) {

    public EditManifest {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public long count(OperationStatus status) {
        return results.stream().filter(result -> result.status() == status).count();
    }

    /**
     * True when some record failed or was rejected. Skipped records do not count.
     */
    public boolean hasProblems() {
        return count(OperationStatus.FAILED) > 0 || count(OperationStatus.INVALID) > 0;
    }
}
