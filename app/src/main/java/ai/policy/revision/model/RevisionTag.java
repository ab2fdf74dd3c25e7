package ai.policy.revision.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Attribution attached to a run that was inserted or deleted as a tracked change.
 */
public record RevisionTag(RevisionKind kind, String author, Instant timestamp, int revisionId) {

    public RevisionTag {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(timestamp, "timestamp");
        if (author == null || author.isBlank()) {
            throw new IllegalArgumentException("author must not be blank");
        }
        if (revisionId < 0) {
            throw new IllegalArgumentException("revisionId must not be negative");
        }
    }

    public boolean isDeletion() {
        return kind == RevisionKind.DELETED;
    }

    public boolean isInsertion() {
        return kind == RevisionKind.INSERTED;
    }
}
