package ai.policy.revision.revision;

import ai.policy.revision.model.RevisionTag;
import java.util.Objects;

/**
 * The two halves of a tracked replacement.
 */
public record RevisionPair(RevisionTag deletion, RevisionTag insertion) {

    public RevisionPair {
        Objects.requireNonNull(deletion, "deletion");
        Objects.requireNonNull(insertion, "insertion");
    }
}
