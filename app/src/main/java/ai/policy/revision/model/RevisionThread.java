package ai.policy.revision.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Comment thread created during a revision session. Runs refer to it by {@link #commentId()}.
 */
public record RevisionThread(int commentId, String author, String body, Instant timestamp, Optional<RevisionTag> anchor) {

    public RevisionThread {
        Objects.requireNonNull(timestamp, "timestamp");
        if (author == null || author.isBlank()) {
            throw new IllegalArgumentException("author must not be blank");
        }
        if (body == null || body.isBlank()) {
            throw new IllegalArgumentException("body must not be blank");
        }
        anchor = anchor == null ? Optional.empty() : anchor;
    }
}
