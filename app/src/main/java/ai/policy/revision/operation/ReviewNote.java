package ai.policy.revision.operation;

/**
 * Comment body and author attached to an edit.
 */
public record ReviewNote(String body, String author) {

    public ReviewNote {
        if (body == null || body.isBlank()) {
            throw new IllegalArgumentException("body must not be blank");
        }
        if (author == null || author.isBlank()) {
            throw new IllegalArgumentException("author must not be blank");
        }
    }
}
