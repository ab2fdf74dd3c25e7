package ai.policy.revision.model;

/**
 * Kind of story a block of text lives in.
 */
public enum ContainerKind {
    BODY,
    TABLE_CELL,
    HEADER,
    FOOTER;

    /**
     * Comments can only be anchored in the main document story.
     */
    public boolean supportsComments() {
        return this == BODY || this == TABLE_CELL;
    }
}
