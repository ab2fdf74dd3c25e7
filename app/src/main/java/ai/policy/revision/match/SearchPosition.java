package ai.policy.revision.match;

/**
 * Point in document order from which a search resumes.
 */
public record SearchPosition(int blockIndex, int liveOffset) {

    public static final SearchPosition START = new SearchPosition(0, 0);

    public SearchPosition {
        if (blockIndex < 0 || liveOffset < 0) {
            throw new IllegalArgumentException("search position must not be negative");
        }
    }
}
