package ai.policy.revision.match;

/**
 * Location of one match inside a block.
 *
 * <p>Run coordinates address the block's run list: the span starts at {@code startOffset} of run
 * {@code startRunIndex} and ends before {@code endOffset} of run {@code endRunIndex}. The live
 * offsets locate the same characters in the block's live text.
 */
public record MatchSpan(
        int blockId,
        int startRunIndex,
        int startOffset,
        int endRunIndex,
        int endOffset,
        int liveStart,
        int liveEnd
) {

    public MatchSpan {
        if (startRunIndex < 0 || endRunIndex < startRunIndex) {
            throw new IllegalArgumentException("invalid run range " + startRunIndex + ".." + endRunIndex);
        }
        if (startOffset < 0 || endOffset < 0) {
            throw new IllegalArgumentException("offsets must not be negative");
        }
        if (liveEnd <= liveStart) {
            throw new IllegalArgumentException("span must cover at least one character");
        }
    }

    public int length() {
        return liveEnd - liveStart;
    }
}
