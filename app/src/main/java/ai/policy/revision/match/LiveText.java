package ai.policy.revision.match;

import ai.policy.revision.model.Block;
import ai.policy.revision.model.Run;
import java.util.Objects;

/**
 * Text of a block with deleted runs left out, plus a map from each live character back to its run.
 */
public final class LiveText {

    private final Block block;
    private final String text;
    private final int[] runIndex;
    private final int[] runOffset;

    private LiveText(Block block, String text, int[] runIndex, int[] runOffset) {
        this.block = block;
        this.text = text;
        this.runIndex = runIndex;
        this.runOffset = runOffset;
    }

    public static LiveText of(Block block) {
        Objects.requireNonNull(block, "block");
        StringBuilder builder = new StringBuilder();
        for (Run run : block.runs()) {
            if (!run.isDeleted()) {
                builder.append(run.text());
            }
        }
        int[] runIndex = new int[builder.length()];
        int[] runOffset = new int[builder.length()];
        int position = 0;
        for (int i = 0; i < block.runCount(); i++) {
            Run run = block.run(i);
            if (run.isDeleted()) {
                continue;
            }
            for (int offset = 0; offset < run.length(); offset++) {
                runIndex[position] = i;
                runOffset[position] = offset;
                position++;
            }
        }
        return new LiveText(block, builder.toString(), runIndex, runOffset);
    }

    public String text() {
        return text;
    }

    public int length() {
        return text.length();
    }

    /**
     * Converts the live range {@code [start, end)} to run coordinates.
     */
    public MatchSpan span(int start, int end) {
        if (start < 0 || end > text.length() || end <= start) {
            throw new IllegalArgumentException("live range " + start + ".." + end + " outside text of length " + text.length());
        }
        int last = end - 1;
        return new MatchSpan(block.id(),
                runIndex[start], runOffset[start],
                runIndex[last], runOffset[last] + 1,
                start, end);
    }
}
