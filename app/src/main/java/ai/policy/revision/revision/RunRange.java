package ai.policy.revision.revision;

import ai.policy.revision.match.MatchSpan;
import ai.policy.revision.model.Block;
import ai.policy.revision.model.Document;
import ai.policy.revision.model.Run;
import java.util.List;

/**
 * Inclusive range of whole runs in a block, produced by splitting the runs at a span's edges.
 */
record RunRange(int first, int last) {

    /**
     * Checks that {@code span} still addresses live text of {@code block}. Nothing is mutated.
     */
    static void validate(Block block, MatchSpan span) {
        if (span.endRunIndex() >= block.runCount()) {
            throw new IllegalArgumentException("span ends at run " + span.endRunIndex() + " but block " + block.id()
                    + " has " + block.runCount() + " runs");
        }
        Run start = block.run(span.startRunIndex());
        Run end = block.run(span.endRunIndex());
        if (!start.isText() || start.isDeleted() || span.startOffset() >= start.length()) {
            throw new IllegalArgumentException("span start does not address live text in block " + block.id());
        }
        if (!end.isText() || end.isDeleted() || span.endOffset() == 0 || span.endOffset() > end.length()) {
            throw new IllegalArgumentException("span end does not address live text in block " + block.id());
        }
        if (span.startRunIndex() == span.endRunIndex() && span.endOffset() <= span.startOffset()) {
            throw new IllegalArgumentException("span is empty");
        }
    }

    /**
     * Splits the boundary runs so the span covers whole runs. The end is split first so the start
     * index stays valid.
     */
    static RunRange isolate(Document document, Block block, MatchSpan span) {
        int first = span.startRunIndex();
        int last = span.endRunIndex();
        Run end = block.run(last);
        if (span.endOffset() < end.length()) {
            Run[] parts = end.split(span.endOffset(), document.nextRunId());
            block.replaceRuns(last, last + 1, List.of(parts[0], parts[1]));
        }
        if (span.startOffset() > 0) {
            Run[] parts = block.run(first).split(span.startOffset(), document.nextRunId());
            block.replaceRuns(first, first + 1, List.of(parts[0], parts[1]));
            first++;
            last++;
        }
        return new RunRange(first, last);
    }
}
