package ai.policy.revision.revision;

import ai.policy.revision.match.MatchSpan;
import ai.policy.revision.model.Block;
import ai.policy.revision.model.Document;
import ai.policy.revision.model.RevisionTag;
import ai.policy.revision.model.RevisionThread;
import ai.policy.revision.model.Run;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates comment threads and marks the runs they are anchored to.
 */
public class CommentAttacher {

    private static final Logger LOGGER = LoggerFactory.getLogger(CommentAttacher.class);

    private final Clock clock;

    public CommentAttacher(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Anchors a comment to the runs carrying {@code revision}, normally the deletion half of a
     * replacement, so reviewers see the note next to the text that was removed.
     *
     * @return the new thread, or empty when the body is blank or the block cannot hold comments
     */
    public Optional<RevisionThread> attach(Document document, int blockId, RevisionTag revision, String body, String author) {
        Objects.requireNonNull(revision, "revision");
        if (isBlank(body)) {
            return Optional.empty();
        }
        Block block = document.block(blockId);
        if (!block.kind().supportsComments()) {
            LOGGER.warn("Comment '{}' skipped: {} blocks cannot hold comments", abbreviate(body), block.kind());
            return Optional.empty();
        }
        if (!carries(block, revision)) {
            throw new IllegalArgumentException("No run in block " + blockId + " carries revision " + revision.revisionId());
        }
        RevisionThread thread = newThread(document, author, body, Optional.of(revision));
        for (int i = 0; i < block.runCount(); i++) {
            Run run = block.run(i);
            if (run.revision().filter(revision::equals).isPresent()) {
                block.setRun(i, run.withComment(thread.commentId()));
            }
        }
        document.addThread(thread);
        return Optional.of(thread);
    }

    /**
     * Anchors a comment to the first of {@code candidates} that some run of the block still
     * carries. A replacement of text inserted earlier in the session leaves no deleted runs, so
     * the note then lands on the insertion half.
     *
     * @return the new thread, or empty when no candidate is carried by any run
     */
    public Optional<RevisionThread> attachToFirstCarried(Document document, int blockId, List<RevisionTag> candidates,
                                                         String body, String author) {
        Objects.requireNonNull(candidates, "candidates");
        Block block = document.block(blockId);
        for (RevisionTag candidate : candidates) {
            if (carries(block, candidate)) {
                return attach(document, blockId, candidate, body, author);
            }
        }
        if (!isBlank(body)) {
            LOGGER.warn("Comment '{}' skipped: the text it refers to was retracted", abbreviate(body));
        }
        return Optional.empty();
    }

    /**
     * Anchors a comment to the live text of {@code span} without changing the text.
     */
    public Optional<RevisionThread> attachToSpan(Document document, MatchSpan span, String body, String author) {
        Objects.requireNonNull(span, "span");
        if (isBlank(body)) {
            return Optional.empty();
        }
        Block block = document.block(span.blockId());
        if (!block.kind().supportsComments()) {
            LOGGER.warn("Comment '{}' skipped: {} blocks cannot hold comments", abbreviate(body), block.kind());
            return Optional.empty();
        }
        RunRange.validate(block, span);
        RunRange range = RunRange.isolate(document, block, span);
        RevisionThread thread = newThread(document, author, body, Optional.empty());
        for (int i = range.first(); i <= range.last(); i++) {
            Run run = block.run(i);
            if (run.isText() && !run.isDeleted()) {
                block.setRun(i, run.withComment(thread.commentId()));
            }
        }
        document.addThread(thread);
        return Optional.of(thread);
    }

    private static boolean carries(Block block, RevisionTag revision) {
        return block.runs().stream().anyMatch(run -> run.revision().filter(revision::equals).isPresent());
    }

    private RevisionThread newThread(Document document, String author, String body, Optional<RevisionTag> anchor) {
        Instant timestamp = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        return new RevisionThread(document.nextCommentId(), author, body.strip(), timestamp, anchor);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String abbreviate(String value) {
        String stripped = value.strip();
        return stripped.length() <= 40 ? stripped : stripped.substring(0, 40) + "...";
    }
}
