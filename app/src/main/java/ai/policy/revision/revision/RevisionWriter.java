package ai.policy.revision.revision;

import ai.policy.revision.match.MatchSpan;
import ai.policy.revision.model.Block;
import ai.policy.revision.model.Document;
import ai.policy.revision.model.EmbeddedImage;
import ai.policy.revision.model.RevisionKind;
import ai.policy.revision.model.RevisionTag;
import ai.policy.revision.model.Run;
import ai.policy.revision.model.RunFormat;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns a matched span into tracked changes.
 *
 * <p>Covered live runs are tagged as deleted under one revision id. Runs this session inserted
 * earlier are dropped instead, since deleting one's own insertion simply retracts it. Insertions
 * loaded from the source keep their tag underneath the new deletion. Runs that are already
 * deleted and opaque inline objects stay as they are. Replacement content goes
 * right after the covered range and borrows the formatting of the first covered text run.
 */
public class RevisionWriter {

    private final Clock clock;

    public RevisionWriter(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public RevisionPair applyReplace(Document document, MatchSpan span, String replacement, String author) {
        if (replacement == null || replacement.isEmpty()) {
            throw new IllegalArgumentException("replacement must not be empty");
        }
        return apply(document, span, author, (id, format, tag) -> Run.text(id, replacement, format).withRevision(tag)).toPair();
    }

    public RevisionTag applyDelete(Document document, MatchSpan span, String author) {
        return apply(document, span, author, null).deletion();
    }

    public RevisionPair applyImage(Document document, MatchSpan span, EmbeddedImage image, String author) {
        Objects.requireNonNull(image, "image");
        return apply(document, span, author, (id, format, tag) -> Run.image(id, image, format).withRevision(tag)).toPair();
    }

    /**
     * Timestamp for new tags, truncated to seconds as stored in the document.
     */
    public Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.SECONDS);
    }

    private Outcome apply(Document document, MatchSpan span, String author, InsertedRunFactory insertion) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(span, "span");
        if (author == null || author.isBlank()) {
            throw new IllegalArgumentException("author must not be blank");
        }
        Block block = document.block(span.blockId());
        RunRange.validate(block, span);

        RunRange range = RunRange.isolate(document, block, span);
        Instant timestamp = now();
        RevisionTag deletion = new RevisionTag(RevisionKind.DELETED, author, timestamp, document.nextRevisionId());

        List<Run> rewritten = new ArrayList<>();
        RunFormat format = null;
        for (int i = range.first(); i <= range.last(); i++) {
            Run run = block.run(i);
            if (run.isDeleted() || !run.isText() && !run.isInserted()) {
                rewritten.add(run);
                continue;
            }
            if (format == null && run.isText()) {
                format = run.format();
            }
            if (run.isInserted() && document.isSessionRevision(run.revision().orElseThrow())) {
                continue;
            }
            rewritten.add(run.markDeleted(deletion));
        }

        RevisionTag inserted = null;
        if (insertion != null) {
            inserted = new RevisionTag(RevisionKind.INSERTED, author, timestamp, document.nextRevisionId());
            rewritten.add(insertion.create(document.nextRunId(), format == null ? RunFormat.NONE : format, inserted));
        }
        block.replaceRuns(range.first(), range.last() + 1, rewritten);
        return new Outcome(deletion, Optional.ofNullable(inserted));
    }

    @FunctionalInterface
    private interface InsertedRunFactory {
        Run create(int runId, RunFormat format, RevisionTag tag);
    }

    private record Outcome(RevisionTag deletion, Optional<RevisionTag> insertion) {

        RevisionPair toPair() {
            return new RevisionPair(deletion, insertion.orElseThrow());
        }
    }
}
