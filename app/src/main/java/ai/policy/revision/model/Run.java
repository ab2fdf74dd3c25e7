package ai.policy.revision.model;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable piece of a block with uniform formatting and revision state.
 *
 * <p>A run is either text, an opaque inline object, or an embedded image. Only text runs
 * contribute characters to the block text.
 *
 * <p>{@code priorInsertion} is set when a deletion covers text another author inserted: the run
 * then carries both tags and disappears under accept-all as well as reject-all.
 */
public record Run(
        int id,
        String text,
        RunFormat format,
        Optional<RevisionTag> revision,
        Optional<InlineObject> inline,
        Optional<EmbeddedImage> image,
        Set<Integer> commentIds,
        Optional<RevisionTag> priorInsertion
) {

    public Run {
        text = text == null ? "" : text;
        format = format == null ? RunFormat.NONE : format;
        revision = revision == null ? Optional.empty() : revision;
        inline = inline == null ? Optional.empty() : inline;
        image = image == null ? Optional.empty() : image;
        commentIds = commentIds == null ? Set.of() : Set.copyOf(commentIds);
        priorInsertion = priorInsertion == null ? Optional.empty() : priorInsertion;
        if (priorInsertion.isPresent()
                && (!priorInsertion.get().isInsertion() || revision.filter(RevisionTag::isDeletion).isEmpty())) {
            throw new IllegalArgumentException("prior insertion requires a deletion on top of an insertion tag");
        }
        if (inline.isPresent() && image.isPresent()) {
            throw new IllegalArgumentException("run cannot hold both an inline object and an image");
        }
        if (!text.isEmpty() && (inline.isPresent() || image.isPresent())) {
            throw new IllegalArgumentException("non-text run must not carry text");
        }
    }

    public static Run text(int id, String text, RunFormat format) {
        return new Run(id, text, format, Optional.empty(), Optional.empty(), Optional.empty(), Set.of(), Optional.empty());
    }

    public static Run inline(int id, InlineObject object) {
        Objects.requireNonNull(object, "object");
        return new Run(id, "", RunFormat.NONE, Optional.empty(), Optional.of(object), Optional.empty(), Set.of(), Optional.empty());
    }

    public static Run image(int id, EmbeddedImage image, RunFormat format) {
        Objects.requireNonNull(image, "image");
        return new Run(id, "", format, Optional.empty(), Optional.empty(), Optional.of(image), Set.of(), Optional.empty());
    }

    public boolean isText() {
        return inline.isEmpty() && image.isEmpty();
    }

    public boolean isDeleted() {
        return revision.filter(RevisionTag::isDeletion).isPresent();
    }

    public boolean isInserted() {
        return priorInsertion.isPresent() || revision.filter(RevisionTag::isInsertion).isPresent();
    }

    public int length() {
        return text.length();
    }

    public Run withRevision(RevisionTag tag) {
        return new Run(id, text, format, Optional.of(tag), inline, image, commentIds, priorInsertion);
    }

    /**
     * Tags this run as deleted. An insertion tag already on the run is kept as the prior insertion.
     */
    public Run markDeleted(RevisionTag deletion) {
        if (!deletion.isDeletion()) {
            throw new IllegalArgumentException("revision " + deletion.revisionId() + " is not a deletion");
        }
        Optional<RevisionTag> inserted = revision.filter(RevisionTag::isInsertion);
        return new Run(id, text, format, Optional.of(deletion), inline, image, commentIds, inserted);
    }

    public Run withComment(int commentId) {
        Set<Integer> ids = new LinkedHashSet<>(commentIds);
        ids.add(commentId);
        return new Run(id, text, format, revision, inline, image, ids, priorInsertion);
    }

    /**
     * Splits a text run at {@code offset}. The left part keeps this run's id.
     */
    public Run[] split(int offset, int rightId) {
        if (!isText()) {
            throw new IllegalStateException("only text runs can be split");
        }
        if (offset <= 0 || offset >= text.length()) {
            throw new IllegalArgumentException("split offset " + offset + " outside run of length " + text.length());
        }
        Run left = new Run(id, text.substring(0, offset), format, revision, inline, image, commentIds, priorInsertion);
        Run right = new Run(rightId, text.substring(offset), format, revision, inline, image, commentIds, priorInsertion);
        return new Run[] {left, right};
    }
}
