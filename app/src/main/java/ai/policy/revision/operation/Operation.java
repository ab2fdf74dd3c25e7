package ai.policy.revision.operation;

import ai.policy.revision.match.MatchOptions;
import ai.policy.revision.revision.SizeConstraint;
import java.util.Objects;
import java.util.Optional;

/**
 * A validated edit. The set of variants is closed; callers dispatch through {@link Visitor}.
 */
public sealed interface Operation
        permits Operation.Replace, Operation.Delete, Operation.Comment, Operation.ReplaceWithImage {

    String target();

    MatchOptions matchOptions();

    boolean wholeDocument();

    boolean skipIfAbsent();

    ActionKind action();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitReplace(Replace operation);

        R visitDelete(Delete operation);

        R visitComment(Comment operation);

        R visitReplaceWithImage(ReplaceWithImage operation);
    }

    record Replace(String target, MatchOptions matchOptions, boolean wholeDocument, boolean skipIfAbsent,
                   String replacement, Optional<ReviewNote> note) implements Operation {

        public Replace {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(matchOptions, "matchOptions");
            Objects.requireNonNull(replacement, "replacement");
            note = note == null ? Optional.empty() : note;
        }

        @Override
        public ActionKind action() {
            return ActionKind.REPLACE;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitReplace(this);
        }
    }

    record Delete(String target, MatchOptions matchOptions, boolean wholeDocument, boolean skipIfAbsent,
                  Optional<ReviewNote> note) implements Operation {

        public Delete {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(matchOptions, "matchOptions");
            note = note == null ? Optional.empty() : note;
        }

        @Override
        public ActionKind action() {
            return ActionKind.DELETE;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDelete(this);
        }
    }

    record Comment(String target, MatchOptions matchOptions, boolean wholeDocument, boolean skipIfAbsent,
                   ReviewNote note) implements Operation {

        public Comment {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(matchOptions, "matchOptions");
            Objects.requireNonNull(note, "note");
        }

        @Override
        public ActionKind action() {
            return ActionKind.COMMENT;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitComment(this);
        }
    }

    record ReplaceWithImage(String target, MatchOptions matchOptions, boolean wholeDocument, boolean skipIfAbsent,
                            String imageSource, byte[] imageData, SizeConstraint size,
                            Optional<ReviewNote> note) implements Operation {

        public ReplaceWithImage {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(matchOptions, "matchOptions");
            Objects.requireNonNull(imageSource, "imageSource");
            Objects.requireNonNull(imageData, "imageData");
            Objects.requireNonNull(size, "size");
            note = note == null ? Optional.empty() : note;
        }

        @Override
        public ActionKind action() {
            return ActionKind.REPLACE_WITH_IMAGE;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitReplaceWithImage(this);
        }
    }
}
