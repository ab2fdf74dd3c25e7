package ai.policy.revision.operation;

import ai.policy.revision.match.MatchOptions;
import ai.policy.revision.match.PatternGuard;
import ai.policy.revision.revision.SizeConstraint;
import java.util.Objects;
import java.util.Optional;

/**
 * Validates raw operation records and turns them into {@link Operation}s, failing fast on the
 * first problem of each record.
 */
public class OperationParser {

    private final String defaultAuthor;
    private final SizeConstraint defaultImageSize;

    public OperationParser(String defaultAuthor, SizeConstraint defaultImageSize) {
        if (defaultAuthor == null || defaultAuthor.isBlank()) {
            throw new IllegalArgumentException("defaultAuthor must not be blank");
        }
        this.defaultAuthor = defaultAuthor;
        this.defaultImageSize = Objects.requireNonNull(defaultImageSize, "defaultImageSize");
    }

    /**
     * @throws InvalidOperationException when the record is malformed
     * @throws ai.policy.revision.match.PatternRejectedException when its pattern is refused
     */
    public Operation parse(EditInstruction instruction) {
        Objects.requireNonNull(instruction, "instruction");
        ActionKind action = ActionKind.from(instruction.action().orElse(null));
        String target = instruction.targetText()
                .filter(value -> !value.isBlank())
                .orElseThrow(() -> new InvalidOperationException("target_text must not be empty"));

        MatchOptions options = new MatchOptions(
                instruction.matchCase().orElse(false),
                instruction.wholeWord().orElse(true),
                instruction.wildcards().orElse(false));
        if (options.pattern()) {
            PatternGuard.compile(target, options.caseSensitive());
        }
        boolean wholeDocument = instruction.wholeDocument().orElse(false);
        boolean skipIfAbsent = instruction.skipIfAbsent().orElse(action == ActionKind.COMMENT);
        String author = instruction.commentAuthor().filter(value -> !value.isBlank()).orElse(defaultAuthor);
        Optional<ReviewNote> note = instruction.comment()
                .filter(value -> !value.isBlank())
                .map(body -> new ReviewNote(body, author));

        return switch (action) {
            case REPLACE -> {
                String replacement = instruction.replacement()
                        .filter(value -> !value.isEmpty())
                        .orElseThrow(() -> new InvalidOperationException("replace requires a non-empty replacement"));
                yield new Operation.Replace(target, options, wholeDocument, skipIfAbsent, replacement, note);
            }
            case DELETE -> new Operation.Delete(target, options, wholeDocument, skipIfAbsent, note);
            case COMMENT -> new Operation.Comment(target, options, wholeDocument, skipIfAbsent,
                    note.orElseThrow(() -> new InvalidOperationException("comment requires a non-empty comment body")));
            case REPLACE_WITH_IMAGE -> parseImage(instruction, target, options, wholeDocument, skipIfAbsent, note);
        };
    }

    private Operation parseImage(EditInstruction instruction, String target, MatchOptions options,
                                 boolean wholeDocument, boolean skipIfAbsent, Optional<ReviewNote> note) {
        String source = instruction.imageSource()
                .filter(value -> !value.isBlank())
                .orElseThrow(() -> new InvalidOperationException("image replacement requires image_path or metadata.logo_path"));
        byte[] data = instruction.imageData()
                .filter(bytes -> bytes.length > 0)
                .orElseThrow(() -> new InvalidOperationException("image '" + source + "' could not be read"));
        double width = instruction.widthMm().orElse(instruction.heightMm().isPresent() ? 0.0 : defaultImageSize.widthMm());
        double height = instruction.heightMm().orElse(instruction.widthMm().isPresent() ? 0.0 : defaultImageSize.heightMm());
        SizeConstraint size;
        try {
            size = new SizeConstraint(width, height);
        } catch (IllegalArgumentException ex) {
            throw new InvalidOperationException("invalid image size: " + ex.getMessage(), ex);
        }
        return new Operation.ReplaceWithImage(target, options, wholeDocument, skipIfAbsent, source, data, size, note);
    }
}
