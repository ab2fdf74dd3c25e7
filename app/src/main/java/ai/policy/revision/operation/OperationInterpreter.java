package ai.policy.revision.operation;

import ai.policy.revision.grammar.GrammarCheckException;
import ai.policy.revision.grammar.GrammarCheckRequest;
import ai.policy.revision.grammar.GrammarCompatibilityOracle;
import ai.policy.revision.grammar.GrammarVerdict;
import ai.policy.revision.grammar.PlaceholderDetector;
import ai.policy.revision.grammar.SentenceLocator;
import ai.policy.revision.match.LiveText;
import ai.policy.revision.match.MatchOptions;
import ai.policy.revision.match.MatchSpan;
import ai.policy.revision.match.PatternRejectedException;
import ai.policy.revision.match.SearchPosition;
import ai.policy.revision.match.TextMatcher;
import ai.policy.revision.model.Document;
import ai.policy.revision.model.RevisionTag;
import ai.policy.revision.revision.CommentAttacher;
import ai.policy.revision.revision.DecodedImage;
import ai.policy.revision.revision.ImageDecodeException;
import ai.policy.revision.revision.ImageSubstitutor;
import ai.policy.revision.revision.RevisionPair;
import ai.policy.revision.revision.RevisionWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Applies an operation list to a document, one record at a time and in order.
 *
 * <p>Every record ends in exactly one of applied, skipped, failed or invalid. A record that does
 * not apply leaves the document as it was and never stops the records after it.
 */
public class OperationInterpreter {

    private static final Logger LOGGER = LoggerFactory.getLogger(OperationInterpreter.class);

    static final String MDC_INDEX = "operation.index";
    static final String MDC_ACTION = "operation.action";
    static final int MAX_OCCURRENCES = 1_000;

    private final OperationParser parser;
    private final TextMatcher matcher;
    private final RevisionWriter revisionWriter;
    private final CommentAttacher commentAttacher;
    private final ImageSubstitutor imageSubstitutor;
    private final GrammarCompatibilityOracle grammarOracle;
    private final String defaultAuthor;

    public OperationInterpreter(OperationParser parser,
                                TextMatcher matcher,
                                RevisionWriter revisionWriter,
                                CommentAttacher commentAttacher,
                                ImageSubstitutor imageSubstitutor,
                                GrammarCompatibilityOracle grammarOracle,
                                String defaultAuthor) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.matcher = Objects.requireNonNull(matcher, "matcher");
        this.revisionWriter = Objects.requireNonNull(revisionWriter, "revisionWriter");
        this.commentAttacher = Objects.requireNonNull(commentAttacher, "commentAttacher");
        this.imageSubstitutor = Objects.requireNonNull(imageSubstitutor, "imageSubstitutor");
        this.grammarOracle = Objects.requireNonNull(grammarOracle, "grammarOracle");
        if (defaultAuthor == null || defaultAuthor.isBlank()) {
            throw new IllegalArgumentException("defaultAuthor must not be blank");
        }
        this.defaultAuthor = defaultAuthor;
    }

    public EditManifest apply(Document document, List<EditInstruction> instructions) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(instructions, "instructions");
        List<OperationResult> results = new ArrayList<>(instructions.size());
        for (int index = 0; index < instructions.size(); index++) {
            EditInstruction instruction = instructions.get(index);
            MDC.put(MDC_INDEX, Integer.toString(index));
            MDC.put(MDC_ACTION, instruction.action().orElse(""));
            try {
                OperationResult result = applyOne(document, index, instruction);
                LOGGER.debug("Operation {} finished as {}", index, result.status());
                results.add(result);
            } finally {
                MDC.remove(MDC_INDEX);
                MDC.remove(MDC_ACTION);
            }
        }
        EditManifest manifest = new EditManifest(results);
        LOGGER.info("Processed {} operations: {} applied, {} skipped, {} failed, {} invalid",
                results.size(),
                manifest.count(OperationStatus.APPLIED),
                manifest.count(OperationStatus.SKIPPED),
                manifest.count(OperationStatus.FAILED),
                manifest.count(OperationStatus.INVALID));
        return manifest;
    }

    OperationResult applyOne(Document document, int index, EditInstruction instruction) {
        String action = instruction.action().orElse("");
        String target = instruction.targetText().orElse("");
        Operation operation;
        try {
            operation = parser.parse(instruction);
        } catch (InvalidOperationException ex) {
            LOGGER.error("Operation {} is invalid: {}", index, ex.getMessage());
            return OperationResult.invalid(index, action, target, FailureKind.INVALID_OPERATION, ex.getMessage());
        } catch (PatternRejectedException ex) {
            LOGGER.error("Operation {} pattern rejected: {}", index, ex.getMessage());
            return OperationResult.invalid(index, action, target, FailureKind.PATTERN_REJECTED, ex.getMessage());
        }
        Document.Snapshot before = document.snapshot();
        try {
            return operation.accept(new Executor(document, index, action));
        } catch (PatternRejectedException ex) {
            document.restore(before);
            LOGGER.error("Operation {} pattern rejected while matching: {}", index, ex.getMessage());
            return OperationResult.invalid(index, action, target, FailureKind.PATTERN_REJECTED, ex.getMessage());
        } catch (GrammarCheckException ex) {
            document.restore(before);
            throw ex;
        } catch (RuntimeException ex) {
            document.restore(before);
            LOGGER.error("Operation {} failed unexpectedly, document left unchanged", index, ex);
            return OperationResult.failed(index, action, target, FailureKind.UNEXPECTED_ERROR, String.valueOf(ex.getMessage()));
        }
    }

    private final class Executor implements Operation.Visitor<OperationResult> {

        private final Document document;
        private final int index;
        private final String action;

        private Executor(Document document, int index, String action) {
            this.document = document;
            this.index = index;
            this.action = action;
        }

        @Override
        public OperationResult visitReplace(Operation.Replace operation) {
            boolean placeholder = PlaceholderDetector.containsPlaceholder(operation.target());
            int widened = 0;
            int occurrences = 0;
            SearchPosition position = SearchPosition.START;
            Optional<MatchSpan> found;
            while ((found = matcher.find(document, operation.target(), operation.matchOptions(), position)).isPresent()) {
                MatchSpan span = found.get();
                String text = operation.replacement();
                if (placeholder) {
                    Optional<Widening> widening = widen(span, operation.replacement());
                    if (widening.isPresent()) {
                        span = widening.get().span();
                        text = widening.get().sentence();
                        widened++;
                    }
                }
                RevisionPair pair = revisionWriter.applyReplace(document, span, text, defaultAuthor);
                attachNote(span.blockId(), List.of(pair.deletion(), pair.insertion()), operation.note());
                occurrences++;
                position = new SearchPosition(document.blockIndex(span.blockId()), span.liveStart() + text.length());
                if (!operation.wholeDocument() || limitReached(occurrences)) {
                    break;
                }
            }
            if (occurrences == 0) {
                return notFound(operation);
            }
            String detail = widened > 0 ? "sentence rewritten in " + widened + " occurrence(s)" : "";
            LOGGER.info("Replaced '{}' in {} place(s)", operation.target(), occurrences);
            return OperationResult.applied(index, action, operation.target(), occurrences, detail);
        }

        @Override
        public OperationResult visitDelete(Operation.Delete operation) {
            int occurrences = 0;
            SearchPosition position = SearchPosition.START;
            Optional<MatchSpan> found;
            while ((found = matcher.find(document, operation.target(), operation.matchOptions(), position)).isPresent()) {
                MatchSpan span = found.get();
                RevisionTag deletion = revisionWriter.applyDelete(document, span, defaultAuthor);
                attachNote(span.blockId(), List.of(deletion), operation.note());
                occurrences++;
                position = new SearchPosition(document.blockIndex(span.blockId()), span.liveStart());
                if (!operation.wholeDocument() || limitReached(occurrences)) {
                    break;
                }
            }
            if (occurrences == 0) {
                return notFound(operation);
            }
            LOGGER.info("Deleted '{}' in {} place(s)", operation.target(), occurrences);
            return OperationResult.applied(index, action, operation.target(), occurrences, "");
        }

        @Override
        public OperationResult visitComment(Operation.Comment operation) {
            int occurrences = 0;
            SearchPosition position = SearchPosition.START;
            Optional<MatchSpan> found;
            while ((found = matcher.find(document, operation.target(), operation.matchOptions(), position)).isPresent()) {
                MatchSpan span = found.get();
                commentAttacher.attachToSpan(document, span, operation.note().body(), operation.note().author())
                        .ifPresent(thread -> LOGGER.debug("Comment {} anchored to '{}'", thread.commentId(), operation.target()));
                occurrences++;
                position = new SearchPosition(document.blockIndex(span.blockId()), span.liveEnd());
                if (!operation.wholeDocument() || limitReached(occurrences)) {
                    break;
                }
            }
            if (occurrences == 0) {
                return notFound(operation);
            }
            LOGGER.info("Commented on '{}' in {} place(s)", operation.target(), occurrences);
            return OperationResult.applied(index, action, operation.target(), occurrences, "");
        }

        @Override
        public OperationResult visitReplaceWithImage(Operation.ReplaceWithImage operation) {
            DecodedImage image;
            try {
                image = imageSubstitutor.decode(operation.imageData());
            } catch (ImageDecodeException ex) {
                LOGGER.error("Image '{}' for operation {} could not be decoded: {}", operation.imageSource(), index, ex.getMessage());
                return OperationResult.failed(index, action, operation.target(), FailureKind.IMAGE_DECODE_FAILED, ex.getMessage());
            }
            int occurrences = 0;
            SearchPosition position = SearchPosition.START;
            Optional<MatchSpan> found;
            while ((found = matcher.find(document, operation.target(), operation.matchOptions(), position)).isPresent()) {
                MatchSpan span = found.get();
                RevisionPair pair = imageSubstitutor.substitute(document, span, image, operation.size(), defaultAuthor);
                attachNote(span.blockId(), List.of(pair.deletion(), pair.insertion()), operation.note());
                occurrences++;
                position = new SearchPosition(document.blockIndex(span.blockId()), span.liveStart());
                if (!operation.wholeDocument() || limitReached(occurrences)) {
                    break;
                }
            }
            if (occurrences == 0) {
                return notFound(operation);
            }
            LOGGER.info("Replaced '{}' with image {} in {} place(s)", operation.target(), operation.imageSource(), occurrences);
            return OperationResult.applied(index, action, operation.target(), occurrences, "");
        }

        /**
         * Consults the grammar oracle once and, when it asks for a rewrite, re-resolves the whole
         * sentence literally so it can be replaced in one tracked change.
         */
        private Optional<Widening> widen(MatchSpan span, String replacement) {
            LiveText live = LiveText.of(document.block(span.blockId()));
            String matched = live.text().substring(span.liveStart(), span.liveEnd());
            SentenceLocator.Sentence sentence = SentenceLocator.locate(live.text(), span.liveStart(), span.liveEnd());
            GrammarVerdict verdict = grammarOracle.classify(new GrammarCheckRequest(matched, sentence.text(), replacement));
            if (!(verdict instanceof GrammarVerdict.NeedsSentenceRewrite rewrite)) {
                return Optional.empty();
            }
            SearchPosition sentenceStart = new SearchPosition(document.blockIndex(span.blockId()), sentence.start());
            Optional<MatchSpan> sentenceSpan = matcher.find(document, sentence.text(), MatchOptions.exact(), sentenceStart)
                    .filter(candidate -> candidate.blockId() == span.blockId() && candidate.liveStart() == sentence.start());
            if (sentenceSpan.isEmpty()) {
                LOGGER.warn("Could not re-locate sentence '{}', replacing the placeholder only", sentence.text());
                return Optional.empty();
            }
            LOGGER.info("Rewriting sentence '{}' as '{}'", sentence.text(), rewrite.sentence());
            return Optional.of(new Widening(sentenceSpan.get(), rewrite.sentence()));
        }

        private void attachNote(int blockId, List<RevisionTag> anchors, Optional<ReviewNote> note) {
            note.ifPresent(value -> commentAttacher.attachToFirstCarried(document, blockId, anchors, value.body(), value.author()));
        }

        private OperationResult notFound(Operation operation) {
            if (operation.skipIfAbsent()) {
                LOGGER.warn("Target not found for operation {}, skipping: '{}'", index, operation.target());
                return OperationResult.skipped(index, action, operation.target(), "target not found");
            }
            LOGGER.warn("Target not found for operation {}: '{}'", index, operation.target());
            return OperationResult.failed(index, action, operation.target(), FailureKind.TARGET_NOT_FOUND, "target not found");
        }

        private boolean limitReached(int occurrences) {
            if (occurrences >= MAX_OCCURRENCES) {
                LOGGER.warn("Operation {} stopped after {} occurrences", index, MAX_OCCURRENCES);
                return true;
            }
            return false;
        }
    }

    private record Widening(MatchSpan span, String sentence) {
    }
}
