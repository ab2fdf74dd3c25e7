package ai.policy.revision.operation;

import static org.assertj.core.api.Assertions.assertThat;

import ai.policy.revision.grammar.GrammarCheckRequest;
import ai.policy.revision.grammar.GrammarCompatibilityOracle;
import ai.policy.revision.grammar.GrammarVerdict;
import ai.policy.revision.grammar.NarrowOnlyGrammarOracle;
import ai.policy.revision.grammar.RuleBasedGrammarOracle;
import ai.policy.revision.match.TextMatcher;
import ai.policy.revision.model.Block;
import ai.policy.revision.model.ContainerKind;
import ai.policy.revision.model.Document;
import ai.policy.revision.model.RevisionThread;
import ai.policy.revision.model.Run;
import ai.policy.revision.model.RunFormat;
import ai.policy.revision.revision.CommentAttacher;
import ai.policy.revision.revision.ImageSubstitutor;
import ai.policy.revision.revision.RevisionWriter;
import ai.policy.revision.revision.SizeConstraint;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class OperationInterpreterTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T09:30:00Z"), ZoneOffset.UTC);
    private static final String AUTHOR = "policy assistant";

    @Test
    @DisplayName("Placeholder replaced narrowly when the answer fits the sentence")
    void replacesOwnerPlaceholder() {
        Document document = documentOf("The policy owner is <owner>.");
        OperationInterpreter interpreter = interpreter(new RuleBasedGrammarOracle());

        EditManifest manifest = interpreter.apply(document, List.of(
                EditInstruction.builder("replace", "<owner>").replacement("Jane Doe").build()));

        assertThat(manifest.results()).singleElement().satisfies(result -> {
            assertThat(result.status()).isEqualTo(OperationStatus.APPLIED);
            assertThat(result.occurrences()).isEqualTo(1);
        });
        assertThat(document.acceptedText()).isEqualTo("The policy owner is Jane Doe.");
        assertThat(document.rejectedText()).isEqualTo("The policy owner is <owner>.");
    }

    @Test
    @DisplayName("Oracle rewrite replaces the whole sentence in one tracked change")
    void widensToSentenceWhenOracleAsksForRewrite() {
        Document document = documentOf("Scope covers all staff. Access will be terminated within <24 business hours> of notice.");
        List<GrammarCheckRequest> requests = new ArrayList<>();
        GrammarCompatibilityOracle oracle = request -> {
            requests.add(request);
            return GrammarVerdict.rewrite("Access will be terminated immediately.");
        };

        EditManifest manifest = interpreter(oracle).apply(document, List.of(
                EditInstruction.builder("replace", "<24 business hours>").replacement("immediately").build()));

        assertThat(requests).singleElement().satisfies(request -> {
            assertThat(request.target()).isEqualTo("<24 business hours>");
            assertThat(request.sentence()).isEqualTo("Access will be terminated within <24 business hours> of notice.");
        });
        assertThat(manifest.results().get(0).status()).isEqualTo(OperationStatus.APPLIED);
        assertThat(manifest.results().get(0).detail()).contains("sentence rewritten");
        assertThat(document.acceptedText()).isEqualTo("Scope covers all staff. Access will be terminated immediately.");
        assertThat(document.rejectedText())
                .isEqualTo("Scope covers all staff. Access will be terminated within <24 business hours> of notice.");
        long insertions = document.block(0).runs().stream().filter(Run::isInserted).count();
        assertThat(insertions).isEqualTo(1);
    }

    @Test
    @DisplayName("Comment on text deleted earlier in the batch is skipped")
    void deleteThenCommentIsSkipped() {
        Document document = documentOf("Use the Password Management System for all accounts.");

        EditManifest manifest = interpreter(new NarrowOnlyGrammarOracle()).apply(document, List.of(
                EditInstruction.builder("delete", "Password Management System").build(),
                EditInstruction.builder("comment", "Password Management System").comment("Which system?").build()));

        assertThat(manifest.results()).extracting(OperationResult::status)
                .containsExactly(OperationStatus.APPLIED, OperationStatus.SKIPPED);
        assertThat(manifest.results().get(1).failure()).contains(FailureKind.TARGET_NOT_FOUND);
        assertThat(manifest.hasProblems()).isFalse();
        assertThat(document.threads()).isEmpty();
    }

    @Test
    void replacementCommentAnchorsToDeletion() {
        Document document = documentOf("Owner: <owner>");

        interpreter(new NarrowOnlyGrammarOracle()).apply(document, List.of(
                EditInstruction.builder("replace", "<owner>").replacement("Jane Doe").comment("From HR").build()));

        RevisionThread thread = document.threads().get(0);
        assertThat(thread.anchor()).isPresent();
        Block block = document.block(0);
        assertThat(block.runs().stream().filter(run -> run.commentIds().contains(thread.commentId())))
                .allMatch(Run::isDeleted)
                .extracting(Run::text)
                .containsExactly("<owner>");
    }

    @Test
    void invalidRecordDoesNotStopTheBatch() {
        Document document = documentOf("Owner: <owner>. Backup: <backup>.");

        EditManifest manifest = interpreter(new NarrowOnlyGrammarOracle()).apply(document, List.of(
                EditInstruction.builder("replace", "<owner>").replacement("").build(),
                EditInstruction.builder("explode", "<owner>").build(),
                EditInstruction.builder("delete", "(a+)+").wildcards(true).build(),
                EditInstruction.builder("replace", "<backup>").replacement("Nightly").build()));

        assertThat(manifest.results()).extracting(OperationResult::status).containsExactly(
                OperationStatus.INVALID, OperationStatus.INVALID, OperationStatus.INVALID, OperationStatus.APPLIED);
        assertThat(manifest.results().get(2).failure()).contains(FailureKind.PATTERN_REJECTED);
        assertThat(manifest.hasProblems()).isTrue();
        assertThat(document.acceptedText()).isEqualTo("Owner: <owner>. Backup: Nightly.");
    }

    @Test
    void missingTargetFailsUnlessSkipIsRequested() {
        Document document = documentOf("Nothing to see.");

        EditManifest manifest = interpreter(new NarrowOnlyGrammarOracle()).apply(document, List.of(
                EditInstruction.builder("delete", "<missing>").build(),
                EditInstruction.builder("delete", "<missing>").skipIfAbsent(true).build()));

        assertThat(manifest.results()).extracting(OperationResult::status)
                .containsExactly(OperationStatus.FAILED, OperationStatus.SKIPPED);
        assertThat(document.modifiedBlocks()).isEmpty();
    }

    @Test
    @DisplayName("Whole-document replace terminates when the replacement contains the target")
    void wholeDocumentReplaceDoesNotLoop() {
        Document document = documentOf("cat and cat");

        EditManifest manifest = interpreter(new NarrowOnlyGrammarOracle()).apply(document, List.of(
                EditInstruction.builder("replace", "cat").replacement("cat cat").wholeDocument(true).build()));

        assertThat(manifest.results().get(0).occurrences()).isEqualTo(2);
        assertThat(document.acceptedText()).isEqualTo("cat cat and cat cat");
    }

    @Test
    void firstOccurrenceOnlyWithoutWholeDocument() {
        Document document = documentOf("Review yearly. Review again.");

        interpreter(new NarrowOnlyGrammarOracle()).apply(document, List.of(
                EditInstruction.builder("delete", "Review").build()));

        assertThat(document.acceptedText()).isEqualTo(" yearly. Review again.");
    }

    @Test
    void undecodableImageFailsWithoutTouchingPlaceholder() {
        Document document = documentOf("Logo: <logo>");

        EditManifest manifest = interpreter(new NarrowOnlyGrammarOracle()).apply(document, List.of(
                EditInstruction.builder("replace_with_logo", "<logo>").image("logo.png", "text".getBytes()).build()));

        assertThat(manifest.results().get(0).status()).isEqualTo(OperationStatus.FAILED);
        assertThat(manifest.results().get(0).failure()).contains(FailureKind.IMAGE_DECODE_FAILED);
        assertThat(document.modifiedBlocks()).isEmpty();
    }

    @Test
    void rejectingEveryChangeRestoresOriginal() {
        Document document = new Document();
        document.addBlock(ContainerKind.BODY, List.of(
                Run.text(document.nextRunId(), "Owner: <owner>. ", RunFormat.NONE),
                Run.text(document.nextRunId(), "Use the Password Management System.", RunFormat.NONE)));
        document.addBlock(ContainerKind.TABLE_CELL, List.of(Run.text(document.nextRunId(), "Access within <24h>.", RunFormat.NONE)));
        String original = document.rejectedText();

        interpreter(new RuleBasedGrammarOracle()).apply(document, Arrays.asList(
                EditInstruction.builder("replace", "<owner>").replacement("Jane Doe").build(),
                EditInstruction.builder("delete", "Password Management").build(),
                EditInstruction.builder("replace", "<24h>").replacement("immediately").build(),
                EditInstruction.builder("comment", "Access").comment("Check").build()));

        assertThat(document.rejectedText()).isEqualTo(original);
        assertThat(document.acceptedText()).isEqualTo("Owner: Jane Doe. Use the  System.\nAccess immediately.");
    }

    @Test
    @DisplayName("Comment on a replacement of earlier inserted text lands on the new insertion")
    void commentedReplaceOfEarlierReplacement() {
        Document document = documentOf("The policy owner is <owner>.");

        EditManifest manifest = interpreter(new RuleBasedGrammarOracle()).apply(document, List.of(
                EditInstruction.builder("replace", "<owner>").replacement("Jane").build(),
                EditInstruction.builder("replace", "Jane").replacement("John").comment("HR confirmed").build(),
                EditInstruction.builder("delete", "policy").build()));

        assertThat(manifest.results()).extracting(OperationResult::status)
                .containsOnly(OperationStatus.APPLIED);
        assertThat(document.acceptedText()).isEqualTo("The  owner is John.");
        assertThat(document.rejectedText()).isEqualTo("The policy owner is <owner>.");
        assertThat(document.threads()).singleElement().satisfies(thread -> {
            assertThat(thread.body()).isEqualTo("HR confirmed");
            assertThat(thread.anchor()).hasValueSatisfying(tag -> assertThat(tag.isInsertion()).isTrue());
        });
    }

    @Test
    @DisplayName("Budget exhausted midway through a whole-document record rolls back its earlier occurrences")
    void budgetTripRollsBackWholeRecord() {
        Document document = new Document();
        document.addBlock(ContainerKind.BODY, List.of(Run.text(document.nextRunId(), "x", RunFormat.NONE)));
        document.addBlock(ContainerKind.BODY, List.of(Run.text(document.nextRunId(), "b".repeat(200), RunFormat.NONE)));
        String before = document.acceptedText();

        EditManifest manifest = interpreter(new NarrowOnlyGrammarOracle(), new TextMatcher(50)).apply(document, List.of(
                EditInstruction.builder("delete", "x").wildcards(true).wholeDocument(true).build()));

        assertThat(manifest.results()).singleElement().satisfies(result -> {
            assertThat(result.status()).isEqualTo(OperationStatus.INVALID);
            assertThat(result.failure()).contains(FailureKind.PATTERN_REJECTED);
        });
        assertThat(document.modifiedBlocks()).isEmpty();
        assertThat(document.acceptedText()).isEqualTo(before);
        assertThat(document.block(0).runs()).extracting(Run::text).containsExactly("x");
    }

    @Test
    void unexpectedErrorFailsOnlyThatRecordAndUndoesIt() {
        Document document = documentOf("Owner <a>, deputy <a>. Backups nightly.");
        List<GrammarCheckRequest> requests = new ArrayList<>();
        GrammarCompatibilityOracle flaky = request -> {
            requests.add(request);
            if (requests.size() > 1) {
                throw new IllegalStateException("oracle state corrupted");
            }
            return GrammarVerdict.narrowOk();
        };

        EditManifest manifest = interpreter(flaky).apply(document, List.of(
                EditInstruction.builder("replace", "<a>").replacement("Jane").wholeDocument(true).build(),
                EditInstruction.builder("delete", "nightly").build()));

        assertThat(manifest.results()).extracting(OperationResult::status)
                .containsExactly(OperationStatus.FAILED, OperationStatus.APPLIED);
        assertThat(manifest.results().get(0).failure()).contains(FailureKind.UNEXPECTED_ERROR);
        assertThat(document.acceptedText()).isEqualTo("Owner <a>, deputy <a>. Backups .");
    }

    private static OperationInterpreter interpreter(GrammarCompatibilityOracle oracle) {
        return interpreter(oracle, new TextMatcher());
    }

    private static OperationInterpreter interpreter(GrammarCompatibilityOracle oracle, TextMatcher matcher) {
        RevisionWriter writer = new RevisionWriter(CLOCK);
        return new OperationInterpreter(
                new OperationParser(AUTHOR, SizeConstraint.DEFAULT_LOGO),
                matcher,
                writer,
                new CommentAttacher(CLOCK),
                new ImageSubstitutor(writer),
                oracle,
                AUTHOR);
    }

    private static Document documentOf(String text) {
        Document document = new Document();
        document.addBlock(ContainerKind.BODY, List.of(Run.text(document.nextRunId(), text, RunFormat.NONE)));
        return document;
    }
}
