package ai.policy.revision.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ai.policy.revision.config.ConfigLoader;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CliApplicationTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T09:30:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    @Test
    void runWritesRevisedDocumentAndManifest() throws IOException {
        Path input = policy();
        Path operations = operations("""
                [{"target_text": "<owner>", "action": "replace", "replacement": "Jane Doe"},
                 {"target_text": "quarterly", "action": "comment", "comment": "Confirm cadence"}]
                """);
        Path output = tempDir.resolve("out/policy-revised.docx");

        int exitCode = application().run(new String[] {
                "--in", input.toString(),
                "--operations", operations.toString(),
                "--out", output.toString(),
                "--grammar-mode", "rules"
        });

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_OK);
        assertThat(output).exists();
        Path manifest = tempDir.resolve("out/policy-revised.docx.manifest.json");
        assertThat(manifest).exists();
        assertThat(Files.readString(manifest)).contains("\"applied\" : 2");
        try (XWPFDocument revised = new XWPFDocument(Files.newInputStream(output))) {
            assertThat(revised.getDocument().xmlText()).contains("<w:ins", "<w:del ");
            assertThat(revised.getDocComments().getComments()).hasSize(1);
        }
    }

    @Test
    void strictModeReportsFailedOperations() throws IOException {
        Path input = policy();
        Path operations = operations("""
                [{"target_text": "<missing>", "action": "replace", "replacement": "x"}]
                """);

        int lenient = application().run(new String[] {
                "--in", input.toString(),
                "--operations", operations.toString(),
                "--out", tempDir.resolve("lenient.docx").toString()
        });
        int strict = application().run(new String[] {
                "--in", input.toString(),
                "--operations", operations.toString(),
                "--out", tempDir.resolve("strict.docx").toString(),
                "--strict"
        });

        assertThat(lenient).isEqualTo(CliApplication.EXIT_OK);
        assertThat(strict).isEqualTo(CliApplication.EXIT_STRICT_PROBLEMS);
        assertThat(tempDir.resolve("strict.docx")).exists();
    }

    @Test
    void missingRequiredOptionIsInvalidConfiguration() {
        int exitCode = application().run(new String[] {"--operations", "ops.json", "--out", "out.docx"});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_INVALID_CONFIG);
    }

    @Test
    void unknownOptionIsRejectedByParser() {
        int exitCode = application().run(new String[] {"--bogus"});

        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    void unreadableInputFailsTheRun() throws IOException {
        Path operations = operations("[]");

        int exitCode = application().run(new String[] {
                "--in", tempDir.resolve("absent.docx").toString(),
                "--operations", operations.toString(),
                "--out", tempDir.resolve("out.docx").toString()
        });

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_RUN_FAILED);
    }

    @Test
    void helpExitsCleanly() {
        assertThat(application().run(new String[] {"--help"})).isZero();
    }

    private static CliApplication application() {
        return new CliApplication(new ConfigLoader(key -> Optional.empty()), CLOCK);
    }

    private Path policy() throws IOException {
        Path file = tempDir.resolve("policy.docx");
        try (XWPFDocument document = new XWPFDocument(); OutputStream out = Files.newOutputStream(file)) {
            document.createParagraph().createRun().setText("The policy owner is <owner>.");
            document.createParagraph().createRun().setText("Access is reviewed quarterly.");
            document.write(out);
        }
        return file;
    }

    private Path operations(String json) throws IOException {
        Path file = tempDir.resolve("operations.json");
        Files.writeString(file, json, StandardCharsets.UTF_8);
        return file;
    }
}
