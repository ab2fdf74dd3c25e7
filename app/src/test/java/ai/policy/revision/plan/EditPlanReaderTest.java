package ai.policy.revision.plan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.policy.revision.operation.EditInstruction;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EditPlanReaderTest {

    @TempDir
    Path tempDir;

    private final EditPlanReader reader = new EditPlanReader();

    @Test
    void readsBareArray() throws IOException {
        Path plan = write("ops.json", """
                [
                  {"target_text": "<owner>", "action": "replace", "replacement": "Jane Doe",
                   "comment": "Confirmed", "MatchCase": true, "WholeWord": false},
                  {"target_text": "legacy", "action": "delete", "whole_document": true, "unknown": 1}
                ]
                """);

        EditPlan editPlan = reader.read(plan);

        assertThat(editPlan.logoPath()).isEmpty();
        assertThat(editPlan.instructions()).hasSize(2);
        EditInstruction first = editPlan.instructions().get(0);
        assertThat(first.action()).contains("replace");
        assertThat(first.targetText()).contains("<owner>");
        assertThat(first.replacement()).contains("Jane Doe");
        assertThat(first.comment()).contains("Confirmed");
        assertThat(first.matchCase()).contains(true);
        assertThat(first.wholeWord()).contains(false);
        assertThat(first.wildcards()).isEmpty();
        EditInstruction second = editPlan.instructions().get(1);
        assertThat(second.wholeDocument()).contains(true);
        assertThat(second.replacement()).isEmpty();
    }

    @Test
    void acceptsSnakeCaseFlagSpellings() throws IOException {
        Path plan = write("ops.json", """
                [{"target_text": "a.c", "action": "delete", "match_case": false, "whole_word": true, "wildcards": true,
                  "skip_if_absent": true, "comment_author": "Legal"}]
                """);

        EditInstruction instruction = reader.read(plan).instructions().get(0);

        assertThat(instruction.matchCase()).contains(false);
        assertThat(instruction.wholeWord()).contains(true);
        assertThat(instruction.wildcards()).contains(true);
        assertThat(instruction.skipIfAbsent()).contains(true);
        assertThat(instruction.commentAuthor()).contains("Legal");
    }

    @Test
    void envelopeResolvesLogoRelativeToPlanFile() throws IOException {
        byte[] logo = {(byte) 0x89, 'P', 'N', 'G'};
        Files.createDirectories(tempDir.resolve("assets"));
        Files.write(tempDir.resolve("assets/logo.png"), logo);
        Path plan = write("ops.json", """
                {
                  "metadata": {"logo_path": "assets/logo.png"},
                  "instructions": {"operations": [
                    {"target_text": "<logo>", "action": "replace_with_logo", "width_mm": 20},
                    {"target_text": "<owner>", "action": "replace", "replacement": "Jane"}
                  ]}
                }
                """);

        EditPlan editPlan = reader.read(plan);

        assertThat(editPlan.logoPath()).contains(tempDir.resolve("assets/logo.png"));
        EditInstruction image = editPlan.instructions().get(0);
        assertThat(image.imageSource()).contains(tempDir.resolve("assets/logo.png").toString());
        assertThat(image.imageData()).hasValueSatisfying(data -> assertThat(data).isEqualTo(logo));
        assertThat(image.widthMm()).contains(20.0);
        assertThat(image.heightMm()).isEmpty();
        assertThat(editPlan.instructions().get(1).imageData()).isEmpty();
    }

    @Test
    void imagePathOnRecordOverridesLogo() throws IOException {
        Files.write(tempDir.resolve("logo.png"), new byte[] {1});
        Files.write(tempDir.resolve("seal.png"), new byte[] {2, 2});
        Path plan = write("ops.json", """
                {"metadata": {"logo_path": "logo.png"},
                 "operations": [{"target_text": "<seal>", "action": "replace_with_logo", "image_path": "seal.png"}]}
                """);

        EditInstruction instruction = reader.read(plan).instructions().get(0);

        assertThat(instruction.imageSource()).contains(tempDir.resolve("seal.png").toString());
        assertThat(instruction.imageData()).hasValueSatisfying(data -> assertThat(data).hasSize(2));
    }

    @Test
    void missingImageYieldsEmptyData() throws IOException {
        Path plan = write("ops.json", """
                [{"target_text": "<logo>", "action": "replace_with_logo", "image_path": "missing.png"}]
                """);

        EditInstruction instruction = reader.read(plan).instructions().get(0);

        assertThat(instruction.imageData()).hasValueSatisfying(data -> assertThat(data).isEmpty());
    }

    @Test
    void unknownActionIsLeftForTheParser() throws IOException {
        Path plan = write("ops.json", """
                [{"target_text": "x", "action": "explode"}, {"target_text": "y"}]
                """);

        EditPlan editPlan = reader.read(plan);

        assertThat(editPlan.instructions()).hasSize(2);
        assertThat(editPlan.instructions().get(1).action()).isEmpty();
    }

    @Test
    void rejectsUnexpectedShape() throws IOException {
        Path plan = write("ops.json", """
                {"steps": []}
                """);

        Throwable thrown = catchThrowable(() -> reader.read(plan));

        assertThat(thrown)
                .isInstanceOf(EditPlanException.class)
                .hasMessageContaining("instructions.operations");
    }

    @Test
    void rejectsMalformedJson() throws IOException {
        Path plan = write("ops.json", "[{\"target_text\": ");

        Throwable thrown = catchThrowable(() -> reader.read(plan));

        assertThat(thrown).isInstanceOf(EditPlanException.class);
    }

    @Test
    void rejectsRecordWithWrongFieldType() throws IOException {
        Path plan = write("ops.json", """
                [{"target_text": "x", "action": "delete", "width_mm": {"value": 3}}]
                """);

        Throwable thrown = catchThrowable(() -> reader.read(plan));

        assertThat(thrown)
                .isInstanceOf(EditPlanException.class)
                .hasMessageContaining("Malformed record #0");
    }

    @Test
    void rejectsMissingFile() {
        Throwable thrown = catchThrowable(() -> reader.read(tempDir.resolve("absent.json")));

        assertThat(thrown).isInstanceOf(EditPlanException.class);
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
