package ai.policy.revision.operation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.policy.revision.match.MatchOptions;
import ai.policy.revision.match.PatternRejectedException;
import ai.policy.revision.revision.SizeConstraint;
import org.junit.jupiter.api.Test;

class OperationParserTest {

    private final OperationParser parser = new OperationParser("policy assistant", SizeConstraint.DEFAULT_LOGO);

    @Test
    void replaceUsesDefaultsAndDefaultAuthor() {
        Operation operation = parser.parse(EditInstruction.builder("replace", "<owner>")
                .replacement("Jane Doe")
                .comment("Filled from questionnaire")
                .build());

        assertThat(operation).isInstanceOf(Operation.Replace.class);
        Operation.Replace replace = (Operation.Replace) operation;
        assertThat(replace.matchOptions()).isEqualTo(MatchOptions.defaults());
        assertThat(replace.wholeDocument()).isFalse();
        assertThat(replace.skipIfAbsent()).isFalse();
        assertThat(replace.note()).contains(new ReviewNote("Filled from questionnaire", "policy assistant"));
    }

    @Test
    void commentSkipsAbsentTargetsByDefault() {
        Operation operation = parser.parse(EditInstruction.builder("comment", "Password Management System")
                .comment("Not in use")
                .commentAuthor("Auditor")
                .build());

        assertThat(operation.skipIfAbsent()).isTrue();
        assertThat(((Operation.Comment) operation).note().author()).isEqualTo("Auditor");
    }

    @Test
    void rejectsMalformedRecords() {
        assertThat(catchThrowable(() -> parser.parse(EditInstruction.builder("replace", "<owner>").replacement("").build())))
                .isInstanceOf(InvalidOperationException.class).hasMessageContaining("replacement");
        assertThat(catchThrowable(() -> parser.parse(EditInstruction.builder("rename", "x").build())))
                .isInstanceOf(InvalidOperationException.class).hasMessageContaining("rename");
        assertThat(catchThrowable(() -> parser.parse(EditInstruction.builder("delete", " ").build())))
                .isInstanceOf(InvalidOperationException.class).hasMessageContaining("target_text");
        assertThat(catchThrowable(() -> parser.parse(EditInstruction.builder("comment", "x").build())))
                .isInstanceOf(InvalidOperationException.class).hasMessageContaining("comment");
    }

    @Test
    void wildcardTargetsGoThroughPatternGuard() {
        Throwable thrown = catchThrowable(() -> parser.parse(EditInstruction.builder("delete", "(a+)+").wildcards(true).build()));

        assertThat(thrown).isInstanceOf(PatternRejectedException.class);
    }

    @Test
    void imageSizeDefaultsAndPartialSizes() {
        byte[] data = {1, 2, 3};
        Operation.ReplaceWithImage defaults = (Operation.ReplaceWithImage) parser.parse(
                EditInstruction.builder("replace_with_logo", "<logo>").image("logo.png", data).build());
        Operation.ReplaceWithImage widthOnly = (Operation.ReplaceWithImage) parser.parse(
                EditInstruction.builder("replace_with_image", "<logo>").image("logo.png", data).size(25.0, null).build());

        assertThat(defaults.size()).isEqualTo(new SizeConstraint(0, 6));
        assertThat(widthOnly.size()).isEqualTo(new SizeConstraint(25, 0));
    }

    @Test
    void imageWithoutDataOrWithBadSizeIsInvalid() {
        assertThat(catchThrowable(() -> parser.parse(EditInstruction.builder("replace_with_logo", "<logo>").build())))
                .isInstanceOf(InvalidOperationException.class);
        assertThat(catchThrowable(() -> parser.parse(EditInstruction.builder("replace_with_logo", "<logo>")
                .image("logo.png", new byte[0]).build())))
                .isInstanceOf(InvalidOperationException.class).hasMessageContaining("could not be read");
        assertThat(catchThrowable(() -> parser.parse(EditInstruction.builder("replace_with_logo", "<logo>")
                .image("logo.png", new byte[] {1}).size(-2.0, 4.0).build())))
                .isInstanceOf(InvalidOperationException.class).hasMessageContaining("size");
    }
}
