package ai.policy.revision.match;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;

class PatternGuardTest {

    @Test
    void acceptsBoundedPatterns() {
        Pattern pattern = PatternGuard.compile("(?:Mon|Tues)day [0-9]{1,2}(st|nd|rd|th)", false);

        assertThat(pattern.matcher("monday 21st").matches()).isTrue();
    }

    @Test
    void rejectsNestedQuantifiers() {
        assertThat(catchThrowable(() -> PatternGuard.compile("(a+)+", true))).isInstanceOf(PatternRejectedException.class);
        assertThat(catchThrowable(() -> PatternGuard.compile("(\\w*x)*", true))).isInstanceOf(PatternRejectedException.class);
        assertThat(catchThrowable(() -> PatternGuard.compile("((ab)*)+", true))).isInstanceOf(PatternRejectedException.class);
    }

    @Test
    void rejectsQuantifiedAlternation() {
        Throwable thrown = catchThrowable(() -> PatternGuard.compile("(a|aa){2,}", true));

        assertThat(thrown).isInstanceOf(PatternRejectedException.class).hasMessageContaining("quantifier");
    }

    @Test
    void rejectsBackReferences() {
        assertThat(catchThrowable(() -> PatternGuard.compile("(a)\\1", true)))
                .isInstanceOf(PatternRejectedException.class)
                .hasMessageContaining("back references");
        assertThat(catchThrowable(() -> PatternGuard.compile("(?<x>a)\\k<x>", true)))
                .isInstanceOf(PatternRejectedException.class);
    }

    @Test
    void quantifierCharactersInsideClassesAreLiteral() {
        Pattern pattern = PatternGuard.compile("([+*?])+", true);

        assertThat(pattern.matcher("+*?").matches()).isTrue();
    }

    @Test
    void rejectsOverlongAndMalformedPatterns() {
        assertThat(catchThrowable(() -> PatternGuard.compile("a".repeat(PatternGuard.MAX_PATTERN_LENGTH + 1), true)))
                .isInstanceOf(PatternRejectedException.class);
        assertThat(catchThrowable(() -> PatternGuard.compile("(unclosed", true)))
                .isInstanceOf(PatternRejectedException.class)
                .hasCauseInstanceOf(java.util.regex.PatternSyntaxException.class);
    }
}
