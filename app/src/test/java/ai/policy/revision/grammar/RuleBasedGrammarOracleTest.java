package ai.policy.revision.grammar;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RuleBasedGrammarOracleTest {

    private final RuleBasedGrammarOracle oracle = new RuleBasedGrammarOracle();

    @Test
    @DisplayName("Immediacy answer after a duration preposition rewrites the sentence")
    void immediacyAfterDurationPreposition() {
        GrammarVerdict verdict = oracle.classify(new GrammarCheckRequest(
                "<24 business hours>",
                "Access will be terminated within <24 business hours> of notice.",
                "immediately"));

        assertThat(verdict).isEqualTo(GrammarVerdict.rewrite("Access will be terminated immediately."));
    }

    @Test
    void durationAnswerKeepsNarrowReplacement() {
        GrammarVerdict verdict = oracle.classify(new GrammarCheckRequest(
                "<24 business hours>",
                "Access will be terminated within <24 business hours> of notice.",
                "two business days"));

        assertThat(verdict).isInstanceOf(GrammarVerdict.NarrowOk.class);
    }

    @Test
    void fixesIndefiniteArticle() {
        GrammarVerdict verdict = oracle.classify(new GrammarCheckRequest(
                "<role>", "A <role> approves every request.", "administrator"));

        assertThat(verdict).isEqualTo(GrammarVerdict.rewrite("An administrator approves every request."));
    }

    @Test
    void correctArticleNeedsNoRewrite() {
        GrammarVerdict verdict = oracle.classify(new GrammarCheckRequest(
                "<role>", "Ask a <role> for access.", "manager"));

        assertThat(verdict).isEqualTo(GrammarVerdict.narrowOk());
    }

    @Test
    void plainPlaceholderIsNarrow() {
        GrammarVerdict verdict = oracle.classify(new GrammarCheckRequest(
                "<owner>", "The policy owner is <owner>.", "Jane Doe"));

        assertThat(verdict).isEqualTo(GrammarVerdict.narrowOk());
    }
}
