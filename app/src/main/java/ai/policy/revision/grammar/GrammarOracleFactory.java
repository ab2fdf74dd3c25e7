package ai.policy.revision.grammar;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Provides the grammar oracle for a {@link GrammarMode}. The model-backed oracle is only built
 * when it is asked for, since it needs provider credentials.
 */
public class GrammarOracleFactory {

    private final Supplier<GrammarCompatibilityOracle> llmOracle;
    private final GrammarCompatibilityOracle ruleOracle;
    private final GrammarCompatibilityOracle narrowOracle;

    public GrammarOracleFactory(Supplier<GrammarCompatibilityOracle> llmOracle,
                                GrammarCompatibilityOracle ruleOracle,
                                GrammarCompatibilityOracle narrowOracle) {
        this.llmOracle = Objects.requireNonNull(llmOracle, "llmOracle");
        this.ruleOracle = Objects.requireNonNull(ruleOracle, "ruleOracle");
        this.narrowOracle = Objects.requireNonNull(narrowOracle, "narrowOracle");
    }

    public GrammarCompatibilityOracle select(GrammarMode mode) {
        return switch (mode) {
            case LLM -> Objects.requireNonNull(llmOracle.get(), "llmOracle");
            case RULES -> ruleOracle;
            case OFF -> narrowOracle;
        };
    }
}
