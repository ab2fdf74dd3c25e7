package ai.policy.revision.grammar;

/**
 * Decides whether a placeholder replacement needs its sentence rewritten.
 * Implementations must not touch the document.
 */
@FunctionalInterface
public interface GrammarCompatibilityOracle {

    GrammarVerdict classify(GrammarCheckRequest request);
}
