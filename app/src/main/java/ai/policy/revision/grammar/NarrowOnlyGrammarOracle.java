package ai.policy.revision.grammar;

/**
 * Oracle used when grammar checks are switched off.
 */
public class NarrowOnlyGrammarOracle implements GrammarCompatibilityOracle {

    @Override
    public GrammarVerdict classify(GrammarCheckRequest request) {
        return GrammarVerdict.narrowOk();
    }
}
