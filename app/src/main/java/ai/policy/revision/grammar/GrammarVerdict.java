package ai.policy.revision.grammar;

/**
 * Answer of a grammar oracle.
 */
public sealed interface GrammarVerdict permits GrammarVerdict.NarrowOk, GrammarVerdict.NeedsSentenceRewrite {

    static GrammarVerdict narrowOk() {
        return NarrowOk.INSTANCE;
    }

    static GrammarVerdict rewrite(String sentence) {
        return new NeedsSentenceRewrite(sentence);
    }

    /** The replacement fits; only the target itself changes. */
    record NarrowOk() implements GrammarVerdict {
        private static final NarrowOk INSTANCE = new NarrowOk();
    }

    /** The whole sentence has to be replaced by {@code sentence}. */
    record NeedsSentenceRewrite(String sentence) implements GrammarVerdict {
        public NeedsSentenceRewrite {
            if (sentence == null || sentence.isBlank()) {
                throw new IllegalArgumentException("sentence must not be blank");
            }
        }
    }
}
