package ai.policy.revision.grammar;

/**
 * Question put to a grammar oracle: does {@code replacement} read correctly in place of
 * {@code target} inside {@code sentence}?
 */
public record GrammarCheckRequest(String target, String sentence, String replacement) {

    public GrammarCheckRequest {
        target = requireNonBlank(target, "target");
        sentence = requireNonBlank(sentence, "sentence");
        replacement = requireNonBlank(replacement, "replacement");
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}
