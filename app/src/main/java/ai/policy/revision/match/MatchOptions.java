package ai.policy.revision.match;

/**
 * Search flags of an operation.
 *
 * @param caseSensitive compare characters exactly
 * @param wholeWord require word boundaries around literal matches
 * @param pattern treat the target as a bounded regular expression
 */
public record MatchOptions(boolean caseSensitive, boolean wholeWord, boolean pattern) {

    private static final MatchOptions DEFAULTS = new MatchOptions(false, true, false);
    private static final MatchOptions EXACT = new MatchOptions(true, false, false);

    /** Case-insensitive whole-word literal search. */
    public static MatchOptions defaults() {
        return DEFAULTS;
    }

    /** Case-sensitive literal search without word boundaries. */
    public static MatchOptions exact() {
        return EXACT;
    }
}
