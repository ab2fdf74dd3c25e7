package ai.policy.revision.match;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiles user supplied search patterns, refusing the shapes that can backtrack without bound.
 *
 * <p>Rejected: patterns longer than {@value #MAX_PATTERN_LENGTH} characters, back references,
 * and quantified groups whose body already contains a quantifier or an alternation.
 */
public final class PatternGuard {

    public static final int MAX_PATTERN_LENGTH = 512;
    public static final long DEFAULT_STEP_BUDGET = 1_000_000L;

    private PatternGuard() {
    }

    public static Pattern compile(String source, boolean caseSensitive) {
        if (source == null || source.isEmpty()) {
            throw new PatternRejectedException("pattern must not be empty");
        }
        if (source.length() > MAX_PATTERN_LENGTH) {
            throw new PatternRejectedException("pattern longer than " + MAX_PATTERN_LENGTH + " characters");
        }
        inspect(source);
        int flags = caseSensitive ? 0 : Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        try {
            return Pattern.compile(source, flags);
        } catch (PatternSyntaxException ex) {
            throw new PatternRejectedException("pattern does not compile: " + ex.getDescription(), ex);
        }
    }

    private static void inspect(String source) {
        Deque<GroupState> groups = new ArrayDeque<>();
        GroupState top = new GroupState();
        boolean inClass = false;
        int length = source.length();
        for (int i = 0; i < length; i++) {
            char ch = source.charAt(i);
            if (ch == '\\') {
                if (i + 1 < length) {
                    char next = source.charAt(i + 1);
                    if (!inClass && (next >= '1' && next <= '9'
                            || next == 'k' && i + 2 < length && source.charAt(i + 2) == '<')) {
                        throw new PatternRejectedException("back references are not allowed");
                    }
                }
                i++;
                continue;
            }
            if (inClass) {
                if (ch == ']') {
                    inClass = false;
                }
                continue;
            }
            switch (ch) {
                case '[' -> {
                    inClass = true;
                    // a leading ']' is literal inside a class
                    if (i + 1 < length && source.charAt(i + 1) == '^') {
                        i++;
                    }
                    if (i + 1 < length && source.charAt(i + 1) == ']') {
                        i++;
                    }
                }
                case '(' -> {
                    groups.push(top);
                    top = new GroupState();
                    // skip the ? of (?:, (?=, (?<name> so it is not read as a quantifier
                    if (i + 1 < length && source.charAt(i + 1) == '?') {
                        i++;
                    }
                }
                case ')' -> {
                    if (groups.isEmpty()) {
                        // unbalanced, Pattern.compile reports it
                        continue;
                    }
                    GroupState closed = top;
                    top = groups.pop();
                    boolean quantified = isQuantifierAt(source, i + 1);
                    if (quantified && (closed.quantifier || closed.alternation)) {
                        throw new PatternRejectedException("nested or ambiguous quantifier in group ending at index " + i);
                    }
                    top.quantifier |= closed.quantifier || quantified;
                    top.alternation |= closed.alternation;
                }
                case '|' -> top.alternation = true;
                case '*', '+', '?' -> top.quantifier = true;
                case '{' -> {
                    if (isQuantifierAt(source, i)) {
                        top.quantifier = true;
                    }
                }
                default -> {
                }
            }
        }
    }

    private static boolean isQuantifierAt(String source, int index) {
        if (index >= source.length()) {
            return false;
        }
        char ch = source.charAt(index);
        if (ch == '*' || ch == '+' || ch == '?') {
            return true;
        }
        return ch == '{' && index + 1 < source.length() && Character.isDigit(source.charAt(index + 1));
    }

    private static final class GroupState {
        private boolean quantifier;
        private boolean alternation;
    }
}
