package ai.policy.revision.match;

import ai.policy.revision.model.Block;
import ai.policy.revision.model.Document;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the first occurrence of a target in document order, looking only at live text.
 */
public class TextMatcher {

    private final long stepBudget;

    public TextMatcher() {
        this(PatternGuard.DEFAULT_STEP_BUDGET);
    }

    public TextMatcher(long stepBudget) {
        if (stepBudget < 1) {
            throw new IllegalArgumentException("stepBudget must be positive");
        }
        this.stepBudget = stepBudget;
    }

    public Optional<MatchSpan> find(Document document, String target, MatchOptions options) {
        return find(document, target, options, SearchPosition.START);
    }

    /**
     * Searches blocks from {@code from} onwards. Within the starting block only matches beginning
     * at or after {@code from.liveOffset()} count.
     *
     * @throws PatternRejectedException when a pattern is refused or runs out of budget
     */
    public Optional<MatchSpan> find(Document document, String target, MatchOptions options, SearchPosition from) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(from, "from");
        if (target == null || target.isEmpty()) {
            throw new IllegalArgumentException("target must not be empty");
        }
        Pattern pattern = options.pattern() ? PatternGuard.compile(target, options.caseSensitive()) : null;
        BudgetedCharSequence.Budget budget = new BudgetedCharSequence.Budget(stepBudget);
        List<Block> blocks = document.blocks();
        for (int index = from.blockIndex(); index < blocks.size(); index++) {
            int offset = index == from.blockIndex() ? from.liveOffset() : 0;
            LiveText live = LiveText.of(blocks.get(index));
            Optional<MatchSpan> span = pattern == null
                    ? findLiteral(live, target, options, offset)
                    : findPattern(live, pattern, budget, offset);
            if (span.isPresent()) {
                return span;
            }
        }
        return Optional.empty();
    }

    private Optional<MatchSpan> findLiteral(LiveText live, String target, MatchOptions options, int fromOffset) {
        String text = live.text();
        int last = text.length() - target.length();
        for (int i = fromOffset; i <= last; i++) {
            if (!text.regionMatches(!options.caseSensitive(), i, target, 0, target.length())) {
                continue;
            }
            int end = i + target.length();
            if (options.wholeWord() && !onWordBoundaries(text, target, i, end)) {
                continue;
            }
            return Optional.of(live.span(i, end));
        }
        return Optional.empty();
    }

    private Optional<MatchSpan> findPattern(LiveText live, Pattern pattern, BudgetedCharSequence.Budget budget, int fromOffset) {
        if (fromOffset > live.length()) {
            return Optional.empty();
        }
        Matcher matcher = pattern.matcher(new BudgetedCharSequence(live.text(), budget));
        int position = fromOffset;
        while (position <= live.length() && matcher.find(position)) {
            if (matcher.end() > matcher.start()) {
                return Optional.of(live.span(matcher.start(), matcher.end()));
            }
            position = matcher.end() + 1;
        }
        return Optional.empty();
    }

    /**
     * A boundary is only required on a side whose edge character is a letter or digit.
     */
    static boolean onWordBoundaries(String text, String target, int start, int end) {
        if (isWordChar(target.charAt(0)) && start > 0 && isWordChar(text.charAt(start - 1))) {
            return false;
        }
        return !(isWordChar(target.charAt(target.length() - 1)) && end < text.length() && isWordChar(text.charAt(end)));
    }

    private static boolean isWordChar(char ch) {
        return Character.isLetterOrDigit(ch);
    }
}
