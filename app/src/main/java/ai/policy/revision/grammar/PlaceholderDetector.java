package ai.policy.revision.grammar;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Recognises template placeholders such as {@code <owner>}, {@code [date]} or {@code {system}}.
 */
public final class PlaceholderDetector {

    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("<[^>]+>"),
            Pattern.compile("\\[[^\\]]+\\]"),
            Pattern.compile("\\{[^}]+\\}"));

    private PlaceholderDetector() {
    }

    public static boolean containsPlaceholder(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        return PATTERNS.stream().anyMatch(pattern -> pattern.matcher(text).find());
    }
}
