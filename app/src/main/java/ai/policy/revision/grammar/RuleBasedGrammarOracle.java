package ai.policy.revision.grammar;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Offline oracle covering the two placeholder fixes policy templates need most often.
 *
 * <ul>
 *   <li>An immediacy answer ("immediately", "at once") for a placeholder introduced by a duration
 *   preposition: "terminated within &lt;24 business hours&gt; of notice." becomes
 *   "terminated immediately."</li>
 *   <li>Indefinite article agreement: "a &lt;role&gt;" answered with "administrator" becomes
 *   "an administrator".</li>
 * </ul>
 */
public class RuleBasedGrammarOracle implements GrammarCompatibilityOracle {

    private static final Logger LOGGER = LoggerFactory.getLogger(RuleBasedGrammarOracle.class);

    private static final List<String> IMMEDIACY_WORDS = List.of(
            "immediately", "instantly", "right away", "asap", "at once",
            "without delay", "forthwith", "straight away");
    private static final Pattern DURATION_PREPOSITION = Pattern.compile("(?i)\\b(within|in|during|over|after)\\s*$");
    private static final Pattern INDEFINITE_ARTICLE = Pattern.compile("\\b(a|an|A|An|AN)\\s+$");

    @Override
    public GrammarVerdict classify(GrammarCheckRequest request) {
        String sentence = request.sentence();
        int position = sentence.indexOf(request.target());
        if (position < 0) {
            return GrammarVerdict.narrowOk();
        }
        String before = sentence.substring(0, position);
        String after = sentence.substring(position + request.target().length());
        String replacement = request.replacement().strip();

        if (isImmediacy(replacement)) {
            Matcher preposition = DURATION_PREPOSITION.matcher(before);
            if (preposition.find()) {
                String rewritten = before.substring(0, preposition.start()).stripTrailing()
                        + " " + replacement + terminalPunctuation(sentence);
                LOGGER.debug("Immediacy answer '{}' after '{}' needs a sentence rewrite", replacement, preposition.group(1));
                return GrammarVerdict.rewrite(rewritten.strip());
            }
        }

        Matcher article = INDEFINITE_ARTICLE.matcher(before);
        if (article.find() && !replacement.isEmpty()) {
            String current = article.group(1);
            String expected = startsWithVowel(replacement) ? "an" : "a";
            if (!current.equalsIgnoreCase(expected)) {
                String fixed = matchCase(expected, current);
                String rewritten = before.substring(0, article.start(1)) + fixed
                        + before.substring(article.end(1)) + replacement + after;
                return GrammarVerdict.rewrite(rewritten);
            }
        }
        return GrammarVerdict.narrowOk();
    }

    private static boolean isImmediacy(String replacement) {
        String lower = replacement.toLowerCase(Locale.ROOT);
        return IMMEDIACY_WORDS.stream().anyMatch(lower::contains);
    }

    private static boolean startsWithVowel(String value) {
        char first = Character.toLowerCase(value.charAt(0));
        return "aeiou".indexOf(first) >= 0;
    }

    private static String terminalPunctuation(String sentence) {
        String stripped = sentence.stripTrailing();
        if (stripped.isEmpty()) {
            return "";
        }
        char last = stripped.charAt(stripped.length() - 1);
        return last == '.' || last == '!' || last == '?' ? String.valueOf(last) : "";
    }

    private static String matchCase(String article, String original) {
        if (original.equals(original.toUpperCase(Locale.ROOT)) && original.length() > 1) {
            return article.toUpperCase(Locale.ROOT);
        }
        if (Character.isUpperCase(original.charAt(0))) {
            return Character.toUpperCase(article.charAt(0)) + article.substring(1);
        }
        return article;
    }
}
