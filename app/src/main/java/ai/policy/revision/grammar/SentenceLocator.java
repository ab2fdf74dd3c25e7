package ai.policy.revision.grammar;

/**
 * Finds the sentence around a range of block text. Sentences end at {@code .}, {@code !} or
 * {@code ?} followed by whitespace or the end of the block.
 */
public final class SentenceLocator {

    private SentenceLocator() {
    }

    public static Sentence locate(String text, int start, int end) {
        if (start < 0 || end > text.length() || end < start) {
            throw new IllegalArgumentException("range " + start + ".." + end + " outside text of length " + text.length());
        }
        int sentenceStart = 0;
        for (int i = start - 1; i > 0; i--) {
            if (isTerminator(text.charAt(i - 1)) && Character.isWhitespace(text.charAt(i))) {
                sentenceStart = i;
                break;
            }
        }
        while (sentenceStart < start && Character.isWhitespace(text.charAt(sentenceStart))) {
            sentenceStart++;
        }
        int sentenceEnd = text.length();
        for (int i = Math.max(end, sentenceStart); i < text.length(); i++) {
            if (isTerminator(text.charAt(i)) && (i + 1 == text.length() || Character.isWhitespace(text.charAt(i + 1)))) {
                sentenceEnd = i + 1;
                break;
            }
        }
        while (sentenceEnd > end && Character.isWhitespace(text.charAt(sentenceEnd - 1))) {
            sentenceEnd--;
        }
        return new Sentence(sentenceStart, sentenceEnd, text.substring(sentenceStart, sentenceEnd));
    }

    private static boolean isTerminator(char ch) {
        return ch == '.' || ch == '!' || ch == '?';
    }

    /**
     * Sentence text and its offsets in the block.
     */
    public record Sentence(int start, int end, String text) {
    }
}
