package ai.policy.revision.operation;

import java.util.Optional;

/**
 * One record of an operation list as it was read, before validation. Absent values are empty.
 */
public record EditInstruction(
        Optional<String> targetText,
        Optional<String> action,
        Optional<String> replacement,
        Optional<String> comment,
        Optional<String> commentAuthor,
        Optional<Boolean> matchCase,
        Optional<Boolean> wholeWord,
        Optional<Boolean> wildcards,
        Optional<Boolean> wholeDocument,
        Optional<Boolean> skipIfAbsent,
        Optional<String> imageSource,
        Optional<byte[]> imageData,
        Optional<Double> widthMm,
        Optional<Double> heightMm
) {

    public EditInstruction {
        targetText = orEmpty(targetText);
        action = orEmpty(action);
        replacement = orEmpty(replacement);
        comment = orEmpty(comment);
        commentAuthor = orEmpty(commentAuthor);
        matchCase = orEmpty(matchCase);
        wholeWord = orEmpty(wholeWord);
        wildcards = orEmpty(wildcards);
        wholeDocument = orEmpty(wholeDocument);
        skipIfAbsent = orEmpty(skipIfAbsent);
        imageSource = orEmpty(imageSource);
        imageData = orEmpty(imageData);
        widthMm = orEmpty(widthMm);
        heightMm = orEmpty(heightMm);
    }

    public static Builder builder(String action, String targetText) {
        return new Builder().action(action).targetText(targetText);
    }

    private static <T> Optional<T> orEmpty(Optional<T> value) {
        return value == null ? Optional.empty() : value;
    }

    /**
     * Fluent construction, mostly for callers that are not reading JSON.
     */
    public static final class Builder {
        private String targetText;
        private String action;
        private String replacement;
        private String comment;
        private String commentAuthor;
        private Boolean matchCase;
        private Boolean wholeWord;
        private Boolean wildcards;
        private Boolean wholeDocument;
        private Boolean skipIfAbsent;
        private String imageSource;
        private byte[] imageData;
        private Double widthMm;
        private Double heightMm;

        public Builder targetText(String value) {
            this.targetText = value;
            return this;
        }

        public Builder action(String value) {
            this.action = value;
            return this;
        }

        public Builder replacement(String value) {
            this.replacement = value;
            return this;
        }

        public Builder comment(String value) {
            this.comment = value;
            return this;
        }

        public Builder commentAuthor(String value) {
            this.commentAuthor = value;
            return this;
        }

        public Builder matchCase(Boolean value) {
            this.matchCase = value;
            return this;
        }

        public Builder wholeWord(Boolean value) {
            this.wholeWord = value;
            return this;
        }

        public Builder wildcards(Boolean value) {
            this.wildcards = value;
            return this;
        }

        public Builder wholeDocument(Boolean value) {
            this.wholeDocument = value;
            return this;
        }

        public Builder skipIfAbsent(Boolean value) {
            this.skipIfAbsent = value;
            return this;
        }

        public Builder image(String source, byte[] data) {
            this.imageSource = source;
            this.imageData = data;
            return this;
        }

        public Builder size(Double width, Double height) {
            this.widthMm = width;
            this.heightMm = height;
            return this;
        }

        public EditInstruction build() {
            return new EditInstruction(
                    Optional.ofNullable(targetText),
                    Optional.ofNullable(action),
                    Optional.ofNullable(replacement),
                    Optional.ofNullable(comment),
                    Optional.ofNullable(commentAuthor),
                    Optional.ofNullable(matchCase),
                    Optional.ofNullable(wholeWord),
                    Optional.ofNullable(wildcards),
                    Optional.ofNullable(wholeDocument),
                    Optional.ofNullable(skipIfAbsent),
                    Optional.ofNullable(imageSource),
                    Optional.ofNullable(imageData),
                    Optional.ofNullable(widthMm),
                    Optional.ofNullable(heightMm));
        }
    }
}
