package ai.policy.revision.grammar;

import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Grammar oracle backed by a LangChain4j {@link ChatModel}.
 *
 * <p>Rate-limited calls are retried with exponential backoff. Any other failure, or an answer
 * that cannot be parsed, degrades to a narrow replacement.
 */
public class ChatModelGrammarOracle implements GrammarCompatibilityOracle {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatModelGrammarOracle.class);
    private static final String NARROW_OK = "NARROW_OK";
    private static final String REWRITE_PREFIX = "REWRITE:";

    private final ChatModel chatModel;
    private final String providerName;
    private final String modelName;
    private final int maxRetryAttempts;
    private final int initialBackoffSeconds;
    private final int maxBackoffSeconds;
    private final double jitterFactor;
    private final Sleeper sleeper;

    public ChatModelGrammarOracle(ChatModel chatModel, String providerName, String modelName,
                                  int maxRetryAttempts, int initialBackoffSeconds, int maxBackoffSeconds, double jitterFactor) {
        this(chatModel, providerName, modelName, maxRetryAttempts, initialBackoffSeconds, maxBackoffSeconds, jitterFactor,
                duration -> Thread.sleep(duration.toMillis()));
    }

    ChatModelGrammarOracle(ChatModel chatModel, String providerName, String modelName,
                           int maxRetryAttempts, int initialBackoffSeconds, int maxBackoffSeconds, double jitterFactor,
                           Sleeper sleeper) {
        this.chatModel = Objects.requireNonNull(chatModel, "chatModel");
        this.providerName = requireNonBlank(providerName, "providerName");
        this.modelName = requireNonBlank(modelName, "modelName");
        if (maxRetryAttempts < 1) {
            throw new IllegalArgumentException("maxRetryAttempts must be at least 1");
        }
        if (initialBackoffSeconds < 1) {
            throw new IllegalArgumentException("initialBackoffSeconds must be at least 1");
        }
        if (maxBackoffSeconds < initialBackoffSeconds) {
            throw new IllegalArgumentException("maxBackoffSeconds must be at least initialBackoffSeconds");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0");
        }
        this.maxRetryAttempts = maxRetryAttempts;
        this.initialBackoffSeconds = initialBackoffSeconds;
        this.maxBackoffSeconds = maxBackoffSeconds;
        this.jitterFactor = jitterFactor;
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    @Override
    public GrammarVerdict classify(GrammarCheckRequest request) {
        Objects.requireNonNull(request, "request");
        String prompt = buildPrompt(request);
        Optional<String> response = chatWithRetry(prompt);
        if (response.isEmpty()) {
            return GrammarVerdict.narrowOk();
        }
        return parse(response.get(), request);
    }

    GrammarVerdict parse(String response, GrammarCheckRequest request) {
        String answer = response.strip();
        if (answer.isEmpty()) {
            LOGGER.warn("{} returned an empty grammar verdict for '{}', keeping the narrow replacement", providerName, request.target());
            return GrammarVerdict.narrowOk();
        }
        String upper = answer.toUpperCase(Locale.ROOT);
        if (upper.startsWith(NARROW_OK)) {
            return GrammarVerdict.narrowOk();
        }
        if (upper.startsWith(REWRITE_PREFIX)) {
            String sentence = unquote(answer.substring(REWRITE_PREFIX.length()).strip());
            if (sentence.isBlank() || !sentence.toLowerCase(Locale.ROOT).contains(request.replacement().strip().toLowerCase(Locale.ROOT))) {
                LOGGER.warn("{} proposed a rewrite without the replacement '{}', keeping the narrow replacement",
                        providerName, request.replacement());
                return GrammarVerdict.narrowOk();
            }
            return GrammarVerdict.rewrite(sentence);
        }
        LOGGER.warn("Unrecognised grammar verdict from {}: '{}', keeping the narrow replacement", providerName, answer);
        return GrammarVerdict.narrowOk();
    }

    private Optional<String> chatWithRetry(String prompt) {
        for (int attempt = 0; attempt < maxRetryAttempts; attempt++) {
            try {
                return Optional.ofNullable(chatModel.chat(prompt));
            } catch (RuntimeException ex) {
                if (isModelMissing(ex)) {
                    throw new GrammarCheckException("%s model '%s' is not available.".formatted(providerName, modelName), ex);
                }
                if (!isRateLimitError(ex)) {
                    LOGGER.warn("Grammar check via {} failed: {}, keeping the narrow replacement", providerName, ex.getMessage());
                    return Optional.empty();
                }
                if (attempt == maxRetryAttempts - 1) {
                    LOGGER.error("Grammar check rate limited; max retries ({}) exceeded", maxRetryAttempts);
                    return Optional.empty();
                }
                Duration delay = backoff(attempt);
                LOGGER.warn("Grammar check rate limited (429/RESOURCE_EXHAUSTED); retrying in {} seconds (attempt {}/{})",
                        delay.toSeconds(), attempt + 1, maxRetryAttempts);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException interruptedException) {
                    Thread.currentThread().interrupt();
                    LOGGER.warn("Grammar check retry interrupted");
                    return Optional.empty();
                }
            }
        }
        return Optional.empty();
    }

    Duration backoff(int attemptNumber) {
        long baseDelaySeconds = initialBackoffSeconds * (1L << Math.min(attemptNumber, 20));
        long cappedDelaySeconds = Math.min(baseDelaySeconds, maxBackoffSeconds);
        double jitterMultiplier = 1.0 + (Math.random() * 2.0 - 1.0) * jitterFactor;
        return Duration.ofSeconds(Math.max(1, (long) (cappedDelaySeconds * jitterMultiplier)));
    }

    private String buildPrompt(GrammarCheckRequest request) {
        return """
You are reviewing an edit to a corporate policy document.
A template placeholder is about to be replaced with an answer supplied by the policy owner.

Sentence: %s
Placeholder: %s
Answer: %s

Decide whether the sentence still reads as correct English when only the placeholder is replaced by the answer.
- If it does, respond with exactly: NARROW_OK
- If it does not, respond with: REWRITE: <the full corrected sentence>
  The corrected sentence must contain the answer, keep the original meaning and terminal punctuation, and change as little as possible.
Do not add commentary.
""".formatted(request.sentence(), request.target(), request.replacement());
    }

    private boolean isRateLimitError(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof RateLimitException) {
                return true;
            }
            String message = cause.getMessage();
            if (message != null && (message.contains("RESOURCE_EXHAUSTED") || message.contains("429"))) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private boolean isModelMissing(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof ModelNotFoundException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1).strip();
        }
        return value;
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }
}
