package ai.policy.revision.config;

import ai.policy.revision.cli.CliArguments;
import ai.policy.revision.grammar.GrammarMode;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_GRAMMAR_MODE = "GRAMMAR_MODE";
    static final String ENV_LLM_PROVIDER = "LLM_PROVIDER";
    static final String ENV_LLM_MODEL = "LLM_MODEL";
    static final String ENV_OLLAMA_BASE_URL = "OLLAMA_BASE_URL";
    static final String ENV_GEMINI_API_KEY = "GEMINI_API_KEY";
    static final String ENV_REVISION_AUTHOR = "REVISION_AUTHOR";
    static final String ENV_LOGO_WIDTH_MM = "LOGO_WIDTH_MM";
    static final String ENV_LOGO_HEIGHT_MM = "LOGO_HEIGHT_MM";
    static final String ENV_CLEAN_HIGHLIGHTING = "CLEAN_HIGHLIGHTING";
    static final String ENV_PATTERN_STEP_BUDGET = "PATTERN_STEP_BUDGET";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_LLM_MAX_RETRY_ATTEMPTS = "LLM_MAX_RETRY_ATTEMPTS";
    static final String ENV_LLM_INITIAL_BACKOFF_SECONDS = "LLM_INITIAL_BACKOFF_SECONDS";
    static final String ENV_LLM_MAX_BACKOFF_SECONDS = "LLM_MAX_BACKOFF_SECONDS";
    static final String ENV_LLM_RETRY_JITTER_FACTOR = "LLM_RETRY_JITTER_FACTOR";

    static final String DEFAULT_AUTHOR = "policy assistant";
    private static final String MANIFEST_SUFFIX = ".manifest.json";
    private static final double DEFAULT_LOGO_WIDTH_MM = 0.0;
    private static final double DEFAULT_LOGO_HEIGHT_MM = 6.0;
    private static final long DEFAULT_PATTERN_STEP_BUDGET = 1_000_000L;
    private static final int DEFAULT_LLM_MAX_RETRY_ATTEMPTS = 6;
    private static final int DEFAULT_LLM_INITIAL_BACKOFF_SECONDS = 2;
    private static final int DEFAULT_LLM_MAX_BACKOFF_SECONDS = 60;
    private static final double DEFAULT_LLM_RETRY_JITTER_FACTOR = 0.3;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Path input = requirePath(arguments.input(), "--in");
        Path operations = requirePath(arguments.operations(), "--operations");
        Path output = requirePath(arguments.output(), "--out");
        Path manifest = Optional.ofNullable(arguments.manifest())
                .orElseGet(() -> output.resolveSibling(output.getFileName() + MANIFEST_SUFFIX));

        GrammarMode grammarMode = resolveGrammarMode(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);
        String author = firstNonBlank(arguments.author(), ENV_REVISION_AUTHOR, DEFAULT_AUTHOR);

        LlmProvider provider = env(ENV_LLM_PROVIDER)
                .map(LlmProvider::from)
                .orElse(LlmProvider.OLLAMA);
        String modelName = env(ENV_LLM_MODEL).orElse(defaultModelFor(provider));
        Optional<String> baseUrl = Optional.empty();
        if (provider == LlmProvider.OLLAMA) {
            baseUrl = Optional.of(env(ENV_OLLAMA_BASE_URL).orElse("http://localhost:11434"));
        }
        Secrets secrets = new Secrets(env(ENV_GEMINI_API_KEY));

        double logoWidthMm = env(ENV_LOGO_WIDTH_MM)
                .map(value -> parseDouble(value, ENV_LOGO_WIDTH_MM))
                .orElse(DEFAULT_LOGO_WIDTH_MM);
        double logoHeightMm = env(ENV_LOGO_HEIGHT_MM)
                .map(value -> parseDouble(value, ENV_LOGO_HEIGHT_MM))
                .orElse(DEFAULT_LOGO_HEIGHT_MM);
        boolean cleanHighlighting = !arguments.noCleanHighlighting()
                && env(ENV_CLEAN_HIGHLIGHTING).map(ConfigLoader::parseBoolean).orElse(true);
        long patternStepBudget = env(ENV_PATTERN_STEP_BUDGET)
                .map(value -> parseLong(value, ENV_PATTERN_STEP_BUDGET))
                .orElse(DEFAULT_PATTERN_STEP_BUDGET);

        int llmMaxRetryAttempts = env(ENV_LLM_MAX_RETRY_ATTEMPTS)
                .map(value -> parsePositiveInteger(value, ENV_LLM_MAX_RETRY_ATTEMPTS))
                .orElse(DEFAULT_LLM_MAX_RETRY_ATTEMPTS);
        int llmInitialBackoffSeconds = env(ENV_LLM_INITIAL_BACKOFF_SECONDS)
                .map(value -> parsePositiveInteger(value, ENV_LLM_INITIAL_BACKOFF_SECONDS))
                .orElse(DEFAULT_LLM_INITIAL_BACKOFF_SECONDS);
        int llmMaxBackoffSeconds = env(ENV_LLM_MAX_BACKOFF_SECONDS)
                .map(value -> parsePositiveInteger(value, ENV_LLM_MAX_BACKOFF_SECONDS))
                .orElse(DEFAULT_LLM_MAX_BACKOFF_SECONDS);
        double llmRetryJitterFactor = env(ENV_LLM_RETRY_JITTER_FACTOR)
                .map(value -> parseDouble(value, ENV_LLM_RETRY_JITTER_FACTOR))
                .orElse(DEFAULT_LLM_RETRY_JITTER_FACTOR);

        if (grammarMode == GrammarMode.LLM && provider == LlmProvider.GEMINI && secrets.geminiApiKey().isEmpty()) {
            throw new IllegalStateException("GEMINI_API_KEY must be provided when GRAMMAR_MODE=llm and LLM_PROVIDER=gemini");
        }

        return new Config(input, operations, output, manifest, grammarMode, logFormat,
                new OracleConfig(provider, modelName, baseUrl), secrets, author,
                logoWidthMm, logoHeightMm, cleanHighlighting, patternStepBudget,
                llmMaxRetryAttempts, llmInitialBackoffSeconds, llmMaxBackoffSeconds, llmRetryJitterFactor,
                arguments.strict());
    }

    private String defaultModelFor(LlmProvider provider) {
        return switch (provider) {
            case GEMINI -> "models/gemini-1.5-flash-latest";
            case OLLAMA -> "llama3.1:8b";
        };
    }

    private GrammarMode resolveGrammarMode(CliArguments arguments) {
        GrammarMode cliMode = arguments.grammarMode();
        if (cliMode != null) {
            return cliMode;
        }
        return env(ENV_GRAMMAR_MODE)
                .map(GrammarMode::from)
                .orElse(GrammarMode.RULES);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return env(ENV_LOG_FORMAT)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private Optional<String> env(String key) {
        return environmentReader.get(key)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim);
    }

    private String firstNonBlank(String cliValue, String envKey, String defaultValue) {
        if (isNotBlank(cliValue)) {
            return cliValue.trim();
        }
        return env(envKey).orElse(defaultValue);
    }

    private static Path requirePath(Path value, String option) {
        if (value == null) {
            throw new IllegalArgumentException(option + " must be provided");
        }
        return value;
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static boolean parseBoolean(String raw) {
        return switch (raw.toLowerCase(Locale.ROOT)) {
            case "true", "1", "yes" -> true;
            case "false", "0", "no" -> false;
            default -> throw new IllegalArgumentException(ENV_CLEAN_HIGHLIGHTING + " must be true or false: " + raw);
        };
    }

    private static int parsePositiveInteger(String raw, String key) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 1) {
                throw new IllegalArgumentException(key + " must be at least 1");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be an integer", ex);
        }
    }

    private static long parseLong(String raw, String key) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be an integer", ex);
        }
    }

    private static double parseDouble(String raw, String key) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid " + key + " value: " + raw, ex);
        }
    }
}
