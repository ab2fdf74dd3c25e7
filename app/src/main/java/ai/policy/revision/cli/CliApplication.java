package ai.policy.revision.cli;

import ai.policy.revision.config.Config;
import ai.policy.revision.config.ConfigLoader;
import ai.policy.revision.config.OracleConfig;
import ai.policy.revision.config.Secrets;
import ai.policy.revision.config.SystemEnvironmentReader;
import ai.policy.revision.docx.DocumentLoadException;
import ai.policy.revision.docx.DocxDocumentReader;
import ai.policy.revision.docx.DocxDocumentWriter;
import ai.policy.revision.docx.SerializationException;
import ai.policy.revision.grammar.ChatModelGrammarOracle;
import ai.policy.revision.grammar.GrammarCheckException;
import ai.policy.revision.grammar.GrammarCompatibilityOracle;
import ai.policy.revision.grammar.GrammarOracleFactory;
import ai.policy.revision.grammar.NarrowOnlyGrammarOracle;
import ai.policy.revision.grammar.RuleBasedGrammarOracle;
import ai.policy.revision.logging.LoggingConfigurator;
import ai.policy.revision.match.TextMatcher;
import ai.policy.revision.operation.OperationInterpreter;
import ai.policy.revision.operation.OperationParser;
import ai.policy.revision.operation.OperationStatus;
import ai.policy.revision.pipeline.RevisionPipeline;
import ai.policy.revision.pipeline.RevisionRunResult;
import ai.policy.revision.plan.EditPlanException;
import ai.policy.revision.plan.EditPlanReader;
import ai.policy.revision.plan.ManifestWriter;
import ai.policy.revision.revision.CommentAttacher;
import ai.policy.revision.revision.ImageSubstitutor;
import ai.policy.revision.revision.RevisionWriter;
import ai.policy.revision.revision.SizeConstraint;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and revision pipeline.
 *
 * <p>Exit codes: 0 on success, 1 when the document or operation list cannot be read or the
 * result cannot be written, 2 on invalid arguments or configuration, 3 in strict mode when an
 * operation failed or was invalid.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_RUN_FAILED = 1;
    static final int EXIT_INVALID_CONFIG = 2;
    static final int EXIT_STRICT_PROBLEMS = 3;

    private final ConfigLoader configLoader;
    private final Clock clock;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), Clock.systemUTC());
    }

    CliApplication(ConfigLoader configLoader, Clock clock) {
        this.configLoader = configLoader;
        this.clock = clock;
    }

    public static void main(String[] args) {
        int exitCode = new CliApplication().run(args);
        if (exitCode != EXIT_OK) {
            System.exit(exitCode);
        }
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException | IllegalStateException ex) {
            commandLine.getErr().println(ex.getMessage());
            return EXIT_INVALID_CONFIG;
        }
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.info("Revising {} with {} (grammar={}, author='{}')",
                config.input(), config.operations(), config.grammarMode(), config.revisionAuthor());

        RevisionRunResult result;
        try {
            result = createPipeline(config).run(config.input(), config.operations(), config.output(), config.manifest());
        } catch (DocumentLoadException | EditPlanException | SerializationException | GrammarCheckException ex) {
            LOGGER.error("Revision failed: {}", ex.getMessage(), ex);
            return EXIT_RUN_FAILED;
        } catch (IllegalStateException ex) {
            LOGGER.error("Invalid configuration: {}", ex.getMessage(), ex);
            return EXIT_INVALID_CONFIG;
        }

        LOGGER.info("Done: {} applied, {} skipped, {} failed, {} invalid; manifest at {}",
                result.manifest().count(OperationStatus.APPLIED),
                result.manifest().count(OperationStatus.SKIPPED),
                result.manifest().count(OperationStatus.FAILED),
                result.manifest().count(OperationStatus.INVALID),
                result.manifestPath());
        if (config.strict() && result.manifest().hasProblems()) {
            LOGGER.warn("Strict mode: some operations failed or were invalid");
            return EXIT_STRICT_PROBLEMS;
        }
        return EXIT_OK;
    }

    private RevisionPipeline createPipeline(Config config) {
        RevisionWriter revisionWriter = new RevisionWriter(clock);
        GrammarOracleFactory oracleFactory = new GrammarOracleFactory(
                () -> createLlmOracle(config),
                new RuleBasedGrammarOracle(),
                new NarrowOnlyGrammarOracle());
        OperationInterpreter interpreter = new OperationInterpreter(
                new OperationParser(config.revisionAuthor(), new SizeConstraint(config.logoWidthMm(), config.logoHeightMm())),
                new TextMatcher(config.patternStepBudget()),
                revisionWriter,
                new CommentAttacher(clock),
                new ImageSubstitutor(revisionWriter),
                oracleFactory.select(config.grammarMode()),
                config.revisionAuthor());
        return new RevisionPipeline(
                new DocxDocumentReader(config.cleanHighlighting()),
                new EditPlanReader(),
                interpreter,
                new DocxDocumentWriter(),
                new ManifestWriter());
    }

    private GrammarCompatibilityOracle createLlmOracle(Config config) {
        OracleConfig oracleConfig = config.oracleConfig();
        ChatModel chatModel = switch (oracleConfig.provider()) {
            case OLLAMA -> createOllamaChatModel(oracleConfig);
            case GEMINI -> createGeminiChatModel(oracleConfig, config.secrets());
        };
        return new ChatModelGrammarOracle(chatModel, oracleConfig.provider().name(), oracleConfig.modelName(),
                config.llmMaxRetryAttempts(),
                config.llmInitialBackoffSeconds(),
                config.llmMaxBackoffSeconds(),
                config.llmRetryJitterFactor());
    }

    private ChatModel createOllamaChatModel(OracleConfig oracleConfig) {
        try {
            String baseUrl = oracleConfig.baseUrl()
                    .orElseThrow(() -> new IllegalStateException("OLLAMA_BASE_URL must be configured when LLM_PROVIDER=ollama"));
            LOGGER.info("Using Ollama model '{}' via {}", oracleConfig.modelName(), baseUrl);
            return OllamaChatModel.builder()
                    .baseUrl(baseUrl)
                    .modelName(oracleConfig.modelName())
                    .temperature(0.0)
                    .timeout(Duration.ofMinutes(2))
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Ollama chat model", ex);
        }
    }

    private ChatModel createGeminiChatModel(OracleConfig oracleConfig, Secrets secrets) {
        String apiKey = secrets.geminiApiKey()
                .filter(value -> !value.isBlank())
                .orElseThrow(() -> new IllegalStateException("GEMINI_API_KEY must be provided when LLM_PROVIDER=gemini"));
        try {
            LOGGER.info("Using Gemini model '{}'", oracleConfig.modelName());
            return GoogleAiGeminiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(oracleConfig.modelName())
                    .temperature(0.0)
                    .timeout(Duration.ofMinutes(2))
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Gemini chat model", ex);
        }
    }
}
