package ai.policy.revision.cli;

import ai.policy.revision.config.LogFormat;
import ai.policy.revision.grammar.GrammarMode;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "policy-revision", mixinStandardHelpOptions = true,
        description = "Applies an operation list to a .docx as tracked changes and comments")
public class CliArguments {

    @CommandLine.Option(names = "--in", description = "Source .docx document", paramLabel = "FILE")
    private Path input;

    @CommandLine.Option(names = "--operations", description = "Operation list (JSON)", paramLabel = "FILE")
    private Path operations;

    @CommandLine.Option(names = "--out", description = "Revised .docx to write", paramLabel = "FILE")
    private Path output;

    @CommandLine.Option(names = "--manifest", description = "Outcome manifest (default: <out>.manifest.json)", paramLabel = "FILE")
    private Path manifest;

    @CommandLine.Option(names = "--grammar-mode", description = "Grammar oracle: rules, llm or off", converter = GrammarModeConverter.class)
    private GrammarMode grammarMode;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = "--author", description = "Author recorded on revisions and comments", paramLabel = "NAME")
    private String author;

    @CommandLine.Option(names = "--strict", description = "Exit non-zero when any operation failed or was invalid")
    private boolean strict;

    @CommandLine.Option(names = "--no-clean-highlighting", description = "Keep placeholder highlighting")
    private boolean noCleanHighlighting;

    public Path input() {
        return input;
    }

    public Path operations() {
        return operations;
    }

    public Path output() {
        return output;
    }

    public Path manifest() {
        return manifest;
    }

    public GrammarMode grammarMode() {
        return grammarMode;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public String author() {
        return author;
    }

    public boolean strict() {
        return strict;
    }

    public boolean noCleanHighlighting() {
        return noCleanHighlighting;
    }
}
