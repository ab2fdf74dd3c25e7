package ai.policy.revision.cli;

import ai.policy.revision.grammar.GrammarMode;
import picocli.CommandLine;

public class GrammarModeConverter implements CommandLine.ITypeConverter<GrammarMode> {

    @Override
    public GrammarMode convert(String value) {
        return GrammarMode.from(value);
    }
}
