package ai.sourcebridge.translator.cli;

import ai.sourcebridge.translator.annotate.AnnotationMode;
import ai.sourcebridge.translator.config.LogFormat;
import ai.sourcebridge.translator.lang.Language;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "sourcebridge", mixinStandardHelpOptions = true,
        description = "Translates programs between a C++ subset and a Python subset, keeping their comments")
public class CliArguments {

    @CommandLine.Option(names = "--from", required = true, converter = LanguageConverter.class, description = "Source language: cpp or python", paramLabel = "LANG")
    private Language from;

    @CommandLine.Option(names = "--to", required = true, converter = LanguageConverter.class, description = "Target language: cpp or python", paramLabel = "LANG")
    private Language to;

    @CommandLine.Option(names = "--annotate", converter = AnnotationModeConverter.class, description = "Comment the translation: ai, none, or mock", paramLabel = "MODE")
    private AnnotationMode annotationMode;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Write the translation to FILE instead of standard output", paramLabel = "FILE")
    private Path output;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log every pipeline stage")
    private boolean verbose;

    @CommandLine.Parameters(index = "0", description = "Source file, or - for standard input", paramLabel = "INPUT")
    private String input;

    public Language from() {
        return from;
    }

    public Language to() {
        return to;
    }

    public AnnotationMode annotationMode() {
        return annotationMode;
    }

    public Path output() {
        return output;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }

    public String input() {
        return input;
    }
}
