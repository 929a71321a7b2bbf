package ai.sourcebridge.translator.cli;

import ai.sourcebridge.translator.annotate.AnnotationService;
import ai.sourcebridge.translator.annotate.Annotator;
import ai.sourcebridge.translator.annotate.AnnotatorFactory;
import ai.sourcebridge.translator.annotate.ChatModelAnnotator;
import ai.sourcebridge.translator.annotate.MockAnnotator;
import ai.sourcebridge.translator.annotate.PassThroughAnnotator;
import ai.sourcebridge.translator.config.AnnotatorConfig;
import ai.sourcebridge.translator.config.Config;
import ai.sourcebridge.translator.config.ConfigLoader;
import ai.sourcebridge.translator.config.Secrets;
import ai.sourcebridge.translator.config.SystemEnvironmentReader;
import ai.sourcebridge.translator.diag.Diagnostic;
import ai.sourcebridge.translator.diag.DiagnosticsReporter;
import ai.sourcebridge.translator.logging.LoggingConfigurator;
import ai.sourcebridge.translator.translate.CodeTranslator;
import ai.sourcebridge.translator.translate.TranslationOutcome;
import ai.sourcebridge.translator.translate.TranslationRequest;
import ai.sourcebridge.translator.translate.TranslationResult;
import ai.sourcebridge.translator.translate.TranslationService;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and translation pipeline.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_TRANSLATION_FAILED = 1;
    static final String STDIN_NAME = "<stdin>";

    private final ConfigLoader configLoader;
    private final CodeTranslator codeTranslator;
    private final InputStream in;
    private final PrintWriter out;
    private final PrintWriter err;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), System.in,
                new PrintWriter(System.out, true, StandardCharsets.UTF_8),
                new PrintWriter(System.err, true, StandardCharsets.UTF_8));
    }

    CliApplication(ConfigLoader configLoader, InputStream in, PrintWriter out, PrintWriter err) {
        this.configLoader = configLoader;
        this.codeTranslator = new CodeTranslator();
        this.in = in;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        commandLine.setOut(out);
        commandLine.setErr(err);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            err.println(ex.getMessage());
            commandLine.usage(err);
            err.flush();
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(out);
            out.flush();
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(out);
            out.flush();
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException | IllegalStateException ex) {
            err.println(ex.getMessage());
            err.flush();
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat(), config.verbose());
        LOGGER.info("Translating {} from {} to {} (annotation {})", config.input(), config.source().displayName(),
                config.target().displayName(), config.annotationMode());

        String sourceName = config.readsStandardInput() ? STDIN_NAME : config.input();
        String sourceText;
        try {
            sourceText = config.readsStandardInput()
                    ? new String(in.readAllBytes(), StandardCharsets.UTF_8)
                    : Files.readString(Path.of(config.input()), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            LOGGER.debug("Reading {} failed", sourceName, ex);
            err.println("cannot read " + sourceName + ": " + ex.getMessage());
            err.flush();
            return EXIT_TRANSLATION_FAILED;
        }

        TranslationOutcome outcome;
        try (AnnotationService annotationService = createAnnotationService(config)) {
            TranslationService translationService = new TranslationService(codeTranslator, annotationService);
            outcome = translationService.translate(new TranslationRequest(sourceName, sourceText, config.source(),
                    config.target(), config.annotationMode()));
        }

        if (!outcome.succeeded()) {
            for (Diagnostic diagnostic : outcome.diagnostics()) {
                err.println(DiagnosticsReporter.format(sourceName, diagnostic));
            }
            err.flush();
            return EXIT_TRANSLATION_FAILED;
        }
        TranslationResult result = outcome.result().orElseThrow();
        return write(result.code(), config);
    }

    private int write(String code, Config config) {
        if (config.output().isEmpty()) {
            out.print(code);
            out.flush();
            return EXIT_OK;
        }
        Path target = config.output().get();
        try {
            Files.writeString(target, code, StandardCharsets.UTF_8);
            LOGGER.info("Wrote {}", target);
            return EXIT_OK;
        } catch (IOException ex) {
            LOGGER.debug("Writing {} failed", target, ex);
            err.println("cannot write " + target + ": " + ex.getMessage());
            err.flush();
            return EXIT_TRANSLATION_FAILED;
        }
    }

    private AnnotationService createAnnotationService(Config config) {
        AnnotatorConfig annotatorConfig = config.annotatorConfig();
        AnnotatorFactory factory = new AnnotatorFactory(() -> createAiAnnotator(config), new PassThroughAnnotator(),
                new MockAnnotator());
        return new AnnotationService(factory, codeTranslator, annotatorConfig.timeout(),
                annotatorConfig.maxRetryAttempts(),
                annotatorConfig.initialBackoffSeconds(),
                annotatorConfig.maxBackoffSeconds(),
                annotatorConfig.retryJitterFactor());
    }

    private Annotator createAiAnnotator(Config config) {
        AnnotatorConfig annotatorConfig = config.annotatorConfig();
        ChatModel chatModel = switch (annotatorConfig.provider()) {
            case OLLAMA -> createOllamaChatModel(annotatorConfig);
            case GEMINI -> createGeminiChatModel(annotatorConfig, config.secrets());
        };
        return new ChatModelAnnotator(chatModel, annotatorConfig.provider().name(), annotatorConfig.modelName());
    }

    private ChatModel createOllamaChatModel(AnnotatorConfig annotatorConfig) {
        try {
            String baseUrl = annotatorConfig.baseUrl()
                    .orElseThrow(() -> new IllegalStateException("OLLAMA_BASE_URL must be configured when LLM_PROVIDER=ollama"));
            LOGGER.info("Using Ollama model '{}' via {}", annotatorConfig.modelName(), baseUrl);
            return OllamaChatModel.builder()
                    .baseUrl(baseUrl)
                    .modelName(annotatorConfig.modelName())
                    .temperature(0.1)
                    .timeout(annotatorConfig.timeout())
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Ollama chat model", ex);
        }
    }

    private ChatModel createGeminiChatModel(AnnotatorConfig annotatorConfig, Secrets secrets) {
        String apiKey = secrets.geminiApiKey()
                .filter(value -> !value.isBlank())
                .orElseThrow(() -> new IllegalStateException("GEMINI_API_KEY must be provided when LLM_PROVIDER=gemini"));
        try {
            LOGGER.info("Using Gemini model '{}'", annotatorConfig.modelName());
            return GoogleAiGeminiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(annotatorConfig.modelName())
                    .temperature(0.1)
                    .timeout(annotatorConfig.timeout().plus(Duration.ofSeconds(5)))
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Gemini chat model", ex);
        }
    }
}
