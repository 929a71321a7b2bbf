package ai.sourcebridge.translator.config;

import ai.sourcebridge.translator.annotate.AnnotationMode;
import ai.sourcebridge.translator.cli.CliArguments;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_ANNOTATION_MODE = "SOURCEBRIDGE_ANNOTATION_MODE";
    static final String ENV_LLM_PROVIDER = "LLM_PROVIDER";
    static final String ENV_LLM_MODEL = "LLM_MODEL";
    static final String ENV_GEMINI_API_KEY = "GEMINI_API_KEY";
    static final String ENV_OLLAMA_BASE_URL = "OLLAMA_BASE_URL";
    static final String ENV_ANNOTATION_TIMEOUT_SECONDS = "ANNOTATION_TIMEOUT_SECONDS";
    static final String ENV_LLM_MAX_RETRY_ATTEMPTS = "LLM_MAX_RETRY_ATTEMPTS";
    static final String ENV_LLM_INITIAL_BACKOFF_SECONDS = "LLM_INITIAL_BACKOFF_SECONDS";
    static final String ENV_LLM_MAX_BACKOFF_SECONDS = "LLM_MAX_BACKOFF_SECONDS";
    static final String ENV_LLM_RETRY_JITTER_FACTOR = "LLM_RETRY_JITTER_FACTOR";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private static final String DEFAULT_OLLAMA_BASE_URL = "http://localhost:11434";
    private static final int DEFAULT_ANNOTATION_TIMEOUT_SECONDS = 30;
    private static final int DEFAULT_LLM_MAX_RETRY_ATTEMPTS = 3;
    private static final int DEFAULT_LLM_INITIAL_BACKOFF_SECONDS = 2;
    private static final int DEFAULT_LLM_MAX_BACKOFF_SECONDS = 30;
    private static final double DEFAULT_LLM_RETRY_JITTER_FACTOR = 0.3;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        AnnotationMode annotationMode = resolveAnnotationMode(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);

        Optional<String> geminiApiKey = environmentReader.get(ENV_GEMINI_API_KEY).filter(ConfigLoader::isNotBlank);

        LlmProvider provider = environmentReader.get(ENV_LLM_PROVIDER)
                .filter(ConfigLoader::isNotBlank)
                .map(LlmProvider::from)
                .orElse(LlmProvider.GEMINI);

        String modelName = environmentReader.get(ENV_LLM_MODEL)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .orElse(provider.defaultModel());

        Optional<String> baseUrl = Optional.empty();
        if (provider == LlmProvider.OLLAMA) {
            String value = environmentReader.get(ENV_OLLAMA_BASE_URL)
                    .filter(ConfigLoader::isNotBlank)
                    .map(String::trim)
                    .orElse(DEFAULT_OLLAMA_BASE_URL);
            baseUrl = Optional.of(value);
        }

        int timeoutSeconds = positiveInteger(ENV_ANNOTATION_TIMEOUT_SECONDS, DEFAULT_ANNOTATION_TIMEOUT_SECONDS);
        int maxRetryAttempts = positiveInteger(ENV_LLM_MAX_RETRY_ATTEMPTS, DEFAULT_LLM_MAX_RETRY_ATTEMPTS);
        int initialBackoffSeconds = positiveInteger(ENV_LLM_INITIAL_BACKOFF_SECONDS,
                DEFAULT_LLM_INITIAL_BACKOFF_SECONDS);
        int maxBackoffSeconds = positiveInteger(ENV_LLM_MAX_BACKOFF_SECONDS, DEFAULT_LLM_MAX_BACKOFF_SECONDS);
        double jitterFactor = environmentReader.get(ENV_LLM_RETRY_JITTER_FACTOR)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(value -> parseDouble(ENV_LLM_RETRY_JITTER_FACTOR, value))
                .orElse(DEFAULT_LLM_RETRY_JITTER_FACTOR);

        if (annotationMode == AnnotationMode.AI && provider == LlmProvider.GEMINI && geminiApiKey.isEmpty()) {
            throw new IllegalStateException("GEMINI_API_KEY must be provided when annotating with LLM_PROVIDER=gemini");
        }

        AnnotatorConfig annotatorConfig = new AnnotatorConfig(provider, modelName, baseUrl,
                Duration.ofSeconds(timeoutSeconds), maxRetryAttempts, initialBackoffSeconds, maxBackoffSeconds,
                jitterFactor);
        return new Config(arguments.from(), arguments.to(), arguments.input(), Optional.ofNullable(arguments.output()),
                annotationMode, logFormat, arguments.verbose(), annotatorConfig, new Secrets(geminiApiKey));
    }

    private AnnotationMode resolveAnnotationMode(CliArguments arguments) {
        AnnotationMode cliMode = arguments.annotationMode();
        if (cliMode != null) {
            return cliMode;
        }
        return environmentReader.get(ENV_ANNOTATION_MODE)
                .map(AnnotationMode::from)
                .orElse(AnnotationMode.NONE);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private int positiveInteger(String key, int defaultValue) {
        return environmentReader.get(key)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(value -> parsePositiveInteger(key, value))
                .orElse(defaultValue);
    }

    private static int parsePositiveInteger(String key, String raw) {
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

    private static double parseDouble(String key, String raw) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be a number: " + raw, ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
