package ai.sourcebridge.translator.config;

import ai.sourcebridge.translator.annotate.AnnotationMode;
import ai.sourcebridge.translator.lang.Language;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 *
 * @param input path of the source file, or {@code -} for standard input
 */
public record Config(
        Language source,
        Language target,
        String input,
        Optional<Path> output,
        AnnotationMode annotationMode,
        LogFormat logFormat,
        boolean verbose,
        AnnotatorConfig annotatorConfig,
        Secrets secrets
) {

    public static final String STANDARD_INPUT = "-";

    public Config {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("input must not be blank");
        }
        output = output == null ? Optional.empty() : output;
        annotationMode = annotationMode == null ? AnnotationMode.NONE : annotationMode;
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
        annotatorConfig = Objects.requireNonNull(annotatorConfig, "annotatorConfig");
        secrets = Objects.requireNonNull(secrets, "secrets");
    }

    public boolean readsStandardInput() {
        return STANDARD_INPUT.equals(input);
    }
}
