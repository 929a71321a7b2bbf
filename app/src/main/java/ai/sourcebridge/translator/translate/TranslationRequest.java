package ai.sourcebridge.translator.translate;

import ai.sourcebridge.translator.annotate.AnnotationMode;
import ai.sourcebridge.translator.lang.Language;
import java.util.Objects;

/**
 * One user request: the source text, its name for diagnostics, both languages and whether to add explanatory comments.
 */
public record TranslationRequest(String sourceName,
                                 String sourceText,
                                 Language source,
                                 Language target,
                                 AnnotationMode annotationMode) {

    public TranslationRequest {
        Objects.requireNonNull(sourceName, "sourceName");
        Objects.requireNonNull(sourceText, "sourceText");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        annotationMode = annotationMode == null ? AnnotationMode.NONE : annotationMode;
    }

    public TranslationRequest(String sourceName, String sourceText, Language source, Language target) {
        this(sourceName, sourceText, source, target, AnnotationMode.NONE);
    }
}
