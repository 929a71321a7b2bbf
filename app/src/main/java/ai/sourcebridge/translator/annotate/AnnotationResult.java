package ai.sourcebridge.translator.annotate;

import ai.sourcebridge.translator.translate.TranslationResult;
import java.util.Objects;
import java.util.Optional;

/**
 * The translation handed back by {@link AnnotationService}: annotated, or the original with the reason it was kept.
 */
public record AnnotationResult(TranslationResult translation, boolean annotated, Optional<String> fallbackReason) {

    public AnnotationResult {
        Objects.requireNonNull(translation, "translation");
        fallbackReason = fallbackReason == null ? Optional.empty() : fallbackReason;
    }

    public static AnnotationResult annotated(TranslationResult translation) {
        return new AnnotationResult(translation, true, Optional.empty());
    }

    public static AnnotationResult unchanged(TranslationResult translation) {
        return new AnnotationResult(translation, false, Optional.empty());
    }

    public static AnnotationResult fallback(TranslationResult translation, String reason) {
        return new AnnotationResult(translation, false, Optional.of(reason));
    }
}
