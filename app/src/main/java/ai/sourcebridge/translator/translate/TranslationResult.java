package ai.sourcebridge.translator.translate;

import java.util.List;
import java.util.Objects;

/**
 * Target source text of one translation and where its comments ended up.
 */
public record TranslationResult(String code, List<TranslatedComment> comments) {

    public TranslationResult {
        Objects.requireNonNull(code, "code");
        comments = List.copyOf(Objects.requireNonNull(comments, "comments"));
    }
}
