package ai.sourcebridge.translator.translate;

import ai.sourcebridge.translator.diag.Diagnostic;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Either a translation or the reasons it failed, most important first.
 */
public record TranslationOutcome(Optional<TranslationResult> result,
                                 List<Diagnostic> diagnostics,
                                 boolean annotated) {

    public TranslationOutcome {
        result = result == null ? Optional.empty() : result;
        diagnostics = List.copyOf(Objects.requireNonNull(diagnostics, "diagnostics"));
        if (result.isPresent() == !diagnostics.isEmpty()) {
            throw new IllegalArgumentException("an outcome has either a result or diagnostics");
        }
    }

    public static TranslationOutcome success(TranslationResult result, boolean annotated) {
        return new TranslationOutcome(Optional.of(result), List.of(), annotated);
    }

    public static TranslationOutcome failure(List<Diagnostic> diagnostics) {
        return new TranslationOutcome(Optional.empty(), diagnostics, false);
    }

    public boolean succeeded() {
        return result.isPresent();
    }

    public Optional<Diagnostic> primaryDiagnostic() {
        return diagnostics.stream().findFirst();
    }
}
