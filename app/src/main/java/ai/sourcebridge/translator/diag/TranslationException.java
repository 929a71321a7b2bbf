package ai.sourcebridge.translator.diag;

import java.util.List;

/**
 * Aborts a translation. Carries the ranked diagnostics, the primary one first.
 */
public abstract class TranslationException extends RuntimeException {

    private final List<Diagnostic> diagnostics;

    protected TranslationException(List<Diagnostic> diagnostics) {
        super(describe(diagnostics));
        this.diagnostics = DiagnosticsReporter.rank(diagnostics);
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    public Diagnostic primary() {
        return diagnostics.get(0);
    }

    private static String describe(List<Diagnostic> diagnostics) {
        if (diagnostics == null || diagnostics.isEmpty()) {
            throw new IllegalArgumentException("at least one diagnostic is required");
        }
        return DiagnosticsReporter.rank(diagnostics).get(0).toString();
    }
}
