package ai.sourcebridge.translator.diag;

import java.util.List;

/**
 * Raised by the normalizer when a structurally valid program breaks a declaration or typing rule.
 */
public class SemanticException extends TranslationException {

    public SemanticException(List<Diagnostic> diagnostics) {
        super(diagnostics);
    }
}
