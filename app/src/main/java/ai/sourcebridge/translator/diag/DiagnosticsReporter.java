package ai.sourcebridge.translator.diag;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Collects diagnostics for one translation and ranks them: source order first, then pipeline stage.
 */
public class DiagnosticsReporter {

    static final Comparator<Diagnostic> PRIORITY = Comparator
            .comparing(Diagnostic::position)
            .thenComparing(diagnostic -> diagnostic.kind().stage())
            .thenComparing(Diagnostic::kind);

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    public List<Diagnostic> ranked() {
        return rank(diagnostics);
    }

    public Optional<Diagnostic> primary() {
        return diagnostics.stream().min(PRIORITY);
    }

    public static List<Diagnostic> rank(List<Diagnostic> diagnostics) {
        List<Diagnostic> sorted = new ArrayList<>(diagnostics);
        sorted.sort(PRIORITY);
        return List.copyOf(sorted);
    }

    /**
     * Renders a diagnostic the way compilers do, e.g. {@code main.cpp:3:5: undeclared identifier: ...}.
     */
    public static String format(String sourceName, Diagnostic diagnostic) {
        return sourceName + ":" + diagnostic.position().line() + ":" + diagnostic.position().column()
                + ": " + diagnostic.kind().label() + ": " + diagnostic.message();
    }
}
