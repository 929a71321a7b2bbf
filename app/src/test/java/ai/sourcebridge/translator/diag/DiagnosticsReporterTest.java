package ai.sourcebridge.translator.diag;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.sourcebridge.translator.lex.SourcePosition;
import java.util.List;
import org.junit.jupiter.api.Test;

class DiagnosticsReporterTest {

    @Test
    void ranksBySourcePositionThenStage() {
        Diagnostic late = Diagnostic.of(ErrorKind.UNDECLARED_IDENTIFIER, new SourcePosition(3, 1), "z");
        Diagnostic semantic = Diagnostic.of(ErrorKind.TYPE_MISMATCH, new SourcePosition(1, 5), "x", "whole-number",
                "text");
        Diagnostic syntax = Diagnostic.of(ErrorKind.SYNTAX_ERROR, new SourcePosition(1, 5), "expected ';'");
        DiagnosticsReporter reporter = new DiagnosticsReporter();
        reporter.report(late);
        reporter.report(semantic);
        reporter.report(syntax);

        assertThat(reporter.hasErrors()).isTrue();
        assertThat(reporter.ranked()).containsExactly(syntax, semantic, late);
        assertThat(reporter.primary()).contains(syntax);
    }

    @Test
    void emptyReporterHasNoPrimary() {
        DiagnosticsReporter reporter = new DiagnosticsReporter();

        assertThat(reporter.hasErrors()).isFalse();
        assertThat(reporter.primary()).isEmpty();
    }

    @Test
    void formatsLikeACompiler() {
        Diagnostic diagnostic = Diagnostic.of(ErrorKind.UNDECLARED_IDENTIFIER, new SourcePosition(1, 9), "y");

        assertThat(DiagnosticsReporter.format("main.cpp", diagnostic))
                .isEqualTo("main.cpp:1:9: undeclared identifier: variable 'y' is used before it is declared");
        assertThat(diagnostic.toString())
                .isEqualTo("1:9: undeclared identifier: variable 'y' is used before it is declared");
    }

    @Test
    void exceptionsKeepRankedDiagnostics() {
        Diagnostic second = Diagnostic.of(ErrorKind.UNDECLARED_IDENTIFIER, new SourcePosition(2, 1), "b");
        Diagnostic first = Diagnostic.of(ErrorKind.REDECLARED_IDENTIFIER, new SourcePosition(1, 1), "a");

        SemanticException exception = new SemanticException(List.of(second, first));

        assertThat(exception.primary()).isEqualTo(first);
        assertThat(exception.diagnostics()).containsExactly(first, second);
        assertThat(exception).hasMessage(first.toString());
        assertThatThrownBy(() -> new SemanticException(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
