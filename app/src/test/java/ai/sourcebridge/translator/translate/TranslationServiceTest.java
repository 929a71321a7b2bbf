package ai.sourcebridge.translator.translate;

import static org.assertj.core.api.Assertions.assertThat;

import ai.sourcebridge.translator.annotate.AnnotationMode;
import ai.sourcebridge.translator.annotate.AnnotationService;
import ai.sourcebridge.translator.annotate.Annotator;
import ai.sourcebridge.translator.annotate.AnnotatorFactory;
import ai.sourcebridge.translator.annotate.MockAnnotator;
import ai.sourcebridge.translator.annotate.PassThroughAnnotator;
import ai.sourcebridge.translator.diag.ErrorKind;
import ai.sourcebridge.translator.lang.Language;
import ai.sourcebridge.translator.lex.SourcePosition;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class TranslationServiceTest {

    private final CodeTranslator codeTranslator = new CodeTranslator();
    private AnnotationService annotationService;

    @AfterEach
    void closeService() {
        if (annotationService != null) {
            annotationService.close();
        }
    }

    private TranslationService serviceWith(Annotator aiAnnotator) {
        AnnotatorFactory factory = new AnnotatorFactory(aiAnnotator, new PassThroughAnnotator(), new MockAnnotator());
        annotationService = new AnnotationService(factory, codeTranslator, Duration.ofSeconds(10));
        return new TranslationService(codeTranslator, annotationService);
    }

    @Test
    void returnsTranslationWithoutAnnotation() {
        TranslationService service = serviceWith((code, language) -> code);

        TranslationOutcome outcome = service.translate(new TranslationRequest("main.cpp",
                "int x = 5;\ncout << x << endl;\n", Language.CPP, Language.PYTHON));

        assertThat(outcome.succeeded()).isTrue();
        assertThat(outcome.annotated()).isFalse();
        assertThat(outcome.diagnostics()).isEmpty();
        assertThat(outcome.result()).map(TranslationResult::code).contains("x = 5\nprint(x)\n");
    }

    @Test
    void returnsDiagnosticsInsteadOfThrowing() {
        TranslationService service = serviceWith((code, language) -> code);

        TranslationOutcome outcome = service.translate(new TranslationRequest("main.cpp", "int x = y + 1;",
                Language.CPP, Language.PYTHON));

        assertThat(outcome.succeeded()).isFalse();
        assertThat(outcome.result()).isEmpty();
        assertThat(outcome.primaryDiagnostic()).hasValueSatisfying(diagnostic -> {
            assertThat(diagnostic.kind()).isEqualTo(ErrorKind.UNDECLARED_IDENTIFIER);
            assertThat(diagnostic.position()).isEqualTo(new SourcePosition(1, 9));
        });
    }

    @Test
    void annotatesWhenRequested() {
        TranslationService service = serviceWith((code, language) -> code);

        TranslationOutcome outcome = service.translate(new TranslationRequest("main.py", "x = 1\nprint(x)\n",
                Language.PYTHON, Language.PYTHON, AnnotationMode.MOCK));

        assertThat(outcome.annotated()).isTrue();
        assertThat(outcome.result()).map(TranslationResult::code)
                .hasValueSatisfying(code -> assertThat(code).startsWith("# [MOCK] annotated\n"));
    }

    @Test
    void keepsPlainTranslationWhenAnnotationFails() {
        TranslationService service = serviceWith((code, language) -> "x = 2\nprint(x)\n");

        TranslationOutcome outcome = service.translate(new TranslationRequest("main.py", "x = 1\nprint(x)\n",
                Language.PYTHON, Language.CPP, AnnotationMode.AI));

        assertThat(outcome.succeeded()).isTrue();
        assertThat(outcome.annotated()).isFalse();
        assertThat(outcome.result()).map(TranslationResult::code)
                .hasValueSatisfying(code -> assertThat(code).contains("int x = 1;"));
    }

    @Test
    void setsLanguagesInMdcOnlyWhileTranslating() {
        AtomicReference<String> seenSource = new AtomicReference<>();
        CodeTranslator recordingTranslator = new CodeTranslator() {
            @Override
            public TranslationResult translate(String sourceText, Language source, Language target) {
                seenSource.set(MDC.get("sourceLanguage") + "->" + MDC.get("targetLanguage"));
                return super.translate(sourceText, source, target);
            }
        };
        AnnotatorFactory factory = new AnnotatorFactory((code, language) -> code, new PassThroughAnnotator(),
                new MockAnnotator());
        annotationService = new AnnotationService(factory, recordingTranslator, Duration.ofSeconds(10));
        TranslationService service = new TranslationService(recordingTranslator, annotationService);

        service.translate(new TranslationRequest("main.py", "x = 1\n", Language.PYTHON, Language.CPP));

        assertThat(seenSource.get()).isEqualTo("Python->C++");
        assertThat(MDC.get("sourceLanguage")).isNull();
        assertThat(MDC.get("targetLanguage")).isNull();
    }
}
