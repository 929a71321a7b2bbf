package ai.sourcebridge.translator.annotate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.sourcebridge.translator.lang.Language;
import ai.sourcebridge.translator.lex.CommentPlacement;
import ai.sourcebridge.translator.translate.CodeTranslator;
import ai.sourcebridge.translator.translate.TranslatedComment;
import ai.sourcebridge.translator.translate.TranslationResult;
import dev.langchain4j.exception.RateLimitException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class AnnotationServiceTest {

    private static final String PLAIN = "x = 1\nprint(x)\n";

    private final CodeTranslator codeTranslator = new CodeTranslator();
    private AnnotationService service;

    @AfterEach
    void closeService() {
        if (service != null) {
            service.close();
        }
    }

    private TranslationResult plainTranslation() {
        return codeTranslator.translate("int x = 1;\ncout << x << endl;", Language.CPP, Language.PYTHON);
    }

    private AnnotationService serviceFor(Annotator annotator, Duration timeout, int attempts, int initialBackoff,
                                         int maxBackoff, double jitter) {
        AnnotatorFactory factory = new AnnotatorFactory(annotator, new PassThroughAnnotator(), new MockAnnotator());
        service = new AnnotationService(factory, codeTranslator, timeout, attempts, initialBackoff, maxBackoff, jitter);
        return service;
    }

    private AnnotationService serviceFor(Annotator annotator) {
        return serviceFor(annotator, Duration.ofSeconds(30), 5, 1, 60, 0.1);
    }

    @Test
    void acceptsCommentsThatKeepTheProgram() {
        AnnotationService annotationService = serviceFor((code, language) -> "# set x\n" + code);

        AnnotationResult result = annotationService.annotate(plainTranslation(), Language.PYTHON, AnnotationMode.AI);

        assertThat(plainTranslation().code()).isEqualTo(PLAIN);
        assertThat(result.annotated()).isTrue();
        assertThat(result.fallbackReason()).isEmpty();
        assertThat(result.translation().code()).isEqualTo("# set x\n" + PLAIN);
        assertThat(result.translation().comments())
                .containsExactly(new TranslatedComment("set x", CommentPlacement.LEADING, 1));
    }

    @Test
    void fallsBackWhenAnnotationChangesTheProgram() {
        AnnotationService annotationService = serviceFor((code, language) -> "x = 2\nprint(x)\n");

        AnnotationResult result = annotationService.annotate(plainTranslation(), Language.PYTHON, AnnotationMode.AI);

        assertThat(result.annotated()).isFalse();
        assertThat(result.translation().code()).isEqualTo(PLAIN);
        assertThat(result.fallbackReason()).contains("annotation changed the program");
    }

    @Test
    void fallsBackWhenAnnotatedCodeDoesNotTranslate() {
        AnnotationService annotationService = serviceFor((code, language) -> "x = (\n");

        AnnotationResult result = annotationService.annotate(plainTranslation(), Language.PYTHON, AnnotationMode.AI);

        assertThat(result.annotated()).isFalse();
        assertThat(result.translation().code()).isEqualTo(PLAIN);
        assertThat(result.fallbackReason()).hasValueSatisfying(
                reason -> assertThat(reason).startsWith("annotated code does not translate"));
    }

    @Test
    void fallsBackWhenAnnotatorTimesOut() {
        Annotator slowAnnotator = (code, language) -> {
            try {
                Thread.sleep(5000);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            return code;
        };
        AnnotationService annotationService = serviceFor(slowAnnotator, Duration.ofSeconds(1), 1, 1, 1, 0.0);

        long startTime = System.currentTimeMillis();
        AnnotationResult result = annotationService.annotate(plainTranslation(), Language.PYTHON, AnnotationMode.AI);
        long duration = System.currentTimeMillis() - startTime;

        assertThat(result.annotated()).isFalse();
        assertThat(result.fallbackReason()).contains("annotation timed out after 1 seconds");
        assertThat(duration).isLessThan(4000);
    }

    @Test
    void timedOutAnnotationDoesNotDelayTheNextOne() {
        AtomicInteger callCount = new AtomicInteger(0);
        Annotator firstCallHangs = (code, language) -> {
            if (callCount.incrementAndGet() == 1) {
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                }
            }
            return "# set x\n" + code;
        };
        AnnotationService annotationService = serviceFor(firstCallHangs, Duration.ofSeconds(1), 1, 1, 1, 0.0);

        AnnotationResult first = annotationService.annotate(plainTranslation(), Language.PYTHON, AnnotationMode.AI);
        long startTime = System.currentTimeMillis();
        AnnotationResult second = annotationService.annotate(plainTranslation(), Language.PYTHON, AnnotationMode.AI);
        long duration = System.currentTimeMillis() - startTime;

        assertThat(first.fallbackReason()).contains("annotation timed out after 1 seconds");
        assertThat(second.annotated()).isTrue();
        assertThat(second.fallbackReason()).isEmpty();
        assertThat(second.translation().code()).isEqualTo("# set x\n" + PLAIN);
        assertThat(duration).isLessThan(3000);
        assertThat(callCount.get()).isEqualTo(2);
    }

    @Test
    void retriesOnRateLimitExceptionAndEventuallySucceeds() {
        AtomicInteger attemptCount = new AtomicInteger(0);
        Annotator rateLimitedAnnotator = (code, language) -> {
            int attempt = attemptCount.incrementAndGet();
            if (attempt < 3) {
                throw new AnnotationException("Rate limited", new RateLimitException("429 Too Many Requests"));
            }
            return "# set x\n" + code;
        };
        AnnotationService annotationService = serviceFor(rateLimitedAnnotator, Duration.ofSeconds(30), 6, 1, 60, 0.1);

        AnnotationResult result = annotationService.annotate(plainTranslation(), Language.PYTHON, AnnotationMode.AI);

        assertThat(result.annotated()).isTrue();
        assertThat(attemptCount.get()).isEqualTo(3);
    }

    @Test
    void fallsBackAfterMaxRetryAttemptsOnRateLimitException() {
        AtomicInteger attemptCount = new AtomicInteger(0);
        Annotator alwaysRateLimited = (code, language) -> {
            attemptCount.incrementAndGet();
            throw new AnnotationException("Rate limited", new RateLimitException("429 Too Many Requests"));
        };
        AnnotationService annotationService = serviceFor(alwaysRateLimited, Duration.ofSeconds(30), 3, 1, 60, 0.1);

        AnnotationResult result = annotationService.annotate(plainTranslation(), Language.PYTHON, AnnotationMode.AI);

        assertThat(result.annotated()).isFalse();
        assertThat(result.translation().code()).isEqualTo(PLAIN);
        assertThat(result.fallbackReason()).contains("Rate limited");
        assertThat(attemptCount.get()).isEqualTo(3);
    }

    @Test
    void retriesOn429ErrorMessage() {
        AtomicInteger attemptCount = new AtomicInteger(0);
        Annotator http429Annotator = (code, language) -> {
            if (attemptCount.incrementAndGet() < 2) {
                throw new AnnotationException("HTTP 429: Too Many Requests", null);
            }
            return code;
        };

        AnnotationResult result = serviceFor(http429Annotator)
                .annotate(plainTranslation(), Language.PYTHON, AnnotationMode.AI);

        assertThat(result.fallbackReason()).isEmpty();
        assertThat(attemptCount.get()).isEqualTo(2);
    }

    @Test
    void retriesOnResourceExhaustedError() {
        AtomicInteger attemptCount = new AtomicInteger(0);
        Annotator exhaustedAnnotator = (code, language) -> {
            if (attemptCount.incrementAndGet() < 2) {
                throw new AnnotationException("RESOURCE_EXHAUSTED: Quota exceeded", null);
            }
            return code;
        };

        AnnotationResult result = serviceFor(exhaustedAnnotator)
                .annotate(plainTranslation(), Language.PYTHON, AnnotationMode.AI);

        assertThat(result.fallbackReason()).isEmpty();
        assertThat(attemptCount.get()).isEqualTo(2);
    }

    @Test
    void usesProviderRetryAfterWhenAvailable() {
        AtomicInteger attemptCount = new AtomicInteger(0);
        Annotator retryAfterAnnotator = (code, language) -> {
            if (attemptCount.incrementAndGet() < 2) {
                throw new AnnotationException("Rate limited, retry in 1s", new RateLimitException("429"));
            }
            return code;
        };
        AnnotationService annotationService = serviceFor(retryAfterAnnotator, Duration.ofSeconds(30), 5, 10, 60, 0.0);

        long startTime = System.currentTimeMillis();
        AnnotationResult result = annotationService.annotate(plainTranslation(), Language.PYTHON, AnnotationMode.AI);
        long duration = System.currentTimeMillis() - startTime;

        assertThat(result.fallbackReason()).isEmpty();
        assertThat(attemptCount.get()).isEqualTo(2);
        assertThat(duration).isLessThan(5000);
    }

    @Test
    void doesNotRetryOnOtherErrors() {
        AtomicInteger attemptCount = new AtomicInteger(0);
        Annotator failingAnnotator = (code, language) -> {
            attemptCount.incrementAndGet();
            throw new AnnotationException("Some other error", null);
        };

        AnnotationResult result = serviceFor(failingAnnotator)
                .annotate(plainTranslation(), Language.PYTHON, AnnotationMode.AI);

        assertThat(result.annotated()).isFalse();
        assertThat(result.fallbackReason()).contains("Some other error");
        assertThat(attemptCount.get()).isEqualTo(1);
    }

    @Test
    void noneModeReturnsTranslationUntouched() {
        AtomicInteger attemptCount = new AtomicInteger(0);
        AnnotationService annotationService = serviceFor((code, language) -> {
            attemptCount.incrementAndGet();
            return code;
        });
        TranslationResult translation = plainTranslation();

        AnnotationResult result = annotationService.annotate(translation, Language.PYTHON, AnnotationMode.NONE);

        assertThat(result).isEqualTo(AnnotationResult.unchanged(translation));
        assertThat(attemptCount.get()).isZero();
    }

    @Test
    void mockModePrependsMarkerComment() {
        AnnotationService annotationService = serviceFor(new PassThroughAnnotator());
        TranslationResult translation = codeTranslator.translate("x = 1\nprint(x)\n", Language.PYTHON, Language.CPP);

        AnnotationResult result = annotationService.annotate(translation, Language.CPP, AnnotationMode.MOCK);

        assertThat(result.annotated()).isTrue();
        assertThat(result.translation().code()).contains("    // " + MockAnnotator.MARKER + "\n    int x = 1;");
        assertThat(result.translation().comments()).extracting(TranslatedComment::text)
                .containsExactly(MockAnnotator.MARKER);
    }

    @Test
    void unavailableAnnotatorBecomesFallback() {
        AnnotatorFactory factory = new AnnotatorFactory(() -> {
            throw new IllegalStateException("GEMINI_API_KEY must be provided");
        }, new PassThroughAnnotator(), new MockAnnotator());
        service = new AnnotationService(factory, codeTranslator, Duration.ofSeconds(5));

        AnnotationResult result = service.annotate(plainTranslation(), Language.PYTHON, AnnotationMode.AI);

        assertThat(result.annotated()).isFalse();
        assertThat(result.fallbackReason()).contains("GEMINI_API_KEY must be provided");
    }

    @Test
    void validatesRetryConfiguration() {
        AnnotatorFactory factory = new AnnotatorFactory(new MockAnnotator(), new PassThroughAnnotator(),
                new MockAnnotator());
        Duration timeout = Duration.ofSeconds(5);

        assertThatThrownBy(() -> new AnnotationService(factory, codeTranslator, timeout, 0, 1, 60, 0.3))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxRetryAttempts");

        assertThatThrownBy(() -> new AnnotationService(factory, codeTranslator, timeout, 6, 0, 60, 0.3))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("initialBackoffSeconds");

        assertThatThrownBy(() -> new AnnotationService(factory, codeTranslator, timeout, 6, 10, 5, 0.3))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxBackoffSeconds");

        assertThatThrownBy(() -> new AnnotationService(factory, codeTranslator, timeout, 6, 1, 60, 1.5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("jitterFactor");

        assertThatThrownBy(() -> new AnnotationService(factory, codeTranslator, Duration.ZERO, 6, 1, 60, 0.3))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("timeout");
    }
}
