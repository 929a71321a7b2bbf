package ai.sourcebridge.translator.translate;

import ai.sourcebridge.translator.annotate.AnnotationMode;
import ai.sourcebridge.translator.annotate.AnnotationResult;
import ai.sourcebridge.translator.annotate.AnnotationService;
import ai.sourcebridge.translator.diag.TranslationException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Front door for callers that present results to a user: translation errors come back as ranked diagnostics instead
 * of exceptions, and a finished translation is optionally annotated.
 */
public class TranslationService {

    private static final Logger LOGGER = LoggerFactory.getLogger(TranslationService.class);
    static final String MDC_SOURCE_LANGUAGE = "sourceLanguage";
    static final String MDC_TARGET_LANGUAGE = "targetLanguage";

    private final CodeTranslator codeTranslator;
    private final AnnotationService annotationService;

    public TranslationService(CodeTranslator codeTranslator, AnnotationService annotationService) {
        this.codeTranslator = Objects.requireNonNull(codeTranslator, "codeTranslator");
        this.annotationService = Objects.requireNonNull(annotationService, "annotationService");
    }

    public TranslationOutcome translate(TranslationRequest request) {
        Objects.requireNonNull(request, "request");
        MDC.put(MDC_SOURCE_LANGUAGE, request.source().displayName());
        MDC.put(MDC_TARGET_LANGUAGE, request.target().displayName());
        try {
            LOGGER.info("Translating {} from {} to {}", request.sourceName(), request.source().displayName(),
                    request.target().displayName());
            TranslationResult result;
            try {
                result = codeTranslator.translate(request.sourceText(), request.source(), request.target());
            } catch (TranslationException ex) {
                LOGGER.info("Translation of {} stopped with {} diagnostics", request.sourceName(),
                        ex.diagnostics().size());
                return TranslationOutcome.failure(ex.diagnostics());
            }
            LOGGER.info("Translated {} ({} comments carried over)", request.sourceName(), result.comments().size());
            if (request.annotationMode() == AnnotationMode.NONE) {
                return TranslationOutcome.success(result, false);
            }
            AnnotationResult annotation = annotationService.annotate(result, request.target(),
                    request.annotationMode());
            annotation.fallbackReason()
                    .ifPresent(reason -> LOGGER.warn("Returning {} without annotation: {}", request.sourceName(), reason));
            return TranslationOutcome.success(annotation.translation(), annotation.annotated());
        } finally {
            MDC.remove(MDC_SOURCE_LANGUAGE);
            MDC.remove(MDC_TARGET_LANGUAGE);
        }
    }
}
