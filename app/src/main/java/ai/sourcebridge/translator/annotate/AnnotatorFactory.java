package ai.sourcebridge.translator.annotate;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Provides annotator instances based on the requested mode. The model-backed annotator is created on first use so
 * that runs without AI annotation need no credentials.
 */
public class AnnotatorFactory {

    private final Supplier<Annotator> aiAnnotatorSupplier;
    private final Annotator passThroughAnnotator;
    private final Annotator mockAnnotator;
    private Annotator aiAnnotator;

    public AnnotatorFactory(Annotator aiAnnotator, Annotator passThroughAnnotator, Annotator mockAnnotator) {
        this(supplierOf(Objects.requireNonNull(aiAnnotator, "aiAnnotator")), passThroughAnnotator, mockAnnotator);
    }

    public AnnotatorFactory(Supplier<Annotator> aiAnnotatorSupplier,
                            Annotator passThroughAnnotator,
                            Annotator mockAnnotator) {
        this.aiAnnotatorSupplier = Objects.requireNonNull(aiAnnotatorSupplier, "aiAnnotatorSupplier");
        this.passThroughAnnotator = Objects.requireNonNull(passThroughAnnotator, "passThroughAnnotator");
        this.mockAnnotator = Objects.requireNonNull(mockAnnotator, "mockAnnotator");
    }

    public synchronized Annotator select(AnnotationMode mode) {
        return switch (mode) {
            case AI -> aiAnnotator();
            case NONE -> passThroughAnnotator;
            case MOCK -> mockAnnotator;
        };
    }

    private Annotator aiAnnotator() {
        if (aiAnnotator == null) {
            aiAnnotator = Objects.requireNonNull(aiAnnotatorSupplier.get(), "aiAnnotator");
        }
        return aiAnnotator;
    }

    private static Supplier<Annotator> supplierOf(Annotator annotator) {
        return () -> annotator;
    }
}
