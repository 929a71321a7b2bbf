package ai.sourcebridge.translator.annotate;

/**
 * Runtime exception used to propagate annotation failures.
 */
public class AnnotationException extends RuntimeException {

    public AnnotationException(String message, Throwable cause) {
        super(message, cause);
    }
}
