package ai.sourcebridge.translator.annotate;

import ai.sourcebridge.translator.lang.Language;

/**
 * Adds explanatory comments to generated code without touching the code itself.
 */
public interface Annotator {

    /**
     * @throws AnnotationException when the collaborator fails or is unreachable
     */
    String annotate(String code, Language language);
}
