package ai.sourcebridge.translator.annotate;

import ai.sourcebridge.translator.lang.Language;

/**
 * Leaves the code as it is without invoking remote APIs.
 */
public class PassThroughAnnotator implements Annotator {

    @Override
    public String annotate(String code, Language language) {
        return code == null ? "" : code;
    }
}
