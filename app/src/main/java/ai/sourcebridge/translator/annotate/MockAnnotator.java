package ai.sourcebridge.translator.annotate;

import ai.sourcebridge.translator.lang.Language;

/**
 * Prepends a fixed marker comment; used for demos and tests.
 */
public class MockAnnotator implements Annotator {

    static final String MARKER = "[MOCK] annotated";

    @Override
    public String annotate(String code, Language language) {
        String marker = switch (language) {
            case CPP -> "// " + MARKER;
            case PYTHON -> "# " + MARKER;
        };
        return marker + "\n" + code;
    }
}
