package ai.sourcebridge.translator.emit;

import ai.sourcebridge.translator.lang.Language;
import java.util.Objects;

/**
 * Looks up the emitter of a target language.
 */
public final class Emitters {

    private static final Emitter CPP = new CppEmitter();
    private static final Emitter PYTHON = new PythonEmitter();

    private Emitters() {
    }

    public static Emitter forLanguage(Language language) {
        Objects.requireNonNull(language, "language");
        return switch (language) {
            case CPP -> CPP;
            case PYTHON -> PYTHON;
        };
    }
}
