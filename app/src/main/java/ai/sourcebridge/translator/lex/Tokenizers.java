package ai.sourcebridge.translator.lex;

import ai.sourcebridge.translator.lang.Language;

/**
 * Selects the tokenizer for a source language.
 */
public final class Tokenizers {

    private static final Tokenizer CPP = new CppTokenizer();
    private static final Tokenizer PYTHON = new PythonTokenizer();

    private Tokenizers() {
    }

    public static Tokenizer forLanguage(Language language) {
        return switch (language) {
            case CPP -> CPP;
            case PYTHON -> PYTHON;
        };
    }
}
