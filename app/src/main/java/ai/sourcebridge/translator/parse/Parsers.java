package ai.sourcebridge.translator.parse;

import ai.sourcebridge.translator.lang.Language;

/**
 * Selects the grammar for a source language. Each parse runs on a fresh parser instance.
 */
public final class Parsers {

    private static final GrammarParser CPP = tokens -> new CppParser(tokens).program();
    private static final GrammarParser PYTHON = tokens -> new PythonParser(tokens).program();

    private Parsers() {
    }

    public static GrammarParser forLanguage(Language language) {
        return switch (language) {
            case CPP -> CPP;
            case PYTHON -> PYTHON;
        };
    }
}
