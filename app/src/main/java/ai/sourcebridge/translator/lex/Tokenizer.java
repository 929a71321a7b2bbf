package ai.sourcebridge.translator.lex;

import java.util.List;

/**
 * Converts raw source text into a flat token sequence terminated by {@link TokenKind#END_OF_INPUT}.
 * Implementations are pure and may be shared between threads.
 */
public interface Tokenizer {

    List<Token> tokenize(String source);
}
