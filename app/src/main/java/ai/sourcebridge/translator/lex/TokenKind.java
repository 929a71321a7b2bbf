package ai.sourcebridge.translator.lex;

/**
 * Classification of lexical tokens shared by both source languages.
 */
public enum TokenKind {
    KEYWORD,
    IDENTIFIER,
    INTEGER_LITERAL,
    FLOAT_LITERAL,
    STRING_LITERAL,
    FORMAT_STRING,
    OPERATOR,
    PUNCTUATION,
    COMMENT,
    DIRECTIVE,
    NEWLINE,
    BLOCK_START,
    BLOCK_END,
    END_OF_INPUT
}
