package ai.sourcebridge.translator.lex;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import ai.sourcebridge.translator.diag.ErrorKind;
import ai.sourcebridge.translator.diag.LexException;
import java.util.List;
import org.junit.jupiter.api.Test;

class CppTokenizerTest {

    private final CppTokenizer tokenizer = new CppTokenizer();

    @Test
    void splitsDeclarationIntoTokens() {
        List<Token> tokens = tokenizer.tokenize("int x = 42;");

        assertThat(tokens).extracting(Token::kind).containsExactly(
                TokenKind.KEYWORD, TokenKind.IDENTIFIER, TokenKind.OPERATOR, TokenKind.INTEGER_LITERAL,
                TokenKind.PUNCTUATION, TokenKind.END_OF_INPUT);
        assertThat(tokens).extracting(Token::text).startsWith("int", "x", "=", "42", ";");
        assertThat(tokens.get(3).position()).isEqualTo(new SourcePosition(1, 9));
    }

    @Test
    void prefersLongestOperator() {
        List<Token> tokens = tokenizer.tokenize("cout << i++ <= 3;");

        assertThat(tokens).filteredOn(token -> token.kind() == TokenKind.OPERATOR)
                .extracting(Token::text)
                .containsExactly("<<", "++", "<=");
    }

    @Test
    void distinguishesLeadingAndTrailingComments() {
        List<Token> tokens = tokenizer.tokenize("int x = 1; // note\n// above\nx = 2;\n");

        List<Token> comments = tokens.stream().filter(token -> token.kind() == TokenKind.COMMENT).toList();
        assertThat(comments).extracting(Token::text).containsExactly("note", "above");
        assertThat(comments).extracting(Token::placement)
                .containsExactly(CommentPlacement.TRAILING, CommentPlacement.LEADING);
    }

    @Test
    void cleansBlockCommentLines() {
        List<Token> tokens = tokenizer.tokenize("/*\n * first\n * second\n */\nint x;");

        assertThat(tokens.get(0).kind()).isEqualTo(TokenKind.COMMENT);
        assertThat(tokens.get(0).text()).isEqualTo("first\nsecond");
        assertThat(tokens.get(0).placement()).isEqualTo(CommentPlacement.LEADING);
    }

    @Test
    void keepsDirectivesWhole() {
        List<Token> tokens = tokenizer.tokenize("#include <iostream>\nusing namespace std;");

        assertThat(tokens.get(0).kind()).isEqualTo(TokenKind.DIRECTIVE);
        assertThat(tokens.get(0).text()).isEqualTo("include <iostream>");
        assertThat(tokens.get(1).isKeyword("using")).isTrue();
    }

    @Test
    void decodesStringEscapes() {
        List<Token> tokens = tokenizer.tokenize("cout << \"a\\tb\\n\";");

        assertThat(tokens.get(2).kind()).isEqualTo(TokenKind.STRING_LITERAL);
        assertThat(tokens.get(2).text()).isEqualTo("a\tb\n");
    }

    @Test
    void readsFloatingLiterals() {
        List<Token> tokens = tokenizer.tokenize("double d = 2.5e3 + .5;");

        assertThat(tokens).filteredOn(token -> token.kind() == TokenKind.FLOAT_LITERAL)
                .extracting(Token::text)
                .containsExactly("2.5e3", ".5");
    }

    @Test
    void rejectsUnexpectedCharacterWithPosition() {
        LexException error = catchThrowableOfType(() -> tokenizer.tokenize("int x = 1;\nx = $;"), LexException.class);

        assertThat(error.primary().kind()).isEqualTo(ErrorKind.LEX_ERROR);
        assertThat(error.primary().position()).isEqualTo(new SourcePosition(2, 5));
        assertThat(error.unexpectedCharacter()).isEqualTo("$");
    }

    @Test
    void rejectsUnclosedBlockComment() {
        LexException error = catchThrowableOfType(() -> tokenizer.tokenize("int x;\n/* never closed"),
                LexException.class);

        assertThat(error.primary().position()).isEqualTo(new SourcePosition(2, 1));
        assertThat(error.primary().message()).contains("never closed");
    }

    @Test
    void rejectsUnterminatedText() {
        LexException error = catchThrowableOfType(() -> tokenizer.tokenize("cout << \"open;\n"), LexException.class);

        assertThat(error.primary().position()).isEqualTo(new SourcePosition(1, 9));
    }

    @Test
    void rejectsLeadingZeroInWholeNumber() {
        LexException error = catchThrowableOfType(() -> tokenizer.tokenize("int x = 007;"), LexException.class);

        assertThat(error.primary().message()).contains("cannot start with 0");
    }
}
