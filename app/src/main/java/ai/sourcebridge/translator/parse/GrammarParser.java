package ai.sourcebridge.translator.parse;

import ai.sourcebridge.translator.ist.Program;
import ai.sourcebridge.translator.lex.Token;
import java.util.List;

/**
 * Builds the tree for one token sequence.
 */
@FunctionalInterface
public interface GrammarParser {

    /**
     * @throws ai.sourcebridge.translator.diag.ParseException when the tokens are malformed or use a construct
     *         outside the supported subset
     */
    Program parse(List<Token> tokens);
}
