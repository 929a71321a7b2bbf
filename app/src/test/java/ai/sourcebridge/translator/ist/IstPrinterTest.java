package ai.sourcebridge.translator.ist;

import static org.assertj.core.api.Assertions.assertThat;

import ai.sourcebridge.translator.lang.Language;
import ai.sourcebridge.translator.lex.SourcePosition;
import ai.sourcebridge.translator.translate.CodeTranslator;
import org.junit.jupiter.api.Test;

class IstPrinterTest {

    private final CodeTranslator translator = new CodeTranslator();

    @Test
    void printsStatementsAndCommentAnchors() {
        Program program = translator.check("int x = 1;  // one\nx = x + 2;\n", Language.CPP);

        assertThat(IstPrinter.print(program)).isEqualTo("""
                program
                  decl x int = int:1
                  comment trailing @0
                  assign x = (+ x:int int:2)
                """);
    }

    @Test
    void codeDumpIgnoresComments() {
        Program commented = translator.check("# start\nx = 1  # one\n", Language.PYTHON);
        Program plain = translator.check("x = 1\n", Language.PYTHON);

        assertThat(IstPrinter.print(commented)).isNotEqualTo(IstPrinter.print(plain));
        assertThat(IstPrinter.printCode(commented)).isEqualTo(IstPrinter.printCode(plain));
    }

    @Test
    void printsExpressionsWithoutPositions() {
        SourcePosition position = SourcePosition.START;
        Expression expression = new BinaryExpr(BinaryOperator.MULTIPLY,
                new Identifier("n", TypeTag.INT, position), Literal.floating("1.0", position), position);

        assertThat(IstPrinter.print(expression)).isEqualTo("(* n:int float:1.0)");
    }
}
