package ai.sourcebridge.translator.parse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import ai.sourcebridge.translator.diag.ErrorKind;
import ai.sourcebridge.translator.diag.ParseException;
import ai.sourcebridge.translator.ist.IstPrinter;
import ai.sourcebridge.translator.ist.Program;
import ai.sourcebridge.translator.lang.Language;
import ai.sourcebridge.translator.lex.SourcePosition;
import ai.sourcebridge.translator.lex.Tokenizers;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class PythonParserTest {

    private static Program parse(String source) {
        return Parsers.forLanguage(Language.PYTHON)
                .parse(Tokenizers.forLanguage(Language.PYTHON).tokenize(source));
    }

    private static ParseException rejection(String source) {
        return catchThrowableOfType(() -> parse(source), ParseException.class);
    }

    @Test
    void keepsBindingsAndReadsAsWritten() {
        Program program = parse("""
                x = 1
                y: float = 2
                name = input("Name: ")
                n = int(input())
                """);

        assertThat(IstPrinter.print(program)).isEqualTo("""
                program
                  bind x = int:1
                  decl y float = int:2
                  read name string prompt "Name: "
                  read n int
                """);
    }

    @Test
    void splitsAnnotatedReadIntoDeclarationAndRead() {
        Program program = parse("flag: bool = bool(int(input()))\n");

        assertThat(IstPrinter.print(program)).isEqualTo("""
                program
                  decl flag bool
                  read flag bool
                """);
    }

    @Test
    void keepsRangeLoopArguments() {
        Program program = parse("""
                for i in range(3):
                    print(i)
                for j in range(10, 0, -2):
                    print(j)
                """);

        assertThat(IstPrinter.print(program)).isEqualTo("""
                program
                  range i int:0 int:3
                    print [i:inferred] newline
                  range j int:10 int:0 (- int:2)
                    print [j:inferred] newline
                """);
    }

    @Test
    void expandsPrintSeparatorAndEnd() {
        Program program = parse("""
                print(a, b)
                print("a", x, sep="", end="")
                print(a, b, sep=", ", end="!\\n")
                print()
                """);

        assertThat(IstPrinter.print(program)).isEqualTo("""
                program
                  print [a:inferred string:" " b:inferred] newline
                  print [string:"a" x:inferred]
                  print [a:inferred string:", " b:inferred string:"!"] newline
                  print [] newline
                """);
    }

    @Test
    void splitsFormattedTextIntoItems() {
        Program program = parse("print(f\"x={x}, next={x + 1}!\")\nprint(f\"{{x}}\")\n");

        assertThat(IstPrinter.print(program)).isEqualTo("""
                program
                  print [string:"x=" x:inferred string:", next=" (+ x:inferred int:1) string:"!"] newline
                  print [string:"{x}"] newline
                """);
    }

    @Test
    void mapsDivisionOperators() {
        Program program = parse("q = a / b + a // b - a % b\n");

        assertThat(IstPrinter.print(program)).isEqualTo("""
                program
                  bind q = (- (+ (/. a:inferred b:inferred) (// a:inferred b:inferred)) (% a:inferred b:inferred))
                """);
    }

    @Test
    void nestsElifChainsAndPlacesHeaderComments() {
        Program program = parse("""
                if x > 0:  # positive
                    y = 1
                elif x < 0:  # negative
                    y = 2
                else:  # zero
                    y = 3
                """);

        assertThat(IstPrinter.print(program)).isEqualTo("""
                program
                  if (> x:inferred int:0)
                    bind y = int:1
                  else
                    if (< x:inferred int:0)
                      bind y = int:2
                    else
                      comment leading @0
                      bind y = int:3
                    comment trailing @0
                  comment trailing @0
                """);
    }

    @Test
    void treatsPassAsEmptyBody() {
        Program program = parse("while x:\n    pass\n");

        assertThat(IstPrinter.print(program)).isEqualTo("""
                program
                  while x:inferred
                """);
    }

    @Test
    void anchorsComments() {
        Program program = parse("# header\nx = 1  # trailing\n");

        assertThat(IstPrinter.print(program)).isEqualTo("""
                program
                  comment leading @0
                  bind x = int:1
                  comment trailing @0
                """);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "def f():\\n    pass|function definition",
            "import math|import statement",
            "xs = [1, 2]|list",
            "print(x ** 2)|exponent operator",
            "for x in items:\\n    pass|for loop over something other than range()",
            "x = 1 if y else 2|conditional expression",
            "x = len(y)|function call 'len()'",
            "x = int(y)|type conversion 'int()'",
            "while True:\\n    break|break statement",
            "if 0 < x < 5:\\n    pass|chained comparison",
            "print(s.upper())|method or attribute access",
            "x = 1; y = 2|several statements on one line",
            "x = y = 1|chained assignment",
            "x = None|None value",
            "while x:\\n    pass\\nelse:\\n    pass|loop else clause",
            "for i in range(1, 2, 3, 4):\\n    pass|range() with 4 arguments"
    })
    void rejectsConstructsOutsideTheSubset(String source, String construct) {
        ParseException error = rejection(source.replace("\\n", "\n"));

        assertThat(error.primary().kind()).isEqualTo(ErrorKind.UNSUPPORTED_CONSTRUCT);
        assertThat(error.constructName()).isEqualTo(construct);
    }

    @Test
    void rejectsFormatSpecification() {
        ParseException error = rejection("print(f\"{x:>5}\")\n");

        assertThat(error.constructName()).isEqualTo("format specification in formatted text");
        assertThat(error.primary().position()).isEqualTo(new SourcePosition(1, 7));
    }

    @Test
    void reportsMissingColon() {
        ParseException error = rejection("if x\n    y = 1\n");

        assertThat(error.primary().kind()).isEqualTo(ErrorKind.SYNTAX_ERROR);
        assertThat(error.primary().message()).contains("expected ':'");
    }

    @Test
    void reportsUnexpectedIndentation() {
        ParseException error = rejection("x = 1\n    y = 2\n");

        assertThat(error.primary().kind()).isEqualTo(ErrorKind.SYNTAX_ERROR);
        assertThat(error.primary().position()).isEqualTo(new SourcePosition(2, 5));
    }

    @Test
    void reportsElseWithoutIf() {
        ParseException error = rejection("else:\n    pass\n");

        assertThat(error.primary().message()).contains("'else' without a matching 'if'");
    }
}
