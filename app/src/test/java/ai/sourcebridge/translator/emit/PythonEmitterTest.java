package ai.sourcebridge.translator.emit;

import static org.assertj.core.api.Assertions.assertThat;

import ai.sourcebridge.translator.lang.Language;
import ai.sourcebridge.translator.lex.CommentPlacement;
import ai.sourcebridge.translator.translate.CodeTranslator;
import org.junit.jupiter.api.Test;

class PythonEmitterTest {

    private final CodeTranslator translator = new CodeTranslator();
    private final PythonEmitter emitter = new PythonEmitter();

    private EmittedCode render(String cppSource) {
        return emitter.render(translator.check(cppSource, Language.CPP));
    }

    private String fromCpp(String cppSource) {
        return render(cppSource).code();
    }

    @Test
    void writesCountingLoopAsRange() {
        assertThat(fromCpp("for (int i = 0; i < 5; i++) { cout << i; }")).isEqualTo("""
                for i in range(0, 5):
                    print(i, end="")
                """);
    }

    @Test
    void writesStepWhenNotOne() {
        assertThat(fromCpp("for (int i = 10; i >= 0; i -= 2) { cout << i << endl; }")).isEqualTo("""
                for i in range(10, -1, -2):
                    print(i)
                """);
    }

    @Test
    void turnsOtherCountingLoopsIntoWhile() {
        assertThat(fromCpp("for (int i = 1; i < 100; i = i * 2) { cout << i << endl; }")).isEqualTo("""
                i = 1
                while i < 100:
                    print(i)
                    i *= 2
                """);
    }

    @Test
    void keepsLeadingCommentAboveStatement() {
        EmittedCode emitted = render("// total so far\nint total = 0;");

        assertThat(emitted.code()).isEqualTo("# total so far\ntotal = 0\n");
        assertThat(emitted.comments()).containsExactly(new EmittedComment("total so far", CommentPlacement.LEADING, 1));
    }

    @Test
    void annotatesDeclarationsOnlyWhenNeeded() {
        assertThat(fromCpp("int x;\ndouble d = 1;\nstring s = \"hi\";\nbool b = true;")).isEqualTo("""
                x: int
                d: float = 1
                s = "hi"
                b = True
                """);
    }

    @Test
    void collapsesDeclarationAndReadIntoOneLine() {
        assertThat(fromCpp("""
                int n;
                cout << "n? ";
                cin >> n;
                double d;
                cin >> d;
                string s;
                cin >> s;
                bool b;
                cin >> b;
                """)).isEqualTo("""
                n = int(input("n? "))
                d = float(input())
                s = input()
                b = bool(int(input()))
                """);
    }

    @Test
    void choosesPrintForm() {
        String code = fromCpp("""
                int a = 1;
                int b = 2;
                string s = "x";
                cout << a << " " << b << endl;
                cout << "sum: " << a + b << endl;
                cout << s + "!" << endl;
                cout << "[" << s + "!" << "]";
                cout << "{" << a << "}" << endl;
                cout << endl;
                """);

        assertThat(code).endsWith("""
                print(a, b)
                print(f"sum: {a + b}")
                print(s + "!")
                print("[", s + "!", "]", sep="", end="")
                print(f"{{{a}}}")
                print()
                """);
    }

    @Test
    void writesWholeNumberDivisionAsFloorDivision() {
        assertThat(fromCpp("int a = 7;\nint b = 2;\ndouble q = a / b;\na /= b;\ndouble r = 7.0 / 2;")).isEqualTo("""
                a = 7
                b = 2
                q: float = a // b
                a //= b
                r = 7.0 / 2
                """);
    }

    @Test
    void chainsElifAndKeepsHeaderComments() {
        String source = """
                int x = 1;
                int y = 0;
                if (x > 0) {  // positive
                    y = 1;
                } else if (x < 0) {  // negative
                    y = 2;
                } else {
                    y = 3;
                }
                """;

        assertThat(fromCpp(source)).isEqualTo("""
                x = 1
                y = 0
                if x > 0:  # positive
                    y = 1
                elif x < 0:  # negative
                    y = 2
                else:
                    y = 3
                """);
    }

    @Test
    void writesBlockLocalDeclarationAsPlainAssignment() {
        assertThat(fromCpp("if (true) { int y = 2; cout << y << endl; }")).isEqualTo("""
                if True:
                    y = 2
                    print(y)
                """);
    }

    @Test
    void writesPassForEmptyBlock() {
        assertThat(fromCpp("while (false) { }")).isEqualTo("while False:\n    pass\n");
    }

    @Test
    void parenthesizesNestedComparisons() {
        assertThat(fromCpp("int a = 1;\nint b = 2;\nbool c = a < b == true;\nbool d = !(a < b) || a >= b && b != 0;"))
                .endsWith("""
                        c = (a < b) == True
                        d = not a < b or a >= b and b != 0
                        """);
    }
}
