package ai.sourcebridge.translator.emit;

import static org.assertj.core.api.Assertions.assertThat;

import ai.sourcebridge.translator.lang.Language;
import ai.sourcebridge.translator.lex.CommentPlacement;
import ai.sourcebridge.translator.translate.CodeTranslator;
import org.junit.jupiter.api.Test;

class CppEmitterTest {

    private final CodeTranslator translator = new CodeTranslator();
    private final CppEmitter emitter = new CppEmitter();

    private EmittedCode fromPython(String source) {
        return emitter.render(translator.check(source, Language.PYTHON));
    }

    private String body(String pythonSource) {
        String code = fromPython(pythonSource).code();
        int start = code.indexOf("int main() {\n") + "int main() {\n".length();
        int end = code.lastIndexOf("    return 0;\n");
        return code.substring(start, end);
    }

    @Test
    void wrapsStatementsInMain() {
        EmittedCode emitted = fromPython("x = 5\nx += 2\nprint(\"x =\", x)\n");

        assertThat(emitted.code()).isEqualTo("""
                #include <iostream>
                #include <string>
                using namespace std;

                int main() {
                    int x = 5;
                    x += 2;
                    cout << "x = " << x << endl;
                    return 0;
                }
                """);
    }

    @Test
    void comparesTwoTextLiteralsAsStrings() {
        assertThat(body("if \"a\" == \"b\":\n    print(\"same\")\n")).isEqualTo("""
                    if (string("a") == "b") {
                        cout << "same" << endl;
                    }
                """);
    }

    @Test
    void joinsAddedTextLiteralsBeforeEmitting() {
        assertThat(body("s = \"a\" + \"b\"\nprint(s)\n")).startsWith("    string s = \"ab\";\n");
    }

    @Test
    void writesMinimalParentheses() {
        String body = body("a = 1\nb = 2\nc = (a + b) * (a - b)\nd = a - (b - 1)\nok = not a == b\ne = -(-a)\n");

        assertThat(body).contains(
                "    int c = (a + b) * (a - b);\n",
                "    int d = a - (b - 1);\n",
                "    bool ok = !(a == b);\n",
                "    int e = -(-a);\n");
    }

    @Test
    void writesCountingLoopHeaders() {
        assertThat(body("for i in range(10, 0, -2):\n    print(i)\nfor j in range(3):\n    print(j)\n")).isEqualTo("""
                    for (int i = 10; i > 0; i -= 2) {
                        cout << i << endl;
                    }
                    for (int j = 0; j < 3; j++) {
                        cout << j << endl;
                    }
                """);
    }

    @Test
    void chainsElseIf() {
        String source = """
                x = 0
                if x > 0:
                    print("pos")
                elif x < 0:
                    print("neg")
                else:
                    print("zero")
                """;

        assertThat(body(source)).isEqualTo("""
                    int x = 0;
                    if (x > 0) {
                        cout << "pos" << endl;
                    } else if (x < 0) {
                        cout << "neg" << endl;
                    } else {
                        cout << "zero" << endl;
                    }
                """);
    }

    @Test
    void writesPromptBeforeRead() {
        assertThat(body("name = input(\"Name: \")\nage = int(input())\n")).isEqualTo("""
                    string name;
                    cout << "Name: ";
                    cin >> name;
                    int age;
                    cin >> age;
                """);
    }

    @Test
    void omitsEndlWithoutLineBreak() {
        assertThat(body("print(\"a\", end=\"\")\nprint(end=\"\")\nprint()\n")).isEqualTo("""
                    cout << "a";
                    cout << "";
                    cout << endl;
                """);
    }

    @Test
    void keepsDecimalResultOfTrueDivision() {
        assertThat(body("x = 7 / 2\nflag = True\n")).isEqualTo("""
                    double x = 7 * 1.0 / 2;
                    bool flag = true;
                """);
    }

    @Test
    void recordsCommentLines() {
        EmittedCode emitted = fromPython("# total so far\ntotal = 0  # start\n");

        assertThat(emitted.code()).contains("    // total so far\n    int total = 0;  // start\n");
        assertThat(emitted.comments()).containsExactly(
                new EmittedComment("total so far", CommentPlacement.LEADING, 6),
                new EmittedComment("start", CommentPlacement.TRAILING, 7));
    }

    @Test
    void separatesDistinctCommentsWithBlankLine() {
        String body = body("# first\n\n# second\nx = 1\n");

        assertThat(body).isEqualTo("""
                    // first

                    // second
                    int x = 1;
                """);
    }
}
