package ai.sourcebridge.translator.annotate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.sourcebridge.translator.lang.Language;
import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.model.chat.ChatModel;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ChatModelAnnotatorTest {

    private static ChatModel replying(String reply) {
        return new ChatModel() {
            @Override
            public String chat(String prompt) {
                return reply;
            }
        };
    }

    @Test
    @DisplayName("Removes code fences and program tags around the model reply")
    void stripsCodeFences() {
        ChatModelAnnotator annotator = new ChatModelAnnotator(
                replying("```python\n# start at one\nx = 1  \nprint(x)\n```\n"), "Gemini", "test-model");

        String annotated = annotator.annotate("x = 1\nprint(x)\n", Language.PYTHON);

        assertThat(annotated).isEqualTo("# start at one\nx = 1\nprint(x)\n");
    }

    @Test
    void dropsProgramTagsEchoedByTheModel() {
        assertThat(ChatModelAnnotator.stripCodeFences("<program>\nint x = 1;\n</program>"))
                .isEqualTo("int x = 1;\n");
    }

    @Test
    void sendsCodeAndCommentSyntaxInPrompt() {
        AtomicReference<String> seenPrompt = new AtomicReference<>();
        ChatModel recordingModel = new ChatModel() {
            @Override
            public String chat(String prompt) {
                seenPrompt.set(prompt);
                return "int x = 1;";
            }
        };
        ChatModelAnnotator annotator = new ChatModelAnnotator(recordingModel, "Ollama", "llama3.1");

        annotator.annotate("int x = 1;\n", Language.CPP);

        assertThat(seenPrompt.get())
                .contains("C++ program")
                .contains("`//`")
                .contains("<program>\nint x = 1;\n\n</program>");
    }

    @Test
    void returnsBlankCodeWithoutCallingTheModel() {
        ChatModel failingModel = new ChatModel() {
            @Override
            public String chat(String prompt) {
                throw new IllegalStateException("should not be called");
            }
        };

        assertThat(new ChatModelAnnotator(failingModel, "Gemini", "m").annotate("  ", Language.PYTHON))
                .isEqualTo("  ");
    }

    @Test
    void reportsMissingModel() {
        ChatModel missingModel = new ChatModel() {
            @Override
            public String chat(String prompt) {
                throw new RuntimeException("request failed", new ModelNotFoundException("model not found"));
            }
        };

        Throwable thrown = catchThrowable(() -> new ChatModelAnnotator(missingModel, "Ollama", "llama3.1")
                .annotate("x = 1\n", Language.PYTHON));

        assertThat(thrown)
                .isInstanceOf(AnnotationException.class)
                .hasMessage("Ollama model 'llama3.1' is not available.");
    }

    @Test
    void wrapsOtherModelFailures() {
        ChatModel brokenModel = new ChatModel() {
            @Override
            public String chat(String prompt) {
                throw new IllegalStateException("connection reset");
            }
        };

        Throwable thrown = catchThrowable(() -> new ChatModelAnnotator(brokenModel, "Gemini", "gemini-2.0-flash")
                .annotate("x = 1\n", Language.PYTHON));

        assertThat(thrown)
                .isInstanceOf(AnnotationException.class)
                .hasMessage("LangChain annotation failed")
                .hasRootCauseMessage("connection reset");
    }

    @Test
    void rejectsEmptyReply() {
        Throwable thrown = catchThrowable(() -> new ChatModelAnnotator(replying(" \n"), "Gemini", "gemini-2.0-flash")
                .annotate("x = 1\n", Language.PYTHON));

        assertThat(thrown)
                .isInstanceOf(AnnotationException.class)
                .hasMessageContaining("returned no code");
    }
}
