package ai.sourcebridge.translator.annotate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import ai.sourcebridge.translator.lang.Language;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class GeminiAnnotatorIntegrationTest {

    @Test
    @DisplayName("Calls Gemini API via LangChain4j and keeps the code lines")
    void annotateSmallProgram() {
        String apiKey = System.getenv("GEMINI_API_KEY");
        assumeTrue(apiKey != null && !apiKey.isBlank(), "GEMINI_API_KEY is required for this integration test");

        GoogleAiGeminiChatModel model = GoogleAiGeminiChatModel.builder()
                .apiKey(apiKey.trim())
                .modelName("gemini-2.0-flash")
                .temperature(0.1)
                .timeout(Duration.ofSeconds(60))
                .build();
        ChatModelAnnotator annotator = new ChatModelAnnotator(model, "GEMINI", "gemini-2.0-flash");

        try {
            String annotated = annotator.annotate("total = 0\nfor i in range(0, 5):\n    total += i\n",
                    Language.PYTHON);
            assertThat(annotated)
                    .as("Gemini annotation result")
                    .contains("total += i");
        } catch (AnnotationException ex) {
            fail("Gemini annotation failed: " + ex.getMessage(), ex);
        }
    }
}
