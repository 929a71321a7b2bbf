package ai.sourcebridge.translator.annotate;

import ai.sourcebridge.translator.lang.Language;
import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.model.chat.ChatModel;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Annotator backed by a LangChain4j {@link ChatModel} implementation.
 */
public class ChatModelAnnotator implements Annotator {

    private final ChatModel model;
    private final String providerName;
    private final String modelName;

    public ChatModelAnnotator(ChatModel model, String providerName, String modelName) {
        this.model = Objects.requireNonNull(model, "model");
        this.providerName = requireNonBlank(providerName, "providerName");
        this.modelName = requireNonBlank(modelName, "modelName");
    }

    @Override
    public String annotate(String code, Language language) {
        if (code == null || code.isBlank()) {
            return code == null ? "" : code;
        }
        String response;
        try {
            response = model.chat(buildPrompt(code, language));
        } catch (RuntimeException ex) {
            if (isModelMissing(ex)) {
                throw new AnnotationException("%s model '%s' is not available.".formatted(providerName, modelName), ex);
            }
            throw new AnnotationException("LangChain annotation failed", ex);
        }
        if (response == null || response.isBlank()) {
            throw new AnnotationException("%s model '%s' returned no code".formatted(providerName, modelName), null);
        }
        return stripCodeFences(response);
    }

    String buildPrompt(String code, Language language) {
        String marker = language == Language.CPP ? "//" : "#";
        return """
Add short, concise comments (3-5 words max) to the %s program below.
Rules:
- Keep every line of code exactly as it is. Do not rename, reorder, reformat, add, or remove any code.
- Only add comment lines starting with `%s`, or append `%s` comments at the end of existing lines.
- Comment only what a beginner would not understand at a glance.
- Output only the commented program as plain text. Do not wrap the result in code fences and do not add commentary.

<program>
""".formatted(language.displayName(), marker, marker) + code + "\n</program>";
    }

    static String stripCodeFences(String response) {
        List<String> lines = new ArrayList<>(Arrays.asList(response.split("\\R", -1)));
        lines.replaceAll(String::stripTrailing);
        while (!lines.isEmpty() && lines.get(0).isBlank()) {
            lines.remove(0);
        }
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isBlank()) {
            lines.remove(lines.size() - 1);
        }
        if (!lines.isEmpty() && lines.get(0).startsWith("```")) {
            lines.remove(0);
            if (!lines.isEmpty() && lines.get(lines.size() - 1).equals("```")) {
                lines.remove(lines.size() - 1);
            }
        }
        lines.removeIf(line -> line.equals("<program>") || line.equals("</program>"));
        return String.join("\n", lines) + "\n";
    }

    private boolean isModelMissing(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof ModelNotFoundException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
