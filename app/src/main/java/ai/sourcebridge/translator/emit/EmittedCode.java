package ai.sourcebridge.translator.emit;

import java.util.List;
import java.util.Objects;

/**
 * Generated source text with the position of every carried-over comment.
 */
public record EmittedCode(String code, List<EmittedComment> comments) {

    public EmittedCode {
        Objects.requireNonNull(code, "code");
        comments = List.copyOf(Objects.requireNonNull(comments, "comments"));
    }
}
