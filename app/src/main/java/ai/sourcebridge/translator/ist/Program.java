package ai.sourcebridge.translator.ist;

import java.util.Objects;

/**
 * Root of the tree: the statements of the single program body.
 */
public record Program(Block body) {

    public Program {
        Objects.requireNonNull(body, "body");
    }
}
