package ai.sourcebridge.translator.translate;

import ai.sourcebridge.translator.emit.EmittedCode;
import ai.sourcebridge.translator.emit.Emitters;
import ai.sourcebridge.translator.ist.Program;
import ai.sourcebridge.translator.lang.Language;
import ai.sourcebridge.translator.lex.Token;
import ai.sourcebridge.translator.lex.Tokenizers;
import ai.sourcebridge.translator.normalize.Normalizer;
import ai.sourcebridge.translator.parse.Parsers;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the whole pipeline: tokenize, parse, normalize, emit. Holds no state between calls and may be shared.
 *
 * <p>Every failure surfaces as a {@link ai.sourcebridge.translator.diag.TranslationException} carrying the ranked
 * diagnostics; nothing is emitted for a program that does not translate completely.
 */
public class CodeTranslator {

    private static final Logger LOGGER = LoggerFactory.getLogger(CodeTranslator.class);

    private final Normalizer normalizer;

    public CodeTranslator() {
        this(new Normalizer());
    }

    CodeTranslator(Normalizer normalizer) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    }

    public TranslationResult translate(String sourceText, Language source, Language target) {
        Objects.requireNonNull(target, "target");
        Program program = check(sourceText, source);
        EmittedCode emitted = Emitters.forLanguage(target).render(program);
        LOGGER.debug("Emitted {} lines of {}", emitted.code().lines().count(), target.displayName());
        List<TranslatedComment> comments = emitted.comments().stream()
                .map(comment -> new TranslatedComment(comment.text(), comment.placement(), comment.line()))
                .toList();
        return new TranslationResult(emitted.code(), comments);
    }

    /**
     * Tokenizes, parses and normalizes {@code sourceText} without emitting anything.
     *
     * @return the normalized tree
     */
    public Program check(String sourceText, Language language) {
        Objects.requireNonNull(sourceText, "sourceText");
        Objects.requireNonNull(language, "language");
        List<Token> tokens = Tokenizers.forLanguage(language).tokenize(sourceText);
        LOGGER.debug("Tokenized {} source into {} tokens", language.displayName(), tokens.size());
        Program parsed = Parsers.forLanguage(language).parse(tokens);
        LOGGER.debug("Parsed {} top-level statements", parsed.body().statements().size());
        return normalizer.normalize(parsed);
    }
}
