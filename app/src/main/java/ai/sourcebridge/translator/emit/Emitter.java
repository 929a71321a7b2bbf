package ai.sourcebridge.translator.emit;

import ai.sourcebridge.translator.ist.Program;

/**
 * Writes a normalized program as source text of one language. Implementations are stateless; every call renders from
 * scratch.
 */
public interface Emitter {

    EmittedCode render(Program program);

    default String emit(Program program) {
        return render(program).code();
    }
}
