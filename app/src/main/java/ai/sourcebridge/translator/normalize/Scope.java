package ai.sourcebridge.translator.normalize;

import ai.sourcebridge.translator.ist.TypeTag;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Variables declared in one block, chained to the enclosing block.
 */
public final class Scope {

    private final Scope enclosing;
    private final Map<String, TypeTag> variables = new HashMap<>();

    public Scope(Scope enclosing) {
        this.enclosing = enclosing;
    }

    public static Scope root() {
        return new Scope(null);
    }

    public Scope child() {
        return new Scope(this);
    }

    public void define(String name, TypeTag type) {
        variables.put(name, type);
    }

    /** Searches this block, then the enclosing ones. */
    public Optional<TypeTag> resolve(String name) {
        Optional<TypeTag> local = resolveLocally(name);
        if (local.isPresent() || enclosing == null) {
            return local;
        }
        return enclosing.resolve(name);
    }

    public Optional<TypeTag> resolveLocally(String name) {
        return Optional.ofNullable(variables.get(name));
    }
}
