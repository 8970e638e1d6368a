package tupi.lang;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Stack of variable scopes. Writes go to the innermost scope, reads search outward.
 */
public final class Environment {

    private final Deque<Map<String, Value>> scopes = new ArrayDeque<>();

    public Environment() {
        scopes.push(new HashMap<>());
    }

    /**
     * Only the global scope is in use until the language grows block statements.
     */
    void pushScope() {
        scopes.push(new HashMap<>());
    }

    void popScope() {
        if (scopes.size() == 1) {
            throw new IllegalStateException("Cannot pop the global scope");
        }
        scopes.pop();
    }

    public int depth() {
        return scopes.size();
    }

    public void assign(String name, Value value) {
        scopes.peek().put(name, value);
    }

    public Optional<Value> lookup(String name) {
        for (var scope : scopes) {
            var value = scope.get(name);
            if (value != null) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
