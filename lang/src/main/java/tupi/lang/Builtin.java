package tupi.lang;

import java.util.List;
import java.util.Map;

/**
 * A callable supplied by the host, looked up by name when no variable shadows it.
 */
public non-sealed interface Builtin extends Value {

    String name();

    Value call(List<Value> arguments, Map<String, Value> keywords);

    @Override
    default String render() {
        return "<embutida " + name() + ">";
    }
}
