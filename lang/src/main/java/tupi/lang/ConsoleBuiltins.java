package tupi.lang;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * {@code imprima} and {@code entrada}, bound to the streams given at construction.
 */
@RequiredArgsConstructor
public final class ConsoleBuiltins {

    private static final Logger log = LoggerFactory.getLogger(ConsoleBuiltins.class);

    public static final String PRINT = "imprima";
    public static final String INPUT = "entrada";

    private final @NonNull PrintStream out;
    private final @NonNull BufferedReader in;

    public Map<String, Builtin> asTable() {
        return Map.of(
            PRINT, builtin(PRINT, this::print),
            INPUT, builtin(INPUT, this::input));
    }

    /**
     * <pre>
     * imprima(valor)
     * </pre>
     */
    Value print(List<Value> arguments, Map<String, Value> keywords) {
        expectNoKeywords(PRINT, keywords);
        if (arguments.size() != 1) {
            throw new RuntimeErrorException(PRINT + " expects 1 argument, got " + arguments.size());
        }
        var value = arguments.get(0);
        if (!(value instanceof Value.Primitive)) {
            throw new RuntimeErrorException("invalid argument for " + PRINT + ": " + Value.typeName(value));
        }
        out.println(value.render());
        out.flush();
        return Value.none();
    }

    /**
     * <pre>
     * entrada()
     * entrada(prompt)
     * </pre>
     * End of input reads as the empty string.
     */
    Value input(List<Value> arguments, Map<String, Value> keywords) {
        expectNoKeywords(INPUT, keywords);
        if (arguments.size() > 1) {
            throw new RuntimeErrorException(INPUT + " expects at most 1 argument, got " + arguments.size());
        }
        if (arguments.size() == 1) {
            out.print(arguments.get(0).render());
            out.flush();
        }
        try {
            var line = in.readLine();
            return Value.of(line != null ? stripLineEnd(line) : "");
        } catch (IOException ex) {
            log.warn("cannot read stdin", ex);
            throw new RuntimeErrorException("cannot read stdin", ex);
        }
    }

    private static String stripLineEnd(String line) {
        var end = line.length();
        while (end > 0 && (line.charAt(end - 1) == '\r' || line.charAt(end - 1) == '\n')) {
            end--;
        }
        return line.substring(0, end);
    }

    private static void expectNoKeywords(String name, Map<String, Value> keywords) {
        if (!keywords.isEmpty()) {
            throw new RuntimeErrorException(name + " takes no named arguments: " + keywords.keySet());
        }
    }

    private static Builtin builtin(String name, BiFunction<List<Value>, Map<String, Value>, Value> body) {
        return new Builtin() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Value call(List<Value> arguments, Map<String, Value> keywords) {
                return body.apply(arguments, keywords);
            }
        };
    }
}
