package tupi.lang;

import java.util.Properties;

import lombok.Builder;
import lombok.Value;

/**
 * Limits shared by the parser and the interpreter.
 */
@Value
@Builder
public class Options {

    public static final String MAX_PARSE_DEPTH = "tupi.maxParseDepth";
    public static final String MAX_EVAL_DEPTH = "tupi.maxEvalDepth";

    /** Deepest expression nesting the parser accepts. */
    @Builder.Default
    int maxParseDepth = 200;

    /** Deepest expression nesting the interpreter evaluates. */
    @Builder.Default
    int maxEvalDepth = 1000;

    public static Options defaults() {
        return Options.builder().build();
    }

    /**
     * Reads {@value #MAX_PARSE_DEPTH} and {@value #MAX_EVAL_DEPTH}, keeping the defaults for absent keys.
     */
    public static Options fromProperties(Properties properties) {
        var builder = Options.builder();
        var parseDepth = properties.getProperty(MAX_PARSE_DEPTH);
        if (parseDepth != null) {
            builder.maxParseDepth(positive(MAX_PARSE_DEPTH, parseDepth));
        }
        var evalDepth = properties.getProperty(MAX_EVAL_DEPTH);
        if (evalDepth != null) {
            builder.maxEvalDepth(positive(MAX_EVAL_DEPTH, evalDepth));
        }
        return builder.build();
    }

    private static int positive(String key, String text) {
        int value;
        try {
            value = Integer.parseInt(text.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be an integer, got '" + text + "'", ex);
        }
        if (value <= 0) {
            throw new IllegalArgumentException(key + " must be positive, got " + value);
        }
        return value;
    }
}
