package tupi.lang;

import java.math.BigDecimal;

import lombok.NonNull;

/**
 * Runtime result of evaluating an expression.
 */
public sealed interface Value permits Value.Primitive, Value.NoValue, Builtin {

    /**
     * Natural textual form, as written by {@code imprima}.
     */
    String render();

    /** Integer, float, string or boolean. */
    sealed interface Primitive extends Value permits IntegerValue, FloatValue, StringValue, BooleanValue {}

    record IntegerValue(long value) implements Primitive {
        @Override
        public String render() {
            return Long.toString(value);
        }
    }

    record FloatValue(double value) implements Primitive {
        @Override
        public String render() {
            if (Double.isNaN(value)) {
                return "NaN";
            }
            if (Double.isInfinite(value)) {
                return value > 0 ? "inf" : "-inf";
            }
            if (value == 0.0) {
                return 1 / value < 0 ? "-0" : "0";
            }
            return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        }
    }

    record StringValue(@NonNull String value) implements Primitive {
        @Override
        public String render() {
            return value;
        }
    }

    record BooleanValue(boolean value) implements Primitive {
        @Override
        public String render() {
            return Boolean.toString(value);
        }
    }

    /** Result of statements and calls that produce nothing. */
    enum NoValue implements Value {
        INSTANCE;

        @Override
        public String render() {
            return "Vazio";
        }
    }

    static Value of(long value) {
        return new IntegerValue(value);
    }

    static Value of(double value) {
        return new FloatValue(value);
    }

    static Value of(String value) {
        return new StringValue(value);
    }

    static Value of(boolean value) {
        return new BooleanValue(value);
    }

    static Value none() {
        return NoValue.INSTANCE;
    }

    /**
     * Name of the value's kind as the language spells it, used in error messages.
     */
    static String typeName(Value value) {
        if (value instanceof Value.IntegerValue) {
            return "inteiro";
        }
        if (value instanceof Value.FloatValue) {
            return "real";
        }
        if (value instanceof Value.StringValue) {
            return "texto";
        }
        if (value instanceof Value.BooleanValue) {
            return "logico";
        }
        if (value instanceof Builtin) {
            return "embutida";
        }
        return "Vazio";
    }
}
