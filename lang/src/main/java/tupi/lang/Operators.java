package tupi.lang;

import java.util.function.DoubleBinaryOperator;
import java.util.function.LongBinaryOperator;
import java.util.function.LongSupplier;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Operator semantics of the value model. No truthiness: boolean operators only accept booleans, and the only
 * implicit conversion is widening an integer to float when it meets a float.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class Operators {

    public static Value add(Value left, Value right) {
        return arithmetic(Operator.ADD, left, right, Math::addExact, Double::sum);
    }

    public static Value subtract(Value left, Value right) {
        return arithmetic(Operator.SUB, left, right, Math::subtractExact, (a, b) -> a - b);
    }

    public static Value multiply(Value left, Value right) {
        return arithmetic(Operator.MUL, left, right, Math::multiplyExact, (a, b) -> a * b);
    }

    /**
     * True division: always a float, even for two integers.
     */
    public static Value realDivide(Value left, Value right) {
        if (isNumber(left) && isNumber(right)) {
            return Value.of(asDouble(left) / asDouble(right));
        }
        throw new OperatorErrorException(Operator.REAL_DIV, left, right);
    }

    /**
     * Truncating division of two integers.
     */
    public static Value intDivide(Value left, Value right) {
        if (left instanceof Value.IntegerValue l && right instanceof Value.IntegerValue r) {
            if (r.value() == 0) {
                throw new OperatorErrorException(Operator.INT_DIV, left, right, "division by zero");
            }
            if (l.value() == Long.MIN_VALUE && r.value() == -1) {
                throw new OperatorErrorException(Operator.INT_DIV, left, right, "integer overflow");
            }
            return Value.of(l.value() / r.value());
        }
        throw new OperatorErrorException(Operator.INT_DIV, left, right);
    }

    public static Value modulo(Value left, Value right) {
        if (left instanceof Value.IntegerValue l && right instanceof Value.IntegerValue r) {
            if (r.value() == 0) {
                throw new OperatorErrorException(Operator.MOD, left, right, "division by zero");
            }
            return Value.of(l.value() % r.value());
        }
        if (isNumber(left) && isNumber(right)) {
            return Value.of(asDouble(left) % asDouble(right));
        }
        throw new OperatorErrorException(Operator.MOD, left, right);
    }

    public static Value negate(Value operand) {
        if (operand instanceof Value.BooleanValue b) {
            return Value.of(!b.value());
        }
        throw new OperatorErrorException(Operator.NEGATE, operand, null);
    }

    public static Value unaryMinus(Value operand) {
        if (operand instanceof Value.IntegerValue i) {
            return exact(Operator.UNARY_MINUS, operand, null, () -> Math.negateExact(i.value()));
        }
        if (operand instanceof Value.FloatValue f) {
            return Value.of(-f.value());
        }
        throw new OperatorErrorException(Operator.UNARY_MINUS, operand, null);
    }

    /**
     * Multiplies by -1, so it currently behaves like {@link #unaryMinus(Value)}.
     */
    public static Value unaryPlus(Value operand) {
        if (operand instanceof Value.IntegerValue i) {
            return exact(Operator.UNARY_PLUS, operand, null, () -> Math.multiplyExact(i.value(), -1L));
        }
        if (operand instanceof Value.FloatValue f) {
            return Value.of(f.value() * -1);
        }
        throw new OperatorErrorException(Operator.UNARY_PLUS, operand, null);
    }

    public static Value and(Value left, Value right) {
        if (left instanceof Value.BooleanValue l && right instanceof Value.BooleanValue r) {
            return Value.of(l.value() && r.value());
        }
        throw new OperatorErrorException(Operator.AND, left, right);
    }

    public static Value or(Value left, Value right) {
        if (left instanceof Value.BooleanValue l && right instanceof Value.BooleanValue r) {
            return Value.of(l.value() || r.value());
        }
        throw new OperatorErrorException(Operator.OR, left, right);
    }

    /**
     * Identity test: true when both operands are the same primitive kind, whatever their values.
     */
    public static Value is(Value left, Value right) {
        if (left instanceof Value.Primitive && right instanceof Value.Primitive) {
            return Value.of(left.getClass() == right.getClass());
        }
        throw new OperatorErrorException(Operator.IS, left, right);
    }

    public static Value lessThan(Value left, Value right) {
        return compare(Operator.LESS_THAN, left, right);
    }

    public static Value greaterThan(Value left, Value right) {
        return compare(Operator.GREATER_THAN, left, right);
    }

    public static Value lessThanEqual(Value left, Value right) {
        return compare(Operator.LESS_THAN_EQUAL, left, right);
    }

    public static Value greaterThanEqual(Value left, Value right) {
        return compare(Operator.GREATER_THAN_EQUAL, left, right);
    }

    public static Value equal(Value left, Value right) {
        return Value.of(isEqual(Operator.EQUAL, left, right));
    }

    public static Value notEqual(Value left, Value right) {
        return Value.of(!isEqual(Operator.NOT_EQUAL, left, right));
    }

    //// coercion ////

    private static boolean isNumber(Value value) {
        return value instanceof Value.IntegerValue || value instanceof Value.FloatValue;
    }

    private static boolean bothIntegers(Value left, Value right) {
        return left instanceof Value.IntegerValue && right instanceof Value.IntegerValue;
    }

    private static long asLong(Value number) {
        return ((Value.IntegerValue) number).value();
    }

    private static double asDouble(Value number) {
        if (number instanceof Value.FloatValue f) {
            return f.value();
        }
        if (number instanceof Value.IntegerValue i) {
            return i.value();
        }
        throw new IllegalArgumentException("Cannot coerce to float: " + number);
    }

    private static Value arithmetic(
            Operator operator,
            Value left,
            Value right,
            LongBinaryOperator onIntegers,
            DoubleBinaryOperator onFloats) {

        if (bothIntegers(left, right)) {
            return exact(operator, left, right, () -> onIntegers.applyAsLong(asLong(left), asLong(right)));
        }
        if (isNumber(left) && isNumber(right)) {
            return Value.of(onFloats.applyAsDouble(asDouble(left), asDouble(right)));
        }
        throw new OperatorErrorException(operator, left, right);
    }

    private static Value compare(Operator operator, Value left, Value right) {
        if (bothIntegers(left, right)) {
            var order = Long.compare(asLong(left), asLong(right));
            return Value.of(holds(operator, order, 0));
        }
        if (isNumber(left) && isNumber(right)) {
            return Value.of(holds(operator, asDouble(left), asDouble(right)));
        }
        throw new OperatorErrorException(operator, left, right);
    }

    private static boolean holds(Operator operator, double a, double b) {
        switch (operator) {
        case LESS_THAN:
            return a < b;
        case GREATER_THAN:
            return a > b;
        case LESS_THAN_EQUAL:
            return a <= b;
        case GREATER_THAN_EQUAL:
            return a >= b;
        default:
            throw new IllegalArgumentException("Not an ordering operator: " + operator);
        }
    }

    private static boolean isEqual(Operator operator, Value left, Value right) {
        if (bothIntegers(left, right)) {
            return asLong(left) == asLong(right);
        }
        if (isNumber(left) && isNumber(right)) {
            return asDouble(left) == asDouble(right);
        }
        if (left instanceof Value.BooleanValue l && right instanceof Value.BooleanValue r) {
            return l.value() == r.value();
        }
        if (left instanceof Value.StringValue l && right instanceof Value.StringValue r) {
            return l.value().equals(r.value());
        }
        throw new OperatorErrorException(operator, left, right);
    }

    private static Value exact(Operator operator, Value left, Value right, LongSupplier result) {
        try {
            return Value.of(result.getAsLong());
        } catch (ArithmeticException ex) {
            throw new OperatorErrorException(operator, left, right, "integer overflow");
        }
    }
}
