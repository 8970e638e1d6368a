package tupi.lang;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.function.BinaryOperator;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class OperatorsTest {

    private static final Value TRUE = Value.of(true);
    private static final Value FALSE = Value.of(false);

    private static Value integer(long value) {
        return Value.of(value);
    }

    private static Value real(double value) {
        return Value.of(value);
    }

    private static Value text(String value) {
        return Value.of(value);
    }

    private static void assertMixedOperandsWiden(BinaryOperator<Value> operator, long i, double f) {
        assertEquals(operator.apply(real(i), real(f)), operator.apply(integer(i), real(f)));
        assertEquals(operator.apply(real(f), real(i)), operator.apply(real(f), integer(i)));
    }

    @ParameterizedTest
    @CsvSource({"1, 1.0", "-7, 2.5", "0, -0.5", "123456, 0.001"})
    void additionWidensAndCommutes(long i, double f) {
        var expected = real(i + f);
        assertEquals(expected, Operators.add(integer(i), real(f)));
        assertEquals(expected, Operators.add(real(f), integer(i)));
    }

    @ParameterizedTest
    @CsvSource({"1, 1.0", "-7, 2.5", "10, 10.0", "3, 2.5", "0, -0.5"})
    void otherOperatorsWidenIntegerOperandOnEitherSide(long i, double f) {
        assertMixedOperandsWiden(Operators::subtract, i, f);
        assertMixedOperandsWiden(Operators::multiply, i, f);
        assertMixedOperandsWiden(Operators::realDivide, i, f);
        assertMixedOperandsWiden(Operators::lessThan, i, f);
        assertMixedOperandsWiden(Operators::greaterThan, i, f);
        assertMixedOperandsWiden(Operators::lessThanEqual, i, f);
        assertMixedOperandsWiden(Operators::greaterThanEqual, i, f);
        assertMixedOperandsWiden(Operators::equal, i, f);
        assertMixedOperandsWiden(Operators::notEqual, i, f);
    }

    @Test
    void widenedResultsMatchExpectedValues() {
        assertEquals(real(-1.5), Operators.subtract(real(2.5), integer(4)));
        assertEquals(real(7.5), Operators.multiply(real(2.5), integer(3)));
        assertEquals(TRUE, Operators.greaterThan(real(2.5), integer(2)));
        assertEquals(FALSE, Operators.lessThanEqual(real(2.5), integer(2)));
        assertEquals(TRUE, Operators.greaterThanEqual(real(2.0), integer(2)));
        assertEquals(FALSE, Operators.lessThan(real(2.0), integer(2)));
    }

    @Test
    void operatorSymbols() {
        assertEquals("//", Operator.INT_DIV.getSymbol());
        assertEquals("é", Operator.IS.getSymbol());
    }

    @Test
    void integersStayIntegers() {
        assertEquals(integer(12), Operators.add(integer(9), integer(3)));
        assertEquals(integer(6), Operators.subtract(integer(9), integer(3)));
        assertEquals(integer(27), Operators.multiply(integer(9), integer(3)));
    }

    @Test
    void floatsStayFloats() {
        assertEquals(real(2.0), Operators.add(real(1.0), real(1.0)));
        assertEquals(real(0.0), Operators.subtract(real(1.0), real(1.0)));
        assertEquals(real(1.0), Operators.multiply(real(1.0), real(1.0)));
    }

    @Test
    void realDivideAlwaysYieldsFloat() {
        assertEquals(real(3.0), Operators.realDivide(integer(9), integer(3)));
        assertEquals(real(2.5), Operators.realDivide(integer(5), integer(2)));
        assertEquals(real(1.0), Operators.realDivide(real(1.0), integer(1)));
    }

    @Test
    void realDivideByZeroFollowsFloatingPoint() {
        assertEquals(real(Double.POSITIVE_INFINITY), Operators.realDivide(integer(1), integer(0)));
    }

    @Test
    void intDivideTruncates() {
        assertEquals(integer(5), Operators.intDivide(integer(10), integer(2)));
        assertEquals(integer(3), Operators.intDivide(integer(7), integer(2)));
        assertEquals(integer(-3), Operators.intDivide(integer(-7), integer(2)));
    }

    @Test
    void intDivideRequiresIntegers() {
        var ex = assertThrows(OperatorErrorException.class, () -> Operators.intDivide(real(10.0), integer(2)));
        assertEquals(Operator.INT_DIV, ex.getOperator());
        assertEquals(real(10.0), ex.getLeft());
        assertEquals(integer(2), ex.getRight());
    }

    @Test
    void intDivideByZero() {
        var ex = assertThrows(OperatorErrorException.class, () -> Operators.intDivide(integer(1), integer(0)));
        assertEquals("division by zero for '//': inteiro and inteiro", ex.getMessage());
    }

    @Test
    void modulo() {
        assertEquals(integer(0), Operators.modulo(integer(9), integer(3)));
        assertEquals(integer(-1), Operators.modulo(integer(-7), integer(2)));
        assertEquals(real(1.5), Operators.modulo(real(7.5), integer(2)));
        assertEquals(real(1.0), Operators.modulo(integer(7), real(2.0)));
        assertThrows(OperatorErrorException.class, () -> Operators.modulo(integer(7), integer(0)));
    }

    @Test
    void integerOverflowIsAnError() {
        var ex = assertThrows(OperatorErrorException.class,
            () -> Operators.add(integer(Long.MAX_VALUE), integer(1)));
        assertEquals(Operator.ADD, ex.getOperator());
        assertEquals("integer overflow for '+': inteiro and inteiro", ex.getMessage());

        assertThrows(OperatorErrorException.class, () -> Operators.unaryMinus(integer(Long.MIN_VALUE)));
        assertThrows(OperatorErrorException.class, () -> Operators.intDivide(integer(Long.MIN_VALUE), integer(-1)));
    }

    @Test
    void arithmeticRejectsNonNumbers() {
        var ex = assertThrows(OperatorErrorException.class, () -> Operators.add(text("a"), integer(1)));
        assertEquals(Operator.ADD, ex.getOperator());
        assertEquals(text("a"), ex.getLeft());
        assertEquals(integer(1), ex.getRight());
        assertEquals("unsupported operand types for '+': texto and inteiro", ex.getMessage());

        assertThrows(OperatorErrorException.class, () -> Operators.multiply(TRUE, integer(2)));
        assertThrows(OperatorErrorException.class, () -> Operators.subtract(integer(2), Value.none()));
    }

    @Test
    void booleanOperators() {
        assertEquals(FALSE, Operators.and(TRUE, FALSE));
        assertEquals(TRUE, Operators.and(TRUE, TRUE));
        assertEquals(TRUE, Operators.or(TRUE, FALSE));
        assertEquals(FALSE, Operators.or(FALSE, FALSE));
        assertEquals(FALSE, Operators.negate(TRUE));
        assertEquals(TRUE, Operators.negate(FALSE));
    }

    @Test
    void booleanOperatorsHaveNoTruthiness() {
        var and = assertThrows(OperatorErrorException.class, () -> Operators.and(TRUE, integer(1)));
        assertEquals(Operator.AND, and.getOperator());

        var or = assertThrows(OperatorErrorException.class, () -> Operators.or(text(""), FALSE));
        assertEquals(Operator.OR, or.getOperator());

        var not = assertThrows(OperatorErrorException.class, () -> Operators.negate(integer(0)));
        assertEquals(Operator.NEGATE, not.getOperator());
        assertNull(not.getRight());
        assertEquals("unsupported operand types for 'nao': inteiro", not.getMessage());
    }

    @Test
    void isComparesKindNotValue() {
        assertEquals(FALSE, Operators.is(integer(10), real(10.0)));
        assertEquals(TRUE, Operators.is(integer(10), integer(2)));
        assertEquals(TRUE, Operators.is(real(1.0), real(2.0)));
        assertEquals(TRUE, Operators.is(text("a"), text("b")));
        assertEquals(TRUE, Operators.is(TRUE, FALSE));
        assertEquals(FALSE, Operators.is(text("1"), integer(1)));
    }

    @Test
    void isRejectsNonPrimitives() {
        var ex = assertThrows(OperatorErrorException.class, () -> Operators.is(Value.none(), Value.none()));
        assertEquals(Operator.IS, ex.getOperator());
    }

    @Test
    void unaryMinus() {
        assertEquals(integer(-1), Operators.unaryMinus(integer(1)));
        assertEquals(real(2.5), Operators.unaryMinus(real(-2.5)));
        assertThrows(OperatorErrorException.class, () -> Operators.unaryMinus(TRUE));
    }

    @Test
    void unaryPlusMultipliesByMinusOne() {
        assertEquals(integer(-1), Operators.unaryPlus(integer(1)));
        assertEquals(integer(1), Operators.unaryPlus(integer(-1)));
        assertEquals(real(-2.5), Operators.unaryPlus(real(2.5)));

        var ex = assertThrows(OperatorErrorException.class, () -> Operators.unaryPlus(text("x")));
        assertEquals(Operator.UNARY_PLUS, ex.getOperator());
    }

    @Test
    void orderingComparisons() {
        assertEquals(FALSE, Operators.lessThan(integer(1), integer(1)));
        assertEquals(TRUE, Operators.lessThanEqual(integer(1), integer(1)));
        assertEquals(FALSE, Operators.greaterThan(real(1.2), real(1.2)));
        assertEquals(TRUE, Operators.greaterThanEqual(real(1.2), real(1.2)));
        assertEquals(TRUE, Operators.greaterThan(integer(2), real(1.5)));
        assertEquals(FALSE, Operators.lessThan(real(Double.NaN), integer(1)));
    }

    @Test
    void orderingRejectsStringsAndBooleans() {
        var ex = assertThrows(OperatorErrorException.class, () -> Operators.lessThan(text("a"), text("b")));
        assertEquals(Operator.LESS_THAN, ex.getOperator());
        assertThrows(OperatorErrorException.class, () -> Operators.greaterThanEqual(TRUE, FALSE));
    }

    @Test
    void equality() {
        assertEquals(TRUE, Operators.equal(integer(1), integer(1)));
        assertEquals(TRUE, Operators.equal(integer(1), real(1.0)));
        assertEquals(TRUE, Operators.equal(real(1.0), integer(1)));
        assertEquals(FALSE, Operators.equal(TRUE, FALSE));
        assertEquals(TRUE, Operators.equal(text("coral"), text("coral")));
        assertEquals(TRUE, Operators.notEqual(TRUE, FALSE));
        assertEquals(FALSE, Operators.notEqual(integer(1), real(1.0)));
        assertEquals(TRUE, Operators.notEqual(real(Double.NaN), real(Double.NaN)));
    }

    @Test
    void equalityAcrossKindsIsAnError() {
        var ex = assertThrows(OperatorErrorException.class, () -> Operators.equal(text("1"), integer(1)));
        assertEquals(Operator.EQUAL, ex.getOperator());

        var notEqual = assertThrows(OperatorErrorException.class, () -> Operators.notEqual(TRUE, integer(1)));
        assertEquals(Operator.NOT_EQUAL, notEqual.getOperator());
    }

    @Test
    void operandsOfBuiltinsAreRejected() {
        Builtin builtin = new Builtin() {
            @Override
            public String name() {
                return "f";
            }

            @Override
            public Value call(List<Value> arguments, Map<String, Value> keywords) {
                return Value.none();
            }
        };
        var ex = assertThrows(OperatorErrorException.class, () -> Operators.add(builtin, integer(1)));
        assertSame(builtin, ex.getLeft());
        assertTrue(ex.getMessage().endsWith("embutida and inteiro"));
    }
}
