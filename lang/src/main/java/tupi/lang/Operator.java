package tupi.lang;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Tags an {@link OperatorErrorException} with the operation that rejected its operands.
 */
@Getter
@RequiredArgsConstructor
public enum Operator {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    INT_DIV("//"),
    REAL_DIV("/"),
    MOD("%"),
    NEGATE("nao"),
    UNARY_MINUS("-"),
    UNARY_PLUS("+"),
    AND("e"),
    OR("ou"),
    LESS_THAN("<"),
    GREATER_THAN(">"),
    LESS_THAN_EQUAL("<="),
    GREATER_THAN_EQUAL(">="),
    EQUAL("=="),
    NOT_EQUAL("!="),
    IS("é");

    private final String symbol;
}
