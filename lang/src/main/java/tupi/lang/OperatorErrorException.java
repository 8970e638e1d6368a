package tupi.lang;

import lombok.Getter;

@Getter
public class OperatorErrorException extends RuntimeErrorException {

    private final Operator operator;
    private final Value left;
    /** Null for unary operators. */
    private final Value right;

    OperatorErrorException(Operator operator, Value left, Value right) {
        this(operator, left, right, "unsupported operand types");
    }

    OperatorErrorException(Operator operator, Value left, Value right, String reason) {
        super(describe(operator, left, right, reason));
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    private static String describe(Operator operator, Value left, Value right, String reason) {
        var operands = right == null
            ? Value.typeName(left)
            : Value.typeName(left) + " and " + Value.typeName(right);
        return reason + " for '" + operator.getSymbol() + "': " + operands;
    }
}
