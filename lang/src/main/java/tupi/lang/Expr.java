package tupi.lang;

import java.util.List;

import lombok.NonNull;

public sealed interface Expr {

    record Compare(@NonNull Expr left, @NonNull CompareOperator operator, @NonNull Expr right) implements Expr {}

    record BoolOp(@NonNull Expr left, @NonNull BooleanOperator operator, @NonNull Expr right) implements Expr {}

    record BinOp(@NonNull Expr left, @NonNull BinaryOperator operator, @NonNull Expr right) implements Expr {}

    record UnaryOp(@NonNull UnaryOperator operator, @NonNull Expr operand) implements Expr {}

    record Str(@NonNull String value) implements Expr {}

    sealed interface NumericLiteral extends Expr {}

    record IntegerLiteral(long value) implements NumericLiteral {}

    record FloatLiteral(double value) implements NumericLiteral {}

    /**
     * {@code se test: body senao: orElse}. Without {@code senao} the else branch is {@link None}.
     */
    record Conditional(@NonNull Expr test, @NonNull Expr body, @NonNull Expr orElse) implements Expr {}

    record Call(@NonNull Expr function, @NonNull List<Expr> arguments, @NonNull List<Keyword> keywords) implements Expr {
        public Call {
            arguments = List.copyOf(arguments);
            keywords = List.copyOf(keywords);
        }
    }

    record Keyword(@NonNull String name, @NonNull Expr value) {}

    record Identifier(@NonNull String name) implements Expr {}

    record True() implements Expr {}

    record False() implements Expr {}

    record None() implements Expr {}

    enum CompareOperator {
        EQUAL,
        NOT_EQUAL,
        LESS,
        GREATER,
        LESS_EQUAL,
        GREATER_EQUAL,
        IS,
        IS_NOT
    }

    enum BooleanOperator {
        AND,
        OR
    }

    enum BinaryOperator {
        ADD,
        SUB,
        MUL,
        DIV,
        INT_DIV,
        MOD
    }

    enum UnaryOperator {
        NOT,
        MINUS,
        PLUS
    }
}
