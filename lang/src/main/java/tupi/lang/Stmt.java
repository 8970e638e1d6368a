package tupi.lang;

import java.util.List;

import lombok.NonNull;

public sealed interface Stmt {

    /** {@code interrompa} */
    record Break() implements Stmt {}

    /** {@code continue} */
    record Continue() implements Stmt {}

    /** {@code passe} */
    record Pass() implements Stmt {}

    /** {@code retorne}, with an empty list when no value follows. */
    record Return(@NonNull List<Expr> values) implements Stmt {
        public Return {
            values = List.copyOf(values);
        }
    }

    /** {@code verifique}; {@code message} is null when absent. */
    record Assert(@NonNull Expr test, Expr message) implements Stmt {}

    record Assign(@NonNull List<Expr> targets, @NonNull Expr value) implements Stmt {
        public Assign {
            targets = List.copyOf(targets);
        }
    }

    record Expression(@NonNull Expr expression) implements Stmt {}
}
