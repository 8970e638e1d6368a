package tupi.lang;

import java.util.List;

import lombok.NonNull;

public record Program(@NonNull List<Stmt> statements) {

    public Program {
        statements = List.copyOf(statements);
    }
}
