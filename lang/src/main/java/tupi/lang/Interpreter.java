package tupi.lang;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Tree-walking evaluator. Variables live in {@link #getEnvironment()} and survive across
 * {@link #interpret(Program)} calls, so a REPL can reuse one instance.
 */
@RequiredArgsConstructor
public final class Interpreter {

    private static final Logger log = LoggerFactory.getLogger(Interpreter.class);

    private final @NonNull Map<String, Builtin> builtins;
    private final @NonNull Options options;

    @Getter
    private final Environment environment = new Environment();

    private int depth = 0;

    public Interpreter() {
        this(Map.of(), Options.defaults());
    }

    public Interpreter(Map<String, Builtin> builtins) {
        this(builtins, Options.defaults());
    }

    /**
     * Runs the statements in order and returns the value of the last one, or {@link Value.NoValue} when there
     * are none.
     */
    public Value interpret(Program program) {
        Value result = Value.none();
        for (var stmt : program.statements()) {
            result = execute(stmt);
        }
        log.debug("interpreted {} statements", program.statements().size());
        return result;
    }

    private Value execute(Stmt stmt) {
        if (stmt instanceof Stmt.Expression expression) {
            return evaluate(expression.expression());
        }

        if (stmt instanceof Stmt.Assign assign) {
            return executeAssign(assign);
        }

        if (stmt instanceof Stmt.Pass) {
            return Value.none();
        }

        if (stmt instanceof Stmt.Assert assertion) {
            return executeAssert(assertion);
        }

        if (stmt instanceof Stmt.Break) {
            throw new NotImplementedException("interrompa");
        }

        if (stmt instanceof Stmt.Continue) {
            throw new NotImplementedException("continue");
        }

        if (stmt instanceof Stmt.Return) {
            throw new NotImplementedException("retorne");
        }

        throw new NotImplementedException("statement " + stmt.getClass().getSimpleName());
    }

    private Value executeAssign(Stmt.Assign assign) {
        var value = evaluate(assign.value());
        for (var target : assign.targets()) {
            if (target instanceof Expr.Identifier identifier) {
                environment.assign(identifier.name(), value);
            } else {
                throw new NotImplementedException("assignment to " + target.getClass().getSimpleName());
            }
        }
        return Value.none();
    }

    private Value executeAssert(Stmt.Assert assertion) {
        var test = evaluate(assertion.test());
        if (!(test instanceof Value.BooleanValue passed)) {
            throw new RuntimeErrorException("verifique condition must be boolean, got "
                + Value.typeName(test));
        }
        if (!passed.value()) {
            var message = assertion.message() != null
                ? evaluate(assertion.message()).render()
                : "verifique failed";
            throw new AssertionFailedException(message);
        }
        return Value.none();
    }

    Value evaluate(Expr expr) {
        if (depth >= options.getMaxEvalDepth()) {
            throw new RuntimeErrorException("maximum evaluation depth of " + options.getMaxEvalDepth() + " exceeded");
        }
        depth++;
        try {
            return evaluateExpr(expr);
        } finally {
            depth--;
        }
    }

    private Value evaluateExpr(Expr expr) {
        if (expr instanceof Expr.BinOp binary) {
            return evaluateBinaryExpr(binary);
        }

        if (expr instanceof Expr.Compare compare) {
            return evaluateCompareExpr(compare);
        }

        if (expr instanceof Expr.BoolOp bool) {
            var left = evaluate(bool.left());
            var right = evaluate(bool.right());
            return bool.operator() == Expr.BooleanOperator.AND
                ? Operators.and(left, right)
                : Operators.or(left, right);
        }

        if (expr instanceof Expr.UnaryOp unary) {
            return evaluateUnaryExpr(unary);
        }

        if (expr instanceof Expr.Conditional conditional) {
            return evaluateConditionalExpr(conditional);
        }

        if (expr instanceof Expr.Call call) {
            return evaluateCallExpr(call);
        }

        if (expr instanceof Expr.Identifier identifier) {
            return evaluateIdentifierExpr(identifier);
        }

        if (expr instanceof Expr.IntegerLiteral literal) {
            return Value.of(literal.value());
        }

        if (expr instanceof Expr.FloatLiteral literal) {
            return Value.of(literal.value());
        }

        if (expr instanceof Expr.Str literal) {
            return Value.of(literal.value());
        }

        if (expr instanceof Expr.True) {
            return Value.of(true);
        }

        if (expr instanceof Expr.False) {
            return Value.of(false);
        }

        if (expr instanceof Expr.None) {
            return Value.none();
        }

        throw new NotImplementedException("expression " + expr.getClass().getSimpleName());
    }

    private Value evaluateBinaryExpr(Expr.BinOp binary) {
        var left = evaluate(binary.left());
        var right = evaluate(binary.right());
        switch (binary.operator()) {
        case ADD:
            return Operators.add(left, right);
        case SUB:
            return Operators.subtract(left, right);
        case MUL:
            return Operators.multiply(left, right);
        case DIV:
            return Operators.realDivide(left, right);
        case INT_DIV:
            return Operators.intDivide(left, right);
        case MOD:
            return Operators.modulo(left, right);
        default:
            throw new NotImplementedException("operator " + binary.operator());
        }
    }

    private Value evaluateCompareExpr(Expr.Compare compare) {
        var left = evaluate(compare.left());
        var right = evaluate(compare.right());
        switch (compare.operator()) {
        case EQUAL:
            return Operators.equal(left, right);
        case NOT_EQUAL:
            return Operators.notEqual(left, right);
        case LESS:
            return Operators.lessThan(left, right);
        case GREATER:
            return Operators.greaterThan(left, right);
        case LESS_EQUAL:
            return Operators.lessThanEqual(left, right);
        case GREATER_EQUAL:
            return Operators.greaterThanEqual(left, right);
        case IS:
            return Operators.is(left, right);
        case IS_NOT:
            return Operators.negate(Operators.is(left, right));
        default:
            throw new NotImplementedException("comparison " + compare.operator());
        }
    }

    private Value evaluateUnaryExpr(Expr.UnaryOp unary) {
        var operand = evaluate(unary.operand());
        switch (unary.operator()) {
        case NOT:
            return Operators.negate(operand);
        case MINUS:
            return Operators.unaryMinus(operand);
        case PLUS:
            return Operators.unaryPlus(operand);
        default:
            throw new NotImplementedException("unary operator " + unary.operator());
        }
    }

    private Value evaluateConditionalExpr(Expr.Conditional conditional) {
        var test = evaluate(conditional.test());
        if (test instanceof Value.BooleanValue condition) {
            return evaluate(condition.value() ? conditional.body() : conditional.orElse());
        }
        throw new RuntimeErrorException("condition must be boolean, got " + Value.typeName(test));
    }

    private Value evaluateCallExpr(Expr.Call call) {
        var callee = evaluate(call.function());
        if (!(callee instanceof Builtin function)) {
            throw new RuntimeErrorException("value of type " + Value.typeName(callee)
                + " is not callable");
        }

        var arguments = new ArrayList<Value>();
        for (var argument : call.arguments()) {
            arguments.add(evaluate(argument));
        }
        var keywords = new LinkedHashMap<String, Value>();
        for (var keyword : call.keywords()) {
            keywords.put(keyword.name(), evaluate(keyword.value()));
        }
        return function.call(arguments, keywords);
    }

    private Value evaluateIdentifierExpr(Expr.Identifier identifier) {
        var name = identifier.name();
        var bound = environment.lookup(name);
        if (bound.isPresent()) {
            return bound.get();
        }
        var builtin = builtins.get(name);
        if (builtin != null) {
            return builtin;
        }
        throw new RuntimeErrorException("name '" + name + "' is not defined");
    }
}
