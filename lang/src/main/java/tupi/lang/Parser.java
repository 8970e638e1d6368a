package tupi.lang;

import static tupi.lang.Token.Type.*;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Recursive descent parser. Binary operators are split into precedence tiers, loosest first:
 * {@code ou}, {@code e}, {@code nao}, comparisons, additive, multiplicative, unary sign.
 */
@RequiredArgsConstructor
public final class Parser {

    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    private final @NonNull TokenStream tokens;
    private final @NonNull Options options;

    private int depth = 0;

    public Parser(TokenStream tokens) {
        this(tokens, Options.defaults());
    }

    public static Program parseSource(String source) {
        return new Parser(new TokenStream(new Scanner(source).getTokens())).parse();
    }

    public Program parse() {
        return program();
    }

    //// grammar rules ////

    /**
     * <pre>
     * program     :: statement* EOF
     * </pre>
     */
    private Program program() {
        var statements = new ArrayList<Stmt>();
        while (!isAtEnd()) {
            statements.add(statement());
        }
        log.debug("parsed {} statements", statements.size());
        return new Program(statements);
    }

    /**
     * <pre>
     * statement   :: "interrompa" | "continue" | "passe"
     *             | "retorne" ( expression ( "," expression )* )?
     *             | "verifique" expression ( "," expression )?
     *             | assignment
     *             | expression
     * </pre>
     */
    private Stmt statement() {
        if (match(BREAK)) {
            return new Stmt.Break();
        }
        if (match(CONTINUE)) {
            return new Stmt.Continue();
        }
        if (match(PASS)) {
            return new Stmt.Pass();
        }
        if (match(RETURN)) {
            var values = new ArrayList<Expr>();
            if (startsExpression(peek())) {
                do {
                    values.add(expression());
                } while (match(COMMA));
            }
            return new Stmt.Return(values);
        }
        if (match(ASSERT)) {
            var test = expression();
            var message = match(COMMA) ? expression() : null;
            return new Stmt.Assert(test, message);
        }
        if (check(IDENTIFIER) && peekNext().type() == EQUAL) {
            return assignment();
        }
        if (!startsExpression(peek())) {
            throw error(peek(), "Unexpected '" + peek().lexeme() + "', expect statement.");
        }
        return new Stmt.Expression(expression());
    }

    /**
     * <pre>
     * assignment  :: ID "=" ( ID "=" )* expression
     * </pre>
     */
    private Stmt assignment() {
        var targets = new ArrayList<Expr>();
        do {
            var name = consume(IDENTIFIER, "Expect variable name.");
            consume(EQUAL, "Expect '=' after variable name.");
            targets.add(new Expr.Identifier(name.lexeme()));
        } while (check(IDENTIFIER) && peekNext().type() == EQUAL);

        var value = expression();
        return new Stmt.Assign(targets, value);
    }

    /**
     * <pre>
     * expression  :: conditional | disjunction
     * </pre>
     */
    private Expr expression() {
        return nested(() -> match(IF) ? conditional() : disjunction());
    }

    /**
     * <pre>
     * conditional :: "se" disjunction ":" expression
     *                ( "ouentaose" disjunction ":" expression )*
     *                ( "senao" ":" expression )?
     * </pre>
     */
    private Expr conditional() {
        var test = disjunction();
        consume(COLON, "Expect ':' after condition.");
        var body = expression();

        Expr orElse;
        if (match(ELIF)) {
            orElse = nested(this::conditional);
        } else if (match(ELSE)) {
            consume(COLON, "Expect ':' after 'senao'.");
            orElse = expression();
        } else {
            orElse = new Expr.None();
        }
        return new Expr.Conditional(test, body, orElse);
    }

    /**
     * <pre>
     * disjunction :: conjunction ( "ou" conjunction )*
     * </pre>
     */
    private Expr disjunction() {
        var expr = conjunction();
        for (var links = 1; match(OR); links++) {
            chained(links);
            expr = new Expr.BoolOp(expr, Expr.BooleanOperator.OR, conjunction());
        }
        return expr;
    }

    /**
     * <pre>
     * conjunction :: inversion ( "e" inversion )*
     * </pre>
     */
    private Expr conjunction() {
        var expr = inversion();
        for (var links = 1; match(AND); links++) {
            chained(links);
            expr = new Expr.BoolOp(expr, Expr.BooleanOperator.AND, inversion());
        }
        return expr;
    }

    /**
     * <pre>
     * inversion   :: "nao" inversion | comparison
     * </pre>
     */
    private Expr inversion() {
        if (match(NOT)) {
            return new Expr.UnaryOp(Expr.UnaryOperator.NOT, nested(this::inversion));
        }
        return comparison();
    }

    /**
     * <pre>
     * comparison  :: sum ( ( "==" | "!=" | "<" | ">" | "<=" | ">=" | "é" "nao"? ) sum )*
     * </pre>
     */
    private Expr comparison() {
        var expr = sum();
        for (var links = 1;; links++) {
            Expr.CompareOperator operator;
            if (match(EQUAL_EQUAL)) {
                operator = Expr.CompareOperator.EQUAL;
            } else if (match(BANG_EQUAL)) {
                operator = Expr.CompareOperator.NOT_EQUAL;
            } else if (match(LESS)) {
                operator = Expr.CompareOperator.LESS;
            } else if (match(GREATER)) {
                operator = Expr.CompareOperator.GREATER;
            } else if (match(LESS_EQUAL)) {
                operator = Expr.CompareOperator.LESS_EQUAL;
            } else if (match(GREATER_EQUAL)) {
                operator = Expr.CompareOperator.GREATER_EQUAL;
            } else if (match(IS)) {
                operator = match(NOT) ? Expr.CompareOperator.IS_NOT : Expr.CompareOperator.IS;
            } else {
                return expr;
            }
            chained(links);
            expr = new Expr.Compare(expr, operator, sum());
        }
    }

    /**
     * <pre>
     * sum         :: term ( ( "+" | "-" ) term )*
     * </pre>
     */
    private Expr sum() {
        var expr = term();
        for (var links = 1;; links++) {
            Expr.BinaryOperator operator;
            if (match(PLUS)) {
                operator = Expr.BinaryOperator.ADD;
            } else if (match(MINUS)) {
                operator = Expr.BinaryOperator.SUB;
            } else {
                return expr;
            }
            chained(links);
            expr = new Expr.BinOp(expr, operator, term());
        }
    }

    /**
     * <pre>
     * term        :: factor ( ( "*" | "/" | "//" | "%" ) factor )*
     * </pre>
     */
    private Expr term() {
        var expr = factor();
        for (var links = 1;; links++) {
            Expr.BinaryOperator operator;
            if (match(STAR)) {
                operator = Expr.BinaryOperator.MUL;
            } else if (match(SLASH)) {
                operator = Expr.BinaryOperator.DIV;
            } else if (match(SLASH_SLASH)) {
                operator = Expr.BinaryOperator.INT_DIV;
            } else if (match(PERCENT)) {
                operator = Expr.BinaryOperator.MOD;
            } else {
                return expr;
            }
            chained(links);
            expr = new Expr.BinOp(expr, operator, factor());
        }
    }

    /**
     * <pre>
     * factor      :: ( "-" | "+" ) factor | call
     * </pre>
     */
    private Expr factor() {
        if (match(MINUS)) {
            return new Expr.UnaryOp(Expr.UnaryOperator.MINUS, nested(this::factor));
        }
        if (match(PLUS)) {
            return new Expr.UnaryOp(Expr.UnaryOperator.PLUS, nested(this::factor));
        }
        return call();
    }

    /**
     * <pre>
     * call        :: primary ( "(" arguments? ")" )*
     * </pre>
     */
    private Expr call() {
        var expr = primary();
        for (var links = 1; match(PAREN_LEFT); links++) {
            chained(links);
            expr = arguments(expr);
        }
        return expr;
    }

    /**
     * <pre>
     * arguments   :: argument ( "," argument )*
     * argument    :: ID "=" expression | expression
     * </pre>
     * Named arguments must come after every positional one.
     */
    private Expr arguments(Expr function) {
        var arguments = new ArrayList<Expr>();
        var keywords = new ArrayList<Expr.Keyword>();
        if (!check(PAREN_RIGHT)) {
            do {
                if (check(IDENTIFIER) && peekNext().type() == EQUAL) {
                    var name = advance();
                    advance(); // EQUAL
                    if (hasKeyword(keywords, name.lexeme())) {
                        throw error(name, "Duplicate named argument '" + name.lexeme() + "'.");
                    }
                    keywords.add(new Expr.Keyword(name.lexeme(), expression()));
                } else if (!keywords.isEmpty()) {
                    throw error(peek(), "Positional argument after named argument.");
                } else {
                    arguments.add(expression());
                }
            } while (match(COMMA));
        }
        consume(PAREN_RIGHT, "Expect ')' after arguments.");
        return new Expr.Call(function, arguments, keywords);
    }

    /**
     * <pre>
     * primary     :: INTEGER | FLOAT | STRING | BOOLEAN | "Vazio"
     *             | ID | "imprima" | "entrada"
     *             | "(" expression ")"
     * </pre>
     */
    private Expr primary() {
        if (match(INTEGER)) {
            return new Expr.IntegerLiteral((Long) previous().literal());
        }
        if (match(FLOAT)) {
            return new Expr.FloatLiteral((Double) previous().literal());
        }
        if (match(STRING)) {
            return new Expr.Str((String) previous().literal());
        }
        if (match(BOOLEAN)) {
            return Boolean.TRUE.equals(previous().literal()) ? new Expr.True() : new Expr.False();
        }
        if (match(NONE)) {
            return new Expr.None();
        }
        if (match(IDENTIFIER, PRINT, INPUT)) {
            return new Expr.Identifier(previous().lexeme());
        }
        if (match(PAREN_LEFT)) {
            var expr = expression();
            consume(PAREN_RIGHT, "Expect ')' after expression.");
            return expr;
        }
        throw error(peek(), "Expect expression.");
    }

    //// utility methods ////

    private static boolean startsExpression(Token token) {
        switch (token.type()) {
        case INTEGER:
        case FLOAT:
        case STRING:
        case BOOLEAN:
        case NONE:
        case IDENTIFIER:
        case PRINT:
        case INPUT:
        case PAREN_LEFT:
        case MINUS:
        case PLUS:
        case NOT:
        case IF:
            return true;
        default:
            return false;
        }
    }

    private static boolean hasKeyword(List<Expr.Keyword> keywords, String name) {
        for (var keyword : keywords) {
            if (keyword.name().equals(name)) {
                return true;
            }
        }
        return false;
    }

    private Expr nested(Supplier<Expr> rule) {
        if (depth >= options.getMaxParseDepth()) {
            throw error(peek(), "Expression nested too deeply.");
        }
        depth++;
        try {
            return rule.get();
        } finally {
            depth--;
        }
    }

    /**
     * Each link of an operator chain nests the tree one level deeper, so chains count against the same limit.
     */
    private void chained(int links) {
        if (depth + links > options.getMaxParseDepth()) {
            throw error(previous(), "Expression nested too deeply.");
        }
    }

    private Token consume(Token.Type type, String message) {
        if (check(type)) {
            return advance();
        }

        throw error(peek(), message);
    }

    private ParseErrorException error(Token token, String message) {
        return new ParseErrorException(token, message);
    }

    private boolean match(Token.Type... types) {
        for (var type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }

        return false;
    }

    private boolean check(Token.Type type) {
        return !isAtEnd() && peek().type() == type;
    }

    private Token advance() {
        return tokens.advance();
    }

    private boolean isAtEnd() {
        return tokens.isAtEnd();
    }

    private Token peek() {
        return tokens.peek();
    }

    private Token peekNext() {
        return tokens.peekNext();
    }

    private Token previous() {
        return tokens.previous();
    }
}
