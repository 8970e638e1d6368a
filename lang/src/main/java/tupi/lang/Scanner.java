package tupi.lang;

import static java.util.Map.entry;
import static tupi.lang.Token.Type.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Turns source text into tokens, one {@link #scanToken()} call at a time.
 */
@RequiredArgsConstructor
public final class Scanner {

    private static final Logger log = LoggerFactory.getLogger(Scanner.class);

    private static final Map<String, Token.Type> keywords = Map.ofEntries(
        entry("Verdadeiro", BOOLEAN),
        entry("Falso", BOOLEAN),
        entry("Vazio", NONE),
        entry("classe", CLASS),
        entry("fun", FUN),
        entry("lista", LIST),
        entry("dicionario", DICT),
        entry("tupla", TUPLE),
        entry("conjunto", SET),
        entry("imprima", PRINT),
        entry("entrada", INPUT),
        entry("se", IF),
        entry("senao", ELSE),
        entry("ouentaose", ELIF),
        entry("e", AND),
        entry("ou", OR),
        entry("nao", NOT),
        entry("é", IS),
        entry("remova", DEL),
        entry("em", IN),
        entry("verifique", ASSERT),
        entry("interrompa", BREAK),
        entry("retorne", RETURN),
        entry("continue", CONTINUE),
        entry("paracada", FOR),
        entry("enquanto", WHILE),
        entry("global", GLOBAL),
        entry("tente", TRY),
        entry("exceto", EXCEPT),
        entry("passe", PASS),
        entry("provoque", RAISE));

    private final @NonNull String source;
    private List<Token> tokens;

    private int start = 0;
    private int current = 0;
    private int lineStart = 0;
    private int line = 1;

    /**
     * Scans the whole source, dropping whitespace and comments. The end marker is not part of the result.
     */
    public List<Token> getTokens() {
        if (tokens != null) {
            return tokens;
        }

        var visible = new ArrayList<Token>();
        for (var token = scanToken(); token.type() != EOF; token = scanToken()) {
            if (!token.hidden()) {
                visible.add(token);
            }
        }
        log.debug("scanned {} tokens from {} characters", visible.size(), source.length());
        tokens = Collections.unmodifiableList(visible);
        return tokens;
    }

    /**
     * Scans a single token, hidden ones included. Returns an {@code EOF} token once the source is exhausted.
     */
    public Token scanToken() {
        start = current;
        if (isAtEnd()) {
            return new Token(EOF, "", line, getColumn());
        }

        var c = advance();
        switch (c) {
        case '+':
            return token(PLUS);
        case '-':
            return token(MINUS);
        case '*':
            return token(STAR);
        case '/':
            return token(match('/') ? SLASH_SLASH : SLASH);
        case '%':
            return token(PERCENT);
        case ':':
            return token(COLON);
        case ',':
            return token(COMMA);
        case '.':
            return token(DOT);
        case '(':
            return token(PAREN_LEFT);
        case ')':
            return token(PAREN_RIGHT);
        case '[':
            return token(BRACKET_LEFT);
        case ']':
            return token(BRACKET_RIGHT);
        case '{':
            return token(BRACE_LEFT);
        case '}':
            return token(BRACE_RIGHT);
        case '=':
            return token(match('=') ? EQUAL_EQUAL : EQUAL);
        case '!':
            return token(match('=') ? BANG_EQUAL : BANG);
        case '>':
            return token(match('=') ? GREATER_EQUAL : GREATER);
        case '<':
            return token(match('=') ? LESS_EQUAL : LESS);
        case '#':
            while (peek() != '\n' && !isAtEnd()) {
                advance();
            }
            return token(COMMENT);
        case '"':
            return string();
        case '\n':
            var newline = token(WHITESPACE);
            line++;
            lineStart = current;
            return newline;
        default:
            if (isDigit(c)) {
                return number();
            } else if (Character.isWhitespace(c)) {
                return token(WHITESPACE);
            } else if (isAlpha(c)) {
                return identifier();
            }
            throw error("Unexpected character: '" + c + "'");
        }
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || Character.isDigit(c);
    }

    private static boolean isAlpha(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private Token identifier() {
        while (isAlphaNumeric(peek())) {
            advance();
        }
        var text = source.substring(start, current);
        var type = keywords.getOrDefault(text, IDENTIFIER);
        if (type == BOOLEAN) {
            return token(BOOLEAN, "Verdadeiro".equals(text));
        }
        return token(type);
    }

    private Token number() {
        while (isDigit(peek())) {
            advance();
        }

        // a dot only belongs to the number when a digit follows it
        if (peek() == '.' && isDigit(peekNext())) {
            advance();

            while (isDigit(peek())) {
                advance();
            }
        }

        var text = source.substring(start, current);
        try {
            if (text.contains(".")) {
                return token(FLOAT, Double.parseDouble(text));
            }
            return token(INTEGER, Long.parseLong(text));
        } catch (NumberFormatException ex) {
            throw error("Malformed number: " + text);
        }
    }

    private Token string() {
        while (peek() != '"' && peek() != '\n' && !isAtEnd()) {
            advance();
        }
        if (!match('"')) {
            throw error("Unterminated string.");
        }
        var value = source.substring(start + 1, current - 1);
        return token(STRING, value);
    }

    private int getColumn() {
        return 1 + start - lineStart;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean match(char expected) {
        if (isAtEnd()) {
            return false;
        }
        if (source.charAt(current) != expected) {
            return false;
        }

        current++;
        return true;
    }

    private char peek() {
        if (isAtEnd()) {
            return '\0';
        }
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) {
            return '\0';
        }
        return source.charAt(current + 1);
    }

    private Token token(Token.Type type) {
        return token(type, null);
    }

    private Token token(Token.Type type, Object literal) {
        var text = source.substring(start, current);
        return new Token(type, text, literal, line, getColumn());
    }

    private ScanErrorException error(String msg) {
        return new ScanErrorException(line, getColumn(), msg);
    }
}
