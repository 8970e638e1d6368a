package tupi.lang;

import static tupi.lang.Token.Type.EOF;

import java.util.List;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Read cursor over a scanned token list. Reading past the last token yields an {@code EOF} marker.
 */
@RequiredArgsConstructor
public final class TokenStream {

    private final @NonNull List<Token> tokens;

    private int current = 0;
    private Token previous = null;
    private Token eof = null;

    public int position() {
        return current;
    }

    public Token previous() {
        return previous != null ? previous : peek();
    }

    public boolean isAtEnd() {
        return peek().type() == EOF;
    }

    public Token peek() {
        return peek(0);
    }

    public Token peek(int ahead) {
        var index = current + ahead;
        if (index < tokens.size()) {
            return tokens.get(index);
        }
        return eof();
    }

    public Token peekNext() {
        return peek(1);
    }

    public Token advance() {
        previous = peek();
        if (current < tokens.size()) {
            current++;
        }
        return previous;
    }

    private Token eof() {
        if (eof == null) {
            if (tokens.isEmpty()) {
                eof = new Token(EOF, "", 1, 1);
            } else {
                var last = tokens.get(tokens.size() - 1);
                eof = new Token(EOF, "", last.line(), last.column() + last.lexeme().length());
            }
        }
        return eof;
    }
}
