package tupi.lang;

import lombok.NonNull;

public record Token(
    @NonNull Type type,
    @NonNull String lexeme,
    Object literal,
    int line,
    int column) {

    public Token(Type type, String lexeme, int line, int column) {
        this(type, lexeme, null, line, column);
    }

    /**
     * Whitespace and comments are produced by {@link Scanner#scanToken()} but never reach the parser.
     */
    public boolean hidden() {
        return type == Type.WHITESPACE || type == Type.COMMENT;
    }

    @Override
    public String toString() {
        var literalTag = literal != null ? " " + literal : "";
        return "(Token " + type + " \"" + lexeme + "\"" + literalTag + " " + line + ":" + column + ")";
    }

    public enum Type {
        // single-character symbols
        BANG,
        BRACE_LEFT,
        BRACE_RIGHT,
        BRACKET_LEFT,
        BRACKET_RIGHT,
        COLON,
        COMMA,
        DOT,
        EQUAL,
        GREATER,
        LESS,
        MINUS,
        PAREN_LEFT,
        PAREN_RIGHT,
        PERCENT,
        PLUS,
        SLASH,
        STAR,

        // composite symbols
        BANG_EQUAL,
        EQUAL_EQUAL,
        GREATER_EQUAL,
        LESS_EQUAL,
        SLASH_SLASH,

        // literals
        BOOLEAN,
        FLOAT,
        IDENTIFIER,
        INTEGER,
        STRING,

        // keywords
        NONE,
        CLASS,
        FUN,
        LIST,
        DICT,
        TUPLE,
        SET,
        PRINT,
        INPUT,
        IF,
        ELSE,
        ELIF,
        AND,
        OR,
        NOT,
        IS,
        DEL,
        IN,
        ASSERT,
        BREAK,
        RETURN,
        CONTINUE,
        FOR,
        WHILE,
        GLOBAL,
        TRY,
        EXCEPT,
        PASS,
        RAISE,

        // discarded by Scanner#getTokens()
        WHITESPACE,
        COMMENT,

        // end-of-file
        EOF;
    }
}
