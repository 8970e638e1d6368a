package tupi.lang;

import lombok.Getter;

public class ParseErrorException extends RuntimeException {
    @Getter
    private final Token token;

    ParseErrorException(Token token, String message) {
        super(message);
        this.token = token;
    }
}
