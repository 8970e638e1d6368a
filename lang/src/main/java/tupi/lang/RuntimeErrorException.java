package tupi.lang;

/**
 * Base of every error raised while evaluating a parsed program.
 */
public class RuntimeErrorException extends RuntimeException {

    RuntimeErrorException(String message) {
        super(message);
    }

    RuntimeErrorException(String message, Throwable cause) {
        super(message, cause);
    }
}
