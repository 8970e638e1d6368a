package tupi.lang;

public class AssertionFailedException extends RuntimeErrorException {

    AssertionFailedException(String message) {
        super(message);
    }
}
