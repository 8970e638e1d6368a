package tupi.lang;

public class NotImplementedException extends RuntimeErrorException {

    NotImplementedException(String what) {
        super(what + " is not implemented");
    }
}
