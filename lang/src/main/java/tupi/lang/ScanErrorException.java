package tupi.lang;

import lombok.Getter;

@Getter
public class ScanErrorException extends RuntimeException {

    private final int line;
    private final int column;

    ScanErrorException(int line, int column, String message) {
        super(message);
        this.line = line;
        this.column = column;
    }
}
