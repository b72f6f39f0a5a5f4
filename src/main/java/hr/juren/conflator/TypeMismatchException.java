package hr.juren.conflator;

public class TypeMismatchException extends IllegalArgumentException {

    public TypeMismatchException(String message) {
        super(message);
    }

    public TypeMismatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
