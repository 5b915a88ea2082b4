package exceptions;

/**
 * Thrown when a requested device change is not valid for that device.
 */
public class ValidationException extends Exception {
    public ValidationException(String message) {
        super(message);
    }
}
