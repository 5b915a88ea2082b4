package exceptions;

/**
 * Thrown when the hub cannot carry out a command, scene or group operation.
 */
public class ExecutionException extends Exception {
    public ExecutionException(String message) {
        super(message);
    }

    public ExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
