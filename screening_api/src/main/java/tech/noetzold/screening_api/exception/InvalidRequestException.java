package tech.noetzold.screening_api.exception;

/**
 * A screening request the caller has to correct, such as a window that ends before it starts.
 */
public class InvalidRequestException extends ScreeningException {

    public InvalidRequestException(String message) {
        super("invalid_request", message);
    }
}
