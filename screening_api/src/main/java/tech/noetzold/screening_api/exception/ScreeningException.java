package tech.noetzold.screening_api.exception;

/**
 * Base type for failures raised by the screening core. The {@code code} is what the HTTP layer
 * reports back to callers.
 */
public abstract class ScreeningException extends RuntimeException {

    private final String code;

    protected ScreeningException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected ScreeningException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
