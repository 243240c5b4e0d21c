package tech.noetzold.screening_api.exception;

/**
 * Network failure, timeout or unexpected payload from a provider.
 */
public class ProviderException extends ScreeningException {

    private final String providerId;
    private final String subjectId;

    public ProviderException(String providerId, String subjectId, String message) {
        super("provider_error", message);
        this.providerId = providerId;
        this.subjectId = subjectId;
    }

    public ProviderException(String providerId, String subjectId, String message, Throwable cause) {
        super("provider_error", message, cause);
        this.providerId = providerId;
        this.subjectId = subjectId;
    }

    public String getProviderId() {
        return providerId;
    }

    public String getSubjectId() {
        return subjectId;
    }
}
