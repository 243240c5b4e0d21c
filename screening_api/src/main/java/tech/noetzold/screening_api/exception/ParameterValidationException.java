package tech.noetzold.screening_api.exception;

import java.util.List;

/**
 * A required probe parameter is missing or malformed. Recovered by the probe as NO_DATA.
 */
public class ParameterValidationException extends ScreeningException {

    private final List<String> invalidParameters;

    public ParameterValidationException(String probeId, List<String> invalidParameters) {
        super("validation_error", "Probe " + probeId + " has missing or malformed parameters " + invalidParameters);
        this.invalidParameters = List.copyOf(invalidParameters);
    }

    public List<String> getInvalidParameters() {
        return invalidParameters;
    }
}
