package tech.noetzold.screening_api.probe;

import tech.noetzold.screening_api.model.ProviderPayload;
import tech.noetzold.screening_api.model.RiskRecord;

import java.util.Map;

public interface LeafProbe extends Probe {

    String providerId();

    /** Parameter that carries the subject id, filled from the subject when absent. */
    String subjectParameter();

    /**
     * Classifies one provider payload. Must not depend on anything but its arguments, and must
     * not throw for missing parameters or provider failures.
     */
    RiskRecord evaluate(String subjectId, Map<String, Object> params, ProviderPayload providerData);
}
