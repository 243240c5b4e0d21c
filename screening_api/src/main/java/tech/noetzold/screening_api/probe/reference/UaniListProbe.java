package tech.noetzold.screening_api.probe.reference;

import com.fasterxml.jackson.databind.JsonNode;
import tech.noetzold.screening_api.model.RiskLevel;
import tech.noetzold.screening_api.probe.AbstractProviderProbe;
import tech.noetzold.screening_api.probe.PayloadReader;
import tech.noetzold.screening_api.probe.ProbeParameters;

import java.util.List;
import java.util.Map;

/**
 * Vessel present on the UANI tanker tracker list.
 */
public class UaniListProbe extends AbstractProviderProbe {

    public static final String ID = "uani_check";

    public UaniListProbe(String providerId) {
        super(ID, "UANI listed vessel", "vessel", providerId, ProbeParameters.VESSEL_IMO,
                List.of(ProbeParameters.VESSEL_IMO), List.of(RiskLevel.HIGH));
    }

    @Override
    protected Classification classify(String subjectId, Map<String, Object> params, JsonNode body) {
        if (!PayloadReader.flag(body, "found")) {
            return Classification.noRisk();
        }
        JsonNode entry = PayloadReader.requireObject(providerId(), body, "entry");
        return new Classification(RiskLevel.HIGH, List.of(PayloadReader.fullRow(entry)));
    }
}
