package tech.noetzold.screening_api.probe.kpler;

import com.fasterxml.jackson.databind.JsonNode;
import tech.noetzold.screening_api.model.RiskLevel;
import tech.noetzold.screening_api.probe.AbstractProviderProbe;
import tech.noetzold.screening_api.probe.PayloadReader;
import tech.noetzold.screening_api.probe.ProbeParameters;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Kpler compliance screening fleet status: any sanctioned vessel in the fleet is HIGH.
 */
public class KplerFleetRiskProbe extends AbstractProviderProbe {

    public static final String ID = "kpler_risk_level";

    public KplerFleetRiskProbe(String providerId) {
        super(ID, "Kpler fleet risk level", "vessel", providerId, ProbeParameters.VESSEL_IMO,
                List.of(ProbeParameters.VESSEL_IMO), List.of(RiskLevel.HIGH));
    }

    @Override
    protected Classification classify(String subjectId, Map<String, Object> params, JsonNode body) {
        JsonNode metrics = PayloadReader.requireObject(providerId(), body, "metrics");
        JsonNode fleetStatus = metrics.get("fleetStatus");
        long sanctionCount = PayloadReader.number(fleetStatus, "sanctionCount");

        Map<String, Object> row = new LinkedHashMap<>();
        row.put("totalCount", PayloadReader.number(fleetStatus, "totalCount"));
        row.put("sanctionCount", sanctionCount);
        row.put("warningCount", PayloadReader.number(fleetStatus, "warningCount"));
        row.put("noRiskCount", PayloadReader.number(fleetStatus, "noRiskCount"));

        return new Classification(sanctionCount > 0 ? RiskLevel.HIGH : RiskLevel.NO_RISK, List.of(row));
    }
}
