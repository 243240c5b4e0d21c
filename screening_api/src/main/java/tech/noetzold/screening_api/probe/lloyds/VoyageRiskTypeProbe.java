package tech.noetzold.screening_api.probe.lloyds;

import com.fasterxml.jackson.databind.JsonNode;
import tech.noetzold.screening_api.model.RiskLevel;
import tech.noetzold.screening_api.probe.AbstractProviderProbe;
import tech.noetzold.screening_api.probe.PayloadReader;
import tech.noetzold.screening_api.probe.ProbeParameters;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Matches Lloyd's voyage events by risk type. Any voyage tagged with one of the configured risk
 * types raises the probe to its level; the matching voyages are the detail rows.
 */
public class VoyageRiskTypeProbe extends AbstractProviderProbe {

    private final Set<String> riskTypes;
    private final RiskLevel matchLevel;

    public VoyageRiskTypeProbe(String id, String description, String providerId,
                               Set<String> riskTypes, RiskLevel matchLevel) {
        super(id, description, "voyage", providerId, ProbeParameters.VESSEL_IMO,
                List.of(ProbeParameters.VESSEL_IMO, ProbeParameters.START_DATE, ProbeParameters.END_DATE),
                List.of(matchLevel));
        this.riskTypes = Set.copyOf(riskTypes);
        this.matchLevel = matchLevel;
    }

    public static VoyageRiskTypeProbe highRiskPort(String providerId) {
        return new VoyageRiskTypeProbe("high_risk_port", "High risk port calling", providerId,
                Set.of("High Risk Port Calling"), RiskLevel.HIGH);
    }

    public static VoyageRiskTypeProbe possibleDarkPort(String providerId) {
        return new VoyageRiskTypeProbe("possible_dark_port", "Possible dark port calling", providerId,
                Set.of("Possible Dark Port Calling", "Probable Dark Port Calling"), RiskLevel.HIGH);
    }

    public static VoyageRiskTypeProbe suspiciousAisGap(String providerId) {
        return new VoyageRiskTypeProbe("suspicious_ais_gap", "Suspicious AIS gap", providerId,
                Set.of("Suspicious AIS Gap"), RiskLevel.MEDIUM);
    }

    public static VoyageRiskTypeProbe darkSts(String providerId) {
        return new VoyageRiskTypeProbe("dark_sts", "Dark STS transfer", providerId,
                Set.of("Possible 1-way Dark STS (as dark party)", "Probable 2 way dark STS",
                        "Possible 2-way Dark STS (as dark party)"),
                RiskLevel.HIGH);
    }

    public static VoyageRiskTypeProbe sanctionedSts(String providerId) {
        return new VoyageRiskTypeProbe("sanctioned_sts", "STS with a sanctioned vessel", providerId,
                Set.of("STS With a Sanctioned Vessel"), RiskLevel.HIGH);
    }

    public static VoyageRiskTypeProbe loitering(String providerId) {
        return new VoyageRiskTypeProbe("loitering_behavior", "Loitering behaviour", providerId,
                Set.of("Loitering"), RiskLevel.MEDIUM);
    }

    @Override
    protected Classification classify(String subjectId, Map<String, Object> params, JsonNode body) {
        JsonNode data = PayloadReader.requireObject(providerId(), body, "Data");
        JsonNode item = PayloadReader.first(data, "Items");
        if (item == null) {
            return Classification.noRisk();
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        for (JsonNode voyage : PayloadReader.elements(item, "Voyages")) {
            List<String> voyageRiskTypes = new ArrayList<>();
            PayloadReader.elements(voyage, "RiskTypes").forEach(type -> voyageRiskTypes.add(type.asText()));
            if (voyageRiskTypes.stream().noneMatch(riskTypes::contains)) {
                continue;
            }
            Map<String, Object> row = PayloadReader.row(voyage,
                    "VoyageId", "VoyageId",
                    "VoyageStartTime", "VoyageStartTime",
                    "VoyageEndTime", "VoyageEndTime",
                    "VoyageRiskRating", "VoyageRiskRating",
                    "StartPlace", "VoyageStartPlace",
                    "EndPlace", "VoyageEndPlace");
            row.put("VesselImo", subjectId);
            row.put("RiskTypes", voyageRiskTypes);
            rows.add(row);
        }

        return new Classification(rows.isEmpty() ? RiskLevel.NO_RISK : matchLevel, rows);
    }
}
