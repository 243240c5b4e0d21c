package tech.noetzold.screening_api.probe.lloyds;

import com.fasterxml.jackson.databind.JsonNode;
import tech.noetzold.screening_api.model.RiskLevel;
import tech.noetzold.screening_api.probe.AbstractProviderProbe;
import tech.noetzold.screening_api.probe.PayloadReader;
import tech.noetzold.screening_api.probe.ProbeParameters;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Lloyd's AIS manipulation compliance risk. Lloyd's "Low" score counts as no risk.
 */
public class AisManipulationProbe extends AbstractProviderProbe {

    public static final String ID = "ais_manipulation";

    private static final String RISK_TYPE = "VesselAisManipulation";

    public AisManipulationProbe(String providerId) {
        super(ID, "AIS signal manipulation", "vessel", providerId, ProbeParameters.VESSEL_IMO,
                List.of(ProbeParameters.VESSEL_IMO), List.of(RiskLevel.MEDIUM, RiskLevel.HIGH));
    }

    @Override
    protected Classification classify(String subjectId, Map<String, Object> params, JsonNode body) {
        JsonNode data = PayloadReader.requireObject(providerId(), body, "Data");
        RiskLevel level = RiskLevel.NO_RISK;
        List<Map<String, Object>> rows = new ArrayList<>();

        for (JsonNode item : PayloadReader.elements(data, "Items")) {
            for (JsonNode risk : PayloadReader.elements(item, "ComplianceRisks")) {
                if (!RISK_TYPE.equals(PayloadReader.text(risk, "ComplianceRiskType", "Description"))) {
                    continue;
                }
                RiskLevel scored = fromScore(PayloadReader.text(risk, "ComplianceRiskScore"));
                if (scored == RiskLevel.NO_RISK) {
                    continue;
                }
                level = RiskLevel.merge(level, scored);

                List<JsonNode> details = PayloadReader.elements(risk, "Details");
                if (details.isEmpty()) {
                    rows.add(baseRow(item, risk));
                }
                for (JsonNode detail : details) {
                    Map<String, Object> row = baseRow(item, risk);
                    row.put("PlaceInfo", PayloadReader.value(detail.get("Place")));
                    List<String> indicators = new ArrayList<>();
                    PayloadReader.elements(detail, "RiskIndicators")
                            .forEach(indicator -> indicators.add(PayloadReader.text(indicator, "Description")));
                    row.put("RiskIndicators", indicators);
                    rows.add(row);
                }
            }
        }
        return new Classification(level, rows);
    }

    private static Map<String, Object> baseRow(JsonNode item, JsonNode risk) {
        Map<String, Object> row = PayloadReader.row(item,
                "VesselImo", "VesselImo",
                "VesselName", "VesselName");
        row.put("ComplianceRiskScore", PayloadReader.text(risk, "ComplianceRiskScore"));
        return row;
    }

    private static RiskLevel fromScore(String score) {
        if ("High".equalsIgnoreCase(score)) {
            return RiskLevel.HIGH;
        }
        if ("Medium".equalsIgnoreCase(score)) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.NO_RISK;
    }
}
