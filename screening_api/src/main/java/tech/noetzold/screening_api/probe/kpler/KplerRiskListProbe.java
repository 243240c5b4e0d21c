package tech.noetzold.screening_api.probe.kpler;

import com.fasterxml.jackson.databind.JsonNode;
import tech.noetzold.screening_api.model.RiskLevel;
import tech.noetzold.screening_api.probe.AbstractProviderProbe;
import tech.noetzold.screening_api.probe.PayloadReader;
import tech.noetzold.screening_api.probe.ProbeParameters;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One Kpler compliance list ({@code sanctionRisks} or {@code operationalRisks}). A non-empty
 * list raises the probe to its level, and the list entries become the detail rows.
 */
public class KplerRiskListProbe extends AbstractProviderProbe {

    static final String SANCTION_RISKS = "sanctionRisks";
    static final String OPERATIONAL_RISKS = "operationalRisks";

    private final String group;
    private final String list;
    private final RiskLevel matchLevel;

    public KplerRiskListProbe(String id, String description, String providerId,
                              String group, String list, RiskLevel matchLevel) {
        super(id, description, "vessel", providerId, ProbeParameters.VESSEL_IMO,
                List.of(ProbeParameters.VESSEL_IMO, ProbeParameters.START_DATE, ProbeParameters.END_DATE),
                List.of(matchLevel));
        this.group = group;
        this.list = list;
        this.matchLevel = matchLevel;
    }

    public static List<KplerRiskListProbe> standardSet(String providerId) {
        return List.of(
                new KplerRiskListProbe("has_sanctioned_cargo_risk", "Sanctioned cargo", providerId,
                        SANCTION_RISKS, "sanctionedCargo", RiskLevel.HIGH),
                new KplerRiskListProbe("has_sanctioned_trades_risk", "Sanctioned trades", providerId,
                        SANCTION_RISKS, "sanctionedTrades", RiskLevel.HIGH),
                new KplerRiskListProbe("has_sanctioned_companies_risk", "Sanctioned companies", providerId,
                        SANCTION_RISKS, "sanctionedCompanies", RiskLevel.HIGH),
                new KplerRiskListProbe("has_port_calls_risk", "Port calls at risky ports", providerId,
                        OPERATIONAL_RISKS, "portCalls", RiskLevel.HIGH),
                new KplerRiskListProbe("has_ais_gap_risk", "AIS gaps", providerId,
                        OPERATIONAL_RISKS, "aisGaps", RiskLevel.MEDIUM),
                new KplerRiskListProbe("has_ais_spoofs_risk", "AIS spoofing", providerId,
                        OPERATIONAL_RISKS, "aisSpoofs", RiskLevel.MEDIUM),
                new KplerRiskListProbe("has_dark_sts_risk", "Dark STS events", providerId,
                        OPERATIONAL_RISKS, "darkStsEvents", RiskLevel.MEDIUM),
                new KplerRiskListProbe("has_sts_events_risk", "STS events", providerId,
                        OPERATIONAL_RISKS, "stsEvents", RiskLevel.MEDIUM));
    }

    @Override
    protected Classification classify(String subjectId, Map<String, Object> params, JsonNode body) {
        JsonNode record = KplerRecords.findVessel(providerId(), body, subjectId);
        if (record == null) {
            return Classification.noRisk();
        }
        List<JsonNode> entries = KplerRecords.riskList(record, group, list);
        if (entries.isEmpty()) {
            return Classification.noRisk();
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        for (JsonNode entry : entries) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("VesselImo", subjectId);
            row.put("VesselName", PayloadReader.text(record, "vessel", "shipname"));
            row.putAll(PayloadReader.fullRow(entry));
            rows.add(row);
        }
        return new Classification(matchLevel, rows);
    }
}
