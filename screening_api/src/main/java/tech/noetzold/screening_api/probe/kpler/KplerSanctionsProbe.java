package tech.noetzold.screening_api.probe.kpler;

import com.fasterxml.jackson.databind.JsonNode;
import tech.noetzold.screening_api.model.RiskLevel;
import tech.noetzold.screening_api.probe.AbstractProviderProbe;
import tech.noetzold.screening_api.probe.PayloadReader;
import tech.noetzold.screening_api.probe.ProbeParameters;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Kpler sanctioned-vessel listing, classified current vs historical on {@code endDate}.
 */
public class KplerSanctionsProbe extends AbstractProviderProbe {

    public static final String ID = "kpler_sanctions";

    public KplerSanctionsProbe(String providerId) {
        super(ID, "Kpler vessel sanctions", "vessel", providerId, ProbeParameters.VESSEL_IMO,
                List.of(ProbeParameters.VESSEL_IMO, ProbeParameters.START_DATE, ProbeParameters.END_DATE),
                List.of(RiskLevel.MEDIUM, RiskLevel.HIGH));
    }

    @Override
    protected Classification classify(String subjectId, Map<String, Object> params, JsonNode body) {
        JsonNode record = KplerRecords.findVessel(providerId(), body, subjectId);
        if (record == null) {
            return Classification.noRisk();
        }
        List<JsonNode> sanctions = KplerRecords.riskList(record, KplerRiskListProbe.SANCTION_RISKS, "sanctionedVessels");

        List<Map<String, Object>> rows = new ArrayList<>();
        for (JsonNode entry : sanctions) {
            rows.add(PayloadReader.row(entry,
                    "VesselImo", "vesselImo",
                    "VesselName", "vesselName",
                    "SanctionId", "sanctionId",
                    "Source", "source",
                    "Type", "type",
                    "Program", "program",
                    "Name", "name",
                    "StartDate", "startDate",
                    "EndDate", "endDate"));
        }
        return new Classification(currentOrHistorical(sanctions, "endDate"), rows);
    }
}
