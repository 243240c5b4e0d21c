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
 * Lloyd's vessel sanctions listing. Each item carries one {@code vesselSanctions} entry.
 */
public class LloydsSanctionsProbe extends AbstractProviderProbe {

    public static final String ID = "lloyds_sanctions";

    public LloydsSanctionsProbe(String providerId) {
        super(ID, "Lloyd's vessel sanctions", "vessel", providerId, ProbeParameters.VESSEL_IMO,
                List.of(ProbeParameters.VESSEL_IMO), List.of(RiskLevel.MEDIUM, RiskLevel.HIGH));
    }

    @Override
    protected Classification classify(String subjectId, Map<String, Object> params, JsonNode body) {
        JsonNode data = PayloadReader.requireObject(providerId(), body, "Data");

        List<JsonNode> sanctions = new ArrayList<>();
        for (JsonNode item : PayloadReader.elements(data, "items")) {
            JsonNode entry = item.get("vesselSanctions");
            if (entry != null && entry.isObject() && entry.size() > 0) {
                sanctions.add(entry);
            }
        }

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
                    "FirstPublished", "firstPublished",
                    "LastPublished", "lastPublished",
                    "StartDate", "startDate",
                    "EndDate", "endDate"));
        }
        return new Classification(currentOrHistorical(sanctions, "endDate"), rows);
    }
}
