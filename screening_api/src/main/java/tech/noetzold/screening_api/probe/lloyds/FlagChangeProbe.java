package tech.noetzold.screening_api.probe.lloyds;

import com.fasterxml.jackson.databind.JsonNode;
import tech.noetzold.screening_api.model.RiskDates;
import tech.noetzold.screening_api.model.RiskLevel;
import tech.noetzold.screening_api.probe.AbstractProviderProbe;
import tech.noetzold.screening_api.probe.PayloadReader;
import tech.noetzold.screening_api.probe.ProbeParameters;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Flags a vessel that changed flag within the recency window before the evaluation date.
 */
public class FlagChangeProbe extends AbstractProviderProbe {

    public static final String ID = "lloyds_flag_sanctions";

    public FlagChangeProbe(String providerId) {
        super(ID, "Recent flag change", "vessel", providerId, ProbeParameters.VESSEL_IMO,
                List.of(ProbeParameters.VESSEL_IMO, ProbeParameters.START_DATE, ProbeParameters.END_DATE),
                List.of(RiskLevel.MEDIUM));
    }

    @Override
    protected Classification classify(String subjectId, Map<String, Object> params, JsonNode body) {
        JsonNode data = PayloadReader.requireObject(providerId(), body, "Data");
        JsonNode item = PayloadReader.first(data, "Items");
        JsonNode flag = item == null ? null : item.get("Flag");
        if (flag == null || !flag.isObject()) {
            return Classification.noRisk();
        }

        LocalDate evaluationDate = ProbeParameters.evaluationDate(params).orElseThrow();
        Optional<LocalDate> changedOn = RiskDates.parse(PayloadReader.text(flag, "FlagStartDate"));
        boolean recent = changedOn.map(date -> RiskDates.isRecent(date, evaluationDate)).orElse(false);

        Map<String, Object> row = new LinkedHashMap<>();
        row.put("VesselImo", subjectId);
        row.putAll(PayloadReader.row(flag,
                "FlagName", "FlagName",
                "FlagStartDate", "FlagStartDate",
                "ParisMouStatus", "ParisMouStatus",
                "ParisMouStartDate", "ParisMouStartDate"));
        row.put("FlagChangedWithinYear", recent);

        return new Classification(recent ? RiskLevel.MEDIUM : RiskLevel.NO_RISK, List.of(row));
    }
}
