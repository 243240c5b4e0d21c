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
 * Sanction status of the vessel, its owners and its flag from the Lloyd's risk score, with the
 * sanctioned owners as detail rows.
 */
public class LloydsComplianceProbe extends AbstractProviderProbe {

    public static final String ID = "lloyds_compliance";

    private static final List<String> CURRENT = List.of(
            "OwnerIsCurrentlySanctioned", "VesselIsCurrentlySanctioned", "FlagIsCurrentlySanctioned");
    private static final List<String> HISTORICAL = List.of(
            "OwnerHasHistoricalSanctions", "VesselHasHistoricalSanctions", "FlagHasHistoricalSanctions");

    public LloydsComplianceProbe(String providerId) {
        super(ID, "Lloyd's stakeholder sanctions", "stakeholder", providerId, ProbeParameters.VESSEL_IMO,
                List.of(ProbeParameters.VESSEL_IMO, ProbeParameters.START_DATE, ProbeParameters.END_DATE),
                List.of(RiskLevel.MEDIUM, RiskLevel.HIGH));
    }

    @Override
    protected Classification classify(String subjectId, Map<String, Object> params, JsonNode body) {
        JsonNode data = PayloadReader.requireObject(providerId(), body, "Data");
        JsonNode item = PayloadReader.first(data, "Items");
        if (item == null) {
            return Classification.noRisk();
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        for (JsonNode owner : PayloadReader.elements(item, "SanctionedOwners")) {
            Map<String, Object> row = PayloadReader.row(owner,
                    "CompanyName", "CompanyName",
                    "OwnershipTypes", "OwnershipTypes",
                    "OwnershipStartDate", "OwnershipStartDate",
                    "HeadOfficeBasedInSanctionedCountry", "HeadOfficeBasedInSanctionedCountry",
                    "HasSanctionedVesselsInFleet", "HasSanctionedVesselsInFleet",
                    "LinkedToSanctionedCompanies", "LinkedToSanctionedCompanies");
            row.put("HeadOffice.Country", PayloadReader.text(owner, "HeadOffice", "Country"));
            row.put("Sanctions.SanctionSource", collect(owner, "Sanctions", "SanctionSource"));
            row.put("Sanctions.SanctionProgram", collect(owner, "Sanctions", "SanctionProgram"));
            rows.add(row);
        }

        return new Classification(level(item), rows);
    }

    private static RiskLevel level(JsonNode item) {
        if (CURRENT.stream().anyMatch(field -> PayloadReader.flag(item, field))) {
            return RiskLevel.HIGH;
        }
        if (HISTORICAL.stream().anyMatch(field -> PayloadReader.flag(item, field))) {
            return RiskLevel.MEDIUM;
        }
        JsonNode voyageRisks = item.get("VoyageRisks");
        if (PayloadReader.number(voyageRisks, "HighRiskPortCallingCount") > 0
                || PayloadReader.number(voyageRisks, "StsWithASanctionedVesselCount") > 0) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.NO_RISK;
    }

    private static List<String> collect(JsonNode owner, String list, String field) {
        List<String> values = new ArrayList<>();
        for (JsonNode entry : PayloadReader.elements(owner, list)) {
            String value = PayloadReader.text(entry, field);
            if (value != null) {
                values.add(value);
            }
        }
        return values;
    }
}
