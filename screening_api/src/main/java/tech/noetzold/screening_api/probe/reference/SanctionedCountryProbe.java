package tech.noetzold.screening_api.probe.reference;

import com.fasterxml.jackson.databind.JsonNode;
import tech.noetzold.screening_api.model.RiskLevel;
import tech.noetzold.screening_api.probe.AbstractProviderProbe;
import tech.noetzold.screening_api.probe.PayloadReader;
import tech.noetzold.screening_api.probe.ProbeParameters;

import java.util.List;
import java.util.Map;

/**
 * Country of cargo origin or of a port call found on a sanctioned-country reference list.
 */
public class SanctionedCountryProbe extends AbstractProviderProbe {

    public SanctionedCountryProbe(String id, String description, String providerId) {
        super(id, description, "country", providerId, ProbeParameters.COUNTRY_NAME,
                List.of(ProbeParameters.COUNTRY_NAME), List.of(RiskLevel.HIGH));
    }

    public static SanctionedCountryProbe cargo(String providerId) {
        return new SanctionedCountryProbe("cargo_country", "Cargo from sanctioned country", providerId);
    }

    public static SanctionedCountryProbe port(String providerId) {
        return new SanctionedCountryProbe("port_country", "Port in sanctioned country", providerId);
    }

    @Override
    protected Classification classify(String subjectId, Map<String, Object> params, JsonNode body) {
        if (!PayloadReader.flag(body, "listed")) {
            return Classification.noRisk();
        }
        return new Classification(RiskLevel.HIGH, List.of(PayloadReader.row(body,
                "CountryName", "country_name",
                "ListType", "list_type")));
    }
}
