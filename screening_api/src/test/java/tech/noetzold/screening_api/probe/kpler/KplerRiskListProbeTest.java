package tech.noetzold.screening_api.probe.kpler;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.noetzold.screening_api.client.KplerVesselRisksClient;
import tech.noetzold.screening_api.model.ProviderPayload;
import tech.noetzold.screening_api.model.RiskLevel;
import tech.noetzold.screening_api.model.RiskRecord;
import tech.noetzold.screening_api.probe.CompositeProbe;
import tech.noetzold.screening_api.probe.LeafProbe;
import tech.noetzold.screening_api.probe.PayloadReader;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class KplerRiskListProbeTest {

    private static final String IMO = "9876543";
    private static final Map<String, Object> PARAMS = Map.of("start_date", "2024-08-25", "end_date", "2025-08-25");

    private final ObjectMapper mapper = new ObjectMapper();
    private ProviderPayload payload;

    @BeforeEach
    void setUp() throws Exception {
        String json = """
                [
                  {"vessel": {"imo": "1111111", "shipname": "OTHER"},
                   "compliance": {"sanctionRisks": {"sanctionedVessels": [{"name": "x"}]}}},
                  {"vessel": {"imo": "9876543", "shipname": "NORTH STAR"},
                   "compliance": {
                     "sanctionRisks": {
                       "sanctionedVessels": [{"vesselImo": "9876543", "source": "EU", "startDate": "2022-03-01", "endDate": "2023-03-01"}],
                       "sanctionedCargo": [{"commodity": "crude", "origin": "Iran"}],
                       "sanctionedTrades": [],
                       "sanctionedCompanies": [{"name": "Gulf Star Shipping", "type": "owner",
                                                "source": {"name": "OFAC", "url": "https://ofac.example/sdn"}}]
                     },
                     "operationalRisks": {
                       "aisGaps": [{"start": "2025-02-01", "end": "2025-02-04"}, {"start": "2025-05-01", "end": "2025-05-02"}]
                     }
                   }}
                ]
                """;
        payload = ProviderPayload.success(KplerVesselRisksClient.PROVIDER_ID, mapper.readTree(json));
    }

    private RiskRecord evaluate(String probeId) {
        LeafProbe probe = KplerRiskListProbe.standardSet(KplerVesselRisksClient.PROVIDER_ID).stream()
                .filter(candidate -> candidate.id().equals(probeId))
                .findFirst()
                .orElseThrow();
        return probe.evaluate(IMO, PARAMS, payload);
    }

    @Test
    @DisplayName("a non-empty sanction list raises the probe to HIGH with one row per entry")
    void sanctionedCargo() {
        RiskRecord record = evaluate("has_sanctioned_cargo_risk");

        assertThat(record.riskLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(record.detailRows()).singleElement()
                .satisfies(row -> {
                    assertThat(row).containsEntry("VesselName", "NORTH STAR");
                    assertThat(row).containsEntry("commodity", "crude");
                });
    }

    @Test
    @DisplayName("operational lists raise the probe to MEDIUM")
    void aisGaps() {
        RiskRecord record = evaluate("has_ais_gap_risk");

        assertThat(record.riskLevel()).isEqualTo(RiskLevel.MEDIUM);
        assertThat(record.detailRows()).hasSize(2);
    }

    @Test
    @DisplayName("empty or absent lists mean no risk")
    void emptyLists() {
        assertThat(evaluate("has_sanctioned_trades_risk").riskLevel()).isEqualTo(RiskLevel.NO_RISK);
        assertThat(evaluate("has_dark_sts_risk").riskLevel()).isEqualTo(RiskLevel.NO_RISK);
    }

    @Test
    @DisplayName("only the subject's record is read")
    void otherVesselIgnored() {
        RiskRecord record = new KplerSanctionsProbe(KplerVesselRisksClient.PROVIDER_ID).evaluate(IMO, PARAMS, payload);

        assertThat(record.riskLevel()).isEqualTo(RiskLevel.MEDIUM);
        assertThat(record.detailRows()).singleElement()
                .satisfies(row -> assertThat(row).containsEntry("Source", "EU"));
    }

    @Test
    @DisplayName("a provider source field is kept apart from the aggregate source tag")
    void providerSourceKeptApart() {
        RiskRecord companies = evaluate("has_sanctioned_companies_risk");

        assertThat(companies.riskLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(companies.detailRows()).singleElement().satisfies(row -> {
            assertThat(row).doesNotContainKey(CompositeProbe.SOURCE);
            assertThat(row.get(PayloadReader.PROVIDER_SOURCE).toString()).contains("OFAC");
        });

        RiskRecord compliance = RiskRecord.of("lloyds_compliance", "Lloyd's compliance", RiskLevel.NO_RISK,
                List.of(), Map.of("vessel_imo", IMO));
        RiskRecord stakeholders = new CompositeProbe("Vessel_stakeholder_is_sanction", "Sanctioned stakeholders",
                "vessel", List.of("lloyds_compliance", "has_sanctioned_companies_risk"), List.of("vessel_imo"))
                .combine(List.of(compliance, companies));

        assertThat(stakeholders.riskLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(stakeholders.detailRows()).singleElement().satisfies(row -> {
            assertThat(row).containsEntry(CompositeProbe.SOURCE, "has_sanctioned_companies_risk");
            assertThat(row).containsEntry("name", "Gulf Star Shipping");
            assertThat(row).containsKey(PayloadReader.PROVIDER_SOURCE);
        });
    }

    @Test
    @DisplayName("a vessel missing from the response means no risk")
    void vesselNotInResponse() {
        RiskRecord record = new KplerSanctionsProbe(KplerVesselRisksClient.PROVIDER_ID).evaluate("2222222", PARAMS, payload);

        assertThat(record.riskLevel()).isEqualTo(RiskLevel.NO_RISK);
    }

    @Test
    @DisplayName("the standard set covers every Kpler compliance list")
    void standardSet() {
        assertThat(KplerRiskListProbe.standardSet(KplerVesselRisksClient.PROVIDER_ID))
                .extracting(LeafProbe::id)
                .hasSize(8)
                .doesNotHaveDuplicates();
    }
}
