package tech.noetzold.screening_api.probe;

import tech.noetzold.screening_api.client.KplerComplianceScreeningClient;
import tech.noetzold.screening_api.client.KplerVesselRisksClient;
import tech.noetzold.screening_api.client.LloydsProviderClient;
import tech.noetzold.screening_api.client.SanctionedCountryClient;
import tech.noetzold.screening_api.client.UaniListClient;
import tech.noetzold.screening_api.probe.kpler.KplerFleetRiskProbe;
import tech.noetzold.screening_api.probe.kpler.KplerRiskListProbe;
import tech.noetzold.screening_api.probe.kpler.KplerSanctionsProbe;
import tech.noetzold.screening_api.probe.lloyds.AisManipulationProbe;
import tech.noetzold.screening_api.probe.lloyds.FlagChangeProbe;
import tech.noetzold.screening_api.probe.lloyds.LloydsComplianceProbe;
import tech.noetzold.screening_api.probe.lloyds.LloydsSanctionsProbe;
import tech.noetzold.screening_api.probe.lloyds.VoyageRiskTypeProbe;
import tech.noetzold.screening_api.probe.reference.SanctionedCountryProbe;
import tech.noetzold.screening_api.probe.reference.UaniListProbe;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The standard set of checks, leaves first so aggregates always find their components.
 */
public final class ProbeCatalog {

    private final Map<String, Probe> probes = new LinkedHashMap<>();

    private ProbeCatalog() {
    }

    public static List<Probe> standard() {
        ProbeCatalog catalog = new ProbeCatalog();

        catalog.add(new LloydsSanctionsProbe(LloydsProviderClient.SANCTIONS));
        catalog.add(new FlagChangeProbe(LloydsProviderClient.RISK_SCORE));
        catalog.add(new LloydsComplianceProbe(LloydsProviderClient.RISK_SCORE));
        catalog.add(new AisManipulationProbe(LloydsProviderClient.COMPLIANCE_RISK));
        catalog.add(VoyageRiskTypeProbe.highRiskPort(LloydsProviderClient.VOYAGE_EVENTS));
        catalog.add(VoyageRiskTypeProbe.possibleDarkPort(LloydsProviderClient.VOYAGE_EVENTS));
        catalog.add(VoyageRiskTypeProbe.suspiciousAisGap(LloydsProviderClient.VOYAGE_EVENTS));
        catalog.add(VoyageRiskTypeProbe.darkSts(LloydsProviderClient.VOYAGE_EVENTS));
        catalog.add(VoyageRiskTypeProbe.sanctionedSts(LloydsProviderClient.VOYAGE_EVENTS));
        catalog.add(VoyageRiskTypeProbe.loitering(LloydsProviderClient.VOYAGE_EVENTS));

        catalog.add(new KplerSanctionsProbe(KplerVesselRisksClient.PROVIDER_ID));
        KplerRiskListProbe.standardSet(KplerVesselRisksClient.PROVIDER_ID).forEach(catalog::add);
        catalog.add(new KplerFleetRiskProbe(KplerComplianceScreeningClient.PROVIDER_ID));

        catalog.add(new UaniListProbe(UaniListClient.PROVIDER_ID));
        catalog.add(SanctionedCountryProbe.cargo(SanctionedCountryClient.CARGO_PROVIDER_ID));
        catalog.add(SanctionedCountryProbe.port(SanctionedCountryClient.PORT_PROVIDER_ID));

        catalog.aggregate("Vessel_is_sanction", "Vessel sanctioned", "lloyds_sanctions", "kpler_sanctions");
        catalog.aggregate("Vessel_in_uani", "Vessel on UANI list", "uani_check");
        catalog.aggregate("Vessel_flag_sanctions", "Recent flag change", "lloyds_flag_sanctions");
        catalog.aggregate("Vessel_ais_gap", "AIS gaps", "suspicious_ais_gap", "has_ais_gap_risk");
        catalog.aggregate("Vessel_Manipulation", "AIS manipulation", "ais_manipulation", "has_ais_spoofs_risk");
        catalog.aggregate("Vessel_risky_port_call", "Risky port calls", "high_risk_port", "has_port_calls_risk");
        catalog.aggregate("Vessel_dark_port_call", "Dark port calls", "possible_dark_port");
        catalog.aggregate("Vessel_cargo_sanction", "Sanctioned cargo", "has_sanctioned_cargo_risk");
        catalog.aggregate("Vessel_trade_sanction", "Sanctioned trades", "has_sanctioned_trades_risk");
        catalog.aggregate("Vessel_dark_sts_events", "Dark STS events", "dark_sts", "has_dark_sts_risk");
        catalog.aggregate("Vessel_sts_transfer", "STS transfers", "sanctioned_sts", "has_sts_events_risk");
        catalog.aggregate("Vessel_stakeholder_is_sanction", "Sanctioned stakeholders",
                "lloyds_compliance", "has_sanctioned_companies_risk");
        catalog.aggregate("Vessel_risk_level", "Vessel risk level", "kpler_risk_level", "lloyds_compliance");
        catalog.aggregate("Vessel_bunkering_sanctions", "Bunkering counterparty sanctions",
                "Vessel_is_sanction", "Vessel_in_uani");

        return List.copyOf(catalog.probes.values());
    }

    private void add(Probe probe) {
        probes.put(probe.id(), probe);
    }

    private void aggregate(String id, String description, String... components) {
        Set<String> required = new LinkedHashSet<>();
        for (String component : components) {
            required.addAll(probes.get(component).requiredParameters());
        }
        add(new CompositeProbe(id, description, "vessel", List.of(components), new ArrayList<>(required)));
    }
}
