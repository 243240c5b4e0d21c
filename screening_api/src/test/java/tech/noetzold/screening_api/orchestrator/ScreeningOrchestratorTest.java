package tech.noetzold.screening_api.orchestrator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tech.noetzold.screening_api.client.KplerVesselRisksClient;
import tech.noetzold.screening_api.client.LloydsProviderClient;
import tech.noetzold.screening_api.client.ProviderClient;
import tech.noetzold.screening_api.exception.ConfigurationException;
import tech.noetzold.screening_api.model.DescriptionText;
import tech.noetzold.screening_api.model.ProviderPayload;
import tech.noetzold.screening_api.model.RiskLevel;
import tech.noetzold.screening_api.model.RiskRecord;
import tech.noetzold.screening_api.model.ScreeningWindow;
import tech.noetzold.screening_api.probe.CompositeProbe;
import tech.noetzold.screening_api.probe.LeafProbe;
import tech.noetzold.screening_api.probe.kpler.KplerRiskListProbe;
import tech.noetzold.screening_api.probe.kpler.KplerSanctionsProbe;
import tech.noetzold.screening_api.probe.lloyds.LloydsSanctionsProbe;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScreeningOrchestratorTest {

    private static final String IMO = "9876543";
    private static final Map<String, Object> PARAMS = Map.of("start_date", "2024-08-25", "end_date", "2025-08-25");

    private static final String LLOYDS_CURRENT_SANCTION = """
            {"IsSuccess": true, "Data": {"items": [
              {"vesselSanctions": {"vesselImo": "9876543", "sanctionId": "S1", "source": "OFAC", "startDate": "2023-01-01", "endDate": ""}}
            ]}}
            """;

    private static final String KPLER_CLEAN = """
            [{"vessel": {"imo": "9876543", "shipname": "NORTH STAR"},
              "compliance": {"sanctionRisks": {"sanctionedVessels": [], "sanctionedCargo": [{"commodity": "crude"}]},
                             "operationalRisks": {"aisGaps": []}}}]
            """;

    private final ObjectMapper mapper = new ObjectMapper();
    private ExecutorService executor;
    private StubClient lloyds;
    private StubClient kpler;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        lloyds = new StubClient(LloydsProviderClient.SANCTIONS, json(LLOYDS_CURRENT_SANCTION), 0);
        kpler = new StubClient(KplerVesselRisksClient.PROVIDER_ID, json(KPLER_CLEAN), 0);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private JsonNode json(String body) {
        try {
            return mapper.readTree(body);
        } catch (Exception e) {
            throw new IllegalArgumentException(e);
        }
    }

    private ScreeningOrchestrator orchestrator(Duration timeout, DescriptionLookup descriptions) {
        ProbeRegistry registry = new ProbeRegistry();
        registry.register(new LloydsSanctionsProbe(LloydsProviderClient.SANCTIONS));
        registry.register(new KplerSanctionsProbe(KplerVesselRisksClient.PROVIDER_ID));
        KplerRiskListProbe.standardSet(KplerVesselRisksClient.PROVIDER_ID).forEach(registry::register);
        registry.register(new BrokenProbe());
        registry.register(new CompositeProbe("Vessel_is_sanction", "Vessel sanctioned", "vessel",
                List.of("lloyds_sanctions", "kpler_sanctions"), List.of("vessel_imo", "start_date", "end_date")));
        registry.register(new CompositeProbe("Vessel_with_broken", "Aggregate over a failing probe", "vessel",
                List.of("broken", "lloyds_sanctions"), List.of("vessel_imo")));
        return new ScreeningOrchestrator(registry, List.of(lloyds, kpler), descriptions, executor, timeout);
    }

    private ScreeningOrchestrator orchestrator() {
        return orchestrator(Duration.ofSeconds(5), DescriptionLookup.none());
    }

    @Nested
    @DisplayName("aggregate evaluation")
    class Aggregates {

        @Test
        @DisplayName("a current Lloyd's sanction makes the vessel sanctioned with Lloyd's rows only")
        void vesselIsSanctioned() {
            List<RiskRecord> records = orchestrator().execute(List.of("Vessel_is_sanction"), IMO, PARAMS);

            assertThat(records).singleElement().satisfies(record -> {
                assertThat(record.riskType()).isEqualTo("Vessel_is_sanction");
                assertThat(record.riskLevel()).isEqualTo(RiskLevel.HIGH);
                assertThat(record.detailRows()).isNotEmpty()
                        .allSatisfy(row -> assertThat(row).containsEntry(CompositeProbe.SOURCE, "lloyds_sanctions"));
                assertThat(record.subjectRef()).containsEntry("vessel_imo", IMO);
            });
        }

        @Test
        @DisplayName("both providers timing out gives NO_DATA with no rows")
        void providersTimeOut() {
            lloyds = new StubClient(LloydsProviderClient.SANCTIONS, json(LLOYDS_CURRENT_SANCTION), 1_000);
            kpler = new StubClient(KplerVesselRisksClient.PROVIDER_ID, json(KPLER_CLEAN), 1_000);

            List<RiskRecord> records = orchestrator(Duration.ofMillis(100), DescriptionLookup.none())
                    .execute(List.of("Vessel_is_sanction"), IMO, PARAMS);

            assertThat(records).singleElement().satisfies(record -> {
                assertThat(record.riskLevel()).isEqualTo(RiskLevel.NO_DATA);
                assertThat(record.detailRows()).isEmpty();
            });
        }

        @Test
        @DisplayName("a component that throws is treated as NO_DATA by its aggregate")
        void failingComponent() {
            List<RiskRecord> records = orchestrator().execute(List.of("Vessel_with_broken"), IMO, PARAMS);

            assertThat(records.get(0).riskLevel()).isEqualTo(RiskLevel.HIGH);
        }
    }

    @Nested
    @DisplayName("fetch deduplication")
    class Deduplication {

        @Test
        @DisplayName("probes sharing a provider trigger a single fetch")
        void sharedProviderFetchedOnce() {
            List<RiskRecord> records = orchestrator().execute(
                    List.of("kpler_sanctions", "has_sanctioned_cargo_risk", "has_ais_gap_risk", "Vessel_is_sanction"),
                    IMO, PARAMS);

            assertThat(records).extracting(RiskRecord::riskLevel)
                    .containsExactly(RiskLevel.NO_RISK, RiskLevel.HIGH, RiskLevel.NO_RISK, RiskLevel.HIGH);
            assertThat(kpler.calls).hasValue(1);
            assertThat(lloyds.calls).hasValue(1);
        }

        @Test
        @DisplayName("a session shares fetched payloads between executions")
        void sessionSharesCache() {
            ScreeningOrchestrator orchestrator = orchestrator();

            try (ScreeningSession session = orchestrator.openSession()) {
                session.execute(List.of("lloyds_sanctions"), IMO, PARAMS);
                session.execute(List.of("Vessel_is_sanction"), IMO, PARAMS);
                assertThat(session.cache().hits()).isEqualTo(1);
            }
            assertThat(lloyds.calls).hasValue(1);
        }

        @Test
        @DisplayName("separate executions fetch again")
        void executionsDoNotShare() {
            ScreeningOrchestrator orchestrator = orchestrator();

            orchestrator.execute(List.of("lloyds_sanctions"), IMO, PARAMS);
            orchestrator.execute(List.of("lloyds_sanctions"), IMO, PARAMS);

            assertThat(lloyds.calls).hasValue(2);
        }
    }

    @Nested
    @DisplayName("results")
    class Results {

        @Test
        @DisplayName("come back in request order, one per check")
        void requestOrder() {
            List<RiskRecord> records = orchestrator().execute(
                    List.of("has_ais_gap_risk", "lloyds_sanctions", "kpler_sanctions"), IMO, PARAMS);

            assertThat(records).extracting(RiskRecord::riskType)
                    .containsExactly("has_ais_gap_risk", "lloyds_sanctions", "kpler_sanctions");
        }

        @Test
        @DisplayName("are identical for identical inputs and provider data")
        void idempotent() {
            ScreeningOrchestrator orchestrator = orchestrator();
            List<String> checks = List.of("Vessel_is_sanction", "has_sanctioned_cargo_risk");

            assertThat(orchestrator.execute(checks, IMO, PARAMS)).isEqualTo(orchestrator.execute(checks, IMO, PARAMS));
        }

        @Test
        @DisplayName("a probe that throws does not abort its siblings")
        void failingProbeIsolated() {
            List<RiskRecord> records = orchestrator().execute(List.of("broken", "lloyds_sanctions"), IMO, PARAMS);

            assertThat(records.get(0).riskType()).isEqualTo("broken");
            assertThat(records.get(0).riskLevel()).isEqualTo(RiskLevel.NO_DATA);
            assertThat(records.get(1).riskLevel()).isEqualTo(RiskLevel.HIGH);
        }

        @Test
        @DisplayName("carry the description texts for their type and level")
        void decorated() {
            DescriptionLookup descriptions = (riskType, level) -> "Vessel_is_sanction".equals(riskType) && level == RiskLevel.HIGH
                    ? new DescriptionText("Vessel is currently sanctioned", "Listed by OFAC")
                    : DescriptionText.EMPTY;

            RiskRecord record = orchestrator(Duration.ofSeconds(5), descriptions)
                    .execute(List.of("Vessel_is_sanction"), IMO, PARAMS).get(0);

            assertThat(record.info()).isEqualTo("Vessel is currently sanctioned");
            assertThat(record.riskDescriptionInfo()).isEqualTo("Listed by OFAC");
        }

        @Test
        @DisplayName("a failing description lookup leaves the texts empty")
        void lookupFailure() {
            DescriptionLookup failing = (riskType, level) -> {
                throw new IllegalStateException("database down");
            };

            RiskRecord record = orchestrator(Duration.ofSeconds(5), failing)
                    .execute(List.of("lloyds_sanctions"), IMO, PARAMS).get(0);

            assertThat(record.riskLevel()).isEqualTo(RiskLevel.HIGH);
            assertThat(record.info()).isEmpty();
        }

        @Test
        @DisplayName("missing window dates degrade dependent probes without calling their provider")
        void missingParameters() {
            List<RiskRecord> records = orchestrator().execute(List.of("kpler_sanctions", "lloyds_sanctions"), IMO, Map.of());

            assertThat(records).extracting(RiskRecord::riskLevel).containsExactly(RiskLevel.NO_DATA, RiskLevel.HIGH);
            assertThat(kpler.calls).hasValue(0);
        }
    }

    @Nested
    @DisplayName("configuration errors")
    class Configuration {

        @Test
        @DisplayName("an unknown check fails the execution before any provider is called")
        void unknownCheck() {
            ScreeningOrchestrator orchestrator = orchestrator();

            assertThatThrownBy(() -> orchestrator.execute(List.of("lloyds_sanctions", "Vessel_unknown"), IMO, PARAMS))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("Vessel_unknown");
            assertThat(lloyds.calls).hasValue(0);
        }

        @Test
        @DisplayName("late registration of a probe without a provider client is rejected")
        void lateRegistrationWithoutClient() {
            ScreeningOrchestrator orchestrator = orchestrator();

            assertThatThrownBy(() -> orchestrator.register(LloydsSanctionsProbe.ID, new LloydsSanctionsProbe("lloyds_unknown")))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("lloyds_unknown");
        }

        @Test
        @DisplayName("late registration makes the probe available to later executions")
        void lateRegistration() {
            ScreeningOrchestrator orchestrator = orchestrator();
            orchestrator.register("Vessel_kpler_only", new CompositeProbe("Vessel_kpler_only", "Kpler only", "vessel",
                    List.of("kpler_sanctions"), List.of()));

            assertThat(orchestrator.execute(List.of("Vessel_kpler_only"), IMO, PARAMS).get(0).riskLevel())
                    .isEqualTo(RiskLevel.NO_RISK);
        }

        @Test
        @DisplayName("two clients for one provider are rejected")
        void duplicateClient() {
            ProbeRegistry registry = new ProbeRegistry();

            assertThatThrownBy(() -> new ScreeningOrchestrator(registry, List.of(lloyds, lloyds), DescriptionLookup.none(),
                    executor, Duration.ofSeconds(1)))
                    .isInstanceOf(ConfigurationException.class);
        }
    }

    static final class StubClient implements ProviderClient {

        private final String providerId;
        private final JsonNode body;
        private final long delayMs;
        final AtomicInteger calls = new AtomicInteger();

        StubClient(String providerId, JsonNode body, long delayMs) {
            this.providerId = providerId;
            this.body = body;
            this.delayMs = delayMs;
        }

        @Override
        public String providerId() {
            return providerId;
        }

        @Override
        public ProviderPayload fetch(String subjectId, ScreeningWindow window) {
            calls.incrementAndGet();
            if (delayMs > 0) {
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return ProviderPayload.success(providerId, body);
        }
    }

    static final class BrokenProbe implements LeafProbe {

        @Override
        public String id() {
            return "broken";
        }

        @Override
        public String description() {
            return "Always fails";
        }

        @Override
        public String businessModule() {
            return "vessel";
        }

        @Override
        public List<String> requiredParameters() {
            return List.of();
        }

        @Override
        public Set<RiskLevel> riskLevels() {
            return Set.of(RiskLevel.NO_DATA);
        }

        @Override
        public String providerId() {
            return LloydsProviderClient.SANCTIONS;
        }

        @Override
        public String subjectParameter() {
            return "vessel_imo";
        }

        @Override
        public RiskRecord evaluate(String subjectId, Map<String, Object> params, ProviderPayload providerData) {
            throw new IllegalStateException("classification bug");
        }
    }
}
