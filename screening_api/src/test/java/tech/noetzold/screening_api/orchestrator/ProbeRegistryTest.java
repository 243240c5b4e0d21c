package tech.noetzold.screening_api.orchestrator;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.noetzold.screening_api.client.KplerVesselRisksClient;
import tech.noetzold.screening_api.client.LloydsProviderClient;
import tech.noetzold.screening_api.exception.ConfigurationException;
import tech.noetzold.screening_api.probe.CompositeProbe;
import tech.noetzold.screening_api.probe.Probe;
import tech.noetzold.screening_api.probe.ProbeCatalog;
import tech.noetzold.screening_api.probe.kpler.KplerSanctionsProbe;
import tech.noetzold.screening_api.probe.lloyds.LloydsSanctionsProbe;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProbeRegistryTest {

    private ProbeRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ProbeRegistry();
        registry.register(new LloydsSanctionsProbe(LloydsProviderClient.SANCTIONS));
        registry.register(new KplerSanctionsProbe(KplerVesselRisksClient.PROVIDER_ID));
    }

    private static CompositeProbe aggregate(String id, String... components) {
        return new CompositeProbe(id, id, "vessel", List.of(components), List.of());
    }

    @Test
    @DisplayName("rejects a second probe with the same id")
    void duplicate() {
        assertThatThrownBy(() -> registry.register(new LloydsSanctionsProbe(LloydsProviderClient.SANCTIONS)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("lloyds_sanctions");
    }

    @Test
    @DisplayName("rejects an aggregate that references an unregistered component")
    void unregisteredComponent() {
        assertThatThrownBy(() -> registry.register(aggregate("Vessel_in_uani", "uani_check")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("uani_check");
        assertThat(registry.contains("Vessel_in_uani")).isFalse();
    }

    @Test
    @DisplayName("rejects an aggregate that depends on itself")
    void selfReference() {
        assertThatThrownBy(() -> registry.register(aggregate("loop", "lloyds_sanctions", "loop")))
                .isInstanceOf(ConfigurationException.class)
                .satisfies(e -> assertThat(((ConfigurationException) e).getProbeId()).isEqualTo("loop"));
    }

    @Test
    @DisplayName("an unknown id fails lookup")
    void unknownLookup() {
        assertThatThrownBy(() -> registry.get("nope"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("nope");
    }

    @Test
    @DisplayName("resolve returns the requested checks and their transitive components")
    void transitivePlan() {
        registry.register(aggregate("Vessel_is_sanction", "lloyds_sanctions", "kpler_sanctions"));
        registry.register(aggregate("Vessel_bunkering_sanctions", "Vessel_is_sanction"));

        Map<String, Probe> plan = registry.resolve(List.of("Vessel_bunkering_sanctions"));

        assertThat(plan).containsOnlyKeys("Vessel_bunkering_sanctions", "Vessel_is_sanction",
                "lloyds_sanctions", "kpler_sanctions");
    }

    @Test
    @DisplayName("resolve fails on the first unknown id")
    void resolveUnknown() {
        assertThatThrownBy(() -> registry.resolve(List.of("lloyds_sanctions", "Vessel_unknown")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Vessel_unknown");
    }

    @Test
    @DisplayName("the standard catalog registers cleanly and every aggregate requires its components' parameters")
    void standardCatalog() {
        ProbeRegistry standard = new ProbeRegistry(ProbeCatalog.standard());

        assertThat(standard.contains("Vessel_is_sanction")).isTrue();
        assertThat(standard.contains("Vessel_bunkering_sanctions")).isTrue();
        for (Probe probe : standard.all()) {
            if (probe instanceof CompositeProbe aggregate) {
                for (String componentId : aggregate.componentProbeIds()) {
                    assertThat(aggregate.requiredParameters())
                            .as("%s requires parameters of %s", aggregate.id(), componentId)
                            .containsAll(standard.get(componentId).requiredParameters());
                }
            }
        }
    }
}
