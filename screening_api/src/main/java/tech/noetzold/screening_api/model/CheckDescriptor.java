package tech.noetzold.screening_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import tech.noetzold.screening_api.probe.AggregateProbe;
import tech.noetzold.screening_api.probe.LeafProbe;
import tech.noetzold.screening_api.probe.Probe;

import java.util.List;

public record CheckDescriptor(
        @JsonProperty("id") String id,
        @JsonProperty("description") String description,
        @JsonProperty("business_module") String businessModule,
        @JsonProperty("provider_id") String providerId,
        @JsonProperty("components") List<String> components,
        @JsonProperty("required_parameters") List<String> requiredParameters
) {

    public static CheckDescriptor of(Probe probe) {
        String providerId = probe instanceof LeafProbe leaf ? leaf.providerId() : null;
        List<String> components = probe instanceof AggregateProbe aggregate ? aggregate.componentProbeIds() : List.of();
        return new CheckDescriptor(probe.id(), probe.description(), probe.businessModule(), providerId,
                components, probe.requiredParameters());
    }
}
