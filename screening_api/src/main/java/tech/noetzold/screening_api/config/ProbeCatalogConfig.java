package tech.noetzold.screening_api.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.reactive.function.client.WebClient;
import tech.noetzold.screening_api.client.KplerComplianceScreeningClient;
import tech.noetzold.screening_api.client.KplerVesselRisksClient;
import tech.noetzold.screening_api.client.LloydsProviderClient;
import tech.noetzold.screening_api.client.ProviderClient;
import tech.noetzold.screening_api.client.SanctionedCountryClient;
import tech.noetzold.screening_api.model.SanctionedCountry;
import tech.noetzold.screening_api.orchestrator.ProbeRegistry;
import tech.noetzold.screening_api.orchestrator.ScreeningOrchestrator;
import tech.noetzold.screening_api.probe.ProbeCatalog;
import tech.noetzold.screening_api.repository.SanctionedCountryRepository;
import tech.noetzold.screening_api.service.DescriptionLookupService;

import java.time.Duration;
import java.util.List;

@Configuration
public class ProbeCatalogConfig {

    @Value("${screening.provider.timeout-ms:10000}")
    private long providerTimeoutMs;

    @Bean
    public LloydsProviderClient lloydsSanctionsClient(@Qualifier("lloydsWebClient") WebClient webClient) {
        return new LloydsProviderClient(LloydsProviderClient.SANCTIONS, webClient, timeout(), "/vesselsanctions_v2", false);
    }

    @Bean
    public LloydsProviderClient lloydsRiskScoreClient(@Qualifier("lloydsWebClient") WebClient webClient) {
        return new LloydsProviderClient(LloydsProviderClient.RISK_SCORE, webClient, timeout(), "/vesselriskscore", true);
    }

    @Bean
    public LloydsProviderClient lloydsComplianceRiskClient(@Qualifier("lloydsWebClient") WebClient webClient) {
        return new LloydsProviderClient(LloydsProviderClient.COMPLIANCE_RISK, webClient, timeout(),
                "/vesseladvancedcompliancerisk_v3", false);
    }

    @Bean
    public LloydsProviderClient lloydsVoyageEventsClient(@Qualifier("lloydsWebClient") WebClient webClient) {
        return new LloydsProviderClient(LloydsProviderClient.VOYAGE_EVENTS, webClient, timeout(), "/vesselvoyageevents", true);
    }

    @Bean
    public KplerVesselRisksClient kplerVesselRisksClient(@Qualifier("kplerWebClient") WebClient webClient) {
        return new KplerVesselRisksClient(webClient, timeout());
    }

    @Bean
    public KplerComplianceScreeningClient kplerComplianceScreeningClient(@Qualifier("kplerWebClient") WebClient webClient) {
        return new KplerComplianceScreeningClient(webClient, timeout());
    }

    @Bean
    public SanctionedCountryClient cargoCountryClient(SanctionedCountryRepository repository, ObjectMapper objectMapper) {
        return new SanctionedCountryClient(SanctionedCountryClient.CARGO_PROVIDER_ID, SanctionedCountry.CARGO,
                repository, objectMapper);
    }

    @Bean
    public SanctionedCountryClient portCountryClient(SanctionedCountryRepository repository, ObjectMapper objectMapper) {
        return new SanctionedCountryClient(SanctionedCountryClient.PORT_PROVIDER_ID, SanctionedCountry.PORT,
                repository, objectMapper);
    }

    @Bean
    public ProbeRegistry probeRegistry() {
        return new ProbeRegistry(ProbeCatalog.standard());
    }

    @Bean
    public ScreeningOrchestrator screeningOrchestrator(ProbeRegistry probeRegistry,
                                                       List<ProviderClient> providerClients,
                                                       DescriptionLookupService descriptionLookupService,
                                                       @Qualifier("probeExecutor") ThreadPoolTaskExecutor probeExecutor) {
        return new ScreeningOrchestrator(probeRegistry, providerClients, descriptionLookupService, probeExecutor, timeout());
    }

    private Duration timeout() {
        return Duration.ofMillis(providerTimeoutMs);
    }
}
