package tech.noetzold.screening_api.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.noetzold.screening_api.model.AssociatedPartyEntity;
import tech.noetzold.screening_api.model.DescriptionTable;
import tech.noetzold.screening_api.model.EntityVerdictRecord;
import tech.noetzold.screening_api.model.RiskLevel;
import tech.noetzold.screening_api.model.SanctionedCountry;
import tech.noetzold.screening_api.model.SignalRowEntity;
import tech.noetzold.screening_api.repository.AssociatedPartyRepository;
import tech.noetzold.screening_api.repository.EntityVerdictRecordRepository;
import tech.noetzold.screening_api.repository.SanctionedCountryRepository;
import tech.noetzold.screening_api.repository.SignalRowRepository;
import tech.noetzold.screening_api.resolver.EntityRiskResolver;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EntityRiskBatchServiceTest {

    @Mock private SignalRowRepository signalRowRepository;
    @Mock private SanctionedCountryRepository sanctionedCountryRepository;
    @Mock private AssociatedPartyRepository associatedPartyRepository;
    @Mock private EntityVerdictRecordRepository verdictRepository;
    @Mock private DescriptionLookupService descriptionLookupService;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private EntityRiskBatchService service;

    @BeforeEach
    void setUp() {
        service = new EntityRiskBatchService(signalRowRepository, sanctionedCountryRepository, associatedPartyRepository,
                verdictRepository, descriptionLookupService, new EntityRiskResolver(), objectMapper,
                Clock.fixed(Instant.parse("2025-08-25T00:00:00Z"), ZoneOffset.UTC));
    }

    private static SignalRowEntity row(String entityId, String country, String date) {
        return SignalRowEntity.builder()
                .entityId(entityId)
                .entityName(entityId + " Shipping")
                .countryName(country)
                .dateValue(date)
                .build();
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("resolves every entity and replaces the stored verdicts")
    void runResolution() {
        when(signalRowRepository.findAll()).thenReturn(List.of(
                row("E1", "Iran", "2020-01-01"),
                row("E2", "France", "2025-07-01"),
                row("E3", "France", "2001-01-01")));
        when(sanctionedCountryRepository.findByListType(SanctionedCountry.PORT)).thenReturn(List.of(
                SanctionedCountry.builder().countryName("Iran").listType(SanctionedCountry.PORT).build()));
        when(associatedPartyRepository.findAll()).thenReturn(List.of(
                AssociatedPartyEntity.builder().entityId("E1").sorpId("P-1").relatedName("Acme Holdings").build()));
        when(descriptionLookupService.reload()).thenReturn(DescriptionTable.empty());

        int resolved = service.runResolution();

        assertThat(resolved).isEqualTo(3);
        InOrder order = inOrder(verdictRepository);
        order.verify(verdictRepository).deleteAllInBatch();
        ArgumentCaptor<List<EntityVerdictRecord>> saved = ArgumentCaptor.forClass(List.class);
        order.verify(verdictRepository).saveAll(saved.capture());

        assertThat(saved.getValue()).extracting(EntityVerdictRecord::getEntityId).containsExactly("E1", "E2", "E3");
        assertThat(saved.getValue()).extracting(EntityVerdictRecord::getSanctionsLevel)
                .containsExactly(RiskLevel.MEDIUM, RiskLevel.MEDIUM, RiskLevel.NO_RISK);
        assertThat(saved.getValue().get(0).getFlaggedSignals()).isEqualTo("SANCTIONED_COUNTRY");
        assertThat(saved.getValue().get(0).getVerdictJson().path("associatedParties").get(0).path("sorp_id").asText())
                .isEqualTo("P-1");
    }

    @Test
    @DisplayName("an empty signal table clears the stored verdicts")
    void emptyRun() {
        when(signalRowRepository.findAll()).thenReturn(List.of());
        when(sanctionedCountryRepository.findByListType(SanctionedCountry.PORT)).thenReturn(List.of());
        when(associatedPartyRepository.findAll()).thenReturn(List.of());
        when(descriptionLookupService.reload()).thenReturn(DescriptionTable.empty());

        assertThat(service.runResolution()).isZero();
        InOrder order = inOrder(verdictRepository);
        order.verify(verdictRepository).deleteAllInBatch();
        order.verify(verdictRepository).saveAll(anyList());
    }

    @Test
    @DisplayName("a stored verdict is returned as JSON")
    void findVerdict() {
        EntityVerdictRecord record = EntityVerdictRecord.builder()
                .entityId("E1")
                .verdictJson(objectMapper.createObjectNode().put("entityId", "E1"))
                .build();
        when(verdictRepository.findByEntityId("E1")).thenReturn(Optional.of(record));
        when(verdictRepository.findByEntityId("E9")).thenReturn(Optional.empty());

        assertThat(service.findVerdict("E1")).hasValueSatisfying(json -> assertThat(json.path("entityId").asText()).isEqualTo("E1"));
        assertThat(service.findVerdict("E9")).isEmpty();
    }
}
