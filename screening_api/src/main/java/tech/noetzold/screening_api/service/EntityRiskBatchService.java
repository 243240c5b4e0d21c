package tech.noetzold.screening_api.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import tech.noetzold.screening_api.model.AssociatedParty;
import tech.noetzold.screening_api.model.AssociatedPartyEntity;
import tech.noetzold.screening_api.model.EntityVerdict;
import tech.noetzold.screening_api.model.EntityVerdictRecord;
import tech.noetzold.screening_api.model.SanctionedCountry;
import tech.noetzold.screening_api.model.SignalRow;
import tech.noetzold.screening_api.model.SignalRowEntity;
import tech.noetzold.screening_api.repository.AssociatedPartyRepository;
import tech.noetzold.screening_api.repository.EntityVerdictRecordRepository;
import tech.noetzold.screening_api.repository.SanctionedCountryRepository;
import tech.noetzold.screening_api.repository.SignalRowRepository;
import tech.noetzold.screening_api.resolver.EntityRiskResolver;
import tech.noetzold.screening_api.resolver.ResolverReferenceData;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Bulk run of the entity resolver: loads signal rows and reference snapshots, resolves every
 * entity and replaces the stored verdicts.
 */
@Slf4j
@Service
public class EntityRiskBatchService {

    private final SignalRowRepository signalRowRepository;
    private final SanctionedCountryRepository sanctionedCountryRepository;
    private final AssociatedPartyRepository associatedPartyRepository;
    private final EntityVerdictRecordRepository verdictRepository;
    private final DescriptionLookupService descriptionLookupService;
    private final EntityRiskResolver resolver;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public EntityRiskBatchService(SignalRowRepository signalRowRepository,
                                  SanctionedCountryRepository sanctionedCountryRepository,
                                  AssociatedPartyRepository associatedPartyRepository,
                                  EntityVerdictRecordRepository verdictRepository,
                                  DescriptionLookupService descriptionLookupService,
                                  EntityRiskResolver resolver,
                                  ObjectMapper objectMapper,
                                  Clock clock) {
        this.signalRowRepository = signalRowRepository;
        this.sanctionedCountryRepository = sanctionedCountryRepository;
        this.associatedPartyRepository = associatedPartyRepository;
        this.verdictRepository = verdictRepository;
        this.descriptionLookupService = descriptionLookupService;
        this.resolver = resolver;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Transactional
    public int runResolution() {
        LocalDate asOf = LocalDate.now(clock);
        List<SignalRow> rows = signalRowRepository.findAll().stream()
                .map(SignalRowEntity::toSignalRow)
                .toList();

        Set<String> countries = sanctionedCountryRepository.findByListType(SanctionedCountry.PORT).stream()
                .map(SanctionedCountry::getCountryName)
                .collect(Collectors.toSet());
        Map<String, List<AssociatedParty>> parties = associatedPartyRepository.findAll().stream()
                .collect(Collectors.groupingBy(AssociatedPartyEntity::getEntityId, LinkedHashMap::new,
                        Collectors.mapping(AssociatedPartyEntity::toAssociatedParty, Collectors.toList())));
        ResolverReferenceData reference = new ResolverReferenceData(countries, descriptionLookupService.reload(), parties);

        List<EntityVerdict> verdicts = resolver.resolve(rows, reference, asOf);

        verdictRepository.deleteAllInBatch();
        verdictRepository.saveAll(verdicts.stream().map(this::toRecord).toList());
        log.info("Entity risk resolution as of {}: {} rows, {} entities", asOf, rows.size(), verdicts.size());
        return verdicts.size();
    }

    public Optional<JsonNode> findVerdict(String entityId) {
        return verdictRepository.findByEntityId(entityId).map(EntityVerdictRecord::getVerdictJson);
    }

    private EntityVerdictRecord toRecord(EntityVerdict verdict) {
        return EntityVerdictRecord.builder()
                .entityId(verdict.entityId())
                .entityName(verdict.entityName())
                .sanctionsLevel(verdict.sanctionsLevel())
                .flaggedSignals(verdict.flaggedSignals().stream().map(Enum::name).collect(Collectors.joining(",")))
                .verdictJson(objectMapper.valueToTree(verdict))
                .build();
    }
}
