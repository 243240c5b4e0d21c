package tech.noetzold.screening_api.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import tech.noetzold.screening_api.model.DescriptionTable;
import tech.noetzold.screening_api.model.DescriptionText;
import tech.noetzold.screening_api.model.RiskLevel;
import tech.noetzold.screening_api.orchestrator.DescriptionLookup;
import tech.noetzold.screening_api.repository.RiskDescriptionRepository;

/**
 * Risk description texts, loaded lazily into an immutable snapshot. A failed load is not cached,
 * so the next lookup tries again.
 */
@Slf4j
@Service
public class DescriptionLookupService implements DescriptionLookup {

    private final RiskDescriptionRepository repository;
    private volatile DescriptionTable snapshot;

    public DescriptionLookupService(RiskDescriptionRepository repository) {
        this.repository = repository;
    }

    @Override
    public DescriptionText lookup(String riskType, RiskLevel level) {
        return snapshot().text(riskType, level);
    }

    public DescriptionTable snapshot() {
        DescriptionTable current = snapshot;
        return current != null ? current : reload();
    }

    public synchronized DescriptionTable reload() {
        try {
            DescriptionTable loaded = DescriptionTable.of(repository.findAll());
            snapshot = loaded;
            log.info("Loaded {} risk descriptions", loaded.size());
            return loaded;
        } catch (DataAccessException e) {
            log.warn("Could not load risk descriptions, using empty texts", e);
            return DescriptionTable.empty();
        }
    }
}
