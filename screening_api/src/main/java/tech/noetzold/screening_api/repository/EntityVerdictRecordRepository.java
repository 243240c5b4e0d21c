package tech.noetzold.screening_api.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import tech.noetzold.screening_api.model.EntityVerdictRecord;

import java.util.Optional;

public interface EntityVerdictRecordRepository extends JpaRepository<EntityVerdictRecord, Long> {
    Optional<EntityVerdictRecord> findByEntityId(String entityId);
}
