package tech.noetzold.screening_api.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import tech.noetzold.screening_api.model.ScreeningLog;

import java.util.Optional;

public interface ScreeningLogRepository extends JpaRepository<ScreeningLog, Long> {
    Optional<ScreeningLog> findFirstByRequestIdOrderByCreatedAtDesc(String requestId);
}
