package tech.noetzold.screening_api.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import tech.noetzold.screening_api.model.SignalRowEntity;

public interface SignalRowRepository extends JpaRepository<SignalRowEntity, Long> {
}
