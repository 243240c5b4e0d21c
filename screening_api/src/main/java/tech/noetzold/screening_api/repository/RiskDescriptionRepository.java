package tech.noetzold.screening_api.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import tech.noetzold.screening_api.model.RiskDescription;

public interface RiskDescriptionRepository extends JpaRepository<RiskDescription, Long> {
}
