package tech.noetzold.screening_api.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import tech.noetzold.screening_api.model.AssociatedPartyEntity;

public interface AssociatedPartyRepository extends JpaRepository<AssociatedPartyEntity, Long> {
}
