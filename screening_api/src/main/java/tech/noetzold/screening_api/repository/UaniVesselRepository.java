package tech.noetzold.screening_api.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import tech.noetzold.screening_api.model.UaniVessel;

import java.util.Optional;

public interface UaniVesselRepository extends JpaRepository<UaniVessel, Long> {
    Optional<UaniVessel> findFirstByImo(String imo);
}
