package tech.noetzold.screening_api.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import tech.noetzold.screening_api.model.SanctionedCountry;

import java.util.List;

public interface SanctionedCountryRepository extends JpaRepository<SanctionedCountry, Long> {
    List<SanctionedCountry> findByListType(String listType);

    boolean existsByListTypeAndCountryNameIgnoreCase(String listType, String countryName);
}
