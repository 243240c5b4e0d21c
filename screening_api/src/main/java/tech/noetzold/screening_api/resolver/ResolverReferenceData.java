package tech.noetzold.screening_api.resolver;

import tech.noetzold.screening_api.model.AssociatedParty;
import tech.noetzold.screening_api.model.DescriptionTable;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Snapshots taken once at the start of a bulk run.
 */
public record ResolverReferenceData(
        Set<String> sanctionedCountries,
        DescriptionTable descriptions,
        Map<String, List<AssociatedParty>> associatedParties
) {

    public ResolverReferenceData {
        sanctionedCountries = sanctionedCountries.stream()
                .filter(country -> country != null && !country.isBlank())
                .map(ResolverReferenceData::normalizeCountry)
                .collect(Collectors.toUnmodifiableSet());
        descriptions = descriptions == null ? DescriptionTable.empty() : descriptions;
        associatedParties = associatedParties == null ? Map.of() : Map.copyOf(associatedParties);
    }

    public boolean isSanctionedCountry(String country) {
        return country != null && sanctionedCountries.contains(normalizeCountry(country));
    }

    static String normalizeCountry(String country) {
        return country.trim().toLowerCase(Locale.ROOT);
    }
}
