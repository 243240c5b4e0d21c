package tech.noetzold.screening_api.model;

import java.util.List;

/**
 * Resolved risk of one entity. {@code sanctionsLevel} is HIGH, MEDIUM or NO_RISK only.
 */
public record EntityVerdict(
        String entityId,
        String entityDate,
        String entityName,
        String secondaryName,
        String activeStatus,
        String countryName,
        RiskLevel sanctionsLevel,
        List<SignalType> flaggedSignals,
        List<SignalBucket> high,
        List<SignalBucket> medium,
        List<SignalBucket> none,
        List<SignalBucket> undetermined,
        List<AssociatedParty> associatedParties
) {

    public EntityVerdict {
        flaggedSignals = List.copyOf(flaggedSignals);
        high = List.copyOf(high);
        medium = List.copyOf(medium);
        none = List.copyOf(none);
        undetermined = List.copyOf(undetermined);
        associatedParties = associatedParties == null ? List.of() : List.copyOf(associatedParties);
    }
}
