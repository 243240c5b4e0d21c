package tech.noetzold.screening_api.model;

import lombok.Builder;

/**
 * One ingested fact about an entity. Flags are null when the source carried no value for them.
 */
@Builder
public record SignalRow(
        String entityId,
        String entityDate,
        String activeStatus,
        String entityName,
        String secondaryName,
        String countryName,
        String secondaryCountry,
        String dateValue,
        String sanctionsName,
        String startTime,
        String endTime,
        String listingDescription,
        String sectorDescription,
        RiskLevel sanFlag,
        RiskLevel oolFlag,
        RiskLevel scoFlag
) {

    public RiskLevel flag(SignalType type) {
        return switch (type) {
            case SAN -> sanFlag;
            case OOL -> oolFlag;
            case SCO -> scoFlag;
            default -> null;
        };
    }
}
