package tech.noetzold.screening_api.resolver;

import org.springframework.stereotype.Component;
import tech.noetzold.screening_api.model.DescriptionText;
import tech.noetzold.screening_api.model.EntityVerdict;
import tech.noetzold.screening_api.model.RiskDates;
import tech.noetzold.screening_api.model.RiskLevel;
import tech.noetzold.screening_api.model.SignalBucket;
import tech.noetzold.screening_api.model.SignalRow;
import tech.noetzold.screening_api.model.SignalType;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reduces ingested signal rows to one verdict per entity.
 *
 * <p>Per entity: rows are deduplicated, the ONE_YEAR and SANCTIONED_COUNTRY signals are derived,
 * every signal type is sorted into the high, medium, undetermined or none bucket, and the final
 * level is HIGH if any type is high, else MEDIUM if any type is medium, else NO_RISK.
 * UNDETERMINED is reported in its bucket but never decides the final level; this asymmetry is
 * intended.
 *
 * <p>Pure: the result depends only on the rows, the reference snapshot and {@code asOf}.
 */
@Component
public class EntityRiskResolver {

    private static final List<RiskLevel> REPORTED = List.of(RiskLevel.HIGH, RiskLevel.MEDIUM, RiskLevel.UNDETERMINED);

    public List<EntityVerdict> resolve(Collection<SignalRow> rows, ResolverReferenceData reference, LocalDate asOf) {
        Map<String, Set<SignalRow>> byEntity = new LinkedHashMap<>();
        for (SignalRow row : rows) {
            if (row == null || row.entityId() == null || row.entityId().isBlank()) {
                continue;
            }
            byEntity.computeIfAbsent(row.entityId().trim(), id -> new LinkedHashSet<>()).add(row);
        }

        List<EntityVerdict> verdicts = new ArrayList<>(byEntity.size());
        byEntity.forEach((entityId, entityRows) ->
                verdicts.add(resolveEntity(entityId, new ArrayList<>(entityRows), reference, asOf)));
        return verdicts;
    }

    private EntityVerdict resolveEntity(String entityId, List<SignalRow> rows, ResolverReferenceData reference,
                                        LocalDate asOf) {
        Map<RiskLevel, List<SignalBucket>> buckets = new EnumMap<>(RiskLevel.class);
        for (RiskLevel level : List.of(RiskLevel.HIGH, RiskLevel.MEDIUM, RiskLevel.NO_RISK, RiskLevel.UNDETERMINED)) {
            buckets.put(level, new ArrayList<>());
        }
        List<SignalType> flagged = new ArrayList<>();

        for (SignalType type : SignalType.values()) {
            TypeOutcome outcome = switch (type) {
                case ONE_YEAR -> recency(rows, asOf);
                case SANCTIONED_COUNTRY -> countryMatch(rows, reference);
                case SCO -> sectorFlags(rows);
                default -> listingFlags(type, rows);
            };

            for (RiskLevel level : REPORTED) {
                Set<Map<String, Object>> details = outcome.hits().get(level);
                if (details != null) {
                    buckets.get(level).add(bucket(type, level, new ArrayList<>(details), reference));
                }
            }
            if (outcome.hits().isEmpty() && outcome.noRisk()) {
                buckets.get(RiskLevel.NO_RISK).add(bucket(type, RiskLevel.NO_RISK, List.of(), reference));
            }
            if (outcome.hits().containsKey(RiskLevel.HIGH) || outcome.hits().containsKey(RiskLevel.MEDIUM)) {
                flagged.add(type);
            }
        }

        RiskLevel finalLevel;
        if (!buckets.get(RiskLevel.HIGH).isEmpty()) {
            finalLevel = RiskLevel.HIGH;
        } else if (!buckets.get(RiskLevel.MEDIUM).isEmpty()) {
            finalLevel = RiskLevel.MEDIUM;
        } else {
            finalLevel = RiskLevel.NO_RISK;
        }

        SignalRow header = rows.get(0);
        return new EntityVerdict(
                entityId,
                header.entityDate(),
                header.entityName(),
                header.secondaryName(),
                header.activeStatus(),
                header.countryName(),
                finalLevel,
                flagged,
                buckets.get(RiskLevel.HIGH),
                buckets.get(RiskLevel.MEDIUM),
                buckets.get(RiskLevel.NO_RISK),
                buckets.get(RiskLevel.UNDETERMINED),
                reference.associatedParties().getOrDefault(entityId, List.of()));
    }

    /**
     * MEDIUM if any row's date is recent, NO_RISK if dates parse but none is recent, UNDETERMINED
     * if no row carries a parseable date.
     */
    public static RiskLevel evaluateRecency(Collection<SignalRow> rows, LocalDate asOf) {
        return recency(rows, asOf).level();
    }

    /**
     * MEDIUM if any row's country is in the reference set, NO_RISK if countries are present but
     * none matches, UNDETERMINED if no row has a country.
     */
    public static RiskLevel evaluateCountryMatch(Collection<SignalRow> rows, ResolverReferenceData reference) {
        return countryMatch(rows, reference).level();
    }

    private static TypeOutcome recency(Collection<SignalRow> rows, LocalDate asOf) {
        TypeOutcome outcome = new TypeOutcome();
        boolean anyParsed = false;
        Set<Map<String, Object>> recent = new LinkedHashSet<>();
        Set<Map<String, Object>> unparsed = new LinkedHashSet<>();

        for (SignalRow row : rows) {
            if (isBlank(row.dateValue())) {
                continue;
            }
            Optional<LocalDate> date = RiskDates.parse(row.dateValue());
            if (date.isEmpty()) {
                unparsed.add(Map.of("date_value", row.dateValue().trim()));
                continue;
            }
            anyParsed = true;
            if (RiskDates.isRecent(date.get(), asOf)) {
                recent.add(Map.of("date_value", row.dateValue().trim()));
            }
        }

        if (!anyParsed) {
            outcome.hits().put(RiskLevel.UNDETERMINED, unparsed);
        } else if (!recent.isEmpty()) {
            outcome.hits().put(RiskLevel.MEDIUM, recent);
        } else {
            outcome.markNoRisk();
        }
        return outcome;
    }

    private static TypeOutcome countryMatch(Collection<SignalRow> rows, ResolverReferenceData reference) {
        TypeOutcome outcome = new TypeOutcome();
        boolean anyCountry = false;
        Set<Map<String, Object>> matched = new LinkedHashSet<>();

        for (SignalRow row : rows) {
            if (isBlank(row.countryName())) {
                continue;
            }
            anyCountry = true;
            if (reference.isSanctionedCountry(row.countryName())) {
                matched.add(Map.of("country_name", row.countryName().trim()));
            }
        }

        if (!anyCountry) {
            outcome.hits().put(RiskLevel.UNDETERMINED, new LinkedHashSet<>());
        } else if (!matched.isEmpty()) {
            outcome.hits().put(RiskLevel.MEDIUM, matched);
        } else {
            outcome.markNoRisk();
        }
        return outcome;
    }

    // SAN and OOL: the flag decides the level; only rows naming the sanctions list become detail rows
    private static TypeOutcome listingFlags(SignalType type, Collection<SignalRow> rows) {
        TypeOutcome outcome = new TypeOutcome();
        for (SignalRow row : rows) {
            RiskLevel level = row.flag(type);
            if (level == null || !REPORTED.contains(level)) {
                continue;
            }
            Set<Map<String, Object>> details = outcome.hits().computeIfAbsent(level, l -> new LinkedHashSet<>());
            if (isBlankOrNullLiteral(row.sanctionsName())) {
                continue;
            }
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("start_time", row.startTime());
            detail.put("end_time", row.endTime());
            detail.put("sanctions_name", row.sanctionsName().trim());
            detail.put("listing_description", row.listingDescription());
            details.add(detail);
        }
        return outcome.noRiskUnlessHit();
    }

    private static TypeOutcome sectorFlags(Collection<SignalRow> rows) {
        TypeOutcome outcome = new TypeOutcome();
        for (SignalRow row : rows) {
            RiskLevel level = row.scoFlag();
            if (level == null || !REPORTED.contains(level)) {
                continue;
            }
            Set<Map<String, Object>> details = outcome.hits().computeIfAbsent(level, l -> new LinkedHashSet<>());
            if (!isBlank(row.sectorDescription())) {
                details.add(Map.of("sector_description", row.sectorDescription().trim()));
            }
        }
        return outcome.noRiskUnlessHit();
    }

    private static SignalBucket bucket(SignalType type, RiskLevel level, List<Map<String, Object>> rows,
                                       ResolverReferenceData reference) {
        DescriptionText text = reference.descriptions().text(type.riskType(), level);
        return new SignalBucket(type.riskType(), level, reference.descriptions().label(type.riskType(), level),
                text.info(), text.riskDescriptionInfo(), rows);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static boolean isBlankOrNullLiteral(String value) {
        return isBlank(value) || "null".equalsIgnoreCase(value.trim());
    }

    private static final class TypeOutcome {

        private final Map<RiskLevel, Set<Map<String, Object>>> hits = new EnumMap<>(RiskLevel.class);
        private boolean noRisk;

        Map<RiskLevel, Set<Map<String, Object>>> hits() {
            return hits;
        }

        boolean noRisk() {
            return noRisk;
        }

        void markNoRisk() {
            noRisk = true;
        }

        // pre-classified flags: no high, medium or undetermined row means no risk, flags absent included
        TypeOutcome noRiskUnlessHit() {
            if (hits.isEmpty()) {
                noRisk = true;
            }
            return this;
        }

        RiskLevel level() {
            for (RiskLevel level : REPORTED) {
                if (hits.containsKey(level)) {
                    return level;
                }
            }
            return noRisk ? RiskLevel.NO_RISK : RiskLevel.UNDETERMINED;
        }
    }
}
