package tech.noetzold.screening_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

public record ScreeningSummary(
        @JsonProperty("total_checks") int totalChecks,
        @JsonProperty("level_counts") Map<RiskLevel, Integer> levelCounts,
        @JsonProperty("overall_level") RiskLevel overallLevel
) {

    public static ScreeningSummary of(Collection<RiskRecord> records) {
        Map<RiskLevel, Integer> counts = new EnumMap<>(RiskLevel.class);
        RiskLevel overall = RiskLevel.UNDETERMINED;
        for (RiskRecord record : records) {
            counts.merge(record.riskLevel(), 1, Integer::sum);
            overall = RiskLevel.merge(overall, record.riskLevel());
        }
        return new ScreeningSummary(records.size(), counts, overall.isDeterminate() ? overall : RiskLevel.NO_DATA);
    }
}
