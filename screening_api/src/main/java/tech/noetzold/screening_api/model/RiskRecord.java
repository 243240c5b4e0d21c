package tech.noetzold.screening_api.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of one probe or aggregate invocation. Detail rows and subject references are copied on
 * construction and exposed read-only.
 */
@JsonPropertyOrder({"riskType", "riskDescription", "riskLevel", "info", "riskDescriptionInfo", "detailRows", "subjectRef"})
public record RiskRecord(
        String riskType,
        String riskDescription,
        RiskLevel riskLevel,
        String info,
        String riskDescriptionInfo,
        List<Map<String, Object>> detailRows,
        Map<String, String> subjectRef
) {

    public RiskRecord {
        riskDescription = riskDescription == null ? "" : riskDescription;
        info = info == null ? "" : info;
        riskDescriptionInfo = riskDescriptionInfo == null ? "" : riskDescriptionInfo;
        detailRows = copyRows(detailRows);
        subjectRef = subjectRef == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(subjectRef));
    }

    public static RiskRecord of(String riskType, String riskDescription, RiskLevel level,
                                List<Map<String, Object>> rows, Map<String, String> subjectRef) {
        return new RiskRecord(riskType, riskDescription, level, "", "", rows, subjectRef);
    }

    public static RiskRecord noData(String riskType, String riskDescription, Map<String, String> subjectRef) {
        return of(riskType, riskDescription, RiskLevel.NO_DATA, List.of(), subjectRef);
    }

    public RiskRecord withDescriptions(String info, String riskDescriptionInfo) {
        return new RiskRecord(riskType, riskDescription, riskLevel, info, riskDescriptionInfo, detailRows, subjectRef);
    }

    public RiskRecord withIdentity(String riskType, String riskDescription) {
        return new RiskRecord(riskType, riskDescription, riskLevel, info, riskDescriptionInfo, detailRows, subjectRef);
    }

    public RiskRecord withSubjectRef(Map<String, String> subjectRef) {
        return new RiskRecord(riskType, riskDescription, riskLevel, info, riskDescriptionInfo, detailRows, subjectRef);
    }

    // rows may carry null values from provider payloads, so Map.copyOf is not an option
    private static List<Map<String, Object>> copyRows(List<Map<String, Object>> rows) {
        if (rows == null || rows.isEmpty()) {
            return List.of();
        }
        List<Map<String, Object>> copy = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        return Collections.unmodifiableList(copy);
    }
}
